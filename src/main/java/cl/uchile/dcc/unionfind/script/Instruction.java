package cl.uchile.dcc.unionfind.script;

import cl.uchile.dcc.unionfind.DisjointSet;

/**
 * One parsed script line: an operation over two elements.
 */
public class Instruction {
	public static final String YES = "yes";
	public static final String NO = "no";
	public static final String TRUE = "1";
	public static final String FALSE = "0";

	private final Operation op;
	private final int p;
	private final int q;
	// answer with 1/0 rather than yes/no
	private final boolean numeric;
	private final int line;

	public Instruction(Operation op, int p, int q, boolean numeric, int line){
		this.op = op;
		this.p = p;
		this.q = q;
		this.numeric = numeric;
		this.line = line;
	}

	/**
	 * Runs the instruction against the set.
	 * @param set
	 * @param tally counts what the instruction did
	 * @return the answer to write, or null if the instruction has none
	 */
	public String execute(DisjointSet set, ScriptResult tally){
		tally.countInstruction();
		switch(op){
		case CONNECTED:
			tally.countQuery();
			return answer(set.connected(p, q));
		case UNION:
			if(set.union(p, q)){
				tally.countMerge();
			}
			return null;
		case MOVE:
			if(set.move(p, q)){
				tally.countMove();
			}
			return null;
		default:
			throw new IllegalStateException("Unknown operation "+op);
		}
	}

	public String answer(boolean connected){
		if(numeric){
			return connected ? TRUE : FALSE;
		}
		return connected ? YES : NO;
	}

	public Operation getOperation(){
		return op;
	}

	public int getP(){
		return p;
	}

	public int getQ(){
		return q;
	}

	public boolean isNumeric(){
		return numeric;
	}

	/**
	 * @return the 1-based line of the script this came from
	 */
	public int getLine(){
		return line;
	}

	@Override
	public String toString(){
		return (numeric ? op.code() : op.symbol())+" "+p+" "+q;
	}
}
