package cl.uchile.dcc.unionfind.script;

/**
 * What running a script did, along with the final shape
 * of the partition.
 */
public class ScriptResult {
	private int universe;
	private int instructions;
	private int queries;
	private int merges;
	private int moves;
	private int setCount;
	private int batches;
	private long elapsed;

	ScriptResult(){
		;
	}

	void countInstruction(){
		instructions++;
	}

	void countQuery(){
		queries++;
	}

	void countMerge(){
		merges++;
	}

	void countMove(){
		moves++;
	}

	void countBatch(){
		batches++;
	}

	void setUniverse(int universe){
		this.universe = universe;
	}

	void setSetCount(int setCount){
		this.setCount = setCount;
	}

	void setElapsed(long elapsed){
		this.elapsed = elapsed;
	}

	/**
	 * Number of elements announced in the header
	 * @return
	 */
	public int getUniverse(){
		return universe;
	}

	/**
	 * Number of instructions run
	 * @return
	 */
	public int getInstructionCount(){
		return instructions;
	}

	/**
	 * Number of connected queries answered
	 * @return
	 */
	public int getQueryCount(){
		return queries;
	}

	/**
	 * Number of unions that joined two different sets
	 * @return
	 */
	public int getMergeCount(){
		return merges;
	}

	/**
	 * Number of moves that changed an element's set
	 * @return
	 */
	public int getMoveCount(){
		return moves;
	}

	/**
	 * Number of disjoint sets once the script finished
	 * @return
	 */
	public int getSetCount(){
		return setCount;
	}

	/**
	 * Number of batches applied; 0 if the script ran sequentially
	 * @return
	 */
	public int getBatchCount(){
		return batches;
	}

	/**
	 * Time taken in ms
	 * @return
	 */
	public long getElapsed(){
		return elapsed;
	}

	@Override
	public String toString(){
		return "universe: "+universe+" instructions: "+instructions+" queries: "+queries+" merges: "+merges+" moves: "+moves+" sets: "+setCount+" batches: "+batches+" time: "+elapsed+" ms";
	}
}
