package cl.uchile.dcc.unionfind.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.primitives.Ints;

import cl.uchile.dcc.unionfind.DisjointSet;

/**
 * Parses operation scripts. The first non-blank line is a header
 * <code>n [m]</code> giving the number of elements and, optionally,
 * the number of instructions; every following non-blank line is an
 * instruction <code>op p q</code>.
 *
 * Everything is checked here so that malformed input never reaches
 * the set.
 */
public class ScriptParser {
	public static final int ALL = -1;

	private static final Splitter FIELDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();

	private final int universe;

	/**
	 * @param universe the number of elements instructions may refer to
	 */
	public ScriptParser(int universe){
		this.universe = universe;
	}

	public static boolean isBlank(String line){
		return CharMatcher.whitespace().matchesAllOf(line);
	}

	/**
	 * Reads lines until the header is found.
	 *
	 * @param br
	 * @return the header, or null if the input holds no header
	 * @throws IOException
	 * @throws ScriptFormatException if the header is malformed
	 */
	public static Header readHeader(BufferedReader br) throws IOException, ScriptFormatException{
		String line = null;
		int lineNo = 0;
		while((line = br.readLine()) != null){
			lineNo++;
			if(!isBlank(line)){
				return parseHeader(line, lineNo);
			}
		}
		return null;
	}

	public static Header parseHeader(String line, int lineNo) throws ScriptFormatException{
		List<String> fields = FIELDS.splitToList(line);
		if(fields.isEmpty() || fields.size() > 2){
			throw new ScriptFormatException(lineNo, "expected header '<elements> [<instructions>]' but found '"+line+"'");
		}
		Integer n = Ints.tryParse(fields.get(0));
		if(n == null || n < 0 || n > DisjointSet.MAX_ELEMENTS){
			throw new ScriptFormatException(lineNo, "invalid number of elements '"+fields.get(0)+"'");
		}
		int m = ALL;
		if(fields.size() == 2){
			Integer mi = Ints.tryParse(fields.get(1));
			if(mi == null || mi < 0){
				throw new ScriptFormatException(lineNo, "invalid number of instructions '"+fields.get(1)+"'");
			}
			m = mi;
		}
		return new Header(n, m, lineNo);
	}

	/**
	 * @param line
	 * @param lineNo 1-based line number, for error messages
	 * @return the instruction
	 * @throws ScriptFormatException if the line is not a valid instruction
	 */
	public Instruction parseInstruction(String line, int lineNo) throws ScriptFormatException{
		List<String> fields = FIELDS.splitToList(line);
		if(fields.size() != 3){
			throw new ScriptFormatException(lineNo, "expected '<op> <p> <q>' but found '"+line+"'");
		}
		String token = fields.get(0);
		Operation op = Operation.forToken(token);
		if(op == null){
			throw new ScriptFormatException(lineNo, "unknown operation '"+token+"'");
		}
		int p = parseElement(fields.get(1), lineNo);
		int q = parseElement(fields.get(2), lineNo);
		return new Instruction(op, p, q, token.equals(op.code()), lineNo);
	}

	private int parseElement(String field, int lineNo) throws ScriptFormatException{
		Integer e = Ints.tryParse(field);
		if(e == null){
			throw new ScriptFormatException(lineNo, "not an element '"+field+"'");
		}
		if(e < 0 || e >= universe){
			throw new ScriptFormatException(lineNo, "element "+e+" outside universe of "+universe);
		}
		return e;
	}

	public int getUniverse(){
		return universe;
	}

	public static class Header{
		private final int elements;
		private final int instructions;
		private final int line;

		Header(int elements, int instructions, int line){
			this.elements = elements;
			this.instructions = instructions;
			this.line = line;
		}

		public int getElements(){
			return elements;
		}

		/**
		 * @return the number of instructions announced, or {@link ScriptParser#ALL}
		 */
		public int getInstructions(){
			return instructions;
		}

		/**
		 * @return the 1-based line holding the header
		 */
		public int getLine(){
			return line;
		}
	}

	public static class ScriptFormatException extends Exception{
		/**
		 *
		 */
		private static final long serialVersionUID = 1L;

		private final int line;

		public ScriptFormatException(int line, String msg){
			super("line "+line+": "+msg);
			this.line = line;
		}

		public int getLine(){
			return line;
		}
	}
}
