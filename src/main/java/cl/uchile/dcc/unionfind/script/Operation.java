package cl.uchile.dcc.unionfind.script;

import java.util.HashMap;
import java.util.Map;

/**
 * The instructions a script may contain, with the tokens
 * that name them.
 */
public enum Operation {
	CONNECTED("0", "?", "connected?"),
	UNION("1", "=", "union"),
	MOVE("2", "move");

	private static final Map<String,Operation> BY_TOKEN = new HashMap<String,Operation>();
	static{
		for(Operation op : values()){
			for(String token : op.tokens){
				BY_TOKEN.put(token, op);
			}
		}
	}

	private final String[] tokens;

	private Operation(String... tokens){
		this.tokens = tokens;
	}

	/**
	 * @return the numeric token, e.g., "1" for union
	 */
	public String code(){
		return tokens[0];
	}

	/**
	 * @return the short symbolic token, e.g., "=" for union
	 */
	public String symbol(){
		return tokens[1];
	}

	/**
	 * @param token
	 * @return the operation or null if the token names none
	 */
	public static Operation forToken(String token){
		return BY_TOKEN.get(token);
	}
}
