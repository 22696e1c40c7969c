package cl.uchile.dcc.unionfind.cli;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Stopwatch;

/**
 * Entry point of the jar. The first argument names one of the
 * utilities below (case is ignored); the remaining arguments are
 * handed to that utility's own main method.
 */
public class Main {

	// utility -> description, in the order they are listed
	static final Map<Class<?>,String> UTILITIES = new LinkedHashMap<Class<?>,String>();
	static{
		UTILITIES.put(RunScript.class, "Run a union/connected/move script over a disjoint set");
		UTILITIES.put(GenerateScript.class, "Write a random script, e.g., for benchmarking");
	}

	public static void main(String[] args) {
		if(args.length < 1){
			usage("missing <utility> arg");
			return;
		}

		Class<?> utility = resolve(args[0]);
		if(utility == null){
			usage("unknown utility '"+args[0]+"'");
			return;
		}

		String[] utilityArgs = Arrays.copyOfRange(args, 1, args.length);
		Stopwatch sw = Stopwatch.createStarted();
		try{
			Method main = utility.getMethod("main", String[].class);
			main.invoke(null, (Object) utilityArgs);
		} catch(InvocationTargetException e){
			e.getCause().printStackTrace();
			usage(utility.getSimpleName()+" failed: "+e.getCause());
			return;
		} catch(ReflectiveOperationException e){
			e.printStackTrace();
			usage(e.toString());
			return;
		}
		System.err.println(utility.getSimpleName()+" finished in "+sw.elapsed(TimeUnit.MILLISECONDS)+" ms");
	}

	/**
	 * @param name simple class name of a utility, any case
	 * @return the utility, or null if there is none by that name
	 */
	static Class<?> resolve(String name){
		for(Class<?> utility : UTILITIES.keySet()){
			if(utility.getSimpleName().equalsIgnoreCase(name)){
				return utility;
			}
		}
		return null;
	}

	static String listUtilities(){
		StringBuilder sb = new StringBuilder("where <utility> is one of");
		for(Map.Entry<Class<?>,String> e : UTILITIES.entrySet()){
			sb.append("\n\t"+e.getKey().getSimpleName()+": "+e.getValue());
		}
		return sb.toString();
	}

	private static void usage(String msg) {
		System.err.println("usage: "+Main.class.getName()+" <utility> [args]");
		System.err.println(msg);
		System.err.println(listUtilities());
		System.exit(-1);
	}
}
