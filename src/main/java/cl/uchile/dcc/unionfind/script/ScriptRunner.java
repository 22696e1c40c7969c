package cl.uchile.dcc.unionfind.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import com.google.common.base.Stopwatch;

import cl.uchile.dcc.unionfind.DisjointSet;
import cl.uchile.dcc.unionfind.DisjointSet.DisjointSetArgs;
import cl.uchile.dcc.unionfind.script.ScriptParser.Header;
import cl.uchile.dcc.unionfind.script.ScriptParser.ScriptFormatException;

/**
 * Runs a script line by line on a fresh {@link DisjointSet},
 * writing one answer line per connected query.
 */
public class ScriptRunner implements Callable<ScriptResult> {
	static final Logger LOG = Logger.getLogger(ScriptRunner.class.getSimpleName());

	private final BufferedReader in;
	private final Writer out;
	private final DisjointSetArgs args;

	private DisjointSet set;

	public ScriptRunner(BufferedReader in, Writer out){
		this(in, out, new DisjointSetArgs());
	}

	public ScriptRunner(BufferedReader in, Writer out, DisjointSetArgs args){
		this.in = in;
		this.out = out;
		this.args = args;
	}

	/**
	 * Reads the whole script and runs it. The writer is flushed
	 * but not closed.
	 */
	public ScriptResult call() throws IOException, ScriptFormatException, InterruptedException{
		Stopwatch sw = Stopwatch.createStarted();
		ScriptResult result = new ScriptResult();

		set = new DisjointSet(0, args);

		Header header = ScriptParser.readHeader(in);
		if(header == null){
			LOG.info("Empty script");
			result.setElapsed(sw.elapsed(TimeUnit.MILLISECONDS));
			return result;
		}
		set.extend(header.getElements());
		result.setUniverse(header.getElements());

		ScriptParser parser = new ScriptParser(header.getElements());
		int expected = header.getInstructions();
		int lineNo = header.getLine();
		int read = 0;

		String line = null;
		while((expected == ScriptParser.ALL || read < expected) && (line = in.readLine()) != null){
			lineNo++;
			if(ScriptParser.isBlank(line)){
				continue;
			}
			if(Thread.interrupted()){
				throw new InterruptedException();
			}
			Instruction ins = parser.parseInstruction(line, lineNo);
			read++;

			String answer = ins.execute(set, result);
			if(answer != null){
				out.write(answer);
				out.write('\n');
			}
		}

		if(expected != ScriptParser.ALL){
			if(read < expected){
				throw new ScriptFormatException(lineNo, "header announced "+expected+" instructions but input ended after "+read);
			}
			warnIfTrailing(in, lineNo);
		}

		out.flush();
		result.setSetCount(set.setCount());
		result.setElapsed(sw.elapsed(TimeUnit.MILLISECONDS));
		return result;
	}

	/**
	 * @return the set the last call ran on
	 */
	public DisjointSet getDisjointSet(){
		return set;
	}

	static void warnIfTrailing(BufferedReader in, int lineNo) throws IOException{
		int ignored = 0;
		String line = null;
		while((line = in.readLine()) != null){
			if(!ScriptParser.isBlank(line)){
				ignored++;
			}
		}
		if(ignored > 0){
			LOG.warning("Ignored "+ignored+" lines after line "+lineNo+", beyond the number of instructions in the header");
		}
	}
}
