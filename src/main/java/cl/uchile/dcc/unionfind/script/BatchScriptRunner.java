package cl.uchile.dcc.unionfind.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;

import cl.uchile.dcc.unionfind.DisjointSet;
import cl.uchile.dcc.unionfind.DisjointSet.DisjointSetArgs;
import cl.uchile.dcc.unionfind.SharedDisjointSet;
import cl.uchile.dcc.unionfind.SharedDisjointSet.Batch;
import cl.uchile.dcc.unionfind.script.ScriptParser.Header;
import cl.uchile.dcc.unionfind.script.ScriptParser.ScriptFormatException;

/**
 * Runs a script in batches of lines. Batches are parsed in parallel
 * by a pool of workers, but are applied to the one shared set strictly
 * in input order, each under a single hold of the set's lock, so the
 * output is the same as that of {@link ScriptRunner}.
 */
public class BatchScriptRunner implements Callable<ScriptResult> {
	static final Logger LOG = Logger.getLogger(BatchScriptRunner.class.getSimpleName());

	public static int DEFAULT_BATCH_SIZE = 1000;

	private final BufferedReader in;
	private final Writer out;
	private final DisjointSetArgs args;
	private final int threads;
	private final int batchSize;

	private SharedDisjointSet shared;

	public BatchScriptRunner(BufferedReader in, Writer out, int threads){
		this(in, out, new DisjointSetArgs(), threads, DEFAULT_BATCH_SIZE);
	}

	public BatchScriptRunner(BufferedReader in, Writer out, DisjointSetArgs args, int threads, int batchSize){
		if(threads < 1){
			throw new IllegalArgumentException("Need at least one worker thread, not "+threads);
		}
		if(batchSize < 1){
			throw new IllegalArgumentException("Batch size must be positive, not "+batchSize);
		}
		this.in = in;
		this.out = out;
		this.args = args;
		this.threads = threads;
		this.batchSize = batchSize;
	}

	public ScriptResult call() throws IOException, ScriptFormatException, InterruptedException{
		Stopwatch sw = Stopwatch.createStarted();
		ScriptResult result = new ScriptResult();

		Header header = ScriptParser.readHeader(in);
		if(header == null){
			LOG.info("Empty script");
			shared = new SharedDisjointSet(0, args);
			result.setElapsed(sw.elapsed(TimeUnit.MILLISECONDS));
			return result;
		}
		shared = new SharedDisjointSet(header.getElements(), args);
		result.setUniverse(header.getElements());

		ScriptParser parser = new ScriptParser(header.getElements());
		int expected = header.getInstructions();
		int lineNo = header.getLine();
		int read = 0;

		// bound the number of parsed batches waiting to be applied
		int window = 2 * threads;
		Deque<Future<List<Instruction>>> pending = new ArrayDeque<Future<List<Instruction>>>();
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		try{
			ParseTask task = new ParseTask(parser, batchSize);
			String line = null;
			while((expected == ScriptParser.ALL || read < expected) && (line = in.readLine()) != null){
				lineNo++;
				if(ScriptParser.isBlank(line)){
					continue;
				}
				task.add(line, lineNo);
				read++;

				if(task.size() == batchSize){
					pending.add(executor.submit(task));
					task = new ParseTask(parser, batchSize);
					if(pending.size() >= window){
						applyBatch(pending.poll(), result);
					}
				}
			}
			if(task.size() > 0){
				pending.add(executor.submit(task));
			}
			while(!pending.isEmpty()){
				applyBatch(pending.poll(), result);
			}
		} finally{
			shutdown(executor);
		}

		if(expected != ScriptParser.ALL){
			if(read < expected){
				throw new ScriptFormatException(lineNo, "header announced "+expected+" instructions but input ended after "+read);
			}
			ScriptRunner.warnIfTrailing(in, lineNo);
		}

		out.flush();
		result.setSetCount(shared.setCount());
		result.setElapsed(sw.elapsed(TimeUnit.MILLISECONDS));
		return result;
	}

	/**
	 * @return the set the last call ran on
	 */
	public SharedDisjointSet getDisjointSet(){
		return shared;
	}

	private void applyBatch(Future<List<Instruction>> future, final ScriptResult result) throws IOException, ScriptFormatException, InterruptedException{
		final List<Instruction> instructions = await(future);

		List<String> answers = shared.apply(new Batch<List<String>>(){
			@Override
			public List<String> run(DisjointSet set) {
				List<String> written = new ArrayList<String>();
				for(Instruction ins : instructions){
					String answer = ins.execute(set, result);
					if(answer != null){
						written.add(answer);
					}
				}
				return written;
			}
		});
		result.countBatch();

		for(String answer : answers){
			out.write(answer);
			out.write('\n');
		}
	}

	/**
	 * Stops the parse workers and waits for them to finish. If the
	 * calling thread is interrupted while waiting, the interrupt is
	 * restored on it and the method returns.
	 */
	static void shutdown(ExecutorService executor){
		executor.shutdownNow();
		try{
			executor.awaitTermination(Long.MAX_VALUE, TimeUnit.DAYS);
		} catch(InterruptedException e){
			LOG.warning("Interrupted while waiting for parse workers to stop");
			Thread.currentThread().interrupt();
		}
	}

	private static List<Instruction> await(Future<List<Instruction>> future) throws ScriptFormatException, InterruptedException{
		try{
			return future.get();
		} catch(ExecutionException e){
			Throwable cause = e.getCause();
			Throwables.throwIfInstanceOf(cause, ScriptFormatException.class);
			Throwables.throwIfUnchecked(cause);
			throw new IllegalStateException("Could not parse batch", cause);
		}
	}

	/**
	 * Parses one batch of raw lines.
	 */
	private static class ParseTask implements Callable<List<Instruction>> {
		private final ScriptParser parser;
		private final List<String> lines;
		private final List<Integer> lineNos;

		ParseTask(ScriptParser parser, int capacity){
			this.parser = parser;
			this.lines = new ArrayList<String>(capacity);
			this.lineNos = new ArrayList<Integer>(capacity);
		}

		void add(String line, int lineNo){
			lines.add(line);
			lineNos.add(lineNo);
		}

		int size(){
			return lines.size();
		}

		public List<Instruction> call() throws ScriptFormatException{
			List<Instruction> parsed = new ArrayList<Instruction>(lines.size());
			for(int i = 0; i < lines.size(); i++){
				parsed.add(parser.parseInstruction(lines.get(i), lineNos.get(i)));
			}
			return parsed;
		}
	}
}
