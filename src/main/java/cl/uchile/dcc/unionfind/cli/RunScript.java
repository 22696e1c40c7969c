package cl.uchile.dcc.unionfind.cli;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.cli.BasicParser;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import cl.uchile.dcc.unionfind.DisjointSet.DisjointSetArgs;
import cl.uchile.dcc.unionfind.DisjointSet.MergePolicy;
import cl.uchile.dcc.unionfind.DisjointSet.PathCompression;
import cl.uchile.dcc.unionfind.script.BatchScriptRunner;
import cl.uchile.dcc.unionfind.script.ScriptParser.ScriptFormatException;
import cl.uchile.dcc.unionfind.script.ScriptResult;
import cl.uchile.dcc.unionfind.script.ScriptRunner;

/**
 * Main method for running an operation script over a disjoint set.
 *
 */
public class RunScript {
	static final Logger LOG = Logger.getLogger(RunScript.class.getSimpleName());
	public static final Level LOG_LEVEL = Level.INFO;
	static{
		for(Handler h : LOG.getParent().getHandlers()){
			if(h instanceof ConsoleHandler){
				h.setLevel(LOG_LEVEL);
			}
		}
		LOG.setLevel(LOG_LEVEL);
	}

	public static String STD = "std";

	public static String DEFAULT_ENCODING = "UTF-8";

	public static void main(String[] args) throws IOException, InterruptedException, ScriptFormatException{
		long b4 = System.currentTimeMillis();

		Option iO = new Option("i", "input script [enter '"+STD+"' for stdin]");
		iO.setArgs(1);
		iO.setRequired(true);

		Option ieO = new Option("ie", "input encoding [default "+DEFAULT_ENCODING+"]");
		ieO.setArgs(1);

		Option igzO = new Option("igz", "input is GZipped");
		igzO.setArgs(0);

		Option oO = new Option("o", "output file for answers [enter '"+STD+"' for stdout]");
		oO.setArgs(1);
		oO.setRequired(true);

		Option oeO = new Option("oe", "output encoding [default "+DEFAULT_ENCODING+"]");
		oeO.setArgs(1);

		Option ogzO = new Option("ogz", "output should be GZipped");
		ogzO.setArgs(0);

		Option tO = new Option("t", "worker threads for parsing batches; 0 runs sequentially [default 0]");
		tO.setArgs(1);

		Option bsO = new Option("bs", "lines per batch when using worker threads [default "+BatchScriptRunner.DEFAULT_BATCH_SIZE+"]");
		bsO.setArgs(1);

		Option mpO = new Option("mp", "merge policy: 0:by rank 1:naive (default "+DisjointSetArgs.DEFAULT_MERGE+")");
		mpO.setArgs(1);

		Option pcO = new Option("pc", "path compression: 0:full 1:halving 2:none (default "+DisjointSetArgs.DEFAULT_COMPRESSION+")");
		pcO.setArgs(1);

		Option helpO = new Option("h", "print help");

		Options options = new Options();
		options.addOption(iO);
		options.addOption(ieO);
		options.addOption(igzO);
		options.addOption(oO);
		options.addOption(oeO);
		options.addOption(ogzO);
		options.addOption(tO);
		options.addOption(bsO);
		options.addOption(mpO);
		options.addOption(pcO);
		options.addOption(helpO);

		CommandLineParser parser = new BasicParser();
		CommandLine cmd = null;

		try {
			cmd = parser.parse(options, args);
		} catch (ParseException e) {
			System.err.println("***ERROR: " + e.getClass() + ": " + e.getMessage());
			HelpFormatter formatter = new HelpFormatter();
			formatter.printHelp("parameters:", options );
			return;
		}

		// print help options and return
		if (cmd.hasOption(helpO.getOpt())) {
			HelpFormatter formatter = new HelpFormatter();
			formatter.printHelp("parameters:", options );
			return;
		}

		DisjointSetArgs dsa = new DisjointSetArgs();
		if(cmd.getOptionValue(mpO.getOpt())!=null){
			int mp = Integer.parseInt(cmd.getOptionValue(mpO.getOpt()));
			switch(mp){
			case 0: dsa.setMergePolicy(MergePolicy.BY_RANK); break;
			case 1: dsa.setMergePolicy(MergePolicy.NAIVE); break;
			default:
				LOG.severe("Illegal value for parameter mp: "+mp);
				HelpFormatter formatter = new HelpFormatter();
				formatter.printHelp("parameters:", options );
				return;
			}
		}
		if(cmd.getOptionValue(pcO.getOpt())!=null){
			int pc = Integer.parseInt(cmd.getOptionValue(pcO.getOpt()));
			switch(pc){
			case 0: dsa.setPathCompression(PathCompression.FULL); break;
			case 1: dsa.setPathCompression(PathCompression.HALVING); break;
			case 2: dsa.setPathCompression(PathCompression.NONE); break;
			default:
				LOG.severe("Illegal value for parameter pc: "+pc);
				HelpFormatter formatter = new HelpFormatter();
				formatter.printHelp("parameters:", options );
				return;
			}
		}

		int threads = 0;
		if(cmd.hasOption(tO.getOpt())){
			threads = Integer.parseInt(cmd.getOptionValue(tO.getOpt()));
		}
		int batchSize = BatchScriptRunner.DEFAULT_BATCH_SIZE;
		if(cmd.hasOption(bsO.getOpt())){
			batchSize = Integer.parseInt(cmd.getOptionValue(bsO.getOpt()));
		}

		InputStream is = null;

		String istr = cmd.getOptionValue(iO.getOpt());
		if(istr.equals(STD)){
			is = System.in;
		} else{
			is = new FileInputStream(istr);
		}
		if(cmd.hasOption(igzO.getOpt())){
			is = new GZIPInputStream(is);
		}

		String iestr = cmd.getOptionValue(ieO.getOpt());
		if(iestr==null){
			iestr = DEFAULT_ENCODING;
		}

		BufferedReader br = new BufferedReader(new InputStreamReader(is,iestr));

		OutputStream os = null;
		String ostr = cmd.getOptionValue(oO.getOpt());
		boolean stdout = ostr.equals(STD);
		if(stdout){
			os = System.out;
		} else{
			os = new FileOutputStream(ostr);
		}
		if(cmd.hasOption(ogzO.getOpt())){
			os = new GZIPOutputStream(os);
		}

		String oestr = cmd.getOptionValue(oeO.getOpt());
		if(oestr==null){
			oestr = DEFAULT_ENCODING;
		}

		BufferedWriter bw = new BufferedWriter(new OutputStreamWriter(os,oestr));

		try{
			runScript(br, bw, dsa, threads, batchSize);
		} finally{
			br.close();
			if(stdout && !cmd.hasOption(ogzO.getOpt())){
				// leave stdout open for whoever called us
				bw.flush();
			} else{
				bw.close();
			}
		}

		LOG.info("Finished in "+(System.currentTimeMillis()-b4)+" ms");
	}

	/**
	 * Runs the script read from in and writes the answers to out.
	 *
	 * @param in - The script
	 * @param out - Where answers to connected queries are written
	 * @param dsa - The options for the disjoint set
	 * @param threads - Worker threads parsing batches; 0 runs the script sequentially
	 * @param batchSize - Lines per batch, ignored if threads is 0
	 * @return statistics on the run
	 * @throws ScriptFormatException if the script is malformed
	 * @throws InterruptedException
	 * @throws IOException
	 */
	public static final ScriptResult runScript(BufferedReader in, Writer out, DisjointSetArgs dsa, int threads, int batchSize) throws IOException, InterruptedException, ScriptFormatException{
		ScriptResult sr = null;
		try{
			if(threads > 0){
				LOG.info("Running script in batches of "+batchSize+" with "+threads+" worker threads ...");
				sr = new BatchScriptRunner(in, out, dsa, threads, batchSize).call();
			} else{
				LOG.info("Running script ...");
				sr = new ScriptRunner(in, out, dsa).call();
			}
		} catch(ScriptFormatException e){
			LOG.severe("Malformed script: "+e.getMessage());
			throw e;
		}
		LOG.info("... done.");

		LOG.info("Number of elements: "+sr.getUniverse());
		LOG.info("Number of instructions: "+sr.getInstructionCount());
		LOG.info("Number of queries: "+sr.getQueryCount());
		LOG.info("Number of merges: "+sr.getMergeCount());
		LOG.info("Number of moves: "+sr.getMoveCount());
		LOG.info("Number of sets: "+sr.getSetCount());
		if(threads > 0){
			LOG.info("Number of batches: "+sr.getBatchCount());
		}
		LOG.info("Script time: "+sr.getElapsed()+" ms");

		return sr;
	}
}
