package cl.uchile.dcc.unionfind.cli;

import java.io.BufferedWriter;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Random;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.cli.BasicParser;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import cl.uchile.dcc.unionfind.script.Operation;

/**
 * Writes a random operation script, e.g., to benchmark
 * {@link RunScript}.
 *
 */
public class GenerateScript {
	static final Logger LOG = Logger.getLogger(GenerateScript.class.getSimpleName());
	public static final Level LOG_LEVEL = Level.INFO;
	static{
		for(Handler h : LOG.getParent().getHandlers()){
			if(h instanceof ConsoleHandler){
				h.setLevel(LOG_LEVEL);
			}
		}
		LOG.setLevel(LOG_LEVEL);
	}

	// percentage of instructions per operation
	public static int QUERY_PERCENT = 40;
	public static int MOVE_PERCENT = 15;

	public static void main(String[] args) throws IOException{
		Option nO = new Option("n", "number of elements");
		nO.setArgs(1);
		nO.setRequired(true);

		Option mO = new Option("m", "number of instructions");
		mO.setArgs(1);
		mO.setRequired(true);

		Option sO = new Option("s", "random seed [default current time]");
		sO.setArgs(1);

		Option symO = new Option("sym", "use symbolic operations (= ? move) rather than numeric ones (1 0 2)");
		symO.setArgs(0);

		Option oO = new Option("o", "output file [enter '"+RunScript.STD+"' for stdout]");
		oO.setArgs(1);
		oO.setRequired(true);

		Option ogzO = new Option("ogz", "output should be GZipped");
		ogzO.setArgs(0);

		Option helpO = new Option("h", "print help");

		Options options = new Options();
		options.addOption(nO);
		options.addOption(mO);
		options.addOption(sO);
		options.addOption(symO);
		options.addOption(oO);
		options.addOption(ogzO);
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

		int n = Integer.parseInt(cmd.getOptionValue(nO.getOpt()));
		int m = Integer.parseInt(cmd.getOptionValue(mO.getOpt()));

		long seed = System.currentTimeMillis();
		if(cmd.hasOption(sO.getOpt())){
			seed = Long.parseLong(cmd.getOptionValue(sO.getOpt()));
		}
		LOG.info("Using seed "+seed);

		OutputStream os = null;
		String ostr = cmd.getOptionValue(oO.getOpt());
		boolean stdout = ostr.equals(RunScript.STD);
		if(stdout){
			os = System.out;
		} else{
			os = new FileOutputStream(ostr);
		}
		if(cmd.hasOption(ogzO.getOpt())){
			os = new GZIPOutputStream(os);
		}
		BufferedWriter bw = new BufferedWriter(new OutputStreamWriter(os,RunScript.DEFAULT_ENCODING));

		LOG.info("Writing "+m+" instructions over "+n+" elements ...");
		writeRandomScript(bw, n, m, new Random(seed), cmd.hasOption(symO.getOpt()));
		LOG.info("... done");

		if(stdout && !cmd.hasOption(ogzO.getOpt())){
			bw.flush();
		} else{
			bw.close();
		}
	}

	/**
	 * Writes a header and m random instructions over n elements.
	 *
	 * @param out
	 * @param n number of elements
	 * @param m number of instructions
	 * @param rand
	 * @param symbolic write = ? move rather than 1 0 2
	 * @throws IOException
	 */
	public static void writeRandomScript(Writer out, int n, int m, Random rand, boolean symbolic) throws IOException{
		if(n < 1 && m > 0){
			throw new IllegalArgumentException("Cannot write instructions over an empty universe");
		}
		out.write(n+" "+m+"\n");
		for(int i = 0; i < m; i++){
			int roll = rand.nextInt(100);
			Operation op = null;
			if(roll < QUERY_PERCENT){
				op = Operation.CONNECTED;
			} else if(roll < QUERY_PERCENT + MOVE_PERCENT){
				op = Operation.MOVE;
			} else{
				op = Operation.UNION;
			}
			String token = symbolic ? op.symbol() : op.code();
			out.write(token+" "+rand.nextInt(n)+" "+rand.nextInt(n)+"\n");
		}
		out.flush();
	}
}
