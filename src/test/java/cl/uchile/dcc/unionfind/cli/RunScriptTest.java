package cl.uchile.dcc.unionfind.cli;

import static org.junit.Assert.assertEquals;

import java.io.BufferedReader;
import java.io.File;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.google.common.base.Charsets;
import com.google.common.io.Files;
import com.google.common.io.Resources;

import cl.uchile.dcc.unionfind.DisjointSet.DisjointSetArgs;
import cl.uchile.dcc.unionfind.script.ScriptResult;

public class RunScriptTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File fixture(String name) throws Exception {
		File f = folder.newFile(name);
		Files.asCharSink(f, Charsets.UTF_8).write(Resources.toString(Resources.getResource("scripts/"+name), Charsets.UTF_8));
		return f;
	}

	private static String answers(String name) throws Exception {
		return Resources.toString(Resources.getResource("scripts/"+name), Charsets.UTF_8);
	}

	@Test
	public void testSequential() throws Exception {
		File in = fixture("numeric.in");
		File out = new File(folder.getRoot(), "numeric.out");

		RunScript.main(new String[]{ "-i", in.getPath(), "-o", out.getPath() });

		assertEquals(answers("numeric.ans"), Files.asCharSource(out, Charsets.UTF_8).read());
	}

	@Test
	public void testBatched() throws Exception {
		File in = fixture("symbolic.in");
		File out = new File(folder.getRoot(), "symbolic.out");

		RunScript.main(new String[]{ "-i", in.getPath(), "-o", out.getPath(), "-t", "2", "-bs", "2", "-mp", "1", "-pc", "2" });

		assertEquals(answers("symbolic.ans"), Files.asCharSource(out, Charsets.UTF_8).read());
	}

	@Test
	public void testGeneratedScript() throws Exception {
		File script = new File(folder.getRoot(), "random.in");
		GenerateScript.main(new String[]{ "-n", "50", "-m", "300", "-s", "3", "-o", script.getPath() });

		File seq = new File(folder.getRoot(), "seq.out");
		File batch = new File(folder.getRoot(), "batch.out");
		RunScript.main(new String[]{ "-i", script.getPath(), "-o", seq.getPath() });
		RunScript.main(new String[]{ "-i", script.getPath(), "-o", batch.getPath(), "-t", "3", "-bs", "7", "-pc", "1" });

		assertEquals(301, Files.asCharSource(script, Charsets.UTF_8).readLines().size());
		assertEquals("50 300", Files.asCharSource(script, Charsets.UTF_8).readFirstLine());
		assertEquals(Files.asCharSource(seq, Charsets.UTF_8).read(), Files.asCharSource(batch, Charsets.UTF_8).read());
	}

	@Test
	public void testRunScript() throws Exception {
		StringWriter out = new StringWriter();
		ScriptResult sr = RunScript.runScript(new BufferedReader(new StringReader("2 2\n= 0 1\n? 1 0\n")), out, new DisjointSetArgs(), 0, 10);
		assertEquals("yes\n", out.toString());
		assertEquals(1, sr.getSetCount());
	}
}
