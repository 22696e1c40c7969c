package cl.uchile.dcc.unionfind.cli;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class MainTest {

	@Test
	public void testResolveIgnoresCase() {
		assertEquals(RunScript.class, Main.resolve("RunScript"));
		assertEquals(RunScript.class, Main.resolve("runscript"));
		assertEquals(GenerateScript.class, Main.resolve("GENERATESCRIPT"));
	}

	@Test
	public void testResolveUnknown() {
		assertNull(Main.resolve("Main"));
		assertNull(Main.resolve("DisjointSet"));
		assertNull(Main.resolve(""));
	}

	@Test
	public void testListUtilities() {
		String list = Main.listUtilities();
		assertTrue(list.contains("\n\tRunScript: "));
		assertTrue(list.contains("\n\tGenerateScript: "));
		assertTrue(list.indexOf("RunScript") < list.indexOf("GenerateScript"));
	}
}
