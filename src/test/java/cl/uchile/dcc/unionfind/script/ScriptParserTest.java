package cl.uchile.dcc.unionfind.script;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.BufferedReader;
import java.io.StringReader;

import org.junit.Test;

import cl.uchile.dcc.unionfind.script.ScriptParser.Header;
import cl.uchile.dcc.unionfind.script.ScriptParser.ScriptFormatException;

public class ScriptParserTest {

	@Test
	public void testHeader() throws Exception {
		Header h = ScriptParser.parseHeader("5 9", 1);
		assertEquals(5, h.getElements());
		assertEquals(9, h.getInstructions());

		h = ScriptParser.parseHeader("  7  ", 1);
		assertEquals(7, h.getElements());
		assertEquals(ScriptParser.ALL, h.getInstructions());
	}

	@Test
	public void testReadHeaderSkipsBlankLines() throws Exception {
		BufferedReader br = new BufferedReader(new StringReader("\n \n3 2\n1 0 1\n"));
		Header h = ScriptParser.readHeader(br);
		assertEquals(3, h.getElements());
		assertEquals(2, h.getInstructions());
		assertEquals(3, h.getLine());
		assertEquals("1 0 1", br.readLine());

		assertNull(ScriptParser.readHeader(new BufferedReader(new StringReader("\n\n"))));
	}

	@Test
	public void testBadHeaders() {
		assertBadHeader("x 2");
		assertBadHeader("5 -1");
		assertBadHeader("-5 1");
		assertBadHeader("1 2 3");
		assertBadHeader("99999999999 1");
	}

	@Test
	public void testInstructions() throws Exception {
		ScriptParser parser = new ScriptParser(5);

		Instruction ins = parser.parseInstruction("1 0 4", 2);
		assertEquals(Operation.UNION, ins.getOperation());
		assertEquals(0, ins.getP());
		assertEquals(4, ins.getQ());
		assertTrue(ins.isNumeric());
		assertEquals(2, ins.getLine());

		ins = parser.parseInstruction("= 0 4", 3);
		assertEquals(Operation.UNION, ins.getOperation());
		assertFalse(ins.isNumeric());

		ins = parser.parseInstruction("union 3 2", 3);
		assertEquals(Operation.UNION, ins.getOperation());

		ins = parser.parseInstruction("0 1 2", 4);
		assertEquals(Operation.CONNECTED, ins.getOperation());
		assertEquals("1", ins.answer(true));
		assertEquals("0", ins.answer(false));

		ins = parser.parseInstruction("? 1 2", 4);
		assertEquals(Operation.CONNECTED, ins.getOperation());
		assertEquals("yes", ins.answer(true));
		assertEquals("no", ins.answer(false));

		ins = parser.parseInstruction("connected? 1 2", 4);
		assertEquals(Operation.CONNECTED, ins.getOperation());

		ins = parser.parseInstruction("\t2   3 1 ", 5);
		assertEquals(Operation.MOVE, ins.getOperation());
		assertEquals(3, ins.getP());
		assertEquals(1, ins.getQ());

		ins = parser.parseInstruction("move 3 1", 5);
		assertEquals(Operation.MOVE, ins.getOperation());
		assertEquals("move 3 1", ins.toString());
	}

	@Test
	public void testBadInstructions() {
		ScriptParser parser = new ScriptParser(5);
		assertBadInstruction(parser, "3 0 1");
		assertBadInstruction(parser, "1 0");
		assertBadInstruction(parser, "1 0 1 2");
		assertBadInstruction(parser, "1 0 x");
		assertBadInstruction(parser, "1 0 5");
		assertBadInstruction(parser, "1 -1 0");
		assertBadInstruction(parser, "");
	}

	private static void assertBadHeader(String line){
		try{
			ScriptParser.parseHeader(line, 1);
			fail("Expected header '"+line+"' to be rejected");
		} catch(ScriptFormatException e){
			assertEquals(1, e.getLine());
		}
	}

	private static void assertBadInstruction(ScriptParser parser, String line){
		try{
			parser.parseInstruction(line, 12);
			fail("Expected instruction '"+line+"' to be rejected");
		} catch(ScriptFormatException e){
			assertEquals(12, e.getLine());
			assertTrue(e.getMessage().startsWith("line 12: "));
		}
	}
}
