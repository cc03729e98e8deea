package smv.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

// Inputs that must be rejected, with the offset the parser gets stuck at.
@RunWith(Parameterized.class)
public class SMVParseExceptionTest {

	@Parameterized.Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"VAR x: boolean", 14, 1 },
				{"VAR x: boolean;\n    y: ;", 23, 2 },
				{"MODULE main\n  VAR\n    x : word[8;\n", 32, 3 },
				{"INIT a &", 8, 1 },
				{"CONSTANTS a b;", 12, 1 },
				{"TRANS x = (y", 12, 1 },
				{"DEFINE d = 1;", 9, 1 },
				{"INIT x = 0ud99999999999_1", 9, 1 },
		});
	}

	private final String text;
	private final int offset;
	private final int line;

	public SMVParseExceptionTest(String text, int offset, int line) {
		this.text = text;
		this.offset = offset;
		this.line = line;
	}

	@Test
	public void test() {
		try {
			if(text.startsWith("MODULE")) {
				SMVParser.readModule(text);
			} else {
				SMVParser.readSection(text);
			}
			fail("Expected SMVParseException");
		} catch (SMVParseException e) {
			assertThat(e.getLocation().getStartOffset(), is(offset));
			assertThat(e.getLocation().getStartLine(), is(line));
			assertThat(e.getExpected().isEmpty(), is(false));
			assertThat(e.getMessage(), containsString("Parse failure at line " + line));
		}
	}

	@Test
	public void testContextIsPrepended() {
		try {
			SMVParser.readSection(text);
			fail("Expected SMVParseException");
		} catch (SMVParseException e) {
			SMVParseException wrapped = new SMVParseException("in section", e);
			assertThat(wrapped.getMessage(), startsWith("in section: Parse failure"));
			assertThat(wrapped.getLocation(), is(e.getLocation()));
			assertThat(wrapped.getCause(), is((Throwable) e));
		}
	}

	@Test(expected = SMVParseException.class)
	public void testOversizedWordWidth() throws SMVParseException {
		SMVParser.readSimpleExpression("0ud99999999999_1");
	}

	@Test
	public void testMissingSemicolonMessage() {
		try {
			SMVParser.readSection("VAR x: boolean");
			fail("Expected SMVParseException");
		} catch (SMVParseException e) {
			assertThat(e.getMessage(), is(
					"Parse failure at line 1, column 15\n" +
					"VAR x: boolean\n" +
					"              ^ EOF\n" +
					"    expected \";\""));
		}
	}

}
