package smv.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.is;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import smv.model.smv.SMVType;

import static smv.model.smv.builder.SMVBuilder.*;

@RunWith(Parameterized.class)
public class SMVTypeParseTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
				{"boolean", booleanType(), true },
				{"word[8]", wordType(8), true },
				{"word[N * 2]", wordType(mult(id("N"), num(2))), true },
				{"signed word[4]", signedWordType(4), true },
				{"unsigned word[4]", unsignedWordType(4), true },
				{"{a, b, 1, -2}", enumType(id("a"), id("b"), num(1), num(-2)), true },
				{"0..7", rangeType(0, 7), true },
				// bounds are shift-level expressions, so a leading minus is an operator here
				{"-1..1", rangeType(minus(num(1)), num(1)), true },
				{"N..N + 3", rangeType(id("N"), add(id("N"), num(3))), true },
				{"array 0..3 of boolean", arrayType(0, 3, booleanType()), true },
				{"array 0..1 of array 0..2 of word[2]", arrayType(0, 1, arrayType(0, 2, wordType(2))), true },
				{"counter(1, x)", moduleType("counter", num(1), id("x")), false },
				{"counter()", moduleType("counter"), false },
				{"main", moduleType("main"), false },
				{"process user(s)", processType("user", id("s")), false },
		});
	}

	private final String typeString;
	private final SMVType typeExpected;
	private final boolean simple;

	public SMVTypeParseTest(String typeString, SMVType typeExpected, boolean simple) {
		this.typeString = typeString;
		this.typeExpected = typeExpected;
		this.simple = simple;
	}

	@Test
	public void testType() throws SMVParseException {
		assertThat(SMVParser.readType(typeString), is(typeExpected));
	}

	@Test
	public void testSimpleType() {
		try {
			SMVType actual = SMVParser.readSimpleType(typeString);
			assertTrue("module types are not simple types", simple);
			assertThat(actual, is(typeExpected));
		} catch (SMVParseException e) {
			assertFalse(e.getMessage(), simple);
		}
	}

}
