package smv.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import smv.model.smv.SMVExpression;
import smv.parser.SMVParseException;
import smv.parser.SMVParser;

// Expressions are rendered from their tree, then read back.
@RunWith(Parameterized.class)
public class SMVRoundTripTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
				{"a*b+c" },
				{"(a+b)*c" },
				{"a - b - c" },
				{"!(a&b)|c" },
				{"-(x+1)" },
				{"a::b::c" },
				{"(a::b)[7:0]" },
				{"x[i][3:1]" },
				{"a -> b -> c" },
				{"c ? t : e" },
				{"c1 ? t1 : c2 ? t2 : e" },
				{"(c ? a : b) & d" },
				{"x in {1, 2, 3} union {4}" },
				{"1..3" },
				{"-2..-1" },
				{"case a & b : 1; c | d : {2, 3}; TRUE : x mod 2; esac" },
				{"count(a, b, c) >= 2" },
				{"extend(0ud4_1, 4) << 2 != word1(TRUE)" },
				{"toint(unsigned(0sb4_1010)) + 1 <= 5" },
				{"self.children[2].value = 0" },
				{"a xor b xnor c | d" },
				{"a = b = c" },
				{"(1..3) + 1" },
				{"x * ({1, 2})" },
				{"-(0..2)" },
				{"!({TRUE})" },
				{"(1..3)[0]" },
				{"(a)[1]" },
				{"(a.b)[1][2:0]" },
				{"x--note + 1" },
		});
	}

	private final String text;

	public SMVRoundTripTest(String text) {
		this.text = text;
	}

	@Test
	public void testReparse() throws SMVParseException {
		SMVExpression parsed = SMVParser.readSimpleExpression(text);
		String rendered = parsed.copy().toString();
		assertThat(SMVParser.readSimpleExpression(rendered), is(parsed));
	}

	@Test
	public void testRenderingIsStable() throws SMVParseException {
		String rendered = SMVParser.readSimpleExpression(text).copy().toString();
		assertThat(SMVParser.readSimpleExpression(rendered).copy().toString(), is(rendered));
	}

}
