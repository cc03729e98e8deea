package smv.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.is;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import smv.model.smv.SMVComplexIdentifier;
import smv.model.smv.SMVExpression;

import static smv.model.smv.builder.SMVBuilder.*;

@RunWith(Parameterized.class)
public class SMVExpressionParseTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
				{"1", num(1) },
				{"TRUE", bool(true) },
				{"FALSE", bool(false) },
				{"x", id("x") },
				{"x-y", id("x-y") },
				{"x--note", id("x--note") },
				{"a$b#c", id("a$b#c") },
				{"a.b", cid("a", "b") },
				{"a.b.c", cid("a", "b", "c") },
				{"self.x", cid(Arrays.asList(SMVComplexIdentifier.Segment.self(), SMVComplexIdentifier.Segment.name("x"))) },
				{"a[i].b", cid(Arrays.asList(
						SMVComplexIdentifier.Segment.name("a"),
						SMVComplexIdentifier.Segment.index(id("i")),
						SMVComplexIdentifier.Segment.name("b"))) },

				// word constants
				{"0sd8_3", word('s', 'd', 8, "3") },
				{"0b_1010", word(null, 'b', null, "1010") },
				{"0uh16_ff_ff", word('u', 'h', 16, "ff_ff") },

				// precedence and associativity
				{"x & y | z", or(and(id("x"), id("y")), id("z")) },
				{"x | y & z", or(id("x"), and(id("y"), id("z"))) },
				{"a - b - c", sub(sub(id("a"), id("b")), id("c")) },
				{"a + b * c", add(id("a"), mult(id("b"), id("c"))) },
				{"(a + b) * c", mult(add(id("a"), id("b")), id("c")) },
				{"a -> b -> c", implies(id("a"), implies(id("b"), id("c"))) },
				{"x->y", implies(id("x"), id("y")) },
				{"a & b -> c", implies(and(id("a"), id("b")), id("c")) },
				{"a <-> b <-> c", iff(iff(id("a"), id("b")), id("c")) },
				{"a ? b : c ? d : e", ite(id("a"), id("b"), ite(id("c"), id("d"), id("e"))) },
				{"a = b & c != d", and(eq(id("a"), id("b")), neq(id("c"), id("d"))) },
				{"a < b", lt(id("a"), id("b")) },
				{"a <= b", le(id("a"), id("b")) },
				{"a > b", gt(id("a"), id("b")) },
				{"a >= b", ge(id("a"), id("b")) },
				{"a xor b xnor c", xnor(xor(id("a"), id("b")), id("c")) },
				{"a mod 2 / 3", div(mod(id("a"), num(2)), num(3)) },
				{"a << 1 >> 2", shiftRight(shiftLeft(id("a"), num(1)), num(2)) },
				{"a :: b", concat(id("a"), id("b")) },
				{"a union b in c", in(union(id("a"), id("b")), id("c")) },
				{"x in {1, 2}", in(id("x"), set(num(1), num(2))) },

				// unary operators
				{"! a & b", and(not(id("a")), id("b")) },
				{"!!a", not(not(id("a"))) },
				{"- 1", minus(num(1)) },
				{"-1", minus(num(1)) },
				{"a - - b", sub(id("a"), minus(id("b"))) },

				// ranges
				{"1..3", range(1, 3) },
				{"-1..3", range(-1, 3) },

				// comments are whitespace
				{"a -- first operand\n + b", add(id("a"), id("b")) },

				// calls
				{"case x: 1; TRUE: 0; esac", caseExpr(arm(id("x"), num(1)), arm(bool(true), num(0))) },
				{"count(a, b)", count(id("a"), id("b")) },
				{"toint(x)", toInt(id("x")) },
				{"word1(b)", word1(id("b")) },
				{"bool(w)", toBool(id("w")) },
				{"signed(u)", toSigned(id("u")) },
				{"unsigned(s)", toUnsigned(id("s")) },
				{"extend(w, 2)", extend(id("w"), num(2)) },
				{"resize(w, 4)", resize(id("w"), num(4)) },

				// accesses
				{"a[1]", cid(Arrays.asList(SMVComplexIdentifier.Segment.name("a"), SMVComplexIdentifier.Segment.index(num(1)))) },
				{"a[7:0]", access(id("a"), bits(7, 0)) },
				{"(a :: b)[3:2]", access(concat(id("a"), id("b")), bits(3, 2)) },
				{"(a)[1]", access(id("a"), subscript(num(1))) },
		});
	}

	private final String exprString;
	private final SMVExpression exprExpected;

	public SMVExpressionParseTest(String exprString, SMVExpression exprExpected) {
		this.exprString = exprString;
		this.exprExpected = exprExpected;
	}

	@Test
	public void test() throws SMVParseException {
		SMVExpression actual = SMVParser.readSimpleExpression(exprString);
		assertThat(actual, is(exprExpected));
	}

	@Test
	public void testSourceIsKept() throws SMVParseException {
		SMVExpression actual = SMVParser.readSimpleExpression(exprString);
		assertThat(actual.getSource(), is(exprString));
		assertThat(actual.toString(), is(exprString));
	}

}
