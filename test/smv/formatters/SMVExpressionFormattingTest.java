package smv.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.is;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import smv.model.smv.SMVNode;

import static smv.model.smv.builder.SMVBuilder.*;

@RunWith(Parameterized.class)
public class SMVExpressionFormattingTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
				{add(mult(id("a"), id("b")), id("c")), "a * b + c" },
				{mult(add(id("a"), id("b")), id("c")), "(a + b) * c" },
				{sub(sub(id("a"), id("b")), id("c")), "a - b - c" },
				// only a strictly looser operand is enclosed, whichever side it is on
				{sub(id("a"), sub(id("b"), id("c"))), "a - b - c" },
				{and(or(id("a"), id("b")), not(id("c"))), "(a | b) & ! c" },
				{not(and(id("a"), id("b"))), "! (a & b)" },
				{minus(num(1)), "- 1" },
				{concat(id("a"), minus(id("b"))), "a::(- b)" },
				{implies(and(id("a"), id("b")), id("c")), "a & b -> c" },
				{ite(id("c"), add(id("x"), num(1)), num(0)), "c ? x + 1 : 0" },
				{ite(implies(id("a"), id("b")), id("x"), id("y")), "(a -> b) ? x : y" },
				{in(id("x"), set(num(1), num(2))), "x in {1, 2}" },
				{union(range(1, 3), set(num(7))), "1..3 union {7}" },
				{add(set(num(1), num(2)), num(1)), "({1, 2}) + 1" },
				{mult(id("x"), range(0, 2)), "x * (0..2)" },
				{access(id("a"), subscript(num(1))), "(a)[1]" },
				{access(id("a"), bits(3, 0)), "a[3:0]" },
				{eq(next(id("x")), init(id("y"))), "next(x) = init(y)" },
				{caseExpr(arm(id("x"), num(1)), arm(bool(true), num(0))), "case x: 1; TRUE: 0; esac" },
				{count(id("a"), id("b")), "count(a, b)" },
				{toInt(id("w")), "toint(w)" },
				{resize(id("w"), num(4)), "resize(w, 4)" },
				{access(add(id("a"), id("b")), bits(3, 0), subscript(num(1))), "(a + b)[3:0][1]" },
				{cid("a", "b"), "a.b" },
				{word('s', 'd', 8, "3"), "0sd8_3" },
				{word(null, 'h', null, "ff"), "0h_ff" },
				{compassion(id("p"), id("q")), "(p, q)" },

				// types
				{booleanType(), "boolean" },
				{signedWordType(8), "signed word[8]" },
				{wordType(add(id("n"), num(1))), "word[n + 1]" },
				{enumType(id("a"), num(-1)), "{a, -1}" },
				{rangeType(num(0), sub(id("n"), num(1))), "0..n - 1" },
				{rangeType(num(0), id("n")), "0..n" },
				{rangeType(num(0), union(id("n"), id("m"))), "0..(n union m)" },
				{arrayType(0, 3, wordType(2)), "array 0..3 of word[2]" },
				{moduleType("m"), "m" },
				{moduleType("m", num(1), id("x")), "m(1, x)" },
				{processType("p", id("s")), "process p(s)" },
		});
	}

	private final SMVNode node;
	private final String expected;

	public SMVExpressionFormattingTest(SMVNode node, String expected) {
		this.node = node;
		this.expected = expected;
	}

	@Test
	public void test() {
		assertThat(node.toString(), is(expected));
	}

	@Test
	public void testSourceWins() {
		assertThat(node.withSource("verbatim").toString(), is("verbatim"));
	}

}
