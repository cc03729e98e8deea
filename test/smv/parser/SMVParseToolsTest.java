package smv.parser;

import org.junit.Test;
import smv.util.SourceLocatable;
import smv.util.SourceLocation;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.regex.Pattern;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import static smv.parser.ParseTools.*;
import static smv.parser.SMVParser.*;

public class SMVParseToolsTest {

	private static final Path testFile = Paths.get("TEST");

	private LexicalContext ctx(String contents){
		return new LexicalContext(testFile, contents);
	}

	private <Result extends SourceLocatable> void checkLocation(Grammar<Result> grammar, LexicalContext ctx,
	                                                            int startOffset, int endOffset, int startColumn,
	                                                            int endColumn, int startLine, int endLine)
			throws SMVParseException {
		Result res = grammar.parse(ctx);

		SourceLocation loc = res.getLocation();
		assertThat(
				Arrays.asList(
						loc.getStartOffset(), loc.getEndOffset(), loc.getStartColumn(), loc.getEndColumn(),
						loc.getStartLine(), loc.getEndLine()),
				is(Arrays.asList(startOffset, endOffset, startColumn, endColumn, startLine, endLine)));
	}

	@Test(expected = SMVParseException.class)
	public void testEmptyStringIsNotWhitespace() throws SMVParseException {
		matchWhitespace().parse(ctx(""));
	}

	@Test
	public void testOneSpaceIsWhitespace() throws SMVParseException {
		checkLocation(matchWhitespace(), ctx(" "),
				0, 1, 1, 2, 1, 1);
	}

	@Test
	public void testMatchUnitString() throws SMVParseException {
		checkLocation(matchString("1"), ctx("1"),
				0, 1, 1, 2, 1, 1);
	}

	@Test
	public void testMatchSubString() throws SMVParseException {
		checkLocation(matchString("1"), ctx("12"),
				0, 1, 1, 2, 1, 1);
	}

	@Test(expected = SMVParseException.class)
	public void testMismatchUnitString() throws SMVParseException {
		matchString("1").parse(ctx("2"));
	}

	@Test
	public void testSkipNothing() throws SMVParseException {
		checkLocation(skipWhitespaceAndComments(), ctx(""),
				0, 0, 1, 1, 1, 1);
	}

	@Test
	public void testSkipComments() throws SMVParseException {
		checkLocation(skipWhitespaceAndComments(), ctx("  -- one\n-- two\n x"),
				0, 17, 1, 2, 1, 3);
	}

	@Test
	public void testTokenLocationExcludesWhitespace() throws SMVParseException {
		checkLocation(parseToken("VAR"), ctx("\n  VAR"),
				3, 6, 3, 6, 2, 2);
	}

	@Test
	public void testParseIdentifier() throws SMVParseException {
		checkLocation(parseIdentifierName(), ctx(" counter_cell"),
				1, 13, 2, 14, 1, 1);
	}

	@Test
	public void testIdentifierStopsBeforeArrow() throws SMVParseException {
		assertThat(parseIdentifierName().parse(ctx("a-b->c")).getValue(), is("a-b"));
	}

	@Test(expected = SMVParseException.class)
	public void testIdentifierRejectsReservedWords() throws SMVParseException {
		readOrExcept(ctx("esac"), parseIdentifierName());
	}

	@Test
	public void testKeywordIsAWholeWord() throws SMVParseException {
		checkLocation(parseKeyword("in"), ctx(" in x"),
				1, 3, 2, 4, 1, 1);
		assertThat(parseKeyword("in").enumerate(ctx("init")).isEmpty(), is(true));
		assertThat(parseKeyword("in").enumerate(ctx("in-x")).isEmpty(), is(true));
		assertThat(parseKeyword("in").enumerate(ctx("in->x")).size(), is(1));
	}

	@Test
	public void testSymbolIsNotAPrefix() throws SMVParseException {
		assertThat(parseSymbol(":", "[=:]").enumerate(ctx(":=")).isEmpty(), is(true));
		assertThat(parseSymbol(":", "[=:]").enumerate(ctx("::")).isEmpty(), is(true));
		checkLocation(parseSymbol(":", "[=:]"), ctx(" : x"),
				1, 2, 2, 3, 1, 1);
	}

	@Test
	public void testPatternDescriptionInMessage() {
		try {
			readOrExcept(ctx("x"), matchPattern(Pattern.compile("[0-9]+"), "integer"));
			throw new AssertionError("expected a parse failure");
		} catch (SMVParseException e) {
			assertThat(e.getMessage().contains("expected integer"), is(true));
		}
	}

	@Test
	public void testRepeat1() throws SMVParseException {
		checkLocation(repeat(parseOneOf(matchString("a"), matchString("b"))), ctx("abab"),
				0, 4, 1, 5, 1, 1);
	}

	@Test
	public void testRepeat2() throws SMVParseException {
		checkLocation(repeat(parseOneOf(parseOneOf(matchString("a"), matchString("c")), matchString("b"))), ctx("acbacb"),
				0, 6, 1, 7, 1, 1);
	}

	@Test
	public void testRepeatYieldsLongestFirst() {
		assertThat(repeat(matchString("a")).enumerate(ctx("aaa")).size(), is(4));
		assertThat(cut(repeat(matchString("a"))).enumerate(ctx("aaa")).size(), is(1));
	}

	@Test(expected = SMVParseException.class)
	public void testRepeatOneOrMoreNeedsOne() throws SMVParseException {
		repeatOneOrMore(matchString("a")).parse(ctx("b"));
	}

	@Test
	public void testParseListOf() throws SMVParseException {
		LocatedList<Located<String>> list = parseListOf(parseIdentifierName(), parseToken(","))
				.parse(ctx("a, b ,c"));
		assertThat(list.size(), is(3));
		assertThat(list.get(2).getValue(), is("c"));
	}

	@Test(expected = SMVParseException.class)
	public void testRejectString1() throws SMVParseException {
		reject(matchString("a")).parse(ctx("a"));
	}

	@Test
	public void testRejectString2() throws SMVParseException {
		checkLocation(
				emptySequence()
						.drop(reject(matchString("b")))
						.drop(matchString("a")),
				ctx("a"),
				0, 1, 1, 2, 1, 1);
	}

	@Test
	public void testChoice() throws SMVParseException {
		checkLocation(
				parseOneOf(matchString("a"), matchString("b")),
				ctx("b"),
				0, 1, 1, 2, 1, 1);
	}

	@Test
	public void testMatchStringOneOfPrefersEarlierOption() throws SMVParseException {
		assertThat(matchStringOneOf(Arrays.asList("<<", "<")).parse(ctx("<<")).getValue(), is("<<"));
	}

	@Test(expected = SMVParseException.class)
	public void testReadOrExceptNeedsEOF() throws SMVParseException {
		readOrExcept(ctx("ab"), matchString("a"));
	}

	@Test
	public void testMemoizedGrammarIsReused() throws SMVParseException {
		Grammar<Located<Void>> a = memoize(matchString("a"));
		checkLocation(
				parseOneOf(
						emptySequence().drop(a).drop(matchString("c")),
						emptySequence().drop(a).drop(matchString("b"))),
				ctx("ab"),
				0, 2, 1, 3, 1, 1);
	}

}
