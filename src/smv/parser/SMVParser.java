package smv.parser;

import smv.model.smv.*;
import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static smv.parser.ParseTools.*;

/**
 *
 * <p>
 * The grammar of the SMV modeling language, as combinators over {@link Grammar}. The grammar objects are built
 * once, when this class is initialized, and are never modified afterwards. Each call to one of the {@code read*}
 * methods runs against its own {@link LexicalContext} and memo table, so calls may happen concurrently.
 * </p>
 *
 * <p>
 * Whitespace and {@code --} comments are skipped before every token. Keywords only match as whole words, and
 * no identifier may be spelled like a reserved word. Binary operators are parsed one precedence level at a time,
 * tightest first:
 * </p>
 *
 * <pre>
 *  !          not := "!" not | array
 *  ::         concat := not ("::" not)*
 *  unary -    minus := "-" minus | concat
 *  * / mod    mult := minus (op minus)*
 *  + -        add := mult (op mult)*
 *  &lt;&lt; &gt;&gt;      shift := add (op add)*
 *             set := signed ".." signed | shift | "{" expr, ... "}"
 *  union      union := set ("union" set)*
 *  in         in := union ("in" union)*
 *  = != ...   cmp := in (op in)*
 *  &amp;          and := cmp ("&amp;" cmp)*
 *  | xor xnor or := and (op and)*
 *  ? :        ite := or ["?" ite ":" ite]
 *  &lt;-&gt;        iff := ite ("&lt;-&gt;" ite)*
 *  -&gt;         implies := iff ["-&gt;" implies]
 * </pre>
 *
 * <p>
 * Every repetition is greedy: a level consumes as many operators as it can and never gives them back.
 * </p>
 *
 * <p>
 * There are two expression grammars. Simple expressions are used in DEFINE, ASSIGN and every constraint but
 * TRANS. Next expressions additionally accept {@code next(e)} wherever a reference is accepted, and are used in
 * TRANS.
 * </p>
 *
 */
public final class SMVParser {

	private static final Logger LOGGER = Logger.getLogger(SMVParser.class.getName());

	private SMVParser() {}

	private static final Pattern SMV_WHITESPACE_AND_COMMENTS = Pattern.compile("(?:\\s|--[^\\n\\r]*)*");
	private static final String SMV_NAME_CHARACTER = "[A-Za-z0-9_$#]";
	// a '-' inside a name must not start "->"
	private static final String SMV_KEYWORD_END = "(?!" + SMV_NAME_CHARACTER + "|-(?!>))";
	private static final Pattern SMV_IDENTIFIER = Pattern.compile("[A-Za-z_](?:" + SMV_NAME_CHARACTER + "|-(?!>))*");
	private static final Pattern SMV_INTEGER = Pattern.compile("[0-9]+(?!" + SMV_NAME_CHARACTER + ")");
	private static final Pattern SMV_SIGNED_INTEGER = Pattern.compile("-?[0-9]+(?!" + SMV_NAME_CHARACTER + ")");
	private static final Pattern SMV_WORD_CONSTANT = Pattern.compile(
			"0([us])?([bBoOdDhH])([0-9]*)_([0-9a-fA-F_]+)");

	public static final List<String> SMV_RESERVED_WORDS = Collections.unmodifiableList(Arrays.asList(
			"MODULE", "VAR", "IVAR", "FROZENVAR", "DEFINE", "CONSTANTS", "ASSIGN", "TRANS", "INIT", "INVAR",
			"FAIRNESS", "JUSTICE", "COMPASSION", "TRUE", "FALSE", "case", "esac", "next", "init", "self",
			"boolean", "word", "array", "of", "signed", "unsigned", "process", "mod", "xor", "xnor", "union",
			"in", "word1", "bool", "toint", "extend", "resize", "count"));
	private static final Set<String> RESERVED = new HashSet<>(SMV_RESERVED_WORDS);

	/**
	 * Returns a grammar that accepts and discards any sequence of whitespace and SMV line comments, including
	 * none at all.
	 * @return the grammar
	 */
	public static Grammar<Located<Void>> skipWhitespaceAndComments() {
		return matchPattern(SMV_WHITESPACE_AND_COMMENTS).map(res -> new Located<>(res.getLocation(), null));
	}

	/**
	 * Matches {@param token} exactly, after any whitespace and comments. The result is located at the token
	 * itself.
	 */
	static Grammar<Located<Void>> parseToken(String token) {
		return emptySequence()
				.drop(skipWhitespaceAndComments())
				.part(matchString(token))
				.map(seq -> seq.getValue().getFirst());
	}

	/**
	 * Matches {@param symbol} unless it is the beginning of a longer symbol, as in ":" against ":=".
	 * @param symbol the symbol to match
	 * @param notFollowedBy a regular expression for what may not immediately follow the symbol
	 */
	static Grammar<Located<Void>> parseSymbol(String symbol, String notFollowedBy) {
		return emptySequence()
				.drop(skipWhitespaceAndComments())
				.part(matchPattern(
						Pattern.compile(Pattern.quote(symbol) + "(?!" + notFollowedBy + ")"), "\"" + symbol + "\"")
						.map(res -> new Located<Void>(res.getLocation(), null)))
				.map(seq -> seq.getValue().getFirst());
	}

	/**
	 * Matches the keyword {@param keyword} as a whole word, so "in" does not match the beginning of "init".
	 */
	static Grammar<Located<Void>> parseKeyword(String keyword) {
		return emptySequence()
				.drop(skipWhitespaceAndComments())
				.part(matchPattern(Pattern.compile(Pattern.quote(keyword) + SMV_KEYWORD_END), "\"" + keyword + "\"")
						.map(res -> new Located<Void>(res.getLocation(), null)))
				.map(seq -> seq.getValue().getFirst());
	}

	static Grammar<Located<MatchResult>> parseTokenPattern(Pattern pattern, String description) {
		return emptySequence()
				.drop(skipWhitespaceAndComments())
				.part(matchPattern(pattern, description))
				.map(seq -> seq.getValue().getFirst());
	}

	/**
	 * Matches an SMV identifier that is not a reserved word.
	 * @return a grammar yielding the located name
	 */
	public static Grammar<Located<String>> parseIdentifierName() {
		return parseTokenPattern(SMV_IDENTIFIER, "identifier")
				.map(res -> new Located<>(res.getLocation(), res.getValue().group()))
				.filter(id -> !RESERVED.contains(id.getValue()));
	}

	private static boolean fitsInLong(String digits) {
		try {
			Long.parseLong(digits);
			return true;
		} catch (NumberFormatException e) {
			return false;
		}
	}

	private static boolean fitsInInt(String digits) {
		try {
			Integer.parseInt(digits);
			return true;
		} catch (NumberFormatException e) {
			return false;
		}
	}

	private static Grammar<SMVNumber> parseInteger(Pattern pattern, String description) {
		return parseTokenPattern(pattern, description)
				.filter(res -> fitsInLong(res.getValue().group()))
				.map(res -> new SMVNumber(res.getLocation(), Long.parseLong(res.getValue().group())));
	}

	private static Grammar<SMVWord> parseWordConstant() {
		return parseTokenPattern(SMV_WORD_CONSTANT, "word constant")
				.filter(res -> res.getValue().group(3).isEmpty() || fitsInInt(res.getValue().group(3)))
				.map(res -> {
					MatchResult m = res.getValue();
					return new SMVWord(
							res.getLocation(),
							m.group(1) == null ? null : m.group(1).charAt(0),
							m.group(2).charAt(0),
							m.group(3).isEmpty() ? null : Integer.valueOf(m.group(3)),
							m.group(4));
				});
	}

	private static Grammar<Located<Void>> parseOptionalSemicolon() {
		return cut(parseOneOf(parseToken(";"), nop()));
	}

	private static Grammar<Located<SMVBinaryOperator>> parseOperator(
			Grammar<Located<Void>> token, SMVBinaryOperator operator) {
		return token.map(v -> new Located<>(v.getLocation(), operator));
	}

	private static final class BinOpPart {
		private final SMVBinaryOperator operator;
		private final SMVExpression rhs;

		public BinOpPart(SMVBinaryOperator operator, SMVExpression rhs) {
			this.operator = operator;
			this.rhs = rhs;
		}

		public SMVBinaryOperator getOperator() {
			return operator;
		}

		public SMVExpression getRhs() {
			return rhs;
		}
	}

	/**
	 * Parses {@param operand} followed by as many (operator, operand) pairs as possible, and folds them to the
	 * left: {@code a - b - c} is {@code (a - b) - c}.
	 */
	@SafeVarargs
	private static Grammar<SMVExpression> parseLeftAssociative(
			Grammar<SMVExpression> operand, Grammar<Located<SMVBinaryOperator>>... operators) {
		Grammar<Located<SMVBinaryOperator>> operator = parseOneOf(operators);
		return emptySequence()
				.part(operand)
				.part(cut(repeat(emptySequence()
						.part(operator)
						.part(operand)
						.map(seq -> new Located<>(seq.getLocation(), new BinOpPart(
								seq.getValue().getRest().getFirst().getValue(),
								seq.getValue().getFirst()))))))
				.map(seq -> {
					SMVExpression lhs = seq.getValue().getRest().getFirst();
					for(Located<BinOpPart> part : seq.getValue().getFirst()) {
						lhs = new SMVBinOp(
								lhs.getLocation().combine(part.getLocation()),
								part.getValue().getOperator(),
								lhs,
								part.getValue().getRhs());
					}
					return lhs;
				});
	}

	private static Grammar<Located<SMVComplexIdentifier.Segment>> parseComplexIdentifierHead() {
		return parseOneOf(
				parseKeyword("self").map(v -> new Located<>(v.getLocation(), SMVComplexIdentifier.Segment.self())),
				parseIdentifierName().map(id -> new Located<>(
						id.getLocation(), SMVComplexIdentifier.Segment.name(id.getValue()))));
	}

	/**
	 * A complex identifier is a name or {@code self}, followed by any number of {@code .name}, {@code .self}
	 * and {@code [index]} segments. A name with no segments is an {@link SMVIdentifier}.
	 * @param index the grammar for expressions inside {@code [ ]}
	 */
	private static Grammar<SMVExpression> parseComplexIdentifier(Grammar<SMVExpression> index) {
		Grammar<Located<SMVComplexIdentifier.Segment>> segment = parseOneOf(
				emptySequence()
						.drop(parseSymbol(".", "\\."))
						.drop(parseKeyword("self"))
						.map(seq -> new Located<>(seq.getLocation(), SMVComplexIdentifier.Segment.self())),
				emptySequence()
						.drop(parseSymbol(".", "\\."))
						.part(parseIdentifierName())
						.map(seq -> new Located<>(
								seq.getLocation(), SMVComplexIdentifier.Segment.name(seq.getValue().getFirst().getValue()))),
				emptySequence()
						.drop(parseToken("["))
						.part(index)
						.drop(parseToken("]"))
						.map(seq -> new Located<>(
								seq.getLocation(), SMVComplexIdentifier.Segment.index(seq.getValue().getFirst())))
		);
		return emptySequence()
				.part(parseComplexIdentifierHead())
				.part(cut(repeat(segment)))
				.map(seq -> {
					Located<SMVComplexIdentifier.Segment> head = seq.getValue().getRest().getFirst();
					LocatedList<Located<SMVComplexIdentifier.Segment>> rest = seq.getValue().getFirst();
					if(rest.isEmpty() && head.getValue().getKind() == SMVComplexIdentifier.Segment.Kind.NAME) {
						return new SMVIdentifier(seq.getLocation(), head.getValue().getName());
					}
					List<SMVComplexIdentifier.Segment> segments = new ArrayList<>();
					segments.add(head.getValue());
					for(Located<SMVComplexIdentifier.Segment> s : rest) {
						segments.add(s.getValue());
					}
					return new SMVComplexIdentifier(seq.getLocation(), segments);
				});
	}

	private static Grammar<SMVExpression> parseParenthesized(Grammar<SMVExpression> expression) {
		return emptySequence()
				.drop(parseToken("("))
				.part(expression)
				.drop(parseToken(")"))
				.map(seq -> seq.getValue().getFirst());
	}

	private static Grammar<LocatedList<SMVExpression>> parseArguments(Grammar<SMVExpression> expression) {
		return emptySequence()
				.drop(parseToken("("))
				.part(parseListOf(expression, parseToken(",")))
				.drop(parseToken(")"))
				.map(seq -> seq.getValue().getFirst());
	}

	private static Grammar<SMVExpression> parseCase(Grammar<SMVExpression> expression) {
		Grammar<SMVCaseArm> arm = emptySequence()
				.part(expression)
				.drop(parseSymbol(":", "[=:]"))
				.part(expression)
				.drop(parseToken(";"))
				.map(seq -> new SMVCaseArm(
						seq.getLocation(), seq.getValue().getRest().getFirst(), seq.getValue().getFirst()));
		return emptySequence()
				.drop(parseKeyword("case"))
				.part(cut(repeatOneOrMore(arm)))
				.drop(parseKeyword("esac"))
				.map(seq -> new SMVCase(seq.getLocation(), seq.getValue().getFirst()));
	}

	private static Grammar<SMVExpression> parseBaseExpression(boolean allowNext, Grammar<SMVExpression> expression,
	                                                          Grammar<SMVExpression> complexIdentifier) {
		List<Grammar<? extends SMVExpression>> options = new ArrayList<>();
		options.add(parseParenthesized(expression));
		options.add(parseCase(expression));
		for(SMVConversion.Target target : SMVConversion.Target.values()) {
			options.add(emptySequence()
					.drop(parseKeyword(target.getKeyword()))
					.part(parseParenthesized(expression))
					.map(seq -> new SMVConversion(seq.getLocation(), target, seq.getValue().getFirst())));
		}
		for(SMVWordFunction.Function function : SMVWordFunction.Function.values()) {
			options.add(emptySequence()
					.drop(parseKeyword(function.getKeyword()))
					.drop(parseToken("("))
					.part(expression)
					.drop(parseToken(","))
					.part(expression)
					.drop(parseToken(")"))
					.map(seq -> new SMVWordFunction(
							seq.getLocation(), function, seq.getValue().getRest().getFirst(), seq.getValue().getFirst())));
		}
		options.add(emptySequence()
				.drop(parseKeyword("count"))
				.part(parseArguments(expression))
				.map(seq -> new SMVCount(seq.getLocation(), seq.getValue().getFirst())));
		if(allowNext) {
			options.add(emptySequence()
					.drop(parseKeyword("next"))
					.part(parseParenthesized(SIMPLE_EXPRESSION))
					.map(seq -> new SMVNext(seq.getLocation(), seq.getValue().getFirst())));
		}
		options.add(parseWordConstant());
		options.add(parseInteger(SMV_INTEGER, "integer"));
		options.add(parseKeyword("TRUE").map(v -> new SMVBool(v.getLocation(), true)));
		options.add(parseKeyword("FALSE").map(v -> new SMVBool(v.getLocation(), false)));
		options.add(complexIdentifier);
		return parseOneOf(options);
	}

	private static Grammar<SMVExpression> parseArrayAccesses(Grammar<SMVExpression> base, Grammar<SMVExpression> expression) {
		Grammar<SMVAccess> access = parseOneOf(
				emptySequence()
						.drop(parseToken("["))
						.part(expression)
						.drop(parseToken("]"))
						.map(seq -> new SMVSubscript(seq.getLocation(), seq.getValue().getFirst())),
				emptySequence()
						.drop(parseToken("["))
						.part(expression)
						.drop(parseSymbol(":", "[=:]"))
						.part(expression)
						.drop(parseToken("]"))
						.map(seq -> new SMVBitSelection(
								seq.getLocation(), seq.getValue().getRest().getFirst(), seq.getValue().getFirst())));
		return emptySequence()
				.part(base)
				.part(cut(repeat(access)))
				.map(seq -> {
					SMVExpression array = seq.getValue().getRest().getFirst();
					LocatedList<SMVAccess> accesses = seq.getValue().getFirst();
					if(accesses.isEmpty()) {
						return array;
					}
					return new SMVArrayAccess(seq.getLocation(), array, accesses);
				});
	}

	private static Grammar<SMVExpression> parseUnary(Grammar<Located<Void>> symbol, SMVUnaryOp.Operator operator,
	                                                 ReferenceGrammar<SMVExpression> self,
	                                                 Grammar<SMVExpression> next) {
		return parseOneOf(
				emptySequence()
						.part(symbol)
						.part(self)
						.map(seq -> new SMVUnaryOp(seq.getLocation(), operator, seq.getValue().getFirst())),
				next);
	}

	private static Grammar<SMVRange> parseRangeConstant() {
		Grammar<SMVNumber> signed = parseInteger(SMV_SIGNED_INTEGER, "integer");
		return emptySequence()
				.part(signed)
				.drop(parseToken(".."))
				.part(signed)
				.map(seq -> new SMVRange(seq.getLocation(), seq.getValue().getRest().getFirst(), seq.getValue().getFirst()));
	}

	/**
	 * Fills in one complete expression grammar, from the loosest level {@param expression} down.
	 * @param allowNext whether {@code next(e)} is accepted as a base expression
	 * @param expression receives the implication level, the entry point of the whole grammar
	 * @param shiftLevel receives the shift level, used for the bounds of range types
	 * @param complexIdentifier receives the complex identifier grammar
	 */
	private static void defineExpressionGrammar(boolean allowNext, ReferenceGrammar<SMVExpression> expression,
	                                            ReferenceGrammar<SMVExpression> shiftLevel,
	                                            ReferenceGrammar<SMVExpression> complexIdentifier) {
		complexIdentifier.setReferencedGrammar(parseComplexIdentifier(expression));

		Grammar<SMVExpression> array = memoize(parseArrayAccesses(
				parseBaseExpression(allowNext, expression, complexIdentifier), expression));

		ReferenceGrammar<SMVExpression> not = new ReferenceGrammar<>();
		not.setReferencedGrammar(parseUnary(parseSymbol("!", "="), SMVUnaryOp.Operator.NOT, not, array));

		Grammar<SMVExpression> concat = memoize(parseLeftAssociative(not,
				parseOperator(parseToken("::"), SMVBinaryOperator.CONCAT)));

		ReferenceGrammar<SMVExpression> minus = new ReferenceGrammar<>();
		minus.setReferencedGrammar(parseUnary(parseSymbol("-", ">"), SMVUnaryOp.Operator.MINUS, minus, concat));

		Grammar<SMVExpression> mult = memoize(parseLeftAssociative(minus,
				parseOperator(parseToken("*"), SMVBinaryOperator.MULT),
				parseOperator(parseToken("/"), SMVBinaryOperator.DIV),
				parseOperator(parseKeyword("mod"), SMVBinaryOperator.MOD)));

		Grammar<SMVExpression> add = memoize(parseLeftAssociative(mult,
				parseOperator(parseToken("+"), SMVBinaryOperator.ADD),
				parseOperator(parseSymbol("-", ">"), SMVBinaryOperator.SUB)));

		shiftLevel.setReferencedGrammar(memoize(parseLeftAssociative(add,
				parseOperator(parseToken("<<"), SMVBinaryOperator.SHIFT_LEFT),
				parseOperator(parseToken(">>"), SMVBinaryOperator.SHIFT_RIGHT))));

		Grammar<SMVExpression> set = memoize(parseOneOf(
				parseRangeConstant(),
				shiftLevel,
				emptySequence()
						.drop(parseToken("{"))
						.part(parseListOf(expression, parseToken(",")))
						.drop(parseToken("}"))
						.map(seq -> new SMVSet(seq.getLocation(), seq.getValue().getFirst()))));

		Grammar<SMVExpression> union = memoize(parseLeftAssociative(set,
				parseOperator(parseKeyword("union"), SMVBinaryOperator.UNION)));

		Grammar<SMVExpression> in = memoize(parseLeftAssociative(union,
				parseOperator(parseKeyword("in"), SMVBinaryOperator.IN)));

		Grammar<SMVExpression> comparison = memoize(parseLeftAssociative(in,
				parseOperator(parseToken("="), SMVBinaryOperator.EQ),
				parseOperator(parseToken("!="), SMVBinaryOperator.NEQ),
				parseOperator(parseToken("<="), SMVBinaryOperator.LE),
				parseOperator(parseToken(">="), SMVBinaryOperator.GE),
				parseOperator(parseSymbol("<", "[<=]|->"), SMVBinaryOperator.LT),
				parseOperator(parseSymbol(">", "[>=]"), SMVBinaryOperator.GT)));

		Grammar<SMVExpression> and = memoize(parseLeftAssociative(comparison,
				parseOperator(parseToken("&"), SMVBinaryOperator.AND)));

		Grammar<SMVExpression> or = memoize(parseLeftAssociative(and,
				parseOperator(parseToken("|"), SMVBinaryOperator.OR),
				parseOperator(parseKeyword("xor"), SMVBinaryOperator.XOR),
				parseOperator(parseKeyword("xnor"), SMVBinaryOperator.XNOR)));

		ReferenceGrammar<SMVExpression> ite = new ReferenceGrammar<>();
		Grammar<SMVExpression> conditional = emptySequence()
				.part(or)
				.drop(parseToken("?"))
				.part(ite)
				.drop(parseSymbol(":", "[=:]"))
				.part(ite)
				.map(seq -> new SMVIfThenElse(
						seq.getLocation(),
						seq.getValue().getRest().getRest().getFirst(),
						seq.getValue().getRest().getFirst(),
						seq.getValue().getFirst()));
		ite.setReferencedGrammar(memoize(cut(parseOneOf(conditional, or))));

		Grammar<SMVExpression> iff = memoize(parseLeftAssociative(ite,
				parseOperator(parseToken("<->"), SMVBinaryOperator.IFF)));

		Grammar<SMVExpression> implication = emptySequence()
				.part(iff)
				.drop(parseToken("->"))
				.part(expression)
				.map(seq -> new SMVBinOp(
						seq.getLocation(), SMVBinaryOperator.IMPLIES, seq.getValue().getRest().getFirst(), seq.getValue().getFirst()));
		expression.setReferencedGrammar(memoize(cut(parseOneOf(implication, iff))));
	}

	static final ReferenceGrammar<SMVExpression> SIMPLE_EXPRESSION = new ReferenceGrammar<>();
	static final ReferenceGrammar<SMVExpression> SIMPLE_SHIFT = new ReferenceGrammar<>();
	static final ReferenceGrammar<SMVExpression> COMPLEX_IDENTIFIER = new ReferenceGrammar<>();
	static final ReferenceGrammar<SMVExpression> NEXT_EXPRESSION = new ReferenceGrammar<>();
	static {
		defineExpressionGrammar(false, SIMPLE_EXPRESSION, SIMPLE_SHIFT, COMPLEX_IDENTIFIER);
		defineExpressionGrammar(true, NEXT_EXPRESSION, new ReferenceGrammar<>(), new ReferenceGrammar<>());
	}

	static final Grammar<SMVIdentifier> IDENTIFIER = parseIdentifierName()
			.map(id -> new SMVIdentifier(id.getLocation(), id.getValue()));

	static final ReferenceGrammar<SMVType> SIMPLE_TYPE = new ReferenceGrammar<>();
	static final ReferenceGrammar<SMVType> TYPE = new ReferenceGrammar<>();
	static {
		Grammar<SMVType> booleanType = parseKeyword("boolean").map(v -> new SMVBooleanType(v.getLocation()));

		Grammar<Located<SMVWordType.Sign>> sign = parseOneOf(
				parseKeyword("signed").map(v -> new Located<>(v.getLocation(), SMVWordType.Sign.SIGNED)),
				parseKeyword("unsigned").map(v -> new Located<>(v.getLocation(), SMVWordType.Sign.UNSIGNED)));
		Grammar<SMVWordType> unsignedWordType = emptySequence()
				.drop(parseKeyword("word"))
				.drop(parseToken("["))
				.part(SIMPLE_EXPRESSION)
				.drop(parseToken("]"))
				.map(seq -> new SMVWordType(seq.getLocation(), seq.getValue().getFirst(), null));
		Grammar<SMVType> wordType = parseOneOf(
				emptySequence()
						.part(sign)
						.part(unsignedWordType)
						.map(seq -> new SMVWordType(
								seq.getLocation(),
								seq.getValue().getFirst().getWidth(),
								seq.getValue().getRest().getFirst().getValue())),
				unsignedWordType);

		Grammar<SMVExpression> enumValue = parseOneOf(
				parseInteger(SMV_SIGNED_INTEGER, "integer"),
				IDENTIFIER);
		Grammar<SMVType> enumType = emptySequence()
				.drop(parseToken("{"))
				.part(parseListOf(enumValue, parseToken(",")))
				.drop(parseToken("}"))
				.map(seq -> new SMVEnumType(seq.getLocation(), seq.getValue().getFirst()));

		Grammar<SMVType> arrayType = emptySequence()
				.drop(parseKeyword("array"))
				.part(SIMPLE_SHIFT)
				.drop(parseToken(".."))
				.part(SIMPLE_SHIFT)
				.drop(parseKeyword("of"))
				.part(SIMPLE_TYPE)
				.map(seq -> new SMVArrayType(
						seq.getLocation(),
						seq.getValue().getRest().getRest().getFirst(),
						seq.getValue().getRest().getFirst(),
						seq.getValue().getFirst()));

		Grammar<SMVType> rangeType = emptySequence()
				.part(SIMPLE_SHIFT)
				.drop(parseToken(".."))
				.part(SIMPLE_SHIFT)
				.map(seq -> new SMVRangeType(
						seq.getLocation(), seq.getValue().getRest().getFirst(), seq.getValue().getFirst()));

		SIMPLE_TYPE.setReferencedGrammar(parseOneOf(booleanType, wordType, enumType, arrayType, rangeType));

		Grammar<LocatedList<SMVExpression>> moduleArguments = cut(parseOneOf(
				parseArguments(SIMPLE_EXPRESSION),
				emptySequence()
						.drop(parseToken("("))
						.drop(parseToken(")"))
						.map(seq -> new LocatedList<SMVExpression>(seq.getLocation(), new ArrayList<>())),
				nop().map(v -> new LocatedList<SMVExpression>(v.getLocation(), new ArrayList<>()))));
		Grammar<Located<Boolean>> process = cut(parseOneOf(
				parseKeyword("process").map(v -> new Located<>(v.getLocation(), true)),
				nop().map(v -> new Located<>(v.getLocation(), false))));
		Grammar<SMVType> moduleType = emptySequence()
				.part(process)
				.part(parseIdentifierName())
				.part(moduleArguments)
				.map(seq -> new SMVModuleType(
						seq.getLocation(),
						seq.getValue().getRest().getFirst().getValue(),
						seq.getValue().getFirst(),
						seq.getValue().getRest().getRest().getFirst().getValue()));

		TYPE.setReferencedGrammar(parseOneOf(SIMPLE_TYPE, moduleType));
	}

	private static final class MappingEntry {
		private final SMVExpression key;
		private final SMVNode value;

		public MappingEntry(SMVExpression key, SMVNode value) {
			this.key = key;
			this.value = value;
		}

		public SMVExpression getKey() {
			return key;
		}

		public SMVNode getValue() {
			return value;
		}
	}

	private static <T extends SMVExpression> Grammar<SMVExpression> asExpression(Grammar<T> grammar) {
		return grammar.map(expression -> expression);
	}

	private static <T extends SMVNode> Grammar<SMVNode> asNode(Grammar<T> grammar) {
		return grammar.map(node -> node);
	}

	static final Map<SMVSection.Kind, Grammar<SMVExpression>> MAPPING_KEYS = new EnumMap<>(SMVSection.Kind.class);
	static final Map<SMVSection.Kind, Grammar<SMVNode>> MAPPING_VALUES = new EnumMap<>(SMVSection.Kind.class);
	static final Map<SMVSection.Kind, Grammar<SMVExpression>> LISTING_ELEMENTS = new EnumMap<>(SMVSection.Kind.class);
	static final Map<SMVSection.Kind, Grammar<SMVSection>> SECTION_BODIES = new EnumMap<>(SMVSection.Kind.class);
	static final ReferenceGrammar<SMVSection> SECTION = new ReferenceGrammar<>();
	static {
		Grammar<SMVExpression> assignTarget = parseOneOf(
				emptySequence()
						.drop(parseKeyword("init"))
						.part(parseParenthesized(COMPLEX_IDENTIFIER))
						.map(seq -> new SMVInit(seq.getLocation(), seq.getValue().getFirst())),
				emptySequence()
						.drop(parseKeyword("next"))
						.part(parseParenthesized(COMPLEX_IDENTIFIER))
						.map(seq -> new SMVNext(seq.getLocation(), seq.getValue().getFirst())),
				COMPLEX_IDENTIFIER);

		MAPPING_KEYS.put(SMVSection.Kind.VAR, asExpression(IDENTIFIER));
		MAPPING_KEYS.put(SMVSection.Kind.IVAR, asExpression(IDENTIFIER));
		MAPPING_KEYS.put(SMVSection.Kind.FROZENVAR, asExpression(IDENTIFIER));
		MAPPING_KEYS.put(SMVSection.Kind.DEFINE, asExpression(IDENTIFIER));
		MAPPING_KEYS.put(SMVSection.Kind.ASSIGN, assignTarget);

		MAPPING_VALUES.put(SMVSection.Kind.VAR, asNode(TYPE));
		MAPPING_VALUES.put(SMVSection.Kind.IVAR, asNode(SIMPLE_TYPE));
		MAPPING_VALUES.put(SMVSection.Kind.FROZENVAR, asNode(SIMPLE_TYPE));
		MAPPING_VALUES.put(SMVSection.Kind.DEFINE, asNode(SIMPLE_EXPRESSION));
		MAPPING_VALUES.put(SMVSection.Kind.ASSIGN, asNode(SIMPLE_EXPRESSION));

		LISTING_ELEMENTS.put(SMVSection.Kind.CONSTANTS, asExpression(IDENTIFIER));
		LISTING_ELEMENTS.put(SMVSection.Kind.TRANS, emptySequence()
				.part(NEXT_EXPRESSION)
				.drop(parseOptionalSemicolon())
				.map(seq -> seq.getValue().getFirst()));
		for(SMVSection.Kind kind : Arrays.asList(SMVSection.Kind.INIT, SMVSection.Kind.INVAR,
				SMVSection.Kind.FAIRNESS, SMVSection.Kind.JUSTICE)) {
			LISTING_ELEMENTS.put(kind, emptySequence()
					.part(SIMPLE_EXPRESSION)
					.drop(parseOptionalSemicolon())
					.map(seq -> seq.getValue().getFirst()));
		}
		LISTING_ELEMENTS.put(SMVSection.Kind.COMPASSION, emptySequence()
				.part(ParseTools.<SMVExpression>cut(emptySequence()
						.drop(parseToken("("))
						.part(SIMPLE_EXPRESSION)
						.drop(parseToken(","))
						.part(SIMPLE_EXPRESSION)
						.drop(parseToken(")"))
						.map(seq -> new SMVCompassion(
								seq.getLocation(), seq.getValue().getRest().getFirst(), seq.getValue().getFirst()))))
				.drop(parseOptionalSemicolon())
				.map(seq -> seq.getValue().getFirst()));

		List<Grammar<? extends SMVSection>> sections = new ArrayList<>();
		for(SMVSection.Kind kind : SMVSection.Kind.values()) {
			Grammar<SMVSection> body;
			switch (kind.getShape()) {
				case MAPPING:
					Grammar<Located<MappingEntry>> entry = emptySequence()
							.part(MAPPING_KEYS.get(kind))
							.drop(kind.getSeparator().trim().equals(":")
									? parseSymbol(":", "[=:]")
									: parseToken(":="))
							.part(MAPPING_VALUES.get(kind))
							.drop(parseToken(";"))
							.map(seq -> new Located<>(seq.getLocation(), new MappingEntry(
									seq.getValue().getRest().getFirst(), seq.getValue().getFirst())));
					body = cut(repeatOneOrMore(entry)).map(entries -> {
						Map<SMVExpression, SMVNode> map = new LinkedHashMap<>();
						for(Located<MappingEntry> e : entries) {
							map.put(e.getValue().getKey(), e.getValue().getValue());
						}
						return new SMVMappingSection(entries.getLocation(), kind, map);
					});
					break;
				case ENUMERATION:
					body = emptySequence()
							.part(parseListOf(LISTING_ELEMENTS.get(kind), parseToken(",")))
							.drop(parseToken(";"))
							.map(seq -> new SMVListingSection(
									seq.getLocation(), kind, new ArrayList<>(seq.getValue().getFirst())));
					break;
				default:
					body = LISTING_ELEMENTS.get(kind)
							.map(element -> new SMVListingSection(
									element.getLocation(), kind, Collections.singletonList(element)));
					break;
			}
			SECTION_BODIES.put(kind, body);
			sections.add(emptySequence()
					.part(parseKeyword(kind.getKeyword()))
					.part(body)
					.map(seq -> relocate(seq.getValue().getFirst(), seq.getLocation())));
		}
		SECTION.setReferencedGrammar(parseOneOf(sections));
	}

	private static SMVSection relocate(SMVSection section, SourceLocation location) {
		if(section instanceof SMVMappingSection) {
			return new SMVMappingSection(location, section.getKind(), ((SMVMappingSection) section).getEntries());
		}
		return new SMVListingSection(location, section.getKind(), ((SMVListingSection) section).getElements());
	}

	/**
	 * Sections of the same kind are merged in order of appearance, and keep the position of the first one.
	 */
	static Map<SMVSection.Kind, SMVSection> mergeSections(List<SMVSection> sections) {
		Map<SMVSection.Kind, SMVSection> merged = new LinkedHashMap<>();
		for(SMVSection section : sections) {
			SMVSection previous = merged.get(section.getKind());
			if(previous == null) {
				merged.put(section.getKind(), section);
			}else{
				LOGGER.finer("merging repeated " + section.getKind() + " section");
				merged.put(section.getKind(), previous.merge(section));
			}
		}
		return merged;
	}

	static final ReferenceGrammar<SMVModule> MODULE = new ReferenceGrammar<>();
	static final ReferenceGrammar<SMVModel> MODEL = new ReferenceGrammar<>();
	static {
		Grammar<LocatedList<SMVIdentifier>> moduleParameters = cut(parseOneOf(
				emptySequence()
						.drop(parseToken("("))
						.part(parseListOf(IDENTIFIER, parseToken(",")))
						.drop(parseToken(")"))
						.map(seq -> seq.getValue().getFirst()),
				emptySequence()
						.drop(parseToken("("))
						.drop(parseToken(")"))
						.map(seq -> new LocatedList<SMVIdentifier>(seq.getLocation(), new ArrayList<>())),
				nop().map(v -> new LocatedList<SMVIdentifier>(v.getLocation(), new ArrayList<>()))));
		MODULE.setReferencedGrammar(emptySequence()
				.drop(parseKeyword("MODULE"))
				.part(parseIdentifierName())
				.part(moduleParameters)
				.part(cut(repeat(SECTION)))
				.map(seq -> new SMVModule(
						seq.getLocation(),
						seq.getValue().getRest().getRest().getFirst().getValue(),
						seq.getValue().getRest().getFirst(),
						mergeSections(seq.getValue().getFirst()))));
		MODEL.setReferencedGrammar(cut(repeatOneOrMore(MODULE))
				.map(modules -> new SMVModel(modules.getLocation(), modules)));

		LOGGER.fine("SMV grammar initialized");
	}

	/**
	 * Parses the whole of {@param ctx} with {@param grammar}, allowing trailing whitespace and comments.
	 */
	private static <T extends SMVNode> T readAll(LexicalContext ctx, Grammar<T> grammar) throws SMVParseException {
		return readOrExcept(ctx, emptySequence()
				.part(grammar)
				.drop(skipWhitespaceAndComments())
				.map(seq -> seq.getValue().getFirst()));
	}

	/**
	 * @return a copy of {@param node} carrying the text it was parsed from
	 */
	@SuppressWarnings("unchecked")
	private static <T extends SMVNode> T withParsedSource(LexicalContext ctx, T node) {
		SourceLocation location = node.getLocation();
		return (T) node.withSource(
				ctx.getText().subSequence(location.getStartOffset(), location.getEndOffset()).toString());
	}

	private static SMVSection withParsedElementSources(LexicalContext ctx, SMVSection section) {
		if(section.getKind().getShape() != SMVSection.Shape.BODIES) {
			return section;
		}
		List<SMVExpression> elements = ((SMVListingSection) section).getElements()
				.stream()
				.map(element -> withParsedSource(ctx, element))
				.collect(Collectors.toList());
		return new SMVListingSection(section.getLocation(), section.getKind(), elements);
	}

	private static void checkShape(SMVSection.Kind kind, boolean mapping) {
		if((kind.getShape() == SMVSection.Shape.MAPPING) != mapping) {
			throw new IllegalArgumentException(
					kind + (mapping ? " is not a mapping section" : " is not a listing section"));
		}
	}

	public static SMVIdentifier readIdentifier(LexicalContext ctx) throws SMVParseException {
		return withParsedSource(ctx, readAll(ctx, IDENTIFIER));
	}

	public static SMVIdentifier readIdentifier(String text) throws SMVParseException {
		return readIdentifier(new LexicalContext(text));
	}

	/**
	 * Reads a name possibly followed by field, {@code self} and index segments. A lone name yields an
	 * {@link SMVIdentifier}.
	 */
	public static SMVExpression readComplexIdentifier(LexicalContext ctx) throws SMVParseException {
		return withParsedSource(ctx, readAll(ctx, COMPLEX_IDENTIFIER));
	}

	public static SMVExpression readComplexIdentifier(String text) throws SMVParseException {
		return readComplexIdentifier(new LexicalContext(text));
	}

	public static SMVExpression readSimpleExpression(LexicalContext ctx) throws SMVParseException {
		return withParsedSource(ctx, readAll(ctx, SIMPLE_EXPRESSION));
	}

	public static SMVExpression readSimpleExpression(String text) throws SMVParseException {
		return readSimpleExpression(new LexicalContext(text));
	}

	public static SMVExpression readNextExpression(LexicalContext ctx) throws SMVParseException {
		return withParsedSource(ctx, readAll(ctx, NEXT_EXPRESSION));
	}

	public static SMVExpression readNextExpression(String text) throws SMVParseException {
		return readNextExpression(new LexicalContext(text));
	}

	public static SMVType readType(LexicalContext ctx) throws SMVParseException {
		return withParsedSource(ctx, readAll(ctx, TYPE));
	}

	public static SMVType readType(String text) throws SMVParseException {
		return readType(new LexicalContext(text));
	}

	public static SMVType readSimpleType(LexicalContext ctx) throws SMVParseException {
		return withParsedSource(ctx, readAll(ctx, SIMPLE_TYPE));
	}

	public static SMVType readSimpleType(String text) throws SMVParseException {
		return readSimpleType(new LexicalContext(text));
	}

	/**
	 * Reads the body of a section of the given kind, that is everything after its keyword. Constraint bodies
	 * keep the text they were parsed from, so their layout survives rendering.
	 */
	public static SMVSection readSectionBody(SMVSection.Kind kind, LexicalContext ctx) throws SMVParseException {
		return withParsedElementSources(ctx, readAll(ctx, SECTION_BODIES.get(kind)));
	}

	public static SMVSection readSectionBody(SMVSection.Kind kind, String text) throws SMVParseException {
		return readSectionBody(kind, new LexicalContext(text));
	}

	/**
	 * Reads what stands left of the separator in a mapping section of kind {@param kind}.
	 * @throws IllegalArgumentException if {@param kind} is not a mapping section
	 */
	public static SMVExpression readMappingKey(SMVSection.Kind kind, LexicalContext ctx) throws SMVParseException {
		checkShape(kind, true);
		return withParsedSource(ctx, readAll(ctx, MAPPING_KEYS.get(kind)));
	}

	public static SMVExpression readMappingKey(SMVSection.Kind kind, String text) throws SMVParseException {
		return readMappingKey(kind, new LexicalContext(text));
	}

	/**
	 * Reads what stands right of the separator in a mapping section of kind {@param kind}: a type or an
	 * expression.
	 * @throws IllegalArgumentException if {@param kind} is not a mapping section
	 */
	public static SMVNode readMappingValue(SMVSection.Kind kind, LexicalContext ctx) throws SMVParseException {
		checkShape(kind, true);
		return withParsedSource(ctx, readAll(ctx, MAPPING_VALUES.get(kind)));
	}

	public static SMVNode readMappingValue(SMVSection.Kind kind, String text) throws SMVParseException {
		return readMappingValue(kind, new LexicalContext(text));
	}

	/**
	 * Reads one element of a listing section: an identifier for CONSTANTS, one constraint body otherwise.
	 * @throws IllegalArgumentException if {@param kind} is a mapping section
	 */
	public static SMVExpression readListingElement(SMVSection.Kind kind, LexicalContext ctx) throws SMVParseException {
		checkShape(kind, false);
		return withParsedSource(ctx, readAll(ctx, LISTING_ELEMENTS.get(kind)));
	}

	public static SMVExpression readListingElement(SMVSection.Kind kind, String text) throws SMVParseException {
		return readListingElement(kind, new LexicalContext(text));
	}

	public static SMVSection readSection(LexicalContext ctx) throws SMVParseException {
		return withParsedElementSources(ctx, readAll(ctx, SECTION));
	}

	public static SMVSection readSection(String text) throws SMVParseException {
		return readSection(new LexicalContext(text));
	}

	public static SMVModule readModule(LexicalContext ctx) throws SMVParseException {
		return withParsedSource(ctx, readAll(ctx, MODULE));
	}

	public static SMVModule readModule(String text) throws SMVParseException {
		return readModule(new LexicalContext(text));
	}

	public static SMVModel readModel(LexicalContext ctx) throws SMVParseException {
		return withParsedSource(ctx, readAll(ctx, MODEL));
	}

	public static SMVModel readModel(String text) throws SMVParseException {
		return readModel(new LexicalContext(text));
	}
}
