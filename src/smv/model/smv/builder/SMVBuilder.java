package smv.model.smv.builder;

import smv.model.smv.*;
import smv.parser.SMVParseException;
import smv.parser.SMVParser;
import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Static factories for building SMV trees in code. Every node is built with an unknown source location.
 * Strings are never turned into expressions implicitly: use {@link #id(String)} for a name and
 * {@link #expr(String)} to parse text.
 */
public final class SMVBuilder {

	private SMVBuilder() {}

	private static SourceLocation here() {
		return SourceLocation.unknown();
	}

	// parsing

	public static SMVExpression expr(String text) throws SMVParseException {
		return SMVParser.readSimpleExpression(text);
	}

	public static SMVExpression nextExpr(String text) throws SMVParseException {
		return SMVParser.readNextExpression(text);
	}

	public static SMVType type(String text) throws SMVParseException {
		return SMVParser.readType(text);
	}

	// atoms

	public static SMVIdentifier id(String name) {
		return new SMVIdentifier(here(), name);
	}

	/**
	 * A dotted reference {@code a.b.c}. A single name gives a plain identifier.
	 */
	public static SMVExpression cid(String head, String... fields) {
		if(fields.length == 0) {
			return id(head);
		}
		List<SMVComplexIdentifier.Segment> segments = new ArrayList<>();
		segments.add(SMVComplexIdentifier.Segment.name(head));
		for(String field : fields) {
			segments.add(SMVComplexIdentifier.Segment.name(field));
		}
		return new SMVComplexIdentifier(here(), segments);
	}

	public static SMVComplexIdentifier cid(List<SMVComplexIdentifier.Segment> segments) {
		return new SMVComplexIdentifier(here(), segments);
	}

	public static SMVNumber num(long value) {
		return new SMVNumber(here(), value);
	}

	public static SMVBool bool(boolean value) {
		return new SMVBool(here(), value);
	}

	/**
	 * @see SMVWord#SMVWord(SourceLocation, Character, char, Integer, String)
	 */
	public static SMVWord word(Character sign, char base, Integer width, String value) {
		return new SMVWord(here(), sign, base, width, value);
	}

	public static SMVRange range(SMVExpression start, SMVExpression stop) {
		return new SMVRange(here(), start, stop);
	}

	public static SMVRange range(long start, long stop) {
		return range(num(start), num(stop));
	}

	// operators

	public static SMVUnaryOp not(SMVExpression operand) {
		return new SMVUnaryOp(here(), SMVUnaryOp.Operator.NOT, operand);
	}

	public static SMVUnaryOp minus(SMVExpression operand) {
		return new SMVUnaryOp(here(), SMVUnaryOp.Operator.MINUS, operand);
	}

	private static SMVBinOp bin(SMVBinaryOperator operator, SMVExpression lhs, SMVExpression rhs) {
		return new SMVBinOp(here(), operator, lhs, rhs);
	}

	public static SMVBinOp concat(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.CONCAT, lhs, rhs);
	}

	public static SMVBinOp mult(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.MULT, lhs, rhs);
	}

	public static SMVBinOp div(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.DIV, lhs, rhs);
	}

	public static SMVBinOp mod(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.MOD, lhs, rhs);
	}

	public static SMVBinOp add(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.ADD, lhs, rhs);
	}

	public static SMVBinOp sub(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.SUB, lhs, rhs);
	}

	public static SMVBinOp shiftLeft(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.SHIFT_LEFT, lhs, rhs);
	}

	public static SMVBinOp shiftRight(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.SHIFT_RIGHT, lhs, rhs);
	}

	public static SMVBinOp union(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.UNION, lhs, rhs);
	}

	public static SMVBinOp in(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.IN, lhs, rhs);
	}

	public static SMVBinOp eq(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.EQ, lhs, rhs);
	}

	public static SMVBinOp neq(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.NEQ, lhs, rhs);
	}

	public static SMVBinOp lt(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.LT, lhs, rhs);
	}

	public static SMVBinOp gt(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.GT, lhs, rhs);
	}

	public static SMVBinOp le(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.LE, lhs, rhs);
	}

	public static SMVBinOp ge(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.GE, lhs, rhs);
	}

	public static SMVBinOp and(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.AND, lhs, rhs);
	}

	public static SMVBinOp or(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.OR, lhs, rhs);
	}

	public static SMVBinOp xor(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.XOR, lhs, rhs);
	}

	public static SMVBinOp xnor(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.XNOR, lhs, rhs);
	}

	public static SMVBinOp iff(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.IFF, lhs, rhs);
	}

	public static SMVBinOp implies(SMVExpression lhs, SMVExpression rhs) {
		return bin(SMVBinaryOperator.IMPLIES, lhs, rhs);
	}

	public static SMVIfThenElse ite(SMVExpression condition, SMVExpression thenExpression,
	                                SMVExpression elseExpression) {
		return new SMVIfThenElse(here(), condition, thenExpression, elseExpression);
	}

	// references and calls

	public static SMVNext next(SMVExpression value) {
		return new SMVNext(here(), value);
	}

	public static SMVInit init(SMVExpression value) {
		return new SMVInit(here(), value);
	}

	public static SMVCount count(SMVExpression... arguments) {
		return new SMVCount(here(), Arrays.asList(arguments));
	}

	public static SMVCaseArm arm(SMVExpression condition, SMVExpression result) {
		return new SMVCaseArm(here(), condition, result);
	}

	public static SMVCase caseExpr(SMVCaseArm... arms) {
		return caseExpr(Arrays.asList(arms));
	}

	public static SMVCase caseExpr(List<SMVCaseArm> arms) {
		return new SMVCase(here(), arms);
	}

	public static SMVSubscript subscript(SMVExpression index) {
		return new SMVSubscript(here(), index);
	}

	public static SMVBitSelection bits(SMVExpression high, SMVExpression low) {
		return new SMVBitSelection(here(), high, low);
	}

	public static SMVBitSelection bits(long high, long low) {
		return bits(num(high), num(low));
	}

	public static SMVArrayAccess access(SMVExpression array, SMVAccess... accesses) {
		return new SMVArrayAccess(here(), array, Arrays.asList(accesses));
	}

	public static SMVSet set(SMVExpression... elements) {
		return new SMVSet(here(), Arrays.asList(elements));
	}

	public static SMVConversion convert(SMVConversion.Target target, SMVExpression value) {
		return new SMVConversion(here(), target, value);
	}

	public static SMVConversion word1(SMVExpression value) {
		return convert(SMVConversion.Target.WORD1, value);
	}

	public static SMVConversion toBool(SMVExpression value) {
		return convert(SMVConversion.Target.BOOL, value);
	}

	public static SMVConversion toInt(SMVExpression value) {
		return convert(SMVConversion.Target.TOINT, value);
	}

	public static SMVConversion toSigned(SMVExpression value) {
		return convert(SMVConversion.Target.SIGNED, value);
	}

	public static SMVConversion toUnsigned(SMVExpression value) {
		return convert(SMVConversion.Target.UNSIGNED, value);
	}

	public static SMVWordFunction extend(SMVExpression value, SMVExpression size) {
		return new SMVWordFunction(here(), SMVWordFunction.Function.EXTEND, value, size);
	}

	public static SMVWordFunction resize(SMVExpression value, SMVExpression size) {
		return new SMVWordFunction(here(), SMVWordFunction.Function.RESIZE, value, size);
	}

	public static SMVCompassion compassion(SMVExpression p, SMVExpression q) {
		return new SMVCompassion(here(), p, q);
	}

	// types

	public static SMVBooleanType booleanType() {
		return new SMVBooleanType(here());
	}

	public static SMVWordType wordType(SMVExpression width) {
		return new SMVWordType(here(), width, null);
	}

	public static SMVWordType wordType(long width) {
		return wordType(num(width));
	}

	public static SMVWordType signedWordType(long width) {
		return new SMVWordType(here(), num(width), SMVWordType.Sign.SIGNED);
	}

	public static SMVWordType unsignedWordType(long width) {
		return new SMVWordType(here(), num(width), SMVWordType.Sign.UNSIGNED);
	}

	public static SMVEnumType enumType(SMVExpression... values) {
		return new SMVEnumType(here(), Arrays.asList(values));
	}

	public static SMVRangeType rangeType(SMVExpression start, SMVExpression stop) {
		return new SMVRangeType(here(), start, stop);
	}

	public static SMVRangeType rangeType(long start, long stop) {
		return rangeType(num(start), num(stop));
	}

	public static SMVArrayType arrayType(SMVExpression start, SMVExpression stop, SMVType elementType) {
		return new SMVArrayType(here(), start, stop, elementType);
	}

	public static SMVArrayType arrayType(long start, long stop, SMVType elementType) {
		return arrayType(num(start), num(stop), elementType);
	}

	public static SMVModuleType moduleType(String moduleName, SMVExpression... arguments) {
		return new SMVModuleType(here(), moduleName, Arrays.asList(arguments), false);
	}

	public static SMVModuleType processType(String moduleName, SMVExpression... arguments) {
		return new SMVModuleType(here(), moduleName, Arrays.asList(arguments), true);
	}

	// declarations, named later by SMVModuleBuilder#declare

	public static SMVDeclaration var(SMVType type) {
		return new SMVDeclaration(here(), SMVSection.Kind.VAR, type);
	}

	public static SMVDeclaration ivar(SMVType type) {
		return new SMVDeclaration(here(), SMVSection.Kind.IVAR, type);
	}

	public static SMVDeclaration frozenVar(SMVType type) {
		return new SMVDeclaration(here(), SMVSection.Kind.FROZENVAR, type);
	}

	public static SMVDeclaration define(SMVExpression value) {
		return new SMVDeclaration(here(), SMVSection.Kind.DEFINE, value);
	}
}
