package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * 0[sign]base[width]_value, for example {@code 0sd8_3} or {@code 0b_1010}
 *
 */
public class SMVWord extends SMVExpression {

	private final Character sign;
	private final char base;
	private final Integer width;
	private final String value;

	/**
	 * @param sign 'u', 's' or null when the constant has no sign specifier
	 * @param base one of b B o O d D h H
	 * @param width the width in bits, or null when omitted
	 * @param value the digits after the underscore, underscores included
	 */
	public SMVWord(SourceLocation location, Character sign, char base, Integer width, String value) {
		super(location);
		if(sign != null && sign != 'u' && sign != 's') {
			throw new IllegalArgumentException("invalid word sign specifier: " + sign);
		}
		if("bBoOdDhH".indexOf(base) == -1) {
			throw new IllegalArgumentException("invalid word base: " + base);
		}
		this.sign = sign;
		this.base = base;
		this.width = width;
		this.value = Objects.requireNonNull(value);
	}

	public Character getSign() {
		return sign;
	}

	public char getBase() {
		return base;
	}

	public Integer getWidth() {
		return width;
	}

	public String getValue() {
		return value;
	}

	@Override
	public SMVWord copy() {
		return new SMVWord(getLocation(), sign, base, width, value);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVWord that = (SMVWord) o;
		return base == that.base &&
				Objects.equals(sign, that.sign) &&
				Objects.equals(width, that.width) &&
				value.equals(that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(sign, base, width, value);
	}
}
