package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * [signed | unsigned] word[width]
 *
 */
public class SMVWordType extends SMVType {

	public enum Sign {
		SIGNED("signed"),
		UNSIGNED("unsigned");

		private final String keyword;

		Sign(String keyword) {
			this.keyword = keyword;
		}

		public String getKeyword() {
			return keyword;
		}
	}

	private final SMVExpression width;
	private final Sign sign;

	/**
	 * @param sign the sign keyword written before {@code word}, or null when there is none
	 */
	public SMVWordType(SourceLocation location, SMVExpression width, Sign sign) {
		super(location);
		this.width = Objects.requireNonNull(width);
		this.sign = sign;
	}

	public SMVExpression getWidth() {
		return width;
	}

	public Sign getSign() {
		return sign;
	}

	@Override
	public SMVWordType copy() {
		return new SMVWordType(getLocation(), width, sign);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVWordType that = (SMVWordType) o;
		return width.equals(that.width) && sign == that.sign;
	}

	@Override
	public int hashCode() {
		return Objects.hash(width, sign);
	}
}
