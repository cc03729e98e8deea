package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * target(value)
 *
 */
public class SMVConversion extends SMVExpression {

	public enum Target {
		WORD1("word1"),
		BOOL("bool"),
		TOINT("toint"),
		SIGNED("signed"),
		UNSIGNED("unsigned");

		private final String keyword;

		Target(String keyword) {
			this.keyword = keyword;
		}

		public String getKeyword() {
			return keyword;
		}
	}

	private final Target target;
	private final SMVExpression value;

	public SMVConversion(SourceLocation location, Target target, SMVExpression value) {
		super(location);
		this.target = Objects.requireNonNull(target);
		this.value = Objects.requireNonNull(value);
	}

	public Target getTarget() {
		return target;
	}

	public SMVExpression getValue() {
		return value;
	}

	@Override
	public SMVConversion copy() {
		return new SMVConversion(getLocation(), target, value);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVConversion that = (SMVConversion) o;
		return target == that.target && value.equals(that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, value);
	}
}
