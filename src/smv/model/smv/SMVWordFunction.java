package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * extend(value, size) | resize(value, size)
 *
 */
public class SMVWordFunction extends SMVExpression {

	public enum Function {
		EXTEND("extend"),
		RESIZE("resize");

		private final String keyword;

		Function(String keyword) {
			this.keyword = keyword;
		}

		public String getKeyword() {
			return keyword;
		}
	}

	private final Function function;
	private final SMVExpression value;
	private final SMVExpression size;

	public SMVWordFunction(SourceLocation location, Function function, SMVExpression value, SMVExpression size) {
		super(location);
		this.function = Objects.requireNonNull(function);
		this.value = Objects.requireNonNull(value);
		this.size = Objects.requireNonNull(size);
	}

	public Function getFunction() {
		return function;
	}

	public SMVExpression getValue() {
		return value;
	}

	public SMVExpression getSize() {
		return size;
	}

	@Override
	public SMVWordFunction copy() {
		return new SMVWordFunction(getLocation(), function, value, size);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVWordFunction that = (SMVWordFunction) o;
		return function == that.function && value.equals(that.value) && size.equals(that.size);
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, value, size);
	}
}
