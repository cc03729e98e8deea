package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * next(value)
 *
 */
public class SMVNext extends SMVExpression {

	private final SMVExpression value;

	public SMVNext(SourceLocation location, SMVExpression value) {
		super(location);
		this.value = Objects.requireNonNull(value);
	}

	public SMVExpression getValue() {
		return value;
	}

	@Override
	public SMVNext copy() {
		return new SMVNext(getLocation(), value);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return value.equals(((SMVNext) o).value);
	}

	@Override
	public int hashCode() {
		return Objects.hash("next", value);
	}
}
