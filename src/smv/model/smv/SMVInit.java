package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * init(value)
 *
 */
public class SMVInit extends SMVExpression {

	private final SMVExpression value;

	public SMVInit(SourceLocation location, SMVExpression value) {
		super(location);
		this.value = Objects.requireNonNull(value);
	}

	public SMVExpression getValue() {
		return value;
	}

	@Override
	public SMVInit copy() {
		return new SMVInit(getLocation(), value);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return value.equals(((SMVInit) o).value);
	}

	@Override
	public int hashCode() {
		return Objects.hash("init", value);
	}
}
