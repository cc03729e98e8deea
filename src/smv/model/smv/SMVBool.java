package smv.model.smv;

import smv.util.SourceLocation;

public class SMVBool extends SMVExpression {

	private final boolean value;

	public SMVBool(SourceLocation location, boolean value) {
		super(location);
		this.value = value;
	}

	public boolean getValue() {
		return value;
	}

	@Override
	public SMVBool copy() {
		return new SMVBool(getLocation(), value);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return value == ((SMVBool) o).value;
	}

	@Override
	public int hashCode() {
		return Boolean.hashCode(value);
	}
}
