package smv.model.smv;

import smv.util.SourceLocation;

public class SMVNumber extends SMVExpression {

	private final long value;

	public SMVNumber(SourceLocation location, long value) {
		super(location);
		this.value = value;
	}

	public long getValue() {
		return value;
	}

	@Override
	public SMVNumber copy() {
		return new SMVNumber(getLocation(), value);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return value == ((SMVNumber) o).value;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(value);
	}
}
