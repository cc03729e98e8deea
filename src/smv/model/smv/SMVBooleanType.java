package smv.model.smv;

import smv.util.SourceLocation;

public class SMVBooleanType extends SMVType {

	public SMVBooleanType(SourceLocation location) {
		super(location);
	}

	@Override
	public SMVBooleanType copy() {
		return new SMVBooleanType(getLocation());
	}

	@Override
	public <T, E extends Throwable> T accept(SMVTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return o != null && getClass() == o.getClass();
	}

	@Override
	public int hashCode() {
		return SMVBooleanType.class.getName().hashCode();
	}
}
