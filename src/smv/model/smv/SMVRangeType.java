package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

public class SMVRangeType extends SMVType {

	private final SMVExpression start;
	private final SMVExpression stop;

	public SMVRangeType(SourceLocation location, SMVExpression start, SMVExpression stop) {
		super(location);
		this.start = Objects.requireNonNull(start);
		this.stop = Objects.requireNonNull(stop);
	}

	public SMVExpression getStart() {
		return start;
	}

	public SMVExpression getStop() {
		return stop;
	}

	@Override
	public SMVRangeType copy() {
		return new SMVRangeType(getLocation(), start, stop);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVRangeType that = (SMVRangeType) o;
		return start.equals(that.start) && stop.equals(that.stop);
	}

	@Override
	public int hashCode() {
		return Objects.hash("range", start, stop);
	}
}
