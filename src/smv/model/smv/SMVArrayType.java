package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * array start..stop of elementType
 *
 */
public class SMVArrayType extends SMVType {

	private final SMVExpression start;
	private final SMVExpression stop;
	private final SMVType elementType;

	public SMVArrayType(SourceLocation location, SMVExpression start, SMVExpression stop, SMVType elementType) {
		super(location);
		this.start = Objects.requireNonNull(start);
		this.stop = Objects.requireNonNull(stop);
		this.elementType = Objects.requireNonNull(elementType);
	}

	public SMVExpression getStart() {
		return start;
	}

	public SMVExpression getStop() {
		return stop;
	}

	public SMVType getElementType() {
		return elementType;
	}

	@Override
	public SMVArrayType copy() {
		return new SMVArrayType(getLocation(), start, stop, elementType);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVArrayType that = (SMVArrayType) o;
		return start.equals(that.start) && stop.equals(that.stop) && elementType.equals(that.elementType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, stop, elementType);
	}
}
