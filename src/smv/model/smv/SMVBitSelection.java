package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * [high : low]
 *
 */
public class SMVBitSelection extends SMVAccess {

	private final SMVExpression high;
	private final SMVExpression low;

	public SMVBitSelection(SourceLocation location, SMVExpression high, SMVExpression low) {
		super(location);
		this.high = Objects.requireNonNull(high);
		this.low = Objects.requireNonNull(low);
	}

	public SMVExpression getHigh() {
		return high;
	}

	public SMVExpression getLow() {
		return low;
	}

	@Override
	public SMVBitSelection copy() {
		return new SMVBitSelection(getLocation(), high, low);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVBitSelection that = (SMVBitSelection) o;
		return high.equals(that.high) && low.equals(that.low);
	}

	@Override
	public int hashCode() {
		return Objects.hash(high, low);
	}
}
