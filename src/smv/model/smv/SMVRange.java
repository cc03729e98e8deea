package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * start..stop
 *
 */
public class SMVRange extends SMVExpression {

	private final SMVExpression start;
	private final SMVExpression stop;

	public SMVRange(SourceLocation location, SMVExpression start, SMVExpression stop) {
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
	public int getPrecedence() {
		return SMVSet.PRECEDENCE;
	}

	@Override
	public SMVRange copy() {
		return new SMVRange(getLocation(), start, stop);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVRange that = (SMVRange) o;
		return start.equals(that.start) && stop.equals(that.stop);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, stop);
	}
}
