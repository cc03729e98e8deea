package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node, the body of a COMPASSION constraint:
 *
 * (p, q)
 *
 */
public class SMVCompassion extends SMVExpression {

	private final SMVExpression p;
	private final SMVExpression q;

	public SMVCompassion(SourceLocation location, SMVExpression p, SMVExpression q) {
		super(location);
		this.p = Objects.requireNonNull(p);
		this.q = Objects.requireNonNull(q);
	}

	public SMVExpression getP() {
		return p;
	}

	public SMVExpression getQ() {
		return q;
	}

	@Override
	public SMVCompassion copy() {
		return new SMVCompassion(getLocation(), p, q);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVCompassion that = (SMVCompassion) o;
		return p.equals(that.p) && q.equals(that.q);
	}

	@Override
	public int hashCode() {
		return Objects.hash(p, q);
	}
}
