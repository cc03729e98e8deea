package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * lhs &lt;op&gt; rhs
 *
 * <p>For commutative operators the operands may be given in either order: {@code a + b} equals
 * {@code b + a}, and both hash alike.</p>
 *
 */
public class SMVBinOp extends SMVExpression {

	private final SMVBinaryOperator operator;
	private final SMVExpression lhs;
	private final SMVExpression rhs;

	public SMVBinOp(SourceLocation location, SMVBinaryOperator operator, SMVExpression lhs, SMVExpression rhs) {
		super(location);
		this.operator = Objects.requireNonNull(operator);
		this.lhs = Objects.requireNonNull(lhs);
		this.rhs = Objects.requireNonNull(rhs);
	}

	public SMVBinaryOperator getOperator() {
		return operator;
	}

	public SMVExpression getLHS() {
		return lhs;
	}

	public SMVExpression getRHS() {
		return rhs;
	}

	@Override
	public int getPrecedence() {
		return operator.getPrecedence();
	}

	@Override
	public SMVBinOp copy() {
		return new SMVBinOp(getLocation(), operator, lhs, rhs);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVBinOp that = (SMVBinOp) o;
		if (operator != that.operator) return false;
		if (lhs.equals(that.lhs) && rhs.equals(that.rhs)) return true;
		return operator.isCommutative() && lhs.equals(that.rhs) && rhs.equals(that.lhs);
	}

	@Override
	public int hashCode() {
		if (operator.isCommutative()) {
			return 31 * operator.hashCode() + lhs.hashCode() + rhs.hashCode();
		}
		return Objects.hash(operator, lhs, rhs);
	}
}
