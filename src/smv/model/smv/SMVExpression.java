package smv.model.smv;

import smv.util.SourceLocation;

public abstract class SMVExpression extends SMVNode {

	/**
	 * Binding strength of non-operator expressions: they never need parentheses.
	 */
	public static final int ATOMIC_PRECEDENCE = 0;

	public SMVExpression(SourceLocation location) {
		super(location);
	}

	/**
	 * @return the precedence rank of this expression, lower binds tighter
	 */
	public int getPrecedence() {
		return ATOMIC_PRECEDENCE;
	}

	@Override
	public abstract SMVExpression copy();

	@Override
	public SMVExpression withSource(String source) {
		return (SMVExpression) super.withSource(source);
	}

	public abstract <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(SMVNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
