package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * condition ? then : else
 *
 */
public class SMVIfThenElse extends SMVExpression {

	public static final int PRECEDENCE = 12;

	private final SMVExpression condition;
	private final SMVExpression thenExpression;
	private final SMVExpression elseExpression;

	public SMVIfThenElse(SourceLocation location, SMVExpression condition, SMVExpression thenExpression,
	                     SMVExpression elseExpression) {
		super(location);
		this.condition = Objects.requireNonNull(condition);
		this.thenExpression = Objects.requireNonNull(thenExpression);
		this.elseExpression = Objects.requireNonNull(elseExpression);
	}

	public SMVExpression getCondition() {
		return condition;
	}

	public SMVExpression getThen() {
		return thenExpression;
	}

	public SMVExpression getElse() {
		return elseExpression;
	}

	@Override
	public int getPrecedence() {
		return PRECEDENCE;
	}

	@Override
	public SMVIfThenElse copy() {
		return new SMVIfThenElse(getLocation(), condition, thenExpression, elseExpression);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVIfThenElse that = (SMVIfThenElse) o;
		return condition.equals(that.condition) &&
				thenExpression.equals(that.thenExpression) &&
				elseExpression.equals(that.elseExpression);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, thenExpression, elseExpression);
	}
}
