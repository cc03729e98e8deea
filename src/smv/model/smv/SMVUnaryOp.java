package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * ! operand | - operand
 *
 */
public class SMVUnaryOp extends SMVExpression {

	public enum Operator {
		NOT("!", 1),
		MINUS("-", 3);

		private final String symbol;
		private final int precedence;

		Operator(String symbol, int precedence) {
			this.symbol = symbol;
			this.precedence = precedence;
		}

		public String getSymbol() {
			return symbol;
		}

		public int getPrecedence() {
			return precedence;
		}
	}

	private final Operator operator;
	private final SMVExpression operand;

	public SMVUnaryOp(SourceLocation location, Operator operator, SMVExpression operand) {
		super(location);
		this.operator = Objects.requireNonNull(operator);
		this.operand = Objects.requireNonNull(operand);
	}

	public Operator getOperator() {
		return operator;
	}

	public SMVExpression getOperand() {
		return operand;
	}

	@Override
	public int getPrecedence() {
		return operator.getPrecedence();
	}

	@Override
	public SMVUnaryOp copy() {
		return new SMVUnaryOp(getLocation(), operator, operand);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVUnaryOp that = (SMVUnaryOp) o;
		return operator == that.operator && operand.equals(that.operand);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, operand);
	}
}
