package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * condition : result;
 *
 */
public class SMVCaseArm extends SMVNode {

	private final SMVExpression condition;
	private final SMVExpression result;

	public SMVCaseArm(SourceLocation location, SMVExpression condition, SMVExpression result) {
		super(location);
		this.condition = Objects.requireNonNull(condition);
		this.result = Objects.requireNonNull(result);
	}

	public SMVExpression getCondition() {
		return condition;
	}

	public SMVExpression getResult() {
		return result;
	}

	@Override
	public SMVCaseArm copy() {
		return new SMVCaseArm(getLocation(), condition, result);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVCaseArm that = (SMVCaseArm) o;
		return condition.equals(that.condition) && result.equals(that.result);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, result);
	}
}
