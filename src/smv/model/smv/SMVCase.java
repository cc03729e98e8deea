package smv.model.smv;

import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * AST node:
 *
 * case
 *     c1 : r1;
 *     c2 : r2;
 * esac
 *
 * <p>Arms are kept in order, duplicates included, since the first arm whose condition holds decides the value.
 * Two case expressions are only equal if their arms are equal in the same order.</p>
 *
 */
public class SMVCase extends SMVExpression {

	private final List<SMVCaseArm> arms;

	public SMVCase(SourceLocation location, List<SMVCaseArm> arms) {
		super(location);
		if(arms.isEmpty()) {
			throw new IllegalArgumentException("case needs at least one arm");
		}
		this.arms = Collections.unmodifiableList(new ArrayList<>(arms));
	}

	public List<SMVCaseArm> getArms() {
		return arms;
	}

	@Override
	public SMVCase copy() {
		return new SMVCase(getLocation(), arms);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return arms.equals(((SMVCase) o).arms);
	}

	@Override
	public int hashCode() {
		return arms.hashCode();
	}
}
