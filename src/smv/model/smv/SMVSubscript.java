package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * [index]
 *
 */
public class SMVSubscript extends SMVAccess {

	private final SMVExpression index;

	public SMVSubscript(SourceLocation location, SMVExpression index) {
		super(location);
		this.index = Objects.requireNonNull(index);
	}

	public SMVExpression getIndex() {
		return index;
	}

	@Override
	public SMVSubscript copy() {
		return new SMVSubscript(getLocation(), index);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return index.equals(((SMVSubscript) o).index);
	}

	@Override
	public int hashCode() {
		return Objects.hash("subscript", index);
	}
}
