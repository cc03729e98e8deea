package smv.model.smv;

import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 *
 * AST node:
 *
 * array[i][7:0]...
 *
 */
public class SMVArrayAccess extends SMVExpression {

	private final SMVExpression array;
	private final List<SMVAccess> accesses;

	public SMVArrayAccess(SourceLocation location, SMVExpression array, List<SMVAccess> accesses) {
		super(location);
		if(accesses.isEmpty()) {
			throw new IllegalArgumentException("an array access needs at least one subscript or bit selection");
		}
		this.array = Objects.requireNonNull(array);
		this.accesses = Collections.unmodifiableList(new ArrayList<>(accesses));
	}

	public SMVExpression getArray() {
		return array;
	}

	public List<SMVAccess> getAccesses() {
		return accesses;
	}

	@Override
	public SMVArrayAccess copy() {
		return new SMVArrayAccess(getLocation(), array, accesses);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVArrayAccess that = (SMVArrayAccess) o;
		return array.equals(that.array) && accesses.equals(that.accesses);
	}

	@Override
	public int hashCode() {
		return Objects.hash(array, accesses);
	}
}
