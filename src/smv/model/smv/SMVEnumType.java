package smv.model.smv;

import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * AST node:
 *
 * { v1, v2, ... }
 *
 * where every value is an integer or a symbolic constant.
 *
 */
public class SMVEnumType extends SMVType {

	private final List<SMVExpression> values;

	public SMVEnumType(SourceLocation location, List<SMVExpression> values) {
		super(location);
		if(values.isEmpty()) {
			throw new IllegalArgumentException("an enumeration type needs at least one value");
		}
		this.values = Collections.unmodifiableList(new ArrayList<>(values));
	}

	public List<SMVExpression> getValues() {
		return values;
	}

	@Override
	public SMVEnumType copy() {
		return new SMVEnumType(getLocation(), values);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return values.equals(((SMVEnumType) o).values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}
}
