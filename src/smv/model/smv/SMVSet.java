package smv.model.smv;

import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 *
 * AST node:
 *
 * { a, b, ... }
 *
 * <p>Elements are rendered in the order given, but two sets are equal whenever they contain the same
 * elements.</p>
 *
 */
public class SMVSet extends SMVExpression {

	/**
	 * Set literals and ranges are only accepted where a {@code union} operand is, so they rank with it.
	 */
	public static final int PRECEDENCE = SMVBinaryOperator.UNION.getPrecedence();

	private final List<SMVExpression> elements;

	public SMVSet(SourceLocation location, List<SMVExpression> elements) {
		super(location);
		if(elements.isEmpty()) {
			throw new IllegalArgumentException("a set literal needs at least one element");
		}
		this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
	}

	public List<SMVExpression> getElements() {
		return elements;
	}

	@Override
	public int getPrecedence() {
		return PRECEDENCE;
	}

	@Override
	public SMVSet copy() {
		return new SMVSet(getLocation(), elements);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return new HashSet<>(elements).equals(new HashSet<>(((SMVSet) o).elements));
	}

	@Override
	public int hashCode() {
		return new HashSet<>(elements).hashCode();
	}
}
