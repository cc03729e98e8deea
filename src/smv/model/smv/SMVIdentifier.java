package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 *
 * AST node:
 *
 * name
 *
 */
public class SMVIdentifier extends SMVExpression {

	private final String name;

	public SMVIdentifier(SourceLocation location, String name) {
		super(location);
		this.name = Objects.requireNonNull(name);
	}

	public String getName() {
		return name;
	}

	@Override
	public SMVIdentifier copy() {
		return new SMVIdentifier(getLocation(), name);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVIdentifier that = (SMVIdentifier) o;
		return name.equals(that.name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}
}
