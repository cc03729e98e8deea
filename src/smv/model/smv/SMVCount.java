package smv.model.smv;

import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * AST node:
 *
 * count(a, b, ...)
 *
 */
public class SMVCount extends SMVExpression {

	private final List<SMVExpression> arguments;

	public SMVCount(SourceLocation location, List<SMVExpression> arguments) {
		super(location);
		if(arguments.isEmpty()) {
			throw new IllegalArgumentException("count needs at least one argument");
		}
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
	}

	public List<SMVExpression> getArguments() {
		return arguments;
	}

	@Override
	public SMVCount copy() {
		return new SMVCount(getLocation(), arguments);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return arguments.equals(((SMVCount) o).arguments);
	}

	@Override
	public int hashCode() {
		return arguments.hashCode();
	}
}
