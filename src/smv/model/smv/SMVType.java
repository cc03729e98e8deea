package smv.model.smv;

import smv.util.SourceLocation;

/**
 * The type of a declared variable: a simple type, or an instance of a module.
 */
public abstract class SMVType extends SMVNode {

	public SMVType(SourceLocation location) {
		super(location);
	}

	@Override
	public abstract SMVType copy();

	@Override
	public SMVType withSource(String source) {
		return (SMVType) super.withSource(source);
	}

	public abstract <T, E extends Throwable> T accept(SMVTypeVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(SMVNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
