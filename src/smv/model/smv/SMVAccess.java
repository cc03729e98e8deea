package smv.model.smv;

import smv.util.SourceLocation;

/**
 * One bracketed access applied to an expression, see {@link SMVArrayAccess}.
 */
public abstract class SMVAccess extends SMVNode {

	public SMVAccess(SourceLocation location) {
		super(location);
	}

	@Override
	public abstract SMVAccess copy();

}
