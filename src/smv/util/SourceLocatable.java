package smv.util;

/**
 *
 * A common abstract base, typically meant for AST nodes, that should be
 * implemented by anything that needs to be traced back to its
 * original location in the parsed text.
 *
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
