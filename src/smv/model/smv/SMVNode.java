package smv.model.smv;

import smv.Unreachable;
import smv.formatters.IndentingWriter;
import smv.formatters.SMVNodeFormattingVisitor;
import smv.util.SourceLocatable;
import smv.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 *
 * The base class for any SMV AST node. Every node knows where it was parsed from and may carry the exact
 * text it was parsed from, in which case that text is what {@link #toString()} produces.
 *
 * <p>Nodes are immutable once built. Equality is structural and ignores both the location and the
 * cached source text.</p>
 *
 */
public abstract class SMVNode extends SourceLocatable {
	private final SourceLocation location;
	private String source;

	public SMVNode(SourceLocation location) {
		this.location = location;
		this.source = null;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the text this node was parsed from, or null if it should be rendered in canonical form
	 */
	public String getSource() {
		return source;
	}

	/**
	 * @param source the verbatim text to render this node as, or null for canonical rendering
	 * @return a copy of this node carrying {@param source}
	 */
	public SMVNode withSource(String source) {
		SMVNode result = copy();
		result.source = source;
		return result;
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new SMVNodeFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return out.toString();
	}

	/**
	 * @return a shallow copy of this node, without its cached source text
	 */
	public abstract SMVNode copy();

	public abstract <T, E extends Throwable> T accept(SMVNodeVisitor<T, E> v) throws E;

}
