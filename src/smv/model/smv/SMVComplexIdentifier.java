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
 * a.b[i].self
 *
 * <p>A reference built from a leading name or {@code self} followed by field, {@code self} and index segments.
 * A lone name is never represented by this class, see {@link SMVIdentifier}.</p>
 *
 */
public class SMVComplexIdentifier extends SMVExpression {

	public static final class Segment {
		public enum Kind { NAME, SELF, INDEX }

		private final Kind kind;
		private final String name;
		private final SMVExpression index;

		private Segment(Kind kind, String name, SMVExpression index) {
			this.kind = kind;
			this.name = name;
			this.index = index;
		}

		public static Segment name(String name) {
			return new Segment(Kind.NAME, Objects.requireNonNull(name), null);
		}

		public static Segment self() {
			return new Segment(Kind.SELF, null, null);
		}

		public static Segment index(SMVExpression index) {
			return new Segment(Kind.INDEX, null, Objects.requireNonNull(index));
		}

		public Kind getKind() { return kind; }
		public String getName() { return name; }
		public SMVExpression getIndex() { return index; }

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Segment segment = (Segment) o;
			return kind == segment.kind &&
					Objects.equals(name, segment.name) &&
					Objects.equals(index, segment.index);
		}

		@Override
		public int hashCode() {
			return Objects.hash(kind, name, index);
		}

		@Override
		public String toString() {
			switch (kind) {
				case NAME:
					return name;
				case SELF:
					return "self";
				default:
					return "[" + index + "]";
			}
		}
	}

	private final List<Segment> segments;

	public SMVComplexIdentifier(SourceLocation location, List<Segment> segments) {
		super(location);
		if(segments.isEmpty()) {
			throw new IllegalArgumentException("a complex identifier needs at least one segment");
		}
		if(segments.get(0).getKind() == Segment.Kind.INDEX) {
			throw new IllegalArgumentException("a complex identifier must start with a name or self");
		}
		this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
	}

	public List<Segment> getSegments() {
		return segments;
	}

	@Override
	public SMVComplexIdentifier copy() {
		return new SMVComplexIdentifier(getLocation(), segments);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVComplexIdentifier that = (SMVComplexIdentifier) o;
		return segments.equals(that.segments);
	}

	@Override
	public int hashCode() {
		return segments.hashCode();
	}
}
