package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 * A keyword-introduced block of a module. The keyword decides the shape of the body, see {@link Shape}.
 */
public abstract class SMVSection extends SMVNode {

	public enum Shape {
		/**
		 * Identifiers (or assignment targets) associated with a type or an expression.
		 */
		MAPPING,
		/**
		 * A comma separated list of identifiers.
		 */
		ENUMERATION,
		/**
		 * Independent constraint bodies, each rendered under its own keyword.
		 */
		BODIES
	}

	public enum Kind {
		VAR(Shape.MAPPING, ": "),
		IVAR(Shape.MAPPING, ": "),
		FROZENVAR(Shape.MAPPING, ": "),
		DEFINE(Shape.MAPPING, " := "),
		CONSTANTS(Shape.ENUMERATION, ", "),
		ASSIGN(Shape.MAPPING, " := "),
		TRANS(Shape.BODIES, null),
		INIT(Shape.BODIES, null),
		INVAR(Shape.BODIES, null),
		FAIRNESS(Shape.BODIES, null),
		JUSTICE(Shape.BODIES, null),
		COMPASSION(Shape.BODIES, null);

		private final Shape shape;
		private final String separator;

		Kind(Shape shape, String separator) {
			this.shape = shape;
			this.separator = separator;
		}

		public Shape getShape() {
			return shape;
		}

		/**
		 * @return what is written between a key and its value, or between enumerated values; null for bodies
		 */
		public String getSeparator() {
			return separator;
		}

		public String getKeyword() {
			return name();
		}

		public static Kind fromKeyword(String keyword) {
			for(Kind kind : values()) {
				if(kind.name().equals(keyword)) {
					return kind;
				}
			}
			throw new UnknownSectionException(keyword);
		}
	}

	private final Kind kind;

	public SMVSection(SourceLocation location, Kind kind) {
		super(location);
		this.kind = Objects.requireNonNull(kind);
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	public abstract int size();

	/**
	 * @param other a section of the same kind
	 * @return a new section holding the contents of this one updated with {@param other}
	 */
	public abstract SMVSection merge(SMVSection other);

	@Override
	public abstract SMVSection copy();

	@Override
	public SMVSection withSource(String source) {
		return (SMVSection) super.withSource(source);
	}

	protected void checkMergeable(SMVSection other) {
		if(other.getKind() != kind) {
			throw new IllegalArgumentException("cannot merge a " + other.getKind() + " section into a " + kind + " section");
		}
	}

}
