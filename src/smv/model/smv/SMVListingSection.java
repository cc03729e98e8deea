package smv.model.smv;

import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *
 * AST node:
 *
 * CONSTANTS a, b, c;
 *
 * or one or more constraint bodies:
 *
 * INIT x = 0
 * INIT y = 0
 *
 */
public class SMVListingSection extends SMVSection {

	private final List<SMVExpression> elements;

	public SMVListingSection(SourceLocation location, Kind kind, List<SMVExpression> elements) {
		super(location, kind);
		if(kind.getShape() == Shape.MAPPING) {
			throw new IllegalArgumentException(kind + " is not a listing section");
		}
		this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
	}

	public List<SMVExpression> getElements() {
		return elements;
	}

	@Override
	public int size() {
		return elements.size();
	}

	/**
	 * Appends the elements of {@param other} after the elements of this section.
	 */
	@Override
	public SMVListingSection merge(SMVSection other) {
		checkMergeable(other);
		List<SMVExpression> merged = new ArrayList<>(elements);
		merged.addAll(((SMVListingSection) other).getElements());
		return new SMVListingSection(getLocation().combine(other.getLocation()), getKind(), merged);
	}

	@Override
	public SMVListingSection copy() {
		return new SMVListingSection(getLocation(), getKind(), elements);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVListingSection that = (SMVListingSection) o;
		return getKind() == that.getKind() && elements.equals(that.elements);
	}

	@Override
	public int hashCode() {
		return 31 * getKind().hashCode() + elements.hashCode();
	}
}
