package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 *
 * AST node:
 *
 * VAR
 *     x: boolean;
 *     y: 0..3;
 *
 * <p>Entries keep their insertion order. Keys are identifiers, or {@code init(x)} / {@code next(x)} targets in
 * ASSIGN sections. Values are types in VAR, IVAR and FROZENVAR, expressions otherwise.</p>
 *
 */
public class SMVMappingSection extends SMVSection {

	private final Map<SMVExpression, SMVNode> entries;

	public SMVMappingSection(SourceLocation location, Kind kind, Map<SMVExpression, SMVNode> entries) {
		super(location, kind);
		if(kind.getShape() != Shape.MAPPING) {
			throw new IllegalArgumentException(kind + " is not a mapping section");
		}
		this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
	}

	public Map<SMVExpression, SMVNode> getEntries() {
		return entries;
	}

	public SMVNode get(SMVExpression key) {
		return entries.get(key);
	}

	@Override
	public int size() {
		return entries.size();
	}

	/**
	 * Key-wise update: entries of {@param other} replace entries of this section with an equal key, in place,
	 * and new keys are appended.
	 */
	@Override
	public SMVMappingSection merge(SMVSection other) {
		checkMergeable(other);
		Map<SMVExpression, SMVNode> merged = new LinkedHashMap<>(entries);
		merged.putAll(((SMVMappingSection) other).getEntries());
		return new SMVMappingSection(getLocation().combine(other.getLocation()), getKind(), merged);
	}

	@Override
	public SMVMappingSection copy() {
		return new SMVMappingSection(getLocation(), getKind(), entries);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVMappingSection that = (SMVMappingSection) o;
		return getKind() == that.getKind() && entries.equals(that.entries);
	}

	@Override
	public int hashCode() {
		return 31 * getKind().hashCode() + entries.hashCode();
	}
}
