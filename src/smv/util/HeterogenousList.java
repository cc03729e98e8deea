package smv.util;

/**
 * Represents a typesafe heterogenous list.
 *
 * <p>Elements of any type can be prepended and retrieved again without an unchecked downcast, because the
 * type of each tail is known to the typechecker. The main use is as the result of
 * {@link smv.parser.AbstractSequenceGrammar}, whose length is known at compile-time.</p>
 * @param <First> the type of the head of this list
 * @param <Rest> the type of the tail of this list, recursively also a list.
 */
public final class HeterogenousList<First, Rest extends EmptyHeterogenousList> extends EmptyHeterogenousList {

	private final First first;
	private final Rest rest;

	public HeterogenousList(First first, Rest rest) {
		this.first = first;
		this.rest = rest;
	}

	/**
	 * @return the head, or first element of this list
	 */
	public First getFirst() {
		return first;
	}

	/**
	 * @return the tail of this list, which is also a list.
	 */
	public Rest getRest() {
		return rest;
	}

	@Override
	public boolean isEmpty() {
		return false;
	}
}
