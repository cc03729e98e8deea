package smv.model.smv.builder;

import smv.model.smv.SMVNode;

import java.util.Objects;

/**
 * One piece of a section contribution: either text still to be parsed, or a node that is already built.
 */
public final class Fragment {

	private final String text;
	private final SMVNode node;

	private Fragment(String text, SMVNode node) {
		this.text = text;
		this.node = node;
	}

	public static Fragment text(String text) {
		return new Fragment(Objects.requireNonNull(text), null);
	}

	public static Fragment node(SMVNode node) {
		return new Fragment(null, Objects.requireNonNull(node));
	}

	public boolean isText() {
		return text != null;
	}

	/**
	 * @throws IllegalStateException if this fragment holds a node
	 */
	public String getText() {
		if(text == null) {
			throw new IllegalStateException("fragment holds a node, not text");
		}
		return text;
	}

	/**
	 * @throws IllegalStateException if this fragment holds text
	 */
	public SMVNode getNode() {
		if(node == null) {
			throw new IllegalStateException("fragment holds text, not a node");
		}
		return node;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Fragment fragment = (Fragment) o;
		return Objects.equals(text, fragment.text) && Objects.equals(node, fragment.node);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text, node);
	}

	@Override
	public String toString() {
		return isText() ? '"' + text + '"' : node.toString();
	}
}
