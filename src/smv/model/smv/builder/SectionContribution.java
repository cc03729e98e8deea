package smv.model.smv.builder;

import smv.model.smv.SMVNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Something handed to a module under construction for one of its sections. Each variant is one of the shapes
 * a section body may be given in; {@link SMVModuleAssembler} turns each of them into a section.
 */
public abstract class SectionContribution {

	private SectionContribution() {}

	public abstract <T, E extends Throwable> T accept(SectionContributionVisitor<T, E> v) throws E;

	public static Text text(String body) {
		return new Text(body);
	}

	public static Single single(SMVNode node) {
		return new Single(node);
	}

	public static Listing listing(List<Fragment> elements) {
		return new Listing(elements);
	}

	public static Listing listing(Fragment... elements) {
		return listing(Arrays.asList(elements));
	}

	/**
	 * A listing in which every element is text.
	 */
	public static Listing listingOfText(String... elements) {
		List<Fragment> fragments = new ArrayList<>();
		for(String element : elements) {
			fragments.add(Fragment.text(element));
		}
		return listing(fragments);
	}

	public static Mapping mapping(List<Mapping.Entry> entries) {
		return new Mapping(entries);
	}

	/**
	 * A mapping in which every key and value is text, taken in the iteration order of {@param entries}.
	 */
	public static Mapping mappingOfText(Map<String, String> entries) {
		List<Mapping.Entry> result = new ArrayList<>();
		for(Map.Entry<String, String> entry : entries.entrySet()) {
			result.add(new Mapping.Entry(Fragment.text(entry.getKey()), Fragment.text(entry.getValue())));
		}
		return mapping(result);
	}

	/**
	 * The whole text of a section body, without its keyword.
	 */
	public static final class Text extends SectionContribution {
		private final String body;

		public Text(String body) {
			this.body = Objects.requireNonNull(body);
		}

		public String getBody() {
			return body;
		}

		@Override
		public <T, E extends Throwable> T accept(SectionContributionVisitor<T, E> v) throws E {
			return v.visit(this);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			return body.equals(((Text) o).body);
		}

		@Override
		public int hashCode() {
			return Objects.hash("text", body);
		}
	}

	public static final class Mapping extends SectionContribution {

		public static final class Entry {
			private final Fragment key;
			private final Fragment value;

			public Entry(Fragment key, Fragment value) {
				this.key = Objects.requireNonNull(key);
				this.value = Objects.requireNonNull(value);
			}

			public Fragment getKey() {
				return key;
			}

			public Fragment getValue() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				if (this == o) return true;
				if (o == null || getClass() != o.getClass()) return false;
				Entry entry = (Entry) o;
				return key.equals(entry.key) && value.equals(entry.value);
			}

			@Override
			public int hashCode() {
				return Objects.hash(key, value);
			}
		}

		private final List<Entry> entries;

		public Mapping(List<Entry> entries) {
			this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
		}

		public List<Entry> getEntries() {
			return entries;
		}

		@Override
		public <T, E extends Throwable> T accept(SectionContributionVisitor<T, E> v) throws E {
			return v.visit(this);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			return entries.equals(((Mapping) o).entries);
		}

		@Override
		public int hashCode() {
			return Objects.hash("mapping", entries);
		}
	}

	public static final class Listing extends SectionContribution {
		private final List<Fragment> elements;

		public Listing(List<Fragment> elements) {
			this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
		}

		public List<Fragment> getElements() {
			return elements;
		}

		@Override
		public <T, E extends Throwable> T accept(SectionContributionVisitor<T, E> v) throws E {
			return v.visit(this);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			return elements.equals(((Listing) o).elements);
		}

		@Override
		public int hashCode() {
			return Objects.hash("listing", elements);
		}
	}

	/**
	 * A single ready node, taken as a listing of one element.
	 */
	public static final class Single extends SectionContribution {
		private final SMVNode node;

		public Single(SMVNode node) {
			this.node = Objects.requireNonNull(node);
		}

		public SMVNode getNode() {
			return node;
		}

		@Override
		public <T, E extends Throwable> T accept(SectionContributionVisitor<T, E> v) throws E {
			return v.visit(this);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			return node.equals(((Single) o).node);
		}

		@Override
		public int hashCode() {
			return Objects.hash("single", node);
		}
	}
}
