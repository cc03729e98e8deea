package smv.util;

import org.junit.Test;

import java.nio.file.Paths;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SourceLocationTest {

	@Test
	public void testCombine() {
		SourceLocation first = new SourceLocation(null, 4, 9, 1, 1, 5, 10);
		SourceLocation second = new SourceLocation(null, 12, 20, 2, 3, 2, 4);
		SourceLocation expected = new SourceLocation(null, 4, 20, 1, 3, 5, 4);
		assertThat(first.combine(second), is(expected));
		assertThat(second.combine(first), is(expected));
	}

	@Test
	public void testCombineUnknown() {
		SourceLocation known = new SourceLocation(null, 0, 3, 1, 1, 1, 4);
		assertThat(SourceLocation.unknown().combine(known), is(known));
		assertThat(known.combine(SourceLocation.unknown()), is(known));
		assertThat(SourceLocation.unknown().combine(SourceLocation.unknown()).isUnknown(), is(true));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testCombineDifferentFiles() {
		new SourceLocation(Paths.get("a.smv"), 0, 1, 1, 1, 1, 2)
				.combine(new SourceLocation(Paths.get("b.smv"), 0, 1, 1, 1, 1, 2));
	}

	@Test
	public void testCompare() {
		SourceLocation early = new SourceLocation(null, 0, 3, 1, 1, 1, 4);
		SourceLocation wider = new SourceLocation(null, 0, 5, 1, 1, 1, 6);
		SourceLocation late = new SourceLocation(null, 2, 3, 1, 1, 3, 4);
		assertThat(early.compareTo(wider) < 0, is(true));
		assertThat(wider.compareTo(late) < 0, is(true));
		assertThat(late.compareTo(early) > 0, is(true));
		assertThat(SourceLocation.unknown().compareTo(early) < 0, is(true));
		assertThat(SourceLocation.unknown().compareTo(SourceLocation.unknown()), is(0));
	}

	@Test
	public void testPrettyString() {
		String text = "VAR\n  x : wrd;\n";
		SourceLocation location = new SourceLocation(null, 10, 13, 2, 2, 7, 10);
		assertThat(location.prettyString(text), is("at line 2, column 7\n  x : wrd;\n      ^^^"));
		assertThat(new SourceLocation(null, 15, 15, 3, 3, 1, 1).prettyString(text),
				is("at line 3, column 1\n\n^ EOF"));
		assertThat(SourceLocation.unknown().prettyString(text), is("at unknown source location"));
	}
}
