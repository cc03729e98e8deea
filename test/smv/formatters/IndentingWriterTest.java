package smv.formatters;

import org.junit.Test;

import java.io.IOException;
import java.io.StringWriter;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class IndentingWriterTest {

	@Test
	public void testNestedIndents() throws IOException {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		out.write("MODULE m");
		try(IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write("VAR");
			try(IndentingWriter.Indent ignored2 = out.indent()) {
				out.newLine();
				out.write("x: boolean;");
			}
		}
		out.newLine();
		out.write("MODULE n");
		assertThat(w.toString(), is("MODULE m\n    VAR\n        x: boolean;\nMODULE n"));
	}

	@Test
	public void testCustomIndent() throws IOException {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w, 2);
		out.write("a");
		try(IndentingWriter.Indent ignored = out.indent()) {
			out.write("\nb\nc");
		}
		assertThat(w.toString(), is("a\n  b\n  c"));
	}

	@Test
	public void testBlankLinesAreNotPadded() throws IOException {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try(IndentingWriter.Indent ignored = out.indent()) {
			out.write("a\n\nb");
		}
		assertThat(w.toString(), is("a\n\n    b"));
	}

	@Test
	public void testHorizontalPosition() throws IOException {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		out.write("abc");
		assertThat(out.getHorizontalPosition(), is(3));
		try(IndentingWriter.Indent ignored = out.indentToPosition(out.getHorizontalPosition())) {
			out.newLine();
			out.write("d");
		}
		assertThat(w.toString(), is("abc\n   d"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeIndent() {
		new IndentingWriter(new StringWriter(), -1);
	}
}
