package smv.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line after a line break with the current indentation. Lines are always
 * separated with a single {@code '\n'}, so rendered text does not depend on the platform.
 */
public class IndentingWriter extends Writer {

	public static final int DEFAULT_INDENT = 4;

	private static final String LF = "\n";

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean shouldIndent = false;
	private int horizontalPosition = 0;

	public static class Indent implements AutoCloseable {

		private final IndentingWriter writer;
		private final int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public IndentingWriter(Writer out) {
		this(out, DEFAULT_INDENT);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		if(defaultIndent < 0) {
			throw new IllegalArgumentException("indentation width must not be negative: " + defaultIndent);
		}
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	public int getDefaultIndent() {
		return defaultIndent;
	}

	/**
	 * @return the 0-based position along the current line of text being written
	 */
	public int getHorizontalPosition() {
		return horizontalPosition;
	}

	/**
	 * Indents any following lines such that they start at {@param position}
	 * @param position the column following lines should start at
	 * @return an AutoCloseable that will reverse the indent when closed
	 */
	public Indent indentToPosition(int position) {
		return indent(position - indent);
	}

	public void unindent(int spaces) {
		if(spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	public void newLine() throws IOException {
		write(LF);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while(start < data.length()) {
			int next = data.indexOf(LF, start);
			if(shouldIndent && next != start) {
				// blank lines are not padded
				for(int i = 0; i < indent; ++i) {
					out.write(" ");
				}
				horizontalPosition = indent;
			}
			shouldIndent = false;
			if(next != -1) {
				out.write(data, start, next + LF.length() - start);
				start = next + LF.length();
				shouldIndent = true;
				horizontalPosition = 0;
			}else {
				horizontalPosition += data.length() - start;
				out.write(data.substring(start));
				break;
			}
		}
	}

}
