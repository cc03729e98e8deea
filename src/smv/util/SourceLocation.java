package smv.util;

import smv.Unreachable;
import smv.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;

/**
 * A region of parsed text. Offsets are 0-based with an exclusive end, lines and columns are 1-based.
 * The file is null when the text did not come from a file.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private static final Comparator<Path> FILE_ORDER = Comparator.nullsFirst(Comparator.naturalOrder());

	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public String prettyString(CharSequence text) {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw), text);
		return sw.getBuffer().toString();
	}

	/**
	 * Writes a human readable description of this location, followed by the line of {@param text} it
	 * starts on and a caret marker underneath the located region.
	 * @param out where to write
	 * @param text the text this location refers to
	 */
	public void writePretty(IndentingWriter out, CharSequence text) {
		try {
			if(isUnknown()) {
				out.write("at unknown source location");
				return;
			}
			out.write("at line "+startLine+", column "+startColumn);
			if(file != null) {
				out.write(" in file "+file);
			}
			if(text == null || startOffset > text.length()) {
				return;
			}
			out.newLine();
			int lineStart = startOffset;
			while(lineStart > 0 && text.charAt(lineStart - 1) != '\n') {
				lineStart--;
			}
			int lineEnd = startOffset;
			while(lineEnd < text.length() && text.charAt(lineEnd) != '\n') {
				lineEnd++;
			}
			out.append(text, lineStart, lineEnd);
			out.newLine();
			for(int pos = lineStart; pos < startOffset; pos++) {
				out.append(text.charAt(pos) == '\t' ? '\t' : ' ');
			}
			int markEnd = Math.min(Math.max(endOffset, startOffset + 1), lineEnd);
			out.append('^');
			for(int pos = startOffset + 1; pos < markEnd; pos++) {
				out.append('^');
			}
			if(startOffset == text.length()) {
				out.append(" EOF");
			}
		} catch (IOException e) {
			throw new Unreachable(e);
		}
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return startOffset < 0;
	}

	public SourceLocation combine(SourceLocation other) {
		if(isUnknown()) {
			return other;
		}else if(other.isUnknown()) {
			return this;
		}
		if(!Objects.equals(file, other.getFile())) {
			throw new IllegalArgumentException(
					"Tried to combine source locations from two different files: " + file + ", " + other.getFile());
		}
		int mStartColumn, mEndColumn;
		if(startOffset <= other.getStartOffset()) {
			mStartColumn = startColumn;
		}else{
			mStartColumn = other.getStartColumn();
		}
		if(endOffset >= other.getEndOffset()) {
			mEndColumn = endColumn;
		}else{
			mEndColumn = other.getEndColumn();
		}
		return new SourceLocation(file,
				Integer.min(startOffset, other.startOffset),
				Integer.max(endOffset, other.endOffset),
				Integer.min(startLine, other.getStartLine()),
				Integer.max(endLine, other.getEndLine()),
				mStartColumn,
				mEndColumn);
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + endColumn;
		result = prime * result + endLine;
		result = prime * result + ((file == null) ? 0 : file.hashCode());
		result = prime * result + startOffset;
		result = prime * result + endOffset;
		result = prime * result + startColumn;
		result = prime * result + startLine;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine &&
				Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [file=" + file + ", startOffset=" + startOffset + ", endOffset=" + endOffset +
					", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
					", endColumn=" + endColumn + "]";
		}
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedFile = FILE_ORDER.compare(getFile(), o.getFile());
		if (comparedFile != 0) {
			return comparedFile;
		}
		int comparedStartOffset = Integer.compare(getStartOffset(), o.getStartOffset());
		if (comparedStartOffset != 0) {
			return comparedStartOffset;
		}
		return Integer.compare(getEndOffset(), o.getEndOffset());
	}

}
