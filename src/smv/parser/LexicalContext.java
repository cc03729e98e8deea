package smv.parser;

import smv.util.SourceLocation;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The text being parsed together with the current read position. Positions can be saved with {@link #mark()}
 * and returned to with {@link #restore(Mark)}, which is how the grammar executor backtracks.
 */
public class LexicalContext {

	private final Path filePath;
	private final CharSequence chars;
	private int line;
	private int column;
	private int index;

	public static class Mark{
		private final int markedLine;
		private final int markedColumn;
		private final int markedIndex;

		public Mark(int markedLine, int markedColumn, int markedIndex) {
			this.markedLine = markedLine;
			this.markedColumn = markedColumn;
			this.markedIndex = markedIndex;
		}

		public int getMarkedLine() { return markedLine; }
		public int getMarkedColumn() { return markedColumn; }
		public int getMarkedIndex() { return markedIndex; }
	}

	public LexicalContext(CharSequence chars) {
		this(null, chars);
	}

	public LexicalContext(Path filePath, CharSequence chars) {
		this.filePath = filePath;
		this.chars = chars;
		this.line = 0;
		this.column = 0;
		this.index = 0;
	}

	public Mark mark() {
		return new Mark(line, column, index);
	}

	private SourceLocation updateLocation(String match){
		int startLine = line + 1;
		int startColumn = column + 1;
		int startIndex = index;
		index += match.length();
		int pos = 0;
		while(true){
			int nextLf = match.indexOf('\n', pos);
			if(nextLf == -1) break;
			++line;
			pos = nextLf + 1;
		}
		if(pos == 0){
			// same line, just advance along it
			column += match.length();
		}else{
			column = match.length() - pos;
		}
		return new SourceLocation(filePath, startIndex, index, startLine, line + 1, startColumn, column + 1);
	}

	/**
	 * Attempts to match {@code pattern} at the current position.
	 * @param pattern the pattern to match
	 * @return the result of the match, or nothing on failure
	 */
	public Optional<Located<MatchResult>> matchPattern(Pattern pattern){
		if(index > chars.length()) return Optional.empty();
		Matcher m = pattern.matcher(chars);
		m.region(index, chars.length());
		if(m.lookingAt()){
			MatchResult result = m.toMatchResult();
			return Optional.of(new Located<>(updateLocation(m.group()), result));
		}else{
			return Optional.empty();
		}
	}

	public Optional<Located<Void>> matchString(String string){
		if(index + string.length() <= chars.length()
				&& string.contentEquals(chars.subSequence(index, index+string.length()))){
			return Optional.of(new Located<>(updateLocation(string), null));
		}else{
			return Optional.empty();
		}
	}

	public SourceLocation getSourceLocation(){
		return new SourceLocation(filePath, index, index, line+1, line+1, column+1, column+1);
	}

	public CharSequence getText() {
		return chars;
	}

	public boolean isEOF(){
		return index >= chars.length();
	}

	public void restore(Mark mark) {
		line = mark.getMarkedLine();
		column = mark.getMarkedColumn();
		index = mark.getMarkedIndex();
	}

}
