package smv.formatters;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

public class FormattingTools {

	private static final int TAB_SIZE = 8;

	private FormattingTools() {}

	public interface Formatter<T>{
		void format(T param) throws IOException;
	}

	public static <T> void writeCommaSeparated(Writer out, List<T> items, Formatter<T> writer) throws IOException {
		boolean isFirst = true;
		for(T item : items) {
			if(!isFirst) {
				out.write(", ");
			}
			isFirst = false;
			writer.format(item);
		}
	}

	/**
	 * Replaces every tab in {@param line} with spaces, up to the next multiple of 8 columns.
	 */
	public static String expandTabs(String line) {
		if(line.indexOf('\t') == -1) {
			return line;
		}
		StringBuilder result = new StringBuilder();
		for(int i = 0; i < line.length(); ++i) {
			char c = line.charAt(i);
			if(c == '\t') {
				do {
					result.append(' ');
				} while(result.length() % TAB_SIZE != 0);
			}else{
				result.append(c);
			}
		}
		return result.toString();
	}

	/**
	 * Normalizes the layout of a multi-line block of text, typically a constraint body written by hand.
	 *
	 * <ul>
	 *     <li>tabs are expanded to spaces</li>
	 *     <li>the first line is stripped on both sides</li>
	 *     <li>the common indentation of the non-empty lines after the first one is removed, keeping their
	 *     relative indentation, and trailing whitespace is stripped</li>
	 *     <li>leading and trailing blank lines are dropped</li>
	 * </ul>
	 *
	 * The resulting lines are joined with {@code '\n'} and carry no indentation of their own, which makes
	 * the result suitable for an {@link IndentingWriter}.
	 * @param text the text to normalize
	 * @return the normalized text, possibly empty
	 */
	public static String reindent(String text) {
		if(text == null || text.isEmpty()) {
			return "";
		}
		String[] lines = text.split("\r\n|\r|\n", -1);
		for(int i = 0; i < lines.length; ++i) {
			lines[i] = expandTabs(lines[i]);
		}
		int indent = Integer.MAX_VALUE;
		for(int i = 1; i < lines.length; ++i) {
			String stripped = lines[i].replaceFirst("^\\s+", "");
			if(!stripped.isEmpty()) {
				indent = Math.min(indent, lines[i].length() - stripped.length());
			}
		}
		List<String> trimmed = new ArrayList<>();
		trimmed.add(lines[0].trim());
		for(int i = 1; i < lines.length; ++i) {
			String line = lines[i];
			if(indent != Integer.MAX_VALUE && line.length() >= indent) {
				line = line.substring(indent);
			}
			trimmed.add(line.replaceFirst("\\s+$", ""));
		}
		while(!trimmed.isEmpty() && trimmed.get(trimmed.size() - 1).isEmpty()) {
			trimmed.remove(trimmed.size() - 1);
		}
		while(!trimmed.isEmpty() && trimmed.get(0).isEmpty()) {
			trimmed.remove(0);
		}
		return String.join("\n", trimmed);
	}

}
