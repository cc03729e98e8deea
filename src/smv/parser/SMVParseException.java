package smv.parser;

import smv.Unreachable;
import smv.formatters.IndentingWriter;
import smv.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeSet;

/**
 * Thrown when text does not conform to the SMV grammar. The message names the furthest position the parser
 * reached, what it expected there, and shows the offending line with a caret under that position.
 */
@SuppressWarnings("serial")
public class SMVParseException extends Exception {
	private final NavigableMap<SourceLocation, Set<ParseFailure>> reason;

	private static String getReasonString(NavigableMap<SourceLocation, Set<ParseFailure>> map, CharSequence text) {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			if(map.isEmpty()) {
				out.write("Parse failure at unknown location");
				return w.toString();
			}
			Map.Entry<SourceLocation, Set<ParseFailure>> e = map.lastEntry();
			out.write("Parse failure ");
			e.getKey().writePretty(out, text);
			try(IndentingWriter.Indent ignored = out.indent()){
				// sorted so the message is stable across runs
				Set<String> expected = new TreeSet<>();
				for(ParseFailure f : e.getValue()) {
					expected.add(f.toString());
				}
				for(String f : expected) {
					out.newLine();
					out.write(f);
				}
			}
		} catch (IOException e1) {
			throw new Unreachable(e1);
		}
		return w.toString();
	}

	public SMVParseException(NavigableMap<SourceLocation, Set<ParseFailure>> reason, CharSequence text) {
		super(getReasonString(reason, text));
		this.reason = reason;
	}

	/**
	 * Wraps a failure found while parsing one fragment of a larger input, such as a single section of a module
	 * being assembled, with a message saying which fragment it was.
	 */
	public SMVParseException(String context, SMVParseException cause) {
		super(context + ": " + cause.getMessage(), cause);
		this.reason = cause.getReason();
	}

	public NavigableMap<SourceLocation, Set<ParseFailure>> getReason() {
		return reason;
	}

	/**
	 * @return the furthest position the parser reached before failing
	 */
	public SourceLocation getLocation() {
		if(reason.isEmpty()) {
			return SourceLocation.unknown();
		}
		return reason.lastKey();
	}

	/**
	 * @return everything that would have been accepted at {@link #getLocation()}
	 */
	public Set<ParseFailure> getExpected() {
		if(reason.isEmpty()) {
			return Collections.emptySet();
		}
		return Collections.unmodifiableSet(reason.lastEntry().getValue());
	}

}
