package smv.parser;

import smv.Unreachable;
import smv.formatters.IndentingWriter;
import smv.formatters.ParseFailureFormattingVisitor;
import smv.util.SourceLocatable;
import smv.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One reason a grammar could not match at some position. The executor records every failure at the position
 * where it happened, and the failures at the furthest position explain a failed parse.
 */
public abstract class ParseFailure {

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	public abstract <T, E extends Throwable> T accept(ParseFailureVisitor<T, E> v) throws E;

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try{
			accept(new ParseFailureFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	public static class StringMatchFailure extends ParseFailure{

		private final SourceLocation location;
		private final String string;

		public StringMatchFailure(SourceLocation location, String string){
			this.location = location;
			this.string = string;
		}

		public SourceLocation getLocation() {
			return location;
		}

		public String getString(){
			return string;
		}

		@Override
		public <T, E extends Throwable> T accept(ParseFailureVisitor<T, E> v) throws E {
			return v.visit(this);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			StringMatchFailure that = (StringMatchFailure) o;
			return Objects.equals(location, that.location) &&
					Objects.equals(string, that.string);
		}

		@Override
		public int hashCode() {
			return Objects.hash(location, string);
		}
	}

	public static StringMatchFailure stringMatchFailure(SourceLocation location, String string) {
		return new StringMatchFailure(location, string);
	}

	public static class PatternMatchFailure extends ParseFailure{

		private final SourceLocation location;
		private final Pattern pattern;
		private final String description;

		public PatternMatchFailure(SourceLocation location, Pattern pattern, String description){
			this.location = location;
			this.pattern = pattern;
			this.description = description;
		}

		public SourceLocation getLocation(){
			return location;
		}

		public Pattern getPattern(){
			return pattern;
		}

		/**
		 * @return a readable name for what the pattern matches, or null if it has none
		 */
		public String getDescription() {
			return description;
		}

		@Override
		public <T, E extends Throwable> T accept(ParseFailureVisitor<T, E> v) throws E {
			return v.visit(this);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			PatternMatchFailure that = (PatternMatchFailure) o;
			return Objects.equals(location, that.location) &&
					Objects.equals(pattern.pattern(), that.pattern.pattern()) &&
					Objects.equals(description, that.description);
		}

		@Override
		public int hashCode() {
			return Objects.hash(location, pattern.pattern(), description);
		}
	}

	public static PatternMatchFailure patternMatchFailure(SourceLocation location, Pattern pattern, String description) {
		return new PatternMatchFailure(location, pattern, description);
	}

	public static ParseFailure eofMatchFailure() {
		return new EOFMatchFailure();
	}

	public static class EOFMatchFailure extends ParseFailure {
		@Override
		public boolean equals(Object other) {
			return other instanceof EOFMatchFailure;
		}

		@Override
		public int hashCode() {
			return 0;
		}

		@Override
		public <T, E extends Throwable> T accept(ParseFailureVisitor<T, E> v) throws E {
			return v.visit(this);
		}
	}

	public static class RejectFailure<Result extends SourceLocatable> extends ParseFailure {
		private final Grammar<Result> toReject;

		public RejectFailure(Grammar<Result> toReject) {
			this.toReject = toReject;
		}

		public Grammar<Result> getToReject() {
			return toReject;
		}

		@Override
		public <T, E extends Throwable> T accept(ParseFailureVisitor<T, E> v) throws E {
			return v.visit(this);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			RejectFailure<?> that = (RejectFailure<?>) o;
			return Objects.equals(toReject, that.toReject);
		}

		@Override
		public int hashCode() {
			return Objects.hash(toReject);
		}
	}

	public static <Result extends SourceLocatable> ParseFailure rejectFailure(Grammar<Result> toReject) {
		return new RejectFailure<>(toReject);
	}
}
