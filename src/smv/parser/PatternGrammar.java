package smv.parser;

import java.util.regex.MatchResult;
import java.util.regex.Pattern;

public class PatternGrammar extends Grammar<Located<MatchResult>> {

	private final Pattern pattern;
	private final String description;

	public PatternGrammar(Pattern pattern, String description) {
		this.pattern = pattern;
		this.description = description;
	}

	@Override
	public String toString() {
		return description != null ? description : "PATTERN "+pattern;
	}

	public Pattern getPattern() { return pattern; }

	/**
	 * @return what this pattern matches in words, used when reporting failures, or null
	 */
	public String getDescription() { return description; }

	@Override
	public <Result, Except extends Throwable> Result accept(GrammarVisitor<Result, Except> visitor) throws Except {
		return visitor.visit(this);
	}
}
