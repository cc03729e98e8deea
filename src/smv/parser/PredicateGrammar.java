package smv.parser;

import smv.util.SourceLocatable;

import java.util.function.Predicate;

public class PredicateGrammar<Result extends SourceLocatable> extends Grammar<Result> {

	private final Grammar<Result> toFilter;
	private final Predicate<Result> predicate;

	public PredicateGrammar(Grammar<Result> toFilter, Predicate<Result> predicate) {
		this.toFilter = toFilter;
		this.predicate = predicate;
	}

	@Override
	public String toString() {
		return "FILTER "+toFilter;
	}

	public Grammar<Result> getToFilter() { return toFilter; }
	public Predicate<Result> getPredicate() { return predicate; }

	@Override
	public <Result1, Except extends Throwable> Result1 accept(GrammarVisitor<Result1, Except> visitor) throws Except {
		return visitor.visit(this);
	}
}
