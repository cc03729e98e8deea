package smv.parser;

import smv.util.SourceLocatable;

public class CutGrammar<Result extends SourceLocatable> extends Grammar<Result> {

	private final Grammar<Result> toCut;

	public CutGrammar(Grammar<Result> toCut) {
		this.toCut = toCut;
	}

	@Override
	public String toString() {
		return "CUT ["+toCut+"]";
	}

	public Grammar<Result> getToCut() {
		return toCut;
	}

	@Override
	public <Result1, Except extends Throwable> Result1 accept(GrammarVisitor<Result1, Except> visitor) throws Except {
		return visitor.visit(this);
	}
}
