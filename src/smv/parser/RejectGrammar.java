package smv.parser;

import smv.util.SourceLocatable;

public class RejectGrammar<Result extends SourceLocatable> extends Grammar<Located<Void>> {

	private final Grammar<Result> toReject;

	public RejectGrammar(Grammar<Result> toReject) {
		this.toReject = toReject;
	}

	@Override
	public String toString() {
		return "REJECT ["+toReject+"]";
	}

	public Grammar<Result> getToReject() { return toReject; }

	@Override
	public <Result1, Except extends Throwable> Result1 accept(GrammarVisitor<Result1, Except> visitor) throws Except {
		return visitor.visit(this);
	}
}
