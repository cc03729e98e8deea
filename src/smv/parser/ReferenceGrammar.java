package smv.parser;

import smv.util.SourceLocatable;

import java.util.Objects;

/**
 * A grammar standing in for another grammar that is only known later. This is how recursive rules are tied
 * together: create the reference first, use it inside other rules, then point it at the real rule.
 */
public class ReferenceGrammar<Result extends SourceLocatable> extends Grammar<Result> {

	private Grammar<Result> referencedGrammar;

	public ReferenceGrammar() {
		this.referencedGrammar = null;
	}

	public ReferenceGrammar(Grammar<Result> referencedGrammar) {
		Objects.requireNonNull(referencedGrammar);
		this.referencedGrammar = referencedGrammar;
	}

	@Override
	public String toString() {
		return "REF";
	}

	public void setReferencedGrammar(Grammar<Result> referencedGrammar) {
		Objects.requireNonNull(referencedGrammar);
		if(this.referencedGrammar != null) {
			throw new IllegalStateException("grammar reference is already set");
		}
		this.referencedGrammar = referencedGrammar;
	}

	public Grammar<Result> getReferencedGrammar() {
		if(referencedGrammar == null) {
			throw new IllegalStateException("grammar reference used before being set");
		}
		return referencedGrammar;
	}

	@Override
	public <Result1, Except extends Throwable> Result1 accept(GrammarVisitor<Result1, Except> visitor) throws Except {
		return visitor.visit(this);
	}
}
