package smv.parser;

import smv.util.EmptyHeterogenousList;
import smv.util.SourceLocatable;

/**
 * An grammar representing a sequence, to be used Builder-style as a fluent interface to build sequences of grammars.
 * @param <Sequence> a {@link smv.util.HeterogenousList} containing all the non-dropped results of parsing this
 *                  sequence.
 */
public abstract class AbstractSequenceGrammar<Sequence extends EmptyHeterogenousList> extends Grammar<Located<Sequence>> {

	/**
	 * Returns a new sequence grammar whose results will contain all the results of {@param grammar} prepended to the
	 * existing results of the current sequence.
	 *
	 * <p>Note: when accessing the result of this grammar, the results will be in reverse parse order. The most
	 * "recent" part will be first.</p>
	 * @param grammar the grammar to append to this sequence
	 * @param <Result> the result type of {@param grammar}
	 * @return a new sequence grammar yielding all the results of this current sequence, but with all the results of
	 * {@param grammar} prepended.
	 */
	public <Result extends SourceLocatable> PartSequenceGrammar<Result, Sequence> part(Grammar<Result> grammar) {
		return new PartSequenceGrammar<>(this, grammar);
	}

	/**
	 * Returns a new sequence grammar that parses {@param grammar} in addition to the existing sequence, but does not
	 * yield any more results. The locations of the dropped results are still combined with the location of the
	 * overall sequence result.
	 * @param grammar the grammar to append to the sequence
	 * @param <Dropped> the type of results yielded by that grammar.
	 * @return a new sequence grammar yielding the same results as the current sequence
	 */
	public <Dropped extends SourceLocatable> DropSequenceGrammar<Dropped, Sequence> drop(Grammar<Dropped> grammar) {
		return new DropSequenceGrammar<>(this, grammar);
	}

}
