package smv.parser;

import smv.util.EmptyHeterogenousList;
import smv.util.SourceLocatable;
import smv.util.SourceLocation;

import java.util.*;
import java.util.regex.MatchResult;

/**
 * Executes a grammar against a {@link LexicalContext} by backtracking. Every visit yields the list of all
 * successful parses at the current position, each with the position it stopped at. Failures are recorded by
 * position so that the furthest ones can be reported.
 *
 * <p>An instance holds the mutable state of a single parse and must not be shared between parses.</p>
 */
public class GrammarExecuteVisitor extends GrammarVisitor<GrammarExecuteVisitor.ParsingResult, RuntimeException> {

	static final class ParsingResultPair {
		private final LexicalContext.Mark mark;
		private final SourceLocatable result;

		ParsingResultPair(LexicalContext.Mark mark, SourceLocatable result) {
			this.mark = mark;
			this.result = result;
		}

		public LexicalContext.Mark getMark() {
			return mark;
		}

		public SourceLocatable getResult() {
			return result;
		}
	}

	static final class ParsingResult {
		private final List<ParsingResultPair> results;

		ParsingResult(List<ParsingResultPair> results) {
			this.results = results;
		}

		public List<ParsingResultPair> getResults() {
			return results;
		}
	}

	static final class MemoizeTable {
		private final Map<Integer, Map<Grammar<?>, ParsingResult>> table;

		MemoizeTable() {
			this.table = new HashMap<>();
		}

		public ParsingResult get(int index, Grammar<?> grammar) {
			Map<Grammar<?>, ParsingResult> nested = table.get(index);
			if(nested == null) return null;
			return nested.get(grammar);
		}

		public void put(int index, Grammar<?> grammar, ParsingResult result) {
			table.computeIfAbsent(index, k -> new IdentityHashMap<>()).put(grammar, result);
		}
	}

	private final MemoizeTable memoizeTable;
	private final LexicalContext lexicalContext;
	private final NavigableMap<SourceLocation, Set<ParseFailure>> failures;

	GrammarExecuteVisitor(LexicalContext lexicalContext, NavigableMap<SourceLocation, Set<ParseFailure>> failures,
	                      MemoizeTable memoizeTable) {
		this.lexicalContext = lexicalContext;
		this.memoizeTable = memoizeTable;
		this.failures = failures;
	}

	private void addFailure(ParseFailure failure){
		failures.computeIfAbsent(lexicalContext.getSourceLocation(), k -> new HashSet<>()).add(failure);
	}

	public NavigableMap<SourceLocation, Set<ParseFailure>> getFailures() {
		return failures;
	}

	private static ParsingResult noResults() {
		return new ParsingResult(Collections.emptyList());
	}

	@Override
	public ParsingResult visit(PatternGrammar patternGrammar) {
		Optional<Located<MatchResult>> result = lexicalContext.matchPattern(patternGrammar.getPattern());
		if(result.isPresent()) {
			return new ParsingResult(Collections.singletonList(
					new ParsingResultPair(lexicalContext.mark(), result.get())));
		}else{
			addFailure(ParseFailure.patternMatchFailure(
					lexicalContext.getSourceLocation(), patternGrammar.getPattern(), patternGrammar.getDescription()));
			return noResults();
		}
	}

	@Override
	@SuppressWarnings("unchecked")
	public <
			GrammarPredecessorResult extends SourceLocatable,
			GrammarResult extends SourceLocatable
			> ParsingResult visit(MappingGrammar<GrammarPredecessorResult, GrammarResult> mappingGrammar) {
		ParsingResult predecessorResult = mappingGrammar.getPredecessorGrammar().accept(this);
		List<ParsingResultPair> mapped = new ArrayList<>(predecessorResult.getResults().size());
		for(ParsingResultPair prev : predecessorResult.getResults()) {
			mapped.add(new ParsingResultPair(
					prev.getMark(),
					mappingGrammar.getMapping().apply((GrammarPredecessorResult)prev.getResult())));
		}
		return new ParsingResult(mapped);
	}

	@Override
	public <GrammarResult extends SourceLocatable> ParsingResult visit(ReferenceGrammar<GrammarResult> referenceGrammar) {
		return referenceGrammar.getReferencedGrammar().accept(this);
	}

	@Override
	public ParsingResult visit(StringGrammar stringGrammar) {
		Optional<Located<Void>> result = lexicalContext.matchString(stringGrammar.getString());
		if(result.isPresent()) {
			return new ParsingResult(Collections.singletonList(
					new ParsingResultPair(lexicalContext.mark(), result.get())));
		}else{
			addFailure(ParseFailure.stringMatchFailure(lexicalContext.getSourceLocation(), stringGrammar.getString()));
			return noResults();
		}
	}

	@Override
	public <GrammarResult extends SourceLocatable> ParsingResult visit(BranchGrammar<GrammarResult> branchGrammar) {
		List<ParsingResultPair> results = new ArrayList<>();
		LexicalContext.Mark mark = lexicalContext.mark();
		for(Grammar<? extends GrammarResult> branch : branchGrammar.getBranches()) {
			lexicalContext.restore(mark);
			results.addAll(branch.accept(this).getResults());
		}
		return new ParsingResult(results);
	}

	@Override
	public ParsingResult visit(EmptySequenceGrammar emptySequenceGrammar) {
		return new ParsingResult(Collections.singletonList(new ParsingResultPair(
				lexicalContext.mark(), new Located<>(SourceLocation.unknown(), new EmptyHeterogenousList()))));
	}

	@Override
	public <Dropped extends SourceLocatable, Rest extends EmptyHeterogenousList> ParsingResult visit(DropSequenceGrammar<Dropped, Rest> dropSequenceGrammar) {
		ParsingResult restResult = dropSequenceGrammar.getPrevious().accept(this);
		List<ParsingResultPair> results = new ArrayList<>();
		for(ParsingResultPair prevResult : restResult.getResults()) {
			lexicalContext.restore(prevResult.getMark());
			ParsingResult currentResult = dropSequenceGrammar.getDropped().accept(this);
			for(ParsingResultPair p : currentResult.getResults()) {
				Located<?> nResult = (Located<?>)prevResult.getResult();
				results.add(new ParsingResultPair(
						p.getMark(),
						new Located<>(
								nResult.getLocation().combine(p.getResult().getLocation()),
								nResult.getValue())));
			}
		}
		return new ParsingResult(results);
	}

	@Override
	@SuppressWarnings("unchecked")
	public <Part extends SourceLocatable, Rest extends EmptyHeterogenousList> ParsingResult visit(PartSequenceGrammar<Part, Rest> partSequenceGrammar) {
		ParsingResult restResult = partSequenceGrammar.getPrevGrammar().accept(this);
		List<ParsingResultPair> results = new ArrayList<>();
		for(ParsingResultPair prevResult : restResult.getResults()) {
			lexicalContext.restore(prevResult.getMark());
			ParsingResult currentResult = partSequenceGrammar.getCurrent().accept(this);
			for(ParsingResultPair p : currentResult.getResults()) {
				Located<Rest> prev = (Located<Rest>)prevResult.getResult();
				results.add(new ParsingResultPair(
						p.getMark(),
						new Located<>(
								prev.getLocation().combine(p.getResult().getLocation()),
								prev.getValue().cons(p.getResult()))
				));
			}
		}
		return new ParsingResult(results);
	}

	@Override
	public <GrammarResult extends SourceLocatable> ParsingResult visit(CutGrammar<GrammarResult> cutGrammar) {
		ParsingResult result = cutGrammar.getToCut().accept(this);
		if(result.getResults().size() <= 1) {
			return result;
		}else{
			return new ParsingResult(Collections.singletonList(result.getResults().get(0)));
		}
	}

	@Override
	public <GrammarResult extends SourceLocatable> ParsingResult visit(MemoizeGrammar<GrammarResult> memoizeGrammar) {
		int index = lexicalContext.mark().getMarkedIndex();
		Grammar<GrammarResult> grammar = memoizeGrammar.getToMemoize();
		ParsingResult record = memoizeTable.get(index, grammar);
		if(record == null) {
			record = grammar.accept(this);
			memoizeTable.put(index, grammar, record);
		}
		// callers restore to the mark of whichever result they continue from
		return record;
	}

	@Override
	@SuppressWarnings("unchecked")
	public <GrammarResult extends SourceLocatable> ParsingResult visit(PredicateGrammar<GrammarResult> predicateGrammar) {
		ParsingResult prevResult = predicateGrammar.getToFilter().accept(this);
		List<ParsingResultPair> results = new ArrayList<>(prevResult.getResults().size());
		for(ParsingResultPair p : prevResult.getResults()) {
			if(predicateGrammar.getPredicate().test((GrammarResult)p.getResult())) {
				results.add(p);
			}
		}
		return new ParsingResult(results);
	}

	@Override
	public <GrammarResult extends SourceLocatable> ParsingResult visit(RejectGrammar<GrammarResult> rejectGrammar) {
		Grammar<GrammarResult> toReject = rejectGrammar.getToReject();
		LexicalContext.Mark mark = lexicalContext.mark();
		ParsingResult result = toReject.accept(new GrammarExecuteVisitor(lexicalContext, new TreeMap<>(), memoizeTable));
		lexicalContext.restore(mark);
		if(result.getResults().isEmpty()) {
			return new ParsingResult(Collections.singletonList(
					new ParsingResultPair(mark, new Located<Void>(lexicalContext.getSourceLocation(), null))));
		}else{
			// if the grammar succeeds in any way, fail
			addFailure(ParseFailure.rejectFailure(toReject));
			return noResults();
		}
	}

	@Override
	public ParsingResult visit(EOFGrammar eofGrammar) {
		if(lexicalContext.isEOF()) {
			return new ParsingResult(Collections.singletonList(
					new ParsingResultPair(
							lexicalContext.mark(),
							new Located<>(lexicalContext.getSourceLocation(), null))));
		}else{
			addFailure(ParseFailure.eofMatchFailure());
			return noResults();
		}
	}
}
