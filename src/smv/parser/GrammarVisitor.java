package smv.parser;

import smv.util.EmptyHeterogenousList;
import smv.util.SourceLocatable;

public abstract class GrammarVisitor<Result, Except extends Throwable> {
	public abstract Result visit(PatternGrammar patternGrammar) throws Except;
	public abstract <GrammarPredecessorResult extends SourceLocatable, GrammarResult extends SourceLocatable> Result visit(MappingGrammar<GrammarPredecessorResult,GrammarResult> mappingGrammar) throws Except;
	public abstract <GrammarResult extends SourceLocatable> Result visit(ReferenceGrammar<GrammarResult> referenceGrammar) throws Except;
	public abstract Result visit(StringGrammar stringGrammar) throws Except;
	public abstract <GrammarResult extends SourceLocatable> Result visit(BranchGrammar<GrammarResult> branchGrammar) throws Except;
	public abstract <GrammarResult extends SourceLocatable> Result visit(PredicateGrammar<GrammarResult> predicateGrammar) throws Except;
	public abstract <GrammarResult extends SourceLocatable> Result visit(RejectGrammar<GrammarResult> rejectGrammar) throws Except;
	public abstract Result visit(EOFGrammar eofGrammar) throws Except;
	public abstract Result visit(EmptySequenceGrammar emptySequenceGrammar) throws Except;
	public abstract <Dropped extends SourceLocatable, PrevResult extends EmptyHeterogenousList> Result visit(DropSequenceGrammar<Dropped,PrevResult> dropSequenceGrammar) throws Except;
	public abstract <Part extends SourceLocatable, PrevResult extends EmptyHeterogenousList> Result visit(PartSequenceGrammar<Part,PrevResult> partSequenceGrammar) throws Except;
	public abstract <GrammarResult extends SourceLocatable> Result visit(CutGrammar<GrammarResult> cutGrammar) throws Except;
	public abstract <GrammarResult extends SourceLocatable> Result visit(MemoizeGrammar<GrammarResult> memoizeGrammar) throws Except;
}
