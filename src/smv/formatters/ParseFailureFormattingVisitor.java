package smv.formatters;

import smv.parser.ParseFailure;
import smv.parser.ParseFailureVisitor;
import smv.util.SourceLocatable;

import java.io.IOException;

public class ParseFailureFormattingVisitor extends ParseFailureVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ParseFailureFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(ParseFailure.StringMatchFailure stringMatchFailure) throws IOException {
		out.write("expected \""+stringMatchFailure.getString()+"\"");
		return null;
	}

	@Override
	public Void visit(ParseFailure.PatternMatchFailure patternMatchFailure) throws IOException {
		if(patternMatchFailure.getDescription() != null) {
			out.write("expected "+patternMatchFailure.getDescription());
		}else{
			out.write("expected text matching "+patternMatchFailure.getPattern());
		}
		return null;
	}

	@Override
	public Void visit(ParseFailure.EOFMatchFailure eofMatchFailure) throws IOException {
		out.write("expected end of input");
		return null;
	}

	@Override
	public <Result extends SourceLocatable> Void visit(ParseFailure.RejectFailure<Result> rejectFailure) throws IOException {
		out.write("unexpected "+rejectFailure.getToReject());
		return null;
	}

}
