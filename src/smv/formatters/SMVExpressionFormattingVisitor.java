package smv.formatters;

import smv.model.smv.*;

import java.io.IOException;
import java.util.List;

public class SMVExpressionFormattingVisitor extends SMVExpressionVisitor<Void, IOException> {
	IndentingWriter out;

	public SMVExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private boolean writeSource(SMVNode node) throws IOException {
		if(node.getSource() != null) {
			out.write(node.getSource());
			return true;
		}
		return false;
	}

	/**
	 * Writes {@param operand}, parenthesized if it binds more loosely than an operator of rank {@param precedence}.
	 */
	private void enclose(SMVExpression operand, int precedence) throws IOException {
		if(operand.getPrecedence() > precedence) {
			out.write("(");
			operand.accept(this);
			out.write(")");
		}else{
			operand.accept(this);
		}
	}

	private void writeCall(String function, List<SMVExpression> arguments) throws IOException {
		out.write(function);
		out.write("(");
		FormattingTools.writeCommaSeparated(out, arguments, arg -> arg.accept(this));
		out.write(")");
	}

	@Override
	public Void visit(SMVIdentifier identifier) throws IOException {
		if(writeSource(identifier)) return null;
		out.write(identifier.getName());
		return null;
	}

	@Override
	public Void visit(SMVComplexIdentifier complexIdentifier) throws IOException {
		if(writeSource(complexIdentifier)) return null;
		boolean first = true;
		for(SMVComplexIdentifier.Segment segment : complexIdentifier.getSegments()) {
			switch (segment.getKind()) {
				case NAME:
					if(!first) {
						out.write(".");
					}
					out.write(segment.getName());
					break;
				case SELF:
					if(!first) {
						out.write(".");
					}
					out.write("self");
					break;
				case INDEX:
					out.write("[");
					segment.getIndex().accept(this);
					out.write("]");
					break;
			}
			first = false;
		}
		return null;
	}

	@Override
	public Void visit(SMVBool bool) throws IOException {
		if(writeSource(bool)) return null;
		out.write(bool.getValue() ? "TRUE" : "FALSE");
		return null;
	}

	@Override
	public Void visit(SMVWord word) throws IOException {
		if(writeSource(word)) return null;
		out.write("0");
		if(word.getSign() != null) {
			out.write(word.getSign());
		}
		out.write(word.getBase());
		if(word.getWidth() != null) {
			out.write(Integer.toString(word.getWidth()));
		}
		out.write("_");
		out.write(word.getValue());
		return null;
	}

	@Override
	public Void visit(SMVNumber number) throws IOException {
		if(writeSource(number)) return null;
		out.write(Long.toString(number.getValue()));
		return null;
	}

	@Override
	public Void visit(SMVRange range) throws IOException {
		if(writeSource(range)) return null;
		range.getStart().accept(this);
		out.write("..");
		range.getStop().accept(this);
		return null;
	}

	@Override
	public Void visit(SMVConversion conversion) throws IOException {
		if(writeSource(conversion)) return null;
		out.write(conversion.getTarget().getKeyword());
		out.write("(");
		conversion.getValue().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(SMVWordFunction wordFunction) throws IOException {
		if(writeSource(wordFunction)) return null;
		out.write(wordFunction.getFunction().getKeyword());
		out.write("(");
		wordFunction.getValue().accept(this);
		out.write(", ");
		wordFunction.getSize().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(SMVCount count) throws IOException {
		if(writeSource(count)) return null;
		writeCall("count", count.getArguments());
		return null;
	}

	@Override
	public Void visit(SMVNext next) throws IOException {
		if(writeSource(next)) return null;
		out.write("next(");
		next.getValue().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(SMVInit init) throws IOException {
		if(writeSource(init)) return null;
		out.write("init(");
		init.getValue().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(SMVCase smvCase) throws IOException {
		if(writeSource(smvCase)) return null;
		out.write("case ");
		for(SMVCaseArm arm : smvCase.getArms()) {
			arm.accept(new SMVNodeFormattingVisitor(out));
			out.write(" ");
		}
		out.write("esac");
		return null;
	}

	@Override
	public Void visit(SMVArrayAccess arrayAccess) throws IOException {
		if(writeSource(arrayAccess)) return null;
		SMVExpression array = arrayAccess.getArray();
		boolean namedBase = array instanceof SMVIdentifier || array instanceof SMVComplexIdentifier
				|| array instanceof SMVDeclaration;
		if(namedBase && arrayAccess.getAccesses().get(0) instanceof SMVSubscript) {
			// name[i] would read back as one complex identifier
			out.write("(");
			array.accept(this);
			out.write(")");
		}else{
			enclose(array, SMVExpression.ATOMIC_PRECEDENCE);
		}
		for(SMVAccess access : arrayAccess.getAccesses()) {
			access.accept(new SMVNodeFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(SMVSet set) throws IOException {
		if(writeSource(set)) return null;
		out.write("{");
		FormattingTools.writeCommaSeparated(out, set.getElements(), element -> element.accept(this));
		out.write("}");
		return null;
	}

	@Override
	public Void visit(SMVUnaryOp unaryOp) throws IOException {
		if(writeSource(unaryOp)) return null;
		out.write(unaryOp.getOperator().getSymbol());
		out.write(" ");
		enclose(unaryOp.getOperand(), unaryOp.getPrecedence());
		return null;
	}

	@Override
	public Void visit(SMVBinOp binOp) throws IOException {
		if(writeSource(binOp)) return null;
		enclose(binOp.getLHS(), binOp.getPrecedence());
		if(binOp.getOperator() == SMVBinaryOperator.CONCAT) {
			out.write(binOp.getOperator().getSymbol());
		}else{
			out.write(" ");
			out.write(binOp.getOperator().getSymbol());
			out.write(" ");
		}
		enclose(binOp.getRHS(), binOp.getPrecedence());
		return null;
	}

	@Override
	public Void visit(SMVIfThenElse ifThenElse) throws IOException {
		if(writeSource(ifThenElse)) return null;
		enclose(ifThenElse.getCondition(), ifThenElse.getPrecedence());
		out.write(" ? ");
		enclose(ifThenElse.getThen(), ifThenElse.getPrecedence());
		out.write(" : ");
		enclose(ifThenElse.getElse(), ifThenElse.getPrecedence());
		return null;
	}

	@Override
	public Void visit(SMVCompassion compassion) throws IOException {
		if(writeSource(compassion)) return null;
		out.write("(");
		compassion.getP().accept(this);
		out.write(", ");
		compassion.getQ().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(SMVDeclaration declaration) throws IOException {
		if(writeSource(declaration)) return null;
		out.write(declaration.getName());
		return null;
	}
}
