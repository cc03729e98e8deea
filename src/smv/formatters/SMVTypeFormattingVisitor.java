package smv.formatters;

import smv.model.smv.*;

import java.io.IOException;

public class SMVTypeFormattingVisitor extends SMVTypeVisitor<Void, IOException> {
	IndentingWriter out;

	public SMVTypeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private boolean writeSource(SMVNode node) throws IOException {
		if(node.getSource() != null) {
			out.write(node.getSource());
			return true;
		}
		return false;
	}

	// range bounds are read at the shift level
	private void writeBound(SMVExpression bound) throws IOException {
		if(bound.getPrecedence() > SMVBinaryOperator.SHIFT_LEFT.getPrecedence()) {
			out.write("(");
			bound.accept(new SMVExpressionFormattingVisitor(out));
			out.write(")");
		}else{
			bound.accept(new SMVExpressionFormattingVisitor(out));
		}
	}

	@Override
	public Void visit(SMVBooleanType booleanType) throws IOException {
		if(writeSource(booleanType)) return null;
		out.write("boolean");
		return null;
	}

	@Override
	public Void visit(SMVWordType wordType) throws IOException {
		if(writeSource(wordType)) return null;
		if(wordType.getSign() != null) {
			out.write(wordType.getSign().getKeyword());
			out.write(" ");
		}
		out.write("word[");
		wordType.getWidth().accept(new SMVExpressionFormattingVisitor(out));
		out.write("]");
		return null;
	}

	@Override
	public Void visit(SMVEnumType enumType) throws IOException {
		if(writeSource(enumType)) return null;
		out.write("{");
		FormattingTools.writeCommaSeparated(out, enumType.getValues(),
				value -> value.accept(new SMVExpressionFormattingVisitor(out)));
		out.write("}");
		return null;
	}

	@Override
	public Void visit(SMVRangeType rangeType) throws IOException {
		if(writeSource(rangeType)) return null;
		writeBound(rangeType.getStart());
		out.write("..");
		writeBound(rangeType.getStop());
		return null;
	}

	@Override
	public Void visit(SMVArrayType arrayType) throws IOException {
		if(writeSource(arrayType)) return null;
		out.write("array ");
		writeBound(arrayType.getStart());
		out.write("..");
		writeBound(arrayType.getStop());
		out.write(" of ");
		arrayType.getElementType().accept(this);
		return null;
	}

	@Override
	public Void visit(SMVModuleType moduleType) throws IOException {
		if(writeSource(moduleType)) return null;
		if(moduleType.isProcess()) {
			out.write("process ");
		}
		out.write(moduleType.getModuleName());
		if(!moduleType.getArguments().isEmpty()) {
			out.write("(");
			FormattingTools.writeCommaSeparated(out, moduleType.getArguments(),
					arg -> arg.accept(new SMVExpressionFormattingVisitor(out)));
			out.write(")");
		}
		return null;
	}
}
