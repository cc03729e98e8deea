package smv.formatters;

import smv.model.smv.*;

import java.io.IOException;
import java.util.Map;

public class SMVNodeFormattingVisitor extends SMVNodeVisitor<Void, IOException> {
	IndentingWriter out;

	public SMVNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private boolean writeSource(SMVNode node) throws IOException {
		if(node.getSource() != null) {
			out.write(node.getSource());
			return true;
		}
		return false;
	}

	@Override
	public Void visit(SMVExpression expression) throws IOException {
		expression.accept(new SMVExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(SMVType type) throws IOException {
		type.accept(new SMVTypeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(SMVCaseArm caseArm) throws IOException {
		if(writeSource(caseArm)) return null;
		caseArm.getCondition().accept(this);
		out.write(": ");
		caseArm.getResult().accept(this);
		out.write(";");
		return null;
	}

	@Override
	public Void visit(SMVSubscript subscript) throws IOException {
		if(writeSource(subscript)) return null;
		out.write("[");
		subscript.getIndex().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(SMVBitSelection bitSelection) throws IOException {
		if(writeSource(bitSelection)) return null;
		out.write("[");
		bitSelection.getHigh().accept(this);
		out.write(":");
		bitSelection.getLow().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(SMVMappingSection mappingSection) throws IOException {
		if(writeSource(mappingSection)) return null;
		if(mappingSection.isEmpty()) {
			// a keyword with nothing after it does not parse
			return null;
		}
		SMVSection.Kind kind = mappingSection.getKind();
		out.write(kind.getKeyword());
		try(IndentingWriter.Indent ignored = out.indent()) {
			for(Map.Entry<SMVExpression, SMVNode> entry : mappingSection.getEntries().entrySet()) {
				out.newLine();
				entry.getKey().accept(this);
				out.write(kind.getSeparator());
				entry.getValue().accept(this);
				out.write(";");
			}
		}
		return null;
	}

	@Override
	public Void visit(SMVListingSection listingSection) throws IOException {
		if(writeSource(listingSection)) return null;
		if(listingSection.isEmpty()) {
			return null;
		}
		SMVSection.Kind kind = listingSection.getKind();
		if(kind.getShape() == SMVSection.Shape.ENUMERATION) {
			out.write(kind.getKeyword());
			try(IndentingWriter.Indent ignored = out.indent()) {
				out.newLine();
				FormattingTools.writeCommaSeparated(out, listingSection.getElements(), e -> e.accept(this));
				out.write(";");
			}
			return null;
		}
		boolean first = true;
		for(SMVExpression element : listingSection.getElements()) {
			if(!first) {
				out.newLine();
			}
			first = false;
			out.write(kind.getKeyword());
			try(IndentingWriter.Indent ignored = out.indent()) {
				out.newLine();
				out.write(FormattingTools.reindent(element.toString()));
			}
		}
		return null;
	}

	@Override
	public Void visit(SMVModule module) throws IOException {
		if(writeSource(module)) return null;
		out.write("MODULE ");
		out.write(module.getName());
		if(!module.getArguments().isEmpty()) {
			out.write("(");
			FormattingTools.writeCommaSeparated(out, module.getArguments(), arg -> arg.accept(this));
			out.write(")");
		}
		try(IndentingWriter.Indent ignored = out.indent()) {
			for(SMVSection section : module.getSections().values()) {
				if(section.isEmpty()) {
					continue;
				}
				out.newLine();
				section.accept(this);
			}
		}
		return null;
	}

	@Override
	public Void visit(SMVModel model) throws IOException {
		if(writeSource(model)) return null;
		boolean first = true;
		for(SMVModule module : model.getModules()) {
			if(!first) {
				out.newLine();
				out.newLine();
			}
			first = false;
			module.accept(this);
		}
		return null;
	}
}
