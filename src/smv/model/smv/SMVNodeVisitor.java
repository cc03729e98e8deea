package smv.model.smv;

public abstract class SMVNodeVisitor<T, E extends Throwable> {
	public abstract T visit(SMVExpression expression) throws E;
	public abstract T visit(SMVType type) throws E;
	public abstract T visit(SMVCaseArm caseArm) throws E;
	public abstract T visit(SMVSubscript subscript) throws E;
	public abstract T visit(SMVBitSelection bitSelection) throws E;
	public abstract T visit(SMVMappingSection mappingSection) throws E;
	public abstract T visit(SMVListingSection listingSection) throws E;
	public abstract T visit(SMVModule module) throws E;
	public abstract T visit(SMVModel model) throws E;
}
