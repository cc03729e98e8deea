package smv.model.smv;

public abstract class SMVExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(SMVIdentifier identifier) throws E;
	public abstract T visit(SMVComplexIdentifier complexIdentifier) throws E;
	public abstract T visit(SMVBool bool) throws E;
	public abstract T visit(SMVWord word) throws E;
	public abstract T visit(SMVNumber number) throws E;
	public abstract T visit(SMVRange range) throws E;
	public abstract T visit(SMVConversion conversion) throws E;
	public abstract T visit(SMVWordFunction wordFunction) throws E;
	public abstract T visit(SMVCount count) throws E;
	public abstract T visit(SMVNext next) throws E;
	public abstract T visit(SMVInit init) throws E;
	public abstract T visit(SMVCase smvCase) throws E;
	public abstract T visit(SMVArrayAccess arrayAccess) throws E;
	public abstract T visit(SMVSet set) throws E;
	public abstract T visit(SMVUnaryOp unaryOp) throws E;
	public abstract T visit(SMVBinOp binOp) throws E;
	public abstract T visit(SMVIfThenElse ifThenElse) throws E;
	public abstract T visit(SMVCompassion compassion) throws E;
	public abstract T visit(SMVDeclaration declaration) throws E;
}
