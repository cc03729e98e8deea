package smv.model.smv;

public abstract class SMVTypeVisitor<T, E extends Throwable> {
	public abstract T visit(SMVBooleanType booleanType) throws E;
	public abstract T visit(SMVWordType wordType) throws E;
	public abstract T visit(SMVEnumType enumType) throws E;
	public abstract T visit(SMVRangeType rangeType) throws E;
	public abstract T visit(SMVArrayType arrayType) throws E;
	public abstract T visit(SMVModuleType moduleType) throws E;
}
