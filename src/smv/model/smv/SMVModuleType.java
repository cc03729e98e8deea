package smv.model.smv;

import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 *
 * AST node:
 *
 * [process] name(arg1, arg2, ...)
 *
 * <p>The type of a variable holding an instance of another module.</p>
 *
 */
public class SMVModuleType extends SMVType {

	private final String moduleName;
	private final List<SMVExpression> arguments;
	private final boolean process;

	public SMVModuleType(SourceLocation location, String moduleName, List<SMVExpression> arguments, boolean process) {
		super(location);
		this.moduleName = Objects.requireNonNull(moduleName);
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
		this.process = process;
	}

	public String getModuleName() {
		return moduleName;
	}

	public List<SMVExpression> getArguments() {
		return arguments;
	}

	public boolean isProcess() {
		return process;
	}

	@Override
	public SMVModuleType copy() {
		return new SMVModuleType(getLocation(), moduleName, arguments, process);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVModuleType that = (SMVModuleType) o;
		return process == that.process &&
				moduleName.equals(that.moduleName) &&
				arguments.equals(that.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(moduleName, arguments, process);
	}
}
