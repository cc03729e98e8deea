package smv.model.smv;

import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, non-empty list of modules, as read from one SMV file.
 */
public class SMVModel extends SMVNode {

	private final List<SMVModule> modules;

	public SMVModel(SourceLocation location, List<SMVModule> modules) {
		super(location);
		if(modules.isEmpty()) {
			throw new IllegalArgumentException("a model needs at least one module");
		}
		this.modules = Collections.unmodifiableList(new ArrayList<>(modules));
	}

	public List<SMVModule> getModules() {
		return modules;
	}

	/**
	 * @return the first module called {@param name}, or null if there is none
	 */
	public SMVModule getModule(String name) {
		for(SMVModule module : modules) {
			if(module.getName().equals(name)) {
				return module;
			}
		}
		return null;
	}

	@Override
	public SMVModel copy() {
		return new SMVModel(getLocation(), modules);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVModel that = (SMVModel) o;
		return modules.equals(that.modules);
	}

	@Override
	public int hashCode() {
		return modules.hashCode();
	}
}
