package smv.model.smv;

import smv.Unreachable;
import smv.formatters.IndentingWriter;
import smv.formatters.SMVNodeFormattingVisitor;
import smv.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 *
 * AST node:
 *
 * MODULE name(arg1, arg2, ...)
 *     VAR ...
 *     ASSIGN ...
 *
 * <p>Sections are kept in the order their kinds first appeared. There is at most one section of each kind.</p>
 *
 */
public class SMVModule extends SMVNode {

	private final String name;
	private final List<SMVIdentifier> arguments;
	private final Map<SMVSection.Kind, SMVSection> sections;

	public SMVModule(SourceLocation location, String name, List<SMVIdentifier> arguments,
	                 Map<SMVSection.Kind, SMVSection> sections) {
		super(location);
		this.name = Objects.requireNonNull(name);
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
		for(Map.Entry<SMVSection.Kind, SMVSection> entry : sections.entrySet()) {
			if(entry.getKey() != entry.getValue().getKind()) {
				throw new IllegalArgumentException(
						"section of kind " + entry.getValue().getKind() + " filed under " + entry.getKey());
			}
		}
		this.sections = Collections.unmodifiableMap(new LinkedHashMap<>(sections));
	}

	public String getName() {
		return name;
	}

	public List<SMVIdentifier> getArguments() {
		return arguments;
	}

	public Map<SMVSection.Kind, SMVSection> getSections() {
		return sections;
	}

	/**
	 * @return the section of the given kind, or null if the module has none
	 */
	public SMVSection getSection(SMVSection.Kind kind) {
		return sections.get(kind);
	}

	public SMVModuleType instance(SMVExpression... args) {
		return instance(Arrays.asList(args));
	}

	public SMVModuleType instance(List<SMVExpression> args) {
		return new SMVModuleType(SourceLocation.unknown(), name, args, false);
	}

	public SMVModuleType process(SMVExpression... args) {
		return process(Arrays.asList(args));
	}

	public SMVModuleType process(List<SMVExpression> args) {
		return new SMVModuleType(SourceLocation.unknown(), name, args, true);
	}

	/**
	 * Renders this module using {@param indent} spaces per nesting level.
	 */
	public String format(int indent) {
		StringWriter out = new StringWriter();
		try {
			accept(new SMVNodeFormattingVisitor(new IndentingWriter(out, indent)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return out.toString();
	}

	@Override
	public SMVModule copy() {
		return new SMVModule(getLocation(), name, arguments, sections);
	}

	@Override
	public SMVModule withSource(String source) {
		return (SMVModule) super.withSource(source);
	}

	@Override
	public <T, E extends Throwable> T accept(SMVNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SMVModule that = (SMVModule) o;
		return name.equals(that.name) &&
				arguments.equals(that.arguments) &&
				sections.equals(that.sections);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, arguments, sections);
	}
}
