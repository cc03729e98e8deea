package smv.model.smv.builder;

import smv.model.smv.SMVDeclaration;
import smv.model.smv.SMVIdentifier;
import smv.model.smv.SMVModule;
import smv.model.smv.SMVSection;
import smv.parser.SMVParseException;
import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Collects the arguments and section contributions of one module, in order, and assembles them on
 * {@link #build()}.
 *
 * <pre>
 * SMVDeclaration x = SMVBuilder.var(SMVBuilder.booleanType());
 * SMVModule main = new SMVModuleBuilder("main")
 *         .declare("x", x)
 *         .section(SMVSection.Kind.ASSIGN, SectionContribution.mapping(...))
 *         .build();
 * </pre>
 */
public class SMVModuleBuilder {

	private final String name;
	private final List<SMVIdentifier> arguments;
	private final List<SMVModuleAssembler.Part> parts;

	public SMVModuleBuilder(String name) {
		this.name = Objects.requireNonNull(name);
		this.arguments = new ArrayList<>();
		this.parts = new ArrayList<>();
	}

	public String getName() {
		return name;
	}

	public SMVModuleBuilder argument(String argument) {
		return argument(new SMVIdentifier(SourceLocation.unknown(), argument));
	}

	public SMVModuleBuilder argument(SMVIdentifier argument) {
		arguments.add(Objects.requireNonNull(argument));
		return this;
	}

	public SMVModuleBuilder section(SMVSection.Kind kind, SectionContribution contribution) {
		parts.add(new SMVModuleAssembler.Part(Objects.requireNonNull(kind), Objects.requireNonNull(contribution)));
		return this;
	}

	/**
	 * @throws smv.model.smv.UnknownSectionException if {@param keyword} names no section
	 */
	public SMVModuleBuilder section(String keyword, SectionContribution contribution) {
		return section(SMVSection.Kind.fromKeyword(keyword), contribution);
	}

	public SMVModuleBuilder text(String keyword, String body) {
		return section(keyword, SectionContribution.text(body));
	}

	/**
	 * Names {@param declaration} and adds {@code name -> body} to the section of the declaration's kind.
	 * @throws IllegalStateException if the declaration already has a name
	 */
	public SMVModuleBuilder declare(String name, SMVDeclaration declaration) {
		declaration.bind(name);
		List<SectionContribution.Mapping.Entry> entries = Collections.singletonList(
				new SectionContribution.Mapping.Entry(
						Fragment.node(new SMVIdentifier(SourceLocation.unknown(), name)),
						Fragment.node(declaration.getBody())));
		return section(declaration.getKind(), SectionContribution.mapping(entries));
	}

	public List<SMVModuleAssembler.Part> getParts() {
		return Collections.unmodifiableList(parts);
	}

	public SMVModule build() throws SMVParseException {
		return SMVModuleAssembler.assemble(name, arguments, parts);
	}
}
