package smv.model.smv.builder;

import smv.model.smv.SMVCompassion;
import smv.model.smv.SMVExpression;
import smv.model.smv.SMVIdentifier;
import smv.model.smv.SMVListingSection;
import smv.model.smv.SMVMappingSection;
import smv.model.smv.SMVModule;
import smv.model.smv.SMVNode;
import smv.model.smv.SMVSection;
import smv.model.smv.SMVType;
import smv.parser.SMVParseException;
import smv.parser.SMVParser;
import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Turns an ordered list of section contributions into one module. Every contribution is first normalized into
 * a section of its kind, then sections of the same kind are merged in the order they were contributed: mapping
 * sections key by key with the last value winning, listing sections by appending. Empty contributions add no
 * section.
 */
public final class SMVModuleAssembler {

	private static final Logger LOGGER = Logger.getLogger("SMV Module Assembler");

	private SMVModuleAssembler() {}

	/**
	 * One contribution together with the section it is meant for.
	 */
	public static final class Part {
		private final SMVSection.Kind kind;
		private final SectionContribution contribution;

		public Part(SMVSection.Kind kind, SectionContribution contribution) {
			this.kind = kind;
			this.contribution = contribution;
		}

		public SMVSection.Kind getKind() {
			return kind;
		}

		public SectionContribution getContribution() {
			return contribution;
		}
	}

	public static SMVModule assemble(String name, List<SMVIdentifier> arguments, List<Part> parts)
			throws SMVParseException {
		Map<SMVSection.Kind, SMVSection> sections = new LinkedHashMap<>();
		for(Part part : parts) {
			SMVSection section;
			try {
				section = normalize(part.getKind(), part.getContribution());
			} catch (SMVParseException e) {
				throw new SMVParseException("in " + part.getKind() + " section of module " + name, e);
			}
			if(section.isEmpty()) {
				LOGGER.fine("module " + name + ": dropping empty " + part.getKind() + " contribution");
				continue;
			}
			SMVSection existing = sections.get(part.getKind());
			if(existing == null) {
				sections.put(part.getKind(), section);
			} else {
				LOGGER.fine("module " + name + ": merging " + section.size() + " more element(s) into "
						+ part.getKind());
				sections.put(part.getKind(), existing.merge(section));
			}
		}
		return new SMVModule(SourceLocation.unknown(), name, arguments, sections);
	}

	/**
	 * Builds the section of kind {@param kind} described by {@param contribution} alone.
	 * @throws IllegalArgumentException if the contribution's shape or nodes do not fit the section
	 */
	public static SMVSection normalize(SMVSection.Kind kind, SectionContribution contribution)
			throws SMVParseException {
		return contribution.accept(new Normalizer(kind));
	}

	private static final class Normalizer extends SectionContributionVisitor<SMVSection, SMVParseException> {
		private final SMVSection.Kind kind;

		Normalizer(SMVSection.Kind kind) {
			this.kind = kind;
		}

		private boolean isMapping() {
			return kind.getShape() == SMVSection.Shape.MAPPING;
		}

		@Override
		public SMVSection visit(SectionContribution.Text text) throws SMVParseException {
			return SMVParser.readSectionBody(kind, text.getBody());
		}

		@Override
		public SMVSection visit(SectionContribution.Mapping mapping) throws SMVParseException {
			if(!isMapping()) {
				throw new IllegalArgumentException(kind + " does not take a mapping");
			}
			Map<SMVExpression, SMVNode> entries = new LinkedHashMap<>();
			for(SectionContribution.Mapping.Entry entry : mapping.getEntries()) {
				SMVExpression key = entry.getKey().isText()
						? SMVParser.readMappingKey(kind, entry.getKey().getText())
						: checkKey(entry.getKey().getNode());
				SMVNode value = entry.getValue().isText()
						? SMVParser.readMappingValue(kind, entry.getValue().getText())
						: checkValue(entry.getValue().getNode());
				// a repeated key moves nothing, it only replaces the value
				entries.put(key, value);
			}
			return new SMVMappingSection(SourceLocation.unknown(), kind, entries);
		}

		@Override
		public SMVSection visit(SectionContribution.Listing listing) throws SMVParseException {
			if(isMapping()) {
				SMVSection result = new SMVMappingSection(SourceLocation.unknown(), kind, new LinkedHashMap<>());
				for(Fragment element : listing.getElements()) {
					if(!element.isText()) {
						throw new IllegalArgumentException(
								kind + " takes declarations as text or as a mapping, got " + element.getNode());
					}
					result = result.merge(SMVParser.readSectionBody(kind, element.getText()));
				}
				return result;
			}
			List<SMVExpression> elements = new ArrayList<>();
			for(Fragment element : listing.getElements()) {
				elements.add(element.isText()
						? SMVParser.readListingElement(kind, element.getText())
						: checkElement(element.getNode()));
			}
			return new SMVListingSection(SourceLocation.unknown(), kind, elements);
		}

		@Override
		public SMVSection visit(SectionContribution.Single single) throws SMVParseException {
			if(isMapping()) {
				throw new IllegalArgumentException(kind + " cannot be given a single node, got " + single.getNode());
			}
			List<SMVExpression> elements = new ArrayList<>();
			elements.add(checkElement(single.getNode()));
			return new SMVListingSection(SourceLocation.unknown(), kind, elements);
		}

		private SMVExpression checkKey(SMVNode node) {
			if(kind == SMVSection.Kind.ASSIGN ? !(node instanceof SMVExpression) : !(node instanceof SMVIdentifier)) {
				throw new IllegalArgumentException("invalid " + kind + " key: " + node);
			}
			return (SMVExpression) node;
		}

		private SMVNode checkValue(SMVNode node) {
			switch (kind) {
				case VAR:
				case IVAR:
				case FROZENVAR:
					if(!(node instanceof SMVType)) {
						throw new IllegalArgumentException(kind + " values must be types, got " + node);
					}
					break;
				default:
					if(!(node instanceof SMVExpression)) {
						throw new IllegalArgumentException(kind + " values must be expressions, got " + node);
					}
			}
			return node;
		}

		private SMVExpression checkElement(SMVNode node) {
			switch (kind) {
				case CONSTANTS:
					if(!(node instanceof SMVIdentifier)) {
						throw new IllegalArgumentException("CONSTANTS elements must be identifiers, got " + node);
					}
					break;
				case COMPASSION:
					if(!(node instanceof SMVCompassion)) {
						throw new IllegalArgumentException("COMPASSION elements must be (p, q) pairs, got " + node);
					}
					break;
				default:
					if(!(node instanceof SMVExpression)) {
						throw new IllegalArgumentException(kind + " elements must be expressions, got " + node);
					}
			}
			return (SMVExpression) node;
		}
	}
}
