package smv.model.smv.builder;

import org.junit.Test;
import smv.model.smv.SMVListingSection;
import smv.model.smv.SMVMappingSection;
import smv.model.smv.SMVModule;
import smv.model.smv.SMVSection;
import smv.parser.SMVParseException;
import smv.parser.SMVParser;
import smv.util.SourceLocation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.junit.Assert.assertThat;
import static smv.model.smv.builder.SMVBuilder.*;

public class SMVModuleAssemblerTest {

	private static SMVModuleAssembler.Part part(SMVSection.Kind kind, SectionContribution contribution) {
		return new SMVModuleAssembler.Part(kind, contribution);
	}

	private static SMVModule assemble(SMVModuleAssembler.Part... parts) throws SMVParseException {
		return SMVModuleAssembler.assemble("main", Collections.emptyList(), Arrays.asList(parts));
	}

	private static Map<String, String> pairs(String... keysAndValues) {
		Map<String, String> result = new LinkedHashMap<>();
		for(int i = 0; i < keysAndValues.length; i += 2) {
			result.put(keysAndValues[i], keysAndValues[i + 1]);
		}
		return result;
	}

	@Test
	public void testMappingsMerge() throws SMVParseException {
		SMVModule main = assemble(
				part(SMVSection.Kind.VAR, SectionContribution.mappingOfText(pairs("c", "0..2"))),
				part(SMVSection.Kind.VAR, SectionContribution.mappingOfText(pairs("d", "boolean"))));
		assertThat(main.getSections().size(), is(1));
		SMVMappingSection var = (SMVMappingSection) main.getSection(SMVSection.Kind.VAR);
		assertThat(var.size(), is(2));
		assertThat(var.get(id("c")), is(rangeType(0, 2)));
		assertThat(var.get(id("d")), is(booleanType()));
		assertThat(main.toString(), is("MODULE main\n    VAR\n        c: 0..2;\n        d: boolean;"));
	}

	@Test
	public void testLaterValueWins() throws SMVParseException {
		SMVModule main = assemble(
				part(SMVSection.Kind.VAR, SectionContribution.text("x: boolean; y: boolean;")),
				part(SMVSection.Kind.VAR, SectionContribution.mappingOfText(pairs("x", "word[8]"))));
		assertThat(main.getSection(SMVSection.Kind.VAR).toString(),
				is("VAR\n    x: word[8];\n    y: boolean;"));
	}

	@Test
	public void testListingsAppend() throws SMVParseException {
		SMVModule main = assemble(
				part(SMVSection.Kind.INIT, SectionContribution.text("a")),
				part(SMVSection.Kind.DEFINE, SectionContribution.mappingOfText(pairs("d", "a & b"))),
				part(SMVSection.Kind.INIT, SectionContribution.listingOfText("b", "c")));
		assertThat(main.getSection(SMVSection.Kind.INIT), is(new SMVListingSection(SourceLocation.unknown(),
				SMVSection.Kind.INIT, Arrays.asList(id("a"), id("b"), id("c")))));
		List<SMVSection.Kind> order = new ArrayList<>(main.getSections().keySet());
		assertThat(order, is(Arrays.asList(SMVSection.Kind.INIT, SMVSection.Kind.DEFINE)));
	}

	@Test
	public void testSingle() throws SMVParseException {
		SMVModule main = assemble(
				part(SMVSection.Kind.TRANS, SectionContribution.single(eq(next(id("x")), not(id("x"))))),
				part(SMVSection.Kind.COMPASSION, SectionContribution.single(compassion(id("p"), id("q")))));
		assertThat(main.getSection(SMVSection.Kind.TRANS).toString(), is("TRANS\n    next(x) = !x"));
		assertThat(main.getSection(SMVSection.Kind.COMPASSION).toString(), is("COMPASSION\n    (p, q)"));
	}

	@Test
	public void testConstants() throws SMVParseException {
		SMVModule main = assemble(
				part(SMVSection.Kind.CONSTANTS, SectionContribution.listingOfText("low", "high")),
				part(SMVSection.Kind.CONSTANTS, SectionContribution.single(id("mid"))));
		assertThat(main.getSection(SMVSection.Kind.CONSTANTS).toString(), is("CONSTANTS\n    low, high, mid;"));
	}

	@Test
	public void testListingOfMappingText() throws SMVParseException {
		SMVModule main = assemble(
				part(SMVSection.Kind.ASSIGN, SectionContribution.listingOfText("init(x) := 0;", "next(x) := !x;")));
		SMVMappingSection assign = (SMVMappingSection) main.getSection(SMVSection.Kind.ASSIGN);
		assertThat(assign.get(init(id("x"))), is(num(0)));
		assertThat(assign.get(next(id("x"))), is(not(id("x"))));
	}

	@Test
	public void testAssignNodeKeys() throws SMVParseException {
		SMVModule main = assemble(part(SMVSection.Kind.ASSIGN, SectionContribution.mapping(Collections.singletonList(
				new SectionContribution.Mapping.Entry(Fragment.node(init(id("x"))), Fragment.text("0"))))));
		assertThat(main.getSection(SMVSection.Kind.ASSIGN).toString(), is("ASSIGN\n    init(x) := 0;"));
	}

	@Test
	public void testEmptyContributionsAddNoSection() throws SMVParseException {
		SMVModule main = assemble(
				part(SMVSection.Kind.INIT, SectionContribution.listing()),
				part(SMVSection.Kind.CONSTANTS, SectionContribution.listingOfText()),
				part(SMVSection.Kind.DEFINE, SectionContribution.mappingOfText(pairs())),
				part(SMVSection.Kind.INIT, SectionContribution.text("a")));
		assertThat(new ArrayList<>(main.getSections().keySet()), is(Arrays.asList(SMVSection.Kind.INIT)));
		assertThat(main.toString(), is("MODULE main\n    INIT\n        a"));
		assertThat(SMVParser.readModule(main.toString()), is(main));
		assertThat(assemble(part(SMVSection.Kind.INIT, SectionContribution.listing())).toString(),
				is("MODULE main"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMappingForListingKind() throws SMVParseException {
		assemble(part(SMVSection.Kind.INVAR, SectionContribution.mappingOfText(pairs("x", "y"))));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testSingleForMappingKind() throws SMVParseException {
		assemble(part(SMVSection.Kind.VAR, SectionContribution.single(id("x"))));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNodeInMappingListing() throws SMVParseException {
		assemble(part(SMVSection.Kind.DEFINE, SectionContribution.listing(Fragment.node(id("x")))));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testVarValueMustBeType() throws SMVParseException {
		assemble(part(SMVSection.Kind.VAR, SectionContribution.mapping(Collections.singletonList(
				new SectionContribution.Mapping.Entry(Fragment.text("x"), Fragment.node(num(1)))))));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDefineKeyMustBeIdentifier() throws SMVParseException {
		assemble(part(SMVSection.Kind.DEFINE, SectionContribution.mapping(Collections.singletonList(
				new SectionContribution.Mapping.Entry(Fragment.node(next(id("x"))), Fragment.node(num(1)))))));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testConstantsMustBeIdentifiers() throws SMVParseException {
		assemble(part(SMVSection.Kind.CONSTANTS, SectionContribution.single(num(1))));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testCompassionMustBePairs() throws SMVParseException {
		assemble(part(SMVSection.Kind.COMPASSION, SectionContribution.single(id("p"))));
	}

	@Test
	public void testParseFailureContext() {
		try {
			assemble(part(SMVSection.Kind.VAR, SectionContribution.mappingOfText(pairs("x", "word["))));
			throw new AssertionError("malformed type accepted");
		} catch (SMVParseException e) {
			assertThat(e.getMessage(), startsWith("in VAR section of module main: "));
		}
	}
}
