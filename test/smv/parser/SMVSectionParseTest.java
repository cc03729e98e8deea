package smv.parser;

import org.junit.Test;
import smv.model.smv.SMVExpression;
import smv.model.smv.SMVListingSection;
import smv.model.smv.SMVMappingSection;
import smv.model.smv.SMVNode;
import smv.model.smv.SMVSection;
import smv.util.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static smv.model.smv.builder.SMVBuilder.*;

public class SMVSectionParseTest {

	private static SMVMappingSection mapping(SMVSection.Kind kind, Object... keysAndValues) {
		Map<SMVExpression, SMVNode> entries = new LinkedHashMap<>();
		for(int i = 0; i < keysAndValues.length; i += 2) {
			entries.put((SMVExpression) keysAndValues[i], (SMVNode) keysAndValues[i + 1]);
		}
		return new SMVMappingSection(SourceLocation.unknown(), kind, entries);
	}

	private static SMVListingSection listing(SMVSection.Kind kind, SMVExpression... elements) {
		return new SMVListingSection(SourceLocation.unknown(), kind, Arrays.asList(elements));
	}

	@Test
	public void testVarSection() throws SMVParseException {
		assertThat(SMVParser.readSection("VAR x: boolean;"),
				is(mapping(SMVSection.Kind.VAR, id("x"), booleanType())));
	}

	@Test
	public void testVarSectionKeepsDeclarationOrder() throws SMVParseException {
		SMVSection section = SMVParser.readSection("VAR\n  b : word[2];\n  a : 0..3;\n");
		assertThat(section, is(mapping(SMVSection.Kind.VAR, id("b"), wordType(2), id("a"), rangeType(0, 3))));
		assertThat(((SMVMappingSection) section).getEntries().keySet().iterator().next(), is(id("b")));
	}

	@Test
	public void testDefineSection() throws SMVParseException {
		assertThat(SMVParser.readSection("DEFINE\n  done := x & y;\n  count2 := a + 1;"),
				is(mapping(SMVSection.Kind.DEFINE,
						id("done"), and(id("x"), id("y")),
						id("count2"), add(id("a"), num(1)))));
	}

	@Test
	public void testAssignSection() throws SMVParseException {
		assertThat(SMVParser.readSection("ASSIGN\n  init(x) := FALSE;\n  next(x) := !x;\n  y := x;\n"),
				is(mapping(SMVSection.Kind.ASSIGN,
						init(id("x")), bool(false),
						next(id("x")), not(id("x")),
						id("y"), id("x"))));
	}

	@Test
	public void testConstantsSection() throws SMVParseException {
		assertThat(SMVParser.readSection("CONSTANTS a, b, c;"),
				is(listing(SMVSection.Kind.CONSTANTS, id("a"), id("b"), id("c"))));
	}

	@Test
	public void testTransSectionAllowsNext() throws SMVParseException {
		assertThat(SMVParser.readSection("TRANS next(x) = !x;"),
				is(listing(SMVSection.Kind.TRANS, eq(next(id("x")), not(id("x"))))));
	}

	@Test(expected = SMVParseException.class)
	public void testInitSectionRejectsNext() throws SMVParseException {
		SMVParser.readSection("INIT next(x) = !x");
	}

	@Test
	public void testCompassionSection() throws SMVParseException {
		assertThat(SMVParser.readSection("COMPASSION (p, q)"),
				is(listing(SMVSection.Kind.COMPASSION, compassion(id("p"), id("q")))));
	}

	@Test
	public void testBodyKeepsItsText() throws SMVParseException {
		SMVListingSection section = (SMVListingSection) SMVParser.readSection("INVAR\n  x |\n    y;");
		assertThat(section.getElements().get(0).getSource(), is("x |\n    y"));
		assertThat(section.toString(), is("INVAR\n    x |\n    y"));
	}

	@Test
	public void testSectionBodyWithoutKeyword() throws SMVParseException {
		assertThat(SMVParser.readSectionBody(SMVSection.Kind.VAR, "x: boolean; y: boolean;"),
				is(mapping(SMVSection.Kind.VAR, id("x"), booleanType(), id("y"), booleanType())));
		assertThat(SMVParser.readSectionBody(SMVSection.Kind.FAIRNESS, "running"),
				is(listing(SMVSection.Kind.FAIRNESS, id("running"))));
	}

	@Test
	public void testMappingParts() throws SMVParseException {
		assertThat(SMVParser.readMappingKey(SMVSection.Kind.ASSIGN, "next(a.b)"), is(next(cid("a", "b"))));
		assertThat(SMVParser.readMappingValue(SMVSection.Kind.VAR, "process p(1)"), is(processType("p", num(1))));
		assertThat(SMVParser.readMappingValue(SMVSection.Kind.DEFINE, "a ? 1 : 2"), is(ite(id("a"), num(1), num(2))));
	}

	@Test(expected = SMVParseException.class)
	public void testIVarRejectsModuleTypes() throws SMVParseException {
		SMVParser.readMappingValue(SMVSection.Kind.IVAR, "process p(1)");
	}

	@Test
	public void testListingElement() throws SMVParseException {
		assertThat(SMVParser.readListingElement(SMVSection.Kind.TRANS, "next(x) != x;"),
				is(neq(next(id("x")), id("x"))));
		assertThat(SMVParser.readListingElement(SMVSection.Kind.CONSTANTS, "idle"), is(id("idle")));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testListingElementOfMappingSection() throws SMVParseException {
		SMVParser.readListingElement(SMVSection.Kind.VAR, "x");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMappingKeyOfListingSection() throws SMVParseException {
		SMVParser.readMappingKey(SMVSection.Kind.INIT, "x");
	}

	@Test(expected = SMVParseException.class)
	public void testKeywordIsNotAnIdentifier() throws SMVParseException {
		SMVParser.readSection("VAR next: boolean;");
	}

	@Test
	public void testEmptyConstantsIsNotASection() {
		try {
			SMVParser.readSection("CONSTANTS ;");
		} catch (SMVParseException e) {
			assertThat(e.getExpected().isEmpty(), is(false));
			return;
		}
		throw new AssertionError("expected a parse failure");
	}

	@Test
	public void testRenderedSections() throws SMVParseException {
		assertThat(SMVParser.readSection("VAR x : boolean; y : 0..2;").copy().toString(),
				is("VAR\n    x: boolean;\n    y: 0..2;"));
		assertThat(SMVParser.readSection("ASSIGN init(x) := 0;").copy().toString(),
				is("ASSIGN\n    init(x) := 0;"));
		assertThat(SMVParser.readSection("CONSTANTS a,b;").copy().toString(),
				is("CONSTANTS\n    a, b;"));
		assertThat(listing(SMVSection.Kind.INIT, id("a"), id("b")).toString(),
				is("INIT\n    a\nINIT\n    b"));
		assertThat(new SMVListingSection(SourceLocation.unknown(), SMVSection.Kind.JUSTICE,
						Collections.<SMVExpression>emptyList()).toString(),
				is(""));
		assertThat(new SMVListingSection(SourceLocation.unknown(), SMVSection.Kind.CONSTANTS,
						Collections.<SMVExpression>emptyList()).toString(),
				is(""));
		assertThat(mapping(SMVSection.Kind.VAR).toString(), is(""));
	}
}
