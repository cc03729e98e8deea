package smv.model.smv.builder;

import org.junit.Test;
import smv.model.smv.SMVDeclaration;
import smv.model.smv.SMVModule;
import smv.model.smv.SMVSection;
import smv.model.smv.UnknownSectionException;
import smv.parser.SMVParseException;
import smv.parser.SMVParser;

import java.util.Arrays;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static smv.model.smv.builder.SMVBuilder.*;

public class SMVModuleBuilderTest {

	@Test
	public void testDeclarations() throws SMVParseException {
		SMVDeclaration x = var(booleanType());
		SMVDeclaration y = var(rangeType(0, 3));
		SMVDeclaration both = define(and(x, eq(y, num(0))));
		SMVModule main = new SMVModuleBuilder("main")
				.declare("x", x)
				.declare("y", y)
				.declare("both", both)
				.section(SMVSection.Kind.ASSIGN, SectionContribution.mapping(Arrays.asList(
						new SectionContribution.Mapping.Entry(Fragment.node(init(x)), Fragment.node(bool(false))),
						new SectionContribution.Mapping.Entry(Fragment.node(next(x)), Fragment.node(not(x))))))
				.section(SMVSection.Kind.INVAR, SectionContribution.single(implies(both, x)))
				.build();
		String expected = "MODULE main\n" +
				"    VAR\n" +
				"        x: boolean;\n" +
				"        y: 0..3;\n" +
				"    DEFINE\n" +
				"        both := x & y = 0;\n" +
				"    ASSIGN\n" +
				"        init(x) := FALSE;\n" +
				"        next(x) := !x;\n" +
				"    INVAR\n" +
				"        both -> x";
		assertThat(main.toString(), is(expected));
	}

	@Test
	public void testKeywordText() throws SMVParseException {
		SMVModule counter = new SMVModuleBuilder("counter")
				.argument("carry_in")
				.text("VAR", "value: boolean;")
				.text("ASSIGN", "init(value) := FALSE; next(value) := value xor carry_in;")
				.text("DEFINE", "carry_out := value & carry_in;")
				.build();
		assertThat(counter.getArguments().size(), is(1));
		assertThat(counter, is(SMVParser.readModule("MODULE counter(carry_in)\n" +
				"VAR value : boolean;\n" +
				"ASSIGN\n" +
				"  init(value) := FALSE;\n" +
				"  next(value) := value xor carry_in;\n" +
				"DEFINE carry_out := value & carry_in;")));
	}

	@Test
	public void testUnknownKeyword() {
		try {
			new SMVModuleBuilder("main").text("VARIABLES", "x: boolean;");
			throw new AssertionError("unknown keyword accepted");
		} catch (UnknownSectionException e) {
			assertThat(e.getMessage(), is("Unknown section: VARIABLES."));
		}
	}

	@Test(expected = IllegalStateException.class)
	public void testDeclareTwice() {
		SMVDeclaration x = var(booleanType());
		new SMVModuleBuilder("main").declare("x", x).declare("y", x);
	}

	@Test
	public void testParts() {
		SMVModuleBuilder builder = new SMVModuleBuilder("main")
				.text("INIT", "a")
				.text("INIT", "b");
		assertThat(builder.getName(), is("main"));
		assertThat(builder.getParts().size(), is(2));
		assertThat(builder.getParts().get(1).getContribution(), is(SectionContribution.text("b")));
	}

	@Test
	public void testEmptyModule() throws SMVParseException {
		assertThat(new SMVModuleBuilder("main").build().toString(), is("MODULE main"));
	}
}
