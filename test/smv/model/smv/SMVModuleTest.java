package smv.model.smv;

import org.junit.Test;
import smv.util.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;
import static smv.model.smv.builder.SMVBuilder.*;

public class SMVModuleTest {

	private static SMVModule module(String name, SMVSection... sections) {
		Map<SMVSection.Kind, SMVSection> map = new LinkedHashMap<>();
		for(SMVSection section : sections) {
			map.put(section.getKind(), section);
		}
		return new SMVModule(SourceLocation.unknown(), name, Collections.emptyList(), map);
	}

	@Test
	public void testInstance() {
		SMVModule cell = new SMVModule(SourceLocation.unknown(), "cell",
				Collections.singletonList(id("carry_in")), Collections.emptyMap());
		assertThat(cell.instance(bool(true)), is(moduleType("cell", bool(true))));
		assertThat(cell.process(id("s")), is(processType("cell", id("s"))));
		assertThat(cell.process(id("s")).toString(), is("process cell(s)"));
		assertThat(cell.toString(), is("MODULE cell(carry_in)"));
	}

	@Test
	public void testGetSection() {
		SMVListingSection init = new SMVListingSection(SourceLocation.unknown(), SMVSection.Kind.INIT,
				Collections.singletonList(id("a")));
		SMVModule main = module("main", init);
		assertThat(main.getSection(SMVSection.Kind.INIT), is(init));
		assertThat(main.getSection(SMVSection.Kind.VAR), nullValue());
	}

	@Test
	public void testEmptySectionsAreNotRendered() {
		SMVModule main = module("main",
				new SMVListingSection(SourceLocation.unknown(), SMVSection.Kind.CONSTANTS, Collections.emptyList()),
				new SMVMappingSection(SourceLocation.unknown(), SMVSection.Kind.VAR, Collections.emptyMap()),
				new SMVListingSection(SourceLocation.unknown(), SMVSection.Kind.FAIRNESS,
						Collections.singletonList(id("running"))));
		assertThat(main.toString(), is("MODULE main\n    FAIRNESS\n        running"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMisfiledSection() {
		Map<SMVSection.Kind, SMVSection> map = new LinkedHashMap<>();
		map.put(SMVSection.Kind.INVAR, new SMVListingSection(SourceLocation.unknown(), SMVSection.Kind.INIT,
				Collections.singletonList(id("a"))));
		new SMVModule(SourceLocation.unknown(), "main", Collections.emptyList(), map);
	}

	@Test
	public void testModel() {
		SMVModule a = module("a");
		SMVModule b = module("b");
		SMVModel model = new SMVModel(SourceLocation.unknown(), Arrays.asList(a, b));
		assertThat(model.getModule("b"), is(b));
		assertThat(model.getModule("c"), nullValue());
		assertThat(model.toString(), is("MODULE a\n\nMODULE b"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyModel() {
		new SMVModel(SourceLocation.unknown(), Collections.emptyList());
	}
}
