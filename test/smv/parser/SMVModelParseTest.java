package smv.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import smv.model.smv.SMVModel;
import smv.model.smv.SMVModule;

@RunWith(Parameterized.class)
public class SMVModelParseTest {

	@Parameters
	public static List<Object[]> data(){
		return Arrays.asList(new Object[][] {
				{"counter", Arrays.asList("counter_cell", "main") },
				{"mutex", Arrays.asList("user", "main") },
				{"words", Arrays.asList("main") },
		});
	}

	private final String fileName;
	private final List<String> moduleNames;

	public SMVModelParseTest(String fileName, List<String> moduleNames) {
		this.fileName = fileName;
		this.moduleNames = moduleNames;
	}

	private Path modelPath() {
		return Paths.get("test", "models", fileName + ".smv");
	}

	private SMVModel readModel() throws IOException, SMVParseException {
		Path path = modelPath();
		String text = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
		return SMVParser.readModel(new LexicalContext(path, text));
	}

	@Test
	public void testModuleNames() throws IOException, SMVParseException {
		SMVModel model = readModel();
		assertThat(model.getModules().size(), is(moduleNames.size()));
		for(int i = 0; i < moduleNames.size(); i++) {
			assertThat(model.getModules().get(i).getName(), is(moduleNames.get(i)));
			assertThat(model.getModule(moduleNames.get(i)), is(model.getModules().get(i)));
		}
	}

	@Test
	public void testModelKeepsItsText() throws IOException, SMVParseException {
		SMVModel model = readModel();
		String text = FileUtils.readFileToString(new File(modelPath().toString()), StandardCharsets.UTF_8);
		// the model is located from its first token to its last one
		assertThat(model.toString(), is(text.substring(model.getLocation().getStartOffset(), model.getLocation().getEndOffset())));
	}

	@Test
	public void testRenderedModelReparses() throws IOException, SMVParseException {
		SMVModel model = readModel();
		String rendered = model.copy().toString();
		SMVModel reparsed = SMVParser.readModel(rendered);
		assertThat(reparsed, is(model));
		assertThat(reparsed.copy().toString(), is(rendered));
	}

	@Test
	public void testEachModuleReparses() throws IOException, SMVParseException {
		for(SMVModule module : readModel().getModules()) {
			assertThat(SMVParser.readModule(module.copy().toString()), is(module));
		}
	}

}
