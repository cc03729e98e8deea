package smv.model.smv.builder;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import smv.model.smv.SMVModule;
import smv.parser.SMVParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads a module description of the form
 *
 * <pre>
 * {
 *   "name": "main",
 *   "args": ["a", "b"],
 *   "sections": [
 *     ["VAR", "x: boolean;"],
 *     ["VAR", [["y", "0..3"]]],
 *     ["INIT", ["x", "y = 0"]]
 *   ]
 * }
 * </pre>
 *
 * A section body is either a string (the whole body text), an array of strings (a listing) or an array of
 * two-element {@code [key, value]} arrays (a mapping). Objects are not accepted as bodies since their key
 * order is lost.
 */
public final class SMVModuleJSONReader {

	public static final String NAME_FIELD = "name";
	public static final String ARGS_FIELD = "args";
	public static final String SECTIONS_FIELD = "sections";

	private SMVModuleJSONReader() {}

	/**
	 * @throws IllegalArgumentException if {@param text} is not valid JSON or does not describe a module
	 */
	public static SMVModule read(String text) throws SMVParseException {
		JSONObject description;
		try {
			description = new JSONObject(text);
		} catch (JSONException e) {
			throw new IllegalArgumentException("Module description is not valid JSON: " + e.getMessage(), e);
		}
		return read(description);
	}

	public static SMVModule read(JSONObject description) throws SMVParseException {
		return toBuilder(description).build();
	}

	public static SMVModuleBuilder toBuilder(JSONObject description) {
		try {
			SMVModuleBuilder builder = new SMVModuleBuilder(description.getString(NAME_FIELD));
			if(description.has(ARGS_FIELD)) {
				JSONArray args = description.getJSONArray(ARGS_FIELD);
				for(int i = 0; i < args.length(); i++) {
					builder.argument(args.getString(i));
				}
			}
			if(description.has(SECTIONS_FIELD)) {
				JSONArray sections = description.getJSONArray(SECTIONS_FIELD);
				for(int i = 0; i < sections.length(); i++) {
					JSONArray section = sections.getJSONArray(i);
					if(section.length() != 2) {
						throw new IllegalArgumentException(
								"section " + i + " must be a [keyword, body] pair, got " + section);
					}
					builder.section(section.getString(0), readBody(section.get(1)));
				}
			}
			return builder;
		} catch (JSONException e) {
			throw new IllegalArgumentException("Module description is invalid: " + e.getMessage(), e);
		}
	}

	private static SectionContribution readBody(Object body) {
		if(body instanceof String) {
			return SectionContribution.text((String) body);
		}
		if(body instanceof JSONObject) {
			throw new IllegalArgumentException(
					"section bodies cannot be JSON objects, use an array of [key, value] pairs: " + body);
		}
		if(!(body instanceof JSONArray)) {
			throw new IllegalArgumentException("unsupported section body: " + body);
		}
		JSONArray array = (JSONArray) body;
		List<Fragment> elements = new ArrayList<>();
		List<SectionContribution.Mapping.Entry> entries = new ArrayList<>();
		for(int i = 0; i < array.length(); i++) {
			Object element = array.get(i);
			if(element instanceof String) {
				elements.add(Fragment.text((String) element));
			} else if(element instanceof JSONArray && ((JSONArray) element).length() == 2) {
				JSONArray pair = (JSONArray) element;
				entries.add(new SectionContribution.Mapping.Entry(
						Fragment.text(pair.getString(0)), Fragment.text(pair.getString(1))));
			} else {
				throw new IllegalArgumentException("unsupported section body element: " + element);
			}
		}
		if(!elements.isEmpty() && !entries.isEmpty()) {
			throw new IllegalArgumentException("a section body cannot mix strings and [key, value] pairs: " + body);
		}
		if(!entries.isEmpty()) {
			return SectionContribution.mapping(entries);
		}
		return SectionContribution.listing(elements);
	}
}
