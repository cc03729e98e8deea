package smv.model.smv;

/**
 * Thrown when a section is requested by a name that is not one of the module section keywords.
 */
@SuppressWarnings("serial")
public class UnknownSectionException extends RuntimeException {
	private final String sectionName;

	public UnknownSectionException(String sectionName) {
		super("Unknown section: " + sectionName + ".");
		this.sectionName = sectionName;
	}

	public String getSectionName() {
		return sectionName;
	}
}
