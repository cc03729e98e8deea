package smv.model.smv;

/**
 * Thrown when the name of a {@link SMVDeclaration} is needed before one was bound to it.
 */
@SuppressWarnings("serial")
public class UnboundDeclarationException extends RuntimeException {
	public UnboundDeclarationException() {
		super("Unknown declaration name.");
	}
}
