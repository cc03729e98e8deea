package smv.model.smv;

import smv.util.SourceLocation;

import java.util.Objects;

/**
 * A variable or define declared ahead of knowing its name, so it can be used inside expressions while a
 * module is still being put together. The name is bound exactly once, when the declaration is placed in a
 * module, see {@link smv.model.smv.builder.SMVModuleBuilder#declare(String, SMVDeclaration)}. Until then it has
 * no name and renders nowhere.
 *
 * <p>Declarations are compared by identity: two declarations with the same body are still different
 * variables.</p>
 */
public class SMVDeclaration extends SMVExpression {

	private final SMVSection.Kind kind;
	private final SMVNode body;
	private String name;

	public SMVDeclaration(SourceLocation location, SMVSection.Kind kind, SMVNode body) {
		super(location);
		Objects.requireNonNull(kind);
		Objects.requireNonNull(body);
		switch (kind) {
			case VAR:
			case IVAR:
			case FROZENVAR:
				if(!(body instanceof SMVType)) {
					throw new IllegalArgumentException(kind + " declarations need a type, got " + body);
				}
				break;
			case DEFINE:
				if(!(body instanceof SMVExpression)) {
					throw new IllegalArgumentException("DEFINE declarations need an expression, got " + body);
				}
				break;
			default:
				throw new IllegalArgumentException("cannot declare in a " + kind + " section");
		}
		this.kind = kind;
		this.body = body;
		this.name = null;
	}

	public SMVSection.Kind getKind() {
		return kind;
	}

	public SMVNode getBody() {
		return body;
	}

	public boolean isBound() {
		return name != null;
	}

	/**
	 * @return the bound name
	 * @throws UnboundDeclarationException if no name has been bound yet
	 */
	public String getName() {
		if(name == null) {
			throw new UnboundDeclarationException();
		}
		return name;
	}

	/**
	 * Binds this declaration to {@param name}. This can only happen once.
	 * @throws IllegalStateException if a name is already bound
	 */
	public void bind(String name) {
		Objects.requireNonNull(name);
		if(this.name != null) {
			throw new IllegalStateException("declaration is already bound to " + this.name);
		}
		this.name = name;
	}

	@Override
	public SMVDeclaration copy() {
		SMVDeclaration result = new SMVDeclaration(getLocation(), kind, body);
		result.name = name;
		return result;
	}

	@Override
	public <T, E extends Throwable> T accept(SMVExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return this == o;
	}

	@Override
	public int hashCode() {
		return System.identityHashCode(this);
	}
}
