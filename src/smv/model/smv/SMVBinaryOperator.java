package smv.model.smv;

/**
 * The binary operators of the language, with the precedence rank used to decide where parentheses are needed
 * when rendering (lower binds tighter).
 */
public enum SMVBinaryOperator {
	CONCAT("::", 2, false),
	MULT("*", 4, true),
	DIV("/", 4, false),
	MOD("mod", 4, false),
	ADD("+", 5, true),
	SUB("-", 5, false),
	SHIFT_LEFT("<<", 6, false),
	SHIFT_RIGHT(">>", 6, false),
	UNION("union", 7, true),
	IN("in", 8, false),
	EQ("=", 9, true),
	NEQ("!=", 9, true),
	LT("<", 9, false),
	GT(">", 9, false),
	LE("<=", 9, false),
	GE(">=", 9, false),
	AND("&", 10, true),
	OR("|", 11, true),
	XOR("xor", 11, true),
	XNOR("xnor", 11, true),
	IFF("<->", 13, false),
	IMPLIES("->", 14, false);

	private final String symbol;
	private final int precedence;
	private final boolean commutative;

	SMVBinaryOperator(String symbol, int precedence, boolean commutative) {
		this.symbol = symbol;
		this.precedence = precedence;
		this.commutative = commutative;
	}

	public String getSymbol() {
		return symbol;
	}

	public int getPrecedence() {
		return precedence;
	}

	public boolean isCommutative() {
		return commutative;
	}

	public static SMVBinaryOperator fromSymbol(String symbol) {
		for(SMVBinaryOperator op : values()) {
			if(op.symbol.equals(symbol)) {
				return op;
			}
		}
		throw new IllegalArgumentException("unknown binary operator: " + symbol);
	}
}
