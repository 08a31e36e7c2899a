package mixfix.lexer;

public class TermToken {

	private final String value;
	private final TermTokenType type;
	private final int offset;

	public TermToken(String value, TermTokenType type, int offset) {
		this.value = value;
		this.type = type;
		this.offset = offset;
	}

	public String getValue() {
		return value;
	}

	public TermTokenType getType() {
		return type;
	}

	public int getOffset() {
		return offset;
	}

	/**
	 * @return whether this token can be matched by a terminal of a production
	 */
	public boolean isTerminal() {
		return type == TermTokenType.KEYWORD || type == TermTokenType.SYMBOL;
	}

	@Override
	public String toString() {
		return "TermToken [value=" + value + ", type=" + type + ", offset=" + offset + "]";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + offset;
		result = prime * result + ((type == null) ? 0 : type.hashCode());
		result = prime * result + ((value == null) ? 0 : value.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		TermToken other = (TermToken) obj;
		if (offset != other.offset)
			return false;
		if (type != other.type)
			return false;
		if (value == null) {
			return other.value == null;
		} else return value.equals(other.value);
	}
}
