package mixfix.trans.extension;

public class TokenObject extends ExtensionObject {
	private final String text;

	public TokenObject(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(ExtensionObjectVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return text.equals(((TokenObject) obj).text);
	}

	@Override
	public String toString() {
		return "token \"" + text + "\"";
	}
}
