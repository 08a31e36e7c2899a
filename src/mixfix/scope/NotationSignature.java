package mixfix.scope;

import mixfix.model.notation.NotationPrecedence;

import java.util.Objects;

/**
 * What makes two notations the same grammar production: their precedence and their key.
 */
public class NotationSignature {
	private final NotationPrecedence precedence;
	private final String key;

	public NotationSignature(NotationPrecedence precedence, String key) {
		this.precedence = precedence;
		this.key = key;
	}

	public NotationPrecedence getPrecedence() {
		return precedence;
	}

	public String getKey() {
		return key;
	}

	@Override
	public int hashCode() {
		return Objects.hash(precedence, key);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		NotationSignature other = (NotationSignature) obj;
		return precedence.equals(other.precedence) && key.equals(other.key);
	}

	@Override
	public String toString() {
		return "\"" + key + "\" at " + precedence;
	}
}
