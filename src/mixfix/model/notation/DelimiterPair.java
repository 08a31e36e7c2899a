package mixfix.model.notation;

import java.util.Objects;

public class DelimiterPair {
	private final String open;
	private final String close;

	public DelimiterPair(String open, String close) {
		this.open = open;
		this.close = close;
	}

	public String getOpen() {
		return open;
	}

	public String getClose() {
		return close;
	}

	public boolean isEmpty() {
		return open == null || open.isEmpty() || close == null || close.isEmpty();
	}

	@Override
	public int hashCode() {
		return Objects.hash(open, close);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		DelimiterPair other = (DelimiterPair) obj;
		return Objects.equals(open, other.open) && Objects.equals(close, other.close);
	}

	@Override
	public String toString() {
		return "(" + open + ", " + close + ")";
	}
}
