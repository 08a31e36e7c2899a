package mixfix;

/**
 * A Mixfix exception consisting of a prefix (kind of error) and a message.
 */
public abstract class MixfixException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public MixfixException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
