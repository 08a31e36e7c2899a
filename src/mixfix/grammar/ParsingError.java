package mixfix.grammar;

public class ParsingError extends Exception {

	private static final long serialVersionUID = -2731930481766315052L;

	private final int offset;

	public ParsingError(int offset, String message) {
		super(message + " at offset " + offset);
		this.offset = offset;
	}

	public int getOffset() {
		return offset;
	}
}
