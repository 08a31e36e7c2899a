package mixfix;

public class MixfixOptionException extends MixfixException {

	private static final long serialVersionUID = 3870924377520981213L;

	public MixfixOptionException(String msg) {
		super("Option Error", msg);
	}

}
