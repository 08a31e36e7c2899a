package mixfix.model.notation;

public enum Associativity {
	LEFT("LEFTA"),
	RIGHT("RIGHTA"),
	NONE("NONA"),
	// computes windows like LEFT, but is recorded as undeclared
	UNSPECIFIED("LEFTA");

	private final String display;

	Associativity(String display) {
		this.display = display;
	}

	public String getDisplay() {
		return display;
	}
}
