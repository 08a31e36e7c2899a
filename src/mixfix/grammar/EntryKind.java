package mixfix.grammar;

public enum EntryKind {
	TERM,
	TERM_LIST,
	PATTERN,
	OTHER;

	/**
	 * @return whether hand-written grammar rules may extend entries of this kind
	 */
	public boolean isExtensible() {
		return this == TERM || this == TERM_LIST;
	}
}
