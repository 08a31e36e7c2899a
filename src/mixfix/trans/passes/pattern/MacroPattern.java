package mixfix.trans.passes.pattern;

import mixfix.model.term.Term;

/**
 * The two directions of a notation's meaning: the resolved term it stands for, and the reified form of that term
 * the printer recognises.
 */
public class MacroPattern {
	private final Term interpretation;
	private final Term displayPattern;

	public MacroPattern(Term interpretation, Term displayPattern) {
		this.interpretation = interpretation;
		this.displayPattern = displayPattern;
	}

	public Term getInterpretation() {
		return interpretation;
	}

	public Term getDisplayPattern() {
		return displayPattern;
	}
}
