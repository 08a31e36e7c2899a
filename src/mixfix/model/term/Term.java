package mixfix.model.term;

import mixfix.Unreachable;
import mixfix.formatters.IndentingWriter;
import mixfix.formatters.TermFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 *
 * The base class of every term, whether it comes straight from the parser (surface syntax), out of the
 * elaborator (resolved) or from the reifier (display). Terms are immutable; rewriting passes build new trees and
 * share any subtree they leave untouched.
 *
 */
public abstract class Term {

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new TermFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return out.toString();
	}

	public abstract <T, E extends Throwable> T accept(TermVisitor<T, E> v) throws E;

}
