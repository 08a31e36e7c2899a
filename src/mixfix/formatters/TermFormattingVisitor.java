package mixfix.formatters;

import mixfix.model.term.*;

import java.io.IOException;

/**
 * Writes terms in a fully parenthesised, notation-free form. Used for debugging and in error messages; the
 * user-facing printer is {@link mixfix.printer.NotationPrinter}.
 */
public class TermFormattingVisitor extends TermVisitor<Void, IOException> {
	private final IndentingWriter out;

	public TermFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(TermVariable termVariable) throws IOException {
		out.write(termVariable.getName());
		return null;
	}

	@Override
	public Void visit(TermReference termReference) throws IOException {
		out.write(termReference.getName().toString());
		return null;
	}

	@Override
	public Void visit(TermApplication termApplication) throws IOException {
		out.write("(");
		termApplication.getHead().accept(this);
		for (Term arg : termApplication.getArguments()) {
			out.write(" ");
			arg.accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(TermLambda termLambda) throws IOException {
		out.write("(fun ");
		out.write(termLambda.getBinder());
		out.write(" => ");
		termLambda.getBody().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(TermMeta termMeta) throws IOException {
		out.write("$e");
		out.write(Integer.toString(termMeta.getIndex()));
		return null;
	}

	@Override
	public Void visit(TermEvar termEvar) throws IOException {
		out.write("_");
		return null;
	}

	@Override
	public Void visit(TermNumber termNumber) throws IOException {
		out.write(termNumber.getValue());
		return null;
	}

	@Override
	public Void visit(TermNotation termNotation) throws IOException {
		out.write("<");
		out.write(termNotation.getKey());
		out.write(">(");
		FormattingTools.writeCommaSeparated(out, termNotation.getArguments(), arg -> arg.accept(this));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(TermDelimited termDelimited) throws IOException {
		out.write("%");
		out.write(termDelimited.getScope());
		out.write("{");
		termDelimited.getInner().accept(this);
		out.write("}");
		return null;
	}
}
