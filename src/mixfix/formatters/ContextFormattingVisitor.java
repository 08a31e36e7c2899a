package mixfix.formatters;

import mixfix.errors.ContextVisitor;
import mixfix.trans.WhileDeclaringNotation;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(WhileDeclaringNotation whileDeclaringNotation) throws IOException {
		out.write("while declaring ");
		out.write(whileDeclaringNotation.getKind());
		out.write(" \"");
		out.write(whileDeclaringNotation.getFormat());
		out.write("\"");
		return null;
	}

}
