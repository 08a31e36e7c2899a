package mixfix.formatters;

import mixfix.InternalCompilerError;
import mixfix.printer.*;

import java.io.IOException;

/**
 * Renders laid-out hunks on a single line. Boxes only set the indentation continuation lines would get; breaks
 * are rendered as blanks, or dropped in compact mode unless they are glue-protecting.
 */
public class PrintHunkFormattingVisitor extends PrintHunkVisitor<Void, IOException> {
	private final IndentingWriter out;
	private final boolean compact;

	public PrintHunkFormattingVisitor(IndentingWriter out, boolean compact) {
		this.out = out;
		this.compact = compact;
	}

	@Override
	public Void visit(PrintLiteral printLiteral) throws IOException {
		out.write(printLiteral.getText());
		return null;
	}

	@Override
	public Void visit(PrintBreak printBreak) throws IOException {
		if (compact && !printBreak.isGlueProtecting()) {
			return null;
		}
		for (int i = 0; i < printBreak.getSpaces(); ++i) {
			out.write(" ");
		}
		return null;
	}

	@Override
	public Void visit(PrintSubterm printSubterm) throws IOException {
		throw new InternalCompilerError("sub-term $e" + printSubterm.getIndex() + " was not laid out");
	}

	@Override
	public Void visit(PrintBox printBox) throws IOException {
		try (IndentingWriter.Indent ignored = out.indentFromHere(printBox.getIndent())) {
			for (PrintHunk hunk : printBox.getHunks()) {
				hunk.accept(this);
			}
		}
		return null;
	}
}
