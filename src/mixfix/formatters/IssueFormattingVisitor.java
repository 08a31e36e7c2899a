package mixfix.formatters;

import mixfix.elaborator.UnresolvableIdentifierIssue;
import mixfix.errors.IssueVisitor;
import mixfix.errors.IssueWithContext;
import mixfix.grammar.NonExtensibleEntryIssue;
import mixfix.grammar.ParsingIssue;
import mixfix.model.term.QualifiedName;
import mixfix.printer.FreeMetavariableIssue;
import mixfix.scope.DelimitersAlreadyDeclaredIssue;
import mixfix.scope.EmptyDelimiterIssue;
import mixfix.scope.UnknownNotationIssue;
import mixfix.trans.PrecedenceRangeIssue;
import mixfix.trans.passes.pattern.UnboundHoleIssue;
import mixfix.trans.passes.pattern.UnexpectedBoundFormIssue;
import mixfix.trans.passes.pattern.UnexpectedMetavariableIssue;
import mixfix.trans.passes.symbols.AdjacentHolesIssue;
import mixfix.trans.passes.symbols.DuplicateVariableIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(DuplicateVariableIssue duplicateVariableIssue) throws IOException {
		out.write("Variable ");
		out.write(duplicateVariableIssue.getName());
		out.write(" occurs more than once");
		return null;
	}

	@Override
	public Void visit(AdjacentHolesIssue adjacentHolesIssue) throws IOException {
		out.write("holes ");
		out.write(adjacentHolesIssue.getFirst());
		out.write(" and ");
		out.write(adjacentHolesIssue.getSecond());
		out.write(" must be separated by at least one terminal");
		return null;
	}

	@Override
	public Void visit(PrecedenceRangeIssue precedenceRangeIssue) throws IOException {
		out.write("Precedence must be between ");
		out.write(Integer.toString(precedenceRangeIssue.getMin()));
		out.write(" and ");
		out.write(Integer.toString(precedenceRangeIssue.getMax()));
		out.write(", found ");
		out.write(Integer.toString(precedenceRangeIssue.getLevel()));
		return null;
	}

	@Override
	public Void visit(EmptyDelimiterIssue emptyDelimiterIssue) throws IOException {
		out.write("Delimiters cannot be empty (scope ");
		out.write(emptyDelimiterIssue.getScope());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(DelimitersAlreadyDeclaredIssue delimitersAlreadyDeclaredIssue) throws IOException {
		out.write("delimiters already declared for scope ");
		out.write(delimitersAlreadyDeclaredIssue.getScope());
		out.write(": ");
		out.write(delimitersAlreadyDeclaredIssue.getExisting().toString());
		out.write(", cannot declare ");
		out.write(delimitersAlreadyDeclaredIssue.getRequested().toString());
		return null;
	}

	@Override
	public Void visit(UnresolvableIdentifierIssue unresolvableIdentifierIssue) throws IOException {
		if (unresolvableIdentifierIssue.getCandidates().isEmpty()) {
			out.write("unknown identifier ");
			out.write(unresolvableIdentifierIssue.getName());
		} else {
			out.write("ambiguous identifier ");
			out.write(unresolvableIdentifierIssue.getName());
			out.write(", could be any of:");
			try (IndentingWriter.Indent ignored = out.indent()) {
				for (QualifiedName candidate : unresolvableIdentifierIssue.getCandidates()) {
					out.newLine();
					out.write(candidate.toString());
				}
			}
		}
		return null;
	}

	@Override
	public Void visit(NonExtensibleEntryIssue nonExtensibleEntryIssue) throws IOException {
		out.write("Cannot arbitrarily extend non term entries: ");
		out.write(nonExtensibleEntryIssue.getUniverse());
		out.write(":");
		out.write(nonExtensibleEntryIssue.getEntry());
		out.write(" is a ");
		out.write(nonExtensibleEntryIssue.getKind().toString());
		out.write(" entry");
		return null;
	}

	@Override
	public Void visit(FreeMetavariableIssue freeMetavariableIssue) throws IOException {
		out.write("printing rule ");
		out.write(freeMetavariableIssue.getRuleName());
		out.write(" refers to $e");
		out.write(Integer.toString(freeMetavariableIssue.getIndex()));
		out.write(", which its pattern does not bind");
		return null;
	}

	@Override
	public Void visit(UnboundHoleIssue unboundHoleIssue) throws IOException {
		out.write(unboundHoleIssue.getName());
		out.write(" is unbound in the right-hand side");
		return null;
	}

	@Override
	public Void visit(UnexpectedMetavariableIssue unexpectedMetavariableIssue) throws IOException {
		out.write("Unexpected metavariable ");
		unexpectedMetavariableIssue.getMeta().accept(new TermFormattingVisitor(out));
		out.write(" in notation");
		return null;
	}

	@Override
	public Void visit(UnexpectedBoundFormIssue unexpectedBoundFormIssue) throws IOException {
		out.write("unexpected bound form ");
		unexpectedBoundFormIssue.getTerm().accept(new TermFormattingVisitor(out));
		out.write(" in elaborated notation body");
		return null;
	}

	@Override
	public Void visit(UnknownNotationIssue unknownNotationIssue) throws IOException {
		out.write("Unknown interpretation for notation \"");
		out.write(unknownNotationIssue.getKey());
		out.write("\" in scopes ");
		out.write(String.join(", ", unknownNotationIssue.getScopes()));
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write("error parsing \"");
		out.write(parsingIssue.getInput());
		out.write("\": ");
		out.write(parsingIssue.getError().getMessage());
		return null;
	}
}
