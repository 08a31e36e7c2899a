package mixfix.errors;

import mixfix.elaborator.UnresolvableIdentifierIssue;
import mixfix.grammar.NonExtensibleEntryIssue;
import mixfix.grammar.ParsingIssue;
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

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(DuplicateVariableIssue duplicateVariableIssue) throws E;
	public abstract T visit(AdjacentHolesIssue adjacentHolesIssue) throws E;
	public abstract T visit(PrecedenceRangeIssue precedenceRangeIssue) throws E;
	public abstract T visit(EmptyDelimiterIssue emptyDelimiterIssue) throws E;
	public abstract T visit(DelimitersAlreadyDeclaredIssue delimitersAlreadyDeclaredIssue) throws E;
	public abstract T visit(UnresolvableIdentifierIssue unresolvableIdentifierIssue) throws E;
	public abstract T visit(NonExtensibleEntryIssue nonExtensibleEntryIssue) throws E;
	public abstract T visit(FreeMetavariableIssue freeMetavariableIssue) throws E;
	public abstract T visit(UnboundHoleIssue unboundHoleIssue) throws E;
	public abstract T visit(UnexpectedMetavariableIssue unexpectedMetavariableIssue) throws E;
	public abstract T visit(UnexpectedBoundFormIssue unexpectedBoundFormIssue) throws E;
	public abstract T visit(UnknownNotationIssue unknownNotationIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
}
