package mixfix.errors;

/**
 * A malformed declaration, found before anything is installed.
 */
public abstract class DeclarationIssue extends Issue {
}
