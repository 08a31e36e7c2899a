package mixfix.errors;

/**
 * An example term that cannot be turned into a macro pattern.
 */
public abstract class PatternIssue extends Issue {
}
