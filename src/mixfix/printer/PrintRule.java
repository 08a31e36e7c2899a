package mixfix.printer;

import mixfix.model.term.MetaCollectingVisitor;
import mixfix.model.term.ModuleSubstitutionVisitor;
import mixfix.model.term.Term;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * <p>
 * Prints any term matching {@code displayPattern} as the hunks say. A {@link PrintSubterm} with index N prints
 * whatever the pattern's {@code $eN} matched.
 * </p>
 *
 * <p>
 * A rule belongs to a scope: when that scope is not open, terms it matches are printed wrapped in the scope's
 * delimiters, or not through this rule at all if the scope has none.
 * </p>
 */
public class PrintRule {
	private final String name;
	private final String universe;
	private final int level;
	private final String scope;
	private final String key;
	private final Term displayPattern;
	private final List<PrintHunk> hunks;

	public PrintRule(String name, String universe, int level, String scope, String key, Term displayPattern,
	                 List<PrintHunk> hunks) {
		this.name = name;
		this.universe = universe;
		this.level = level;
		this.scope = scope;
		this.key = key;
		this.displayPattern = displayPattern;
		this.hunks = Collections.unmodifiableList(hunks);
	}

	public String getName() {
		return name;
	}

	public String getUniverse() {
		return universe;
	}

	public int getLevel() {
		return level;
	}

	public String getScope() {
		return scope;
	}

	public String getKey() {
		return key;
	}

	public Term getDisplayPattern() {
		return displayPattern;
	}

	public List<PrintHunk> getHunks() {
		return hunks;
	}

	/**
	 * @throws FreeMetavariableIssue if a hunk prints a sub-term the display pattern never binds
	 */
	public void checkMetavariables() {
		Set<Integer> bound = new TreeSet<>();
		displayPattern.accept(new MetaCollectingVisitor(bound));
		Set<Integer> printed = new TreeSet<>();
		collectSubterms(hunks, printed);
		for (int index : printed) {
			if (!bound.contains(index)) {
				throw new FreeMetavariableIssue(name, index);
			}
		}
	}

	private static void collectSubterms(List<PrintHunk> hunks, Set<Integer> printed) {
		for (PrintHunk hunk : hunks) {
			if (hunk instanceof PrintSubterm) {
				printed.add(((PrintSubterm) hunk).getIndex());
			} else if (hunk instanceof PrintBox) {
				collectSubterms(((PrintBox) hunk).getHunks(), printed);
			}
		}
	}

	public PrintRule substitute(ModuleSubstitutionVisitor substitution) {
		Term pattern = displayPattern.accept(substitution);
		if (pattern == displayPattern) {
			return this;
		}
		return new PrintRule(name, universe, level, scope, key, pattern, hunks);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, universe, level, scope, key, displayPattern, hunks);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		PrintRule other = (PrintRule) obj;
		return level == other.level && name.equals(other.name) && universe.equals(other.universe) &&
				Objects.equals(scope, other.scope) && key.equals(other.key) &&
				displayPattern.equals(other.displayPattern) && hunks.equals(other.hunks);
	}

	@Override
	public String toString() {
		return name + " [" + universe + ", level " + level + "]: " + displayPattern + " => " + hunks;
	}
}
