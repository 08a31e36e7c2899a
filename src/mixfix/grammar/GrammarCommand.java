package mixfix.grammar;

import mixfix.model.term.ModuleSubstitutionVisitor;

import java.util.Objects;

/**
 * One grammar extension: a production to be attached to a named entry at a given level.
 */
public class GrammarCommand {
	private final String universe;
	private final String entry;
	private final EntryKind entryKind;
	private final int level;
	private final Production production;

	public GrammarCommand(String universe, String entry, EntryKind entryKind, int level, Production production) {
		this.universe = universe;
		this.entry = entry;
		this.entryKind = entryKind;
		this.level = level;
		this.production = production;
	}

	public String getUniverse() {
		return universe;
	}

	public String getEntry() {
		return entry;
	}

	public EntryKind getEntryKind() {
		return entryKind;
	}

	public int getLevel() {
		return level;
	}

	public Production getProduction() {
		return production;
	}

	public GrammarCommand substitute(ModuleSubstitutionVisitor substitution) {
		Production substituted = production.withAction(production.getAction().substitute(substitution));
		if (substituted == production) {
			return this;
		}
		return new GrammarCommand(universe, entry, entryKind, level, substituted);
	}

	@Override
	public int hashCode() {
		return Objects.hash(universe, entry, entryKind, level, production);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		GrammarCommand other = (GrammarCommand) obj;
		return level == other.level && universe.equals(other.universe) && entry.equals(other.entry) &&
				entryKind == other.entryKind && production.equals(other.production);
	}

	@Override
	public String toString() {
		return universe + ":" + entry + " level " + level + " " + production;
	}
}
