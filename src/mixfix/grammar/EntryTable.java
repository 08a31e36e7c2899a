package mixfix.grammar;

import mixfix.model.notation.PrecedenceLevel;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The fixed correspondence between numeric levels of the term universe and the names of the entries that parse
 * at those levels. Index 11 is the pattern entry.
 */
public class EntryTable {
	private final String universe;
	private final List<String> names;

	public EntryTable(String universe, List<String> names) {
		if (names.size() != PrecedenceLevel.PATTERN_LEVEL + 1) {
			throw new IllegalArgumentException("expected " + (PrecedenceLevel.PATTERN_LEVEL + 1) +
					" entry names, found " + names.size());
		}
		this.universe = universe;
		this.names = new ArrayList<>(names);
	}

	public String getUniverse() {
		return universe;
	}

	public String entryForLevel(int level) {
		return names.get(level);
	}

	public String entryForWindow(PrecedenceLevel window) {
		return entryForLevel(window.getEffectiveLevel());
	}

	public Optional<Integer> levelOfEntry(String name) {
		int index = names.indexOf(name);
		return index < 0 ? Optional.empty() : Optional.of(index);
	}

	public String getPatternEntry() {
		return names.get(PrecedenceLevel.PATTERN_LEVEL);
	}

	public List<String> getNames() {
		return names;
	}
}
