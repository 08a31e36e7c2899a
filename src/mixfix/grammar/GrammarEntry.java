package mixfix.grammar;

import java.util.Objects;

public class GrammarEntry {
	private final String universe;
	private final String name;
	private final EntryKind kind;

	public GrammarEntry(String universe, String name, EntryKind kind) {
		this.universe = universe;
		this.name = name;
		this.kind = kind;
	}

	public String getUniverse() {
		return universe;
	}

	public String getName() {
		return name;
	}

	public EntryKind getKind() {
		return kind;
	}

	@Override
	public int hashCode() {
		return Objects.hash(universe, name, kind);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		GrammarEntry other = (GrammarEntry) obj;
		return universe.equals(other.universe) && name.equals(other.name) && kind == other.kind;
	}

	@Override
	public String toString() {
		return universe + ":" + name;
	}
}
