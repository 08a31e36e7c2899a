package mixfix.model.notation;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The precedence signature of a notation: its own level and the effective level of each hole. Together with the
 * notation key it identifies a grammar production.
 */
public class NotationPrecedence {
	private final int level;
	private final List<Integer> holeLevels;
	private final Associativity associativity;

	public NotationPrecedence(int level, List<Integer> holeLevels, Associativity associativity) {
		this.level = level;
		this.holeLevels = Collections.unmodifiableList(holeLevels);
		this.associativity = associativity;
	}

	public int getLevel() {
		return level;
	}

	public List<Integer> getHoleLevels() {
		return holeLevels;
	}

	public Associativity getAssociativity() {
		return associativity;
	}

	// associativity is recorded for display only
	@Override
	public int hashCode() {
		return Objects.hash(level, holeLevels);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		NotationPrecedence other = (NotationPrecedence) obj;
		return level == other.level && holeLevels.equals(other.holeLevels);
	}

	@Override
	public String toString() {
		return "level " + level + " " + associativity.getDisplay() + " " + holeLevels;
	}
}
