package mixfix.grammar;

import mixfix.library.Summary;
import mixfix.model.term.Term;

import java.util.Optional;

/**
 * The extensible-precedence parsing engine the notation compiler drives. Productions are only ever added.
 */
public interface GrammarEngine extends Summary<GrammarEngine.Snapshot> {

	/**
	 * Opaque saved state of an engine.
	 */
	interface Snapshot {}

	GrammarEntry createEntry(String universe, String name, EntryKind kind);

	boolean entryExists(String universe, String name);

	Optional<GrammarEntry> getEntry(String universe, String name);

	/**
	 * Attaches a production to an entry. Every terminal of the production becomes a token.
	 */
	void addProduction(GrammarEntry entry, int level, Production production);

	boolean hasProduction(GrammarEntry entry, int level, Production production);

	void registerToken(String text);

	boolean isToken(String text);

	Term parse(String universe, String entry, String text) throws ParsingError;

	String describeEntry(String universe, String entry);
}
