package mixfix.grammar;

import mixfix.Unreachable;
import mixfix.formatters.IndentingWriter;
import mixfix.lexer.TermLexer;
import mixfix.lexer.TermToken;
import mixfix.lexer.TermTokenType;
import mixfix.model.notation.PrecedenceLevel;
import mixfix.model.term.Term;
import mixfix.model.term.TermApplication;
import mixfix.model.term.TermEvar;
import mixfix.model.term.TermNumber;
import mixfix.model.term.TermVariable;

import java.io.IOException;
import java.io.StringWriter;
import java.util.*;
import java.util.logging.Logger;

/**
 * <p>
 * A backtracking precedence-climbing parser whose productions can be extended at any time.
 * </p>
 *
 * <p>
 * The universe named by the {@link EntryTable} is parsed by level: an entry at level n holds the productions
 * whose result has level n, and parsing "at level L" accepts any production of level at most L. A production
 * starting with a terminal is tried as a prefix; a production starting with a non-terminal extends an operand
 * already parsed, provided that operand's level fits the non-terminal's entry. This is what makes left and right
 * associativity fall out of the windows alone.
 * </p>
 *
 * <p>
 * Built in, below every extension: identifiers, numbers, {@code _}, parenthesised terms (level 0) and
 * application by juxtaposition (level {@value #APPLICATION_LEVEL}). Entries outside the table are parsed by
 * trying their productions in order.
 * </p>
 */
public class PrattGrammarEngine implements GrammarEngine {

	public static final int APPLICATION_LEVEL = 1;

	private static final Logger logger = Logger.getLogger("Mixfix Grammar");

	private final EntryTable table;
	private Map<String, Map<String, EntryState>> universes;
	private Set<String> tokens;

	private static class EntryState {
		final GrammarEntry entry;
		final TreeMap<Integer, List<Production>> levels;

		EntryState(GrammarEntry entry) {
			this.entry = entry;
			this.levels = new TreeMap<>();
		}

		EntryState copy() {
			EntryState result = new EntryState(entry);
			for (Map.Entry<Integer, List<Production>> level : levels.entrySet()) {
				result.levels.put(level.getKey(), new ArrayList<>(level.getValue()));
			}
			return result;
		}
	}

	private static class FrozenGrammar implements Snapshot {
		final Map<String, Map<String, EntryState>> universes;
		final Set<String> tokens;

		FrozenGrammar(Map<String, Map<String, EntryState>> universes, Set<String> tokens) {
			this.universes = universes;
			this.tokens = tokens;
		}
	}

	private static class Parsed {
		final Term term;
		final int level;
		final boolean juxtaposition;

		Parsed(Term term, int level, boolean juxtaposition) {
			this.term = term;
			this.level = level;
			this.juxtaposition = juxtaposition;
		}
	}

	public PrattGrammarEngine(EntryTable table) {
		this.table = table;
		init();
	}

	public EntryTable getTable() {
		return table;
	}

	@Override
	public void init() {
		universes = new LinkedHashMap<>();
		tokens = new HashSet<>(Arrays.asList("(", ")"));
		for (String name : table.getNames()) {
			EntryKind kind = name.equals(table.getPatternEntry()) ? EntryKind.PATTERN : EntryKind.TERM;
			createEntry(table.getUniverse(), name, kind);
		}
	}

	@Override
	public Snapshot freeze() {
		return new FrozenGrammar(copyUniverses(universes), new HashSet<>(tokens));
	}

	@Override
	public void unfreeze(Snapshot frozen) {
		FrozenGrammar grammar = (FrozenGrammar) frozen;
		universes = copyUniverses(grammar.universes);
		tokens = new HashSet<>(grammar.tokens);
	}

	private static Map<String, Map<String, EntryState>> copyUniverses(Map<String, Map<String, EntryState>> from) {
		Map<String, Map<String, EntryState>> result = new LinkedHashMap<>();
		for (Map.Entry<String, Map<String, EntryState>> universe : from.entrySet()) {
			Map<String, EntryState> entries = new LinkedHashMap<>();
			for (Map.Entry<String, EntryState> entry : universe.getValue().entrySet()) {
				entries.put(entry.getKey(), entry.getValue().copy());
			}
			result.put(universe.getKey(), entries);
		}
		return result;
	}

	@Override
	public GrammarEntry createEntry(String universe, String name, EntryKind kind) {
		Map<String, EntryState> entries = universes.computeIfAbsent(universe, u -> new LinkedHashMap<>());
		EntryState existing = entries.get(name);
		if (existing != null) {
			return existing.entry;
		}
		GrammarEntry entry = new GrammarEntry(universe, name, kind);
		entries.put(name, new EntryState(entry));
		return entry;
	}

	@Override
	public boolean entryExists(String universe, String name) {
		return getEntry(universe, name).isPresent();
	}

	@Override
	public Optional<GrammarEntry> getEntry(String universe, String name) {
		Map<String, EntryState> entries = universes.get(universe);
		if (entries == null || !entries.containsKey(name)) {
			return Optional.empty();
		}
		return Optional.of(entries.get(name).entry);
	}

	private EntryState state(GrammarEntry entry) {
		Map<String, EntryState> entries = universes.get(entry.getUniverse());
		if (entries == null || !entries.containsKey(entry.getName())) {
			throw new IllegalArgumentException("no grammar entry " + entry);
		}
		return entries.get(entry.getName());
	}

	@Override
	public void addProduction(GrammarEntry entry, int level, Production production) {
		EntryState state = state(entry);
		for (ProductionSymbol symbol : production.getSymbols()) {
			if (symbol instanceof ProductionTerminal) {
				registerToken(((ProductionTerminal) symbol).getText());
			}
		}
		state.levels.computeIfAbsent(level, l -> new ArrayList<>()).add(production);
		logger.fine("extended " + entry + " at level " + level + " with " + production.getName());
	}

	@Override
	public boolean hasProduction(GrammarEntry entry, int level, Production production) {
		List<Production> productions = state(entry).levels.get(level);
		return productions != null && productions.contains(production);
	}

	@Override
	public void registerToken(String text) {
		tokens.add(text);
	}

	@Override
	public boolean isToken(String text) {
		return tokens.contains(text);
	}

	@Override
	public Term parse(String universe, String entry, String text) throws ParsingError {
		if (!entryExists(universe, entry)) {
			throw new ParsingError(0, "unknown grammar entry " + universe + ":" + entry);
		}
		Parser parser = new Parser(universe, new TermLexer(tokens).readTokens(text));
		Term result = parser.parseEntry(entry);
		parser.expectEnd();
		return result;
	}

	@Override
	public String describeEntry(String universe, String entry) {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			out.write(universe + ":" + entry);
			Map<String, EntryState> entries = universes.get(universe);
			EntryState state = entries == null ? null : entries.get(entry);
			if (state == null) {
				out.write(" does not exist");
				return w.toString();
			}
			try (IndentingWriter.Indent ignored = out.indent()) {
				for (Map.Entry<Integer, List<Production>> level : state.levels.entrySet()) {
					out.newLine();
					out.write("level " + level.getKey());
					try (IndentingWriter.Indent ignored2 = out.indent()) {
						for (Production production : level.getValue()) {
							out.newLine();
							out.write(production.toString());
						}
					}
				}
			}
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	private class Parser {
		private final String universe;
		private final List<TermToken> input;
		private int pos;

		Parser(String universe, List<TermToken> input) {
			this.universe = universe;
			this.input = input;
			this.pos = 0;
		}

		private TermToken peek() {
			return input.get(pos);
		}

		private ParsingError unexpected() {
			TermToken token = peek();
			if (token.getType() == TermTokenType.EOF) {
				return new ParsingError(token.getOffset(), "unexpected end of input");
			}
			return new ParsingError(token.getOffset(), "unexpected token \"" + token.getValue() + "\"");
		}

		void expectEnd() throws ParsingError {
			if (peek().getType() != TermTokenType.EOF) {
				throw unexpected();
			}
		}

		private void expectTerminal(String text) throws ParsingError {
			TermToken token = peek();
			if (!token.isTerminal() || !token.getValue().equals(text)) {
				throw new ParsingError(token.getOffset(), "expected \"" + text + "\", found \"" +
						token.getValue() + "\"");
			}
			++pos;
		}

		private Optional<Integer> tableLevel(String entry) {
			if (!universe.equals(table.getUniverse())) {
				return Optional.empty();
			}
			return table.levelOfEntry(entry);
		}

		Term parseEntry(String entry) throws ParsingError {
			Optional<Integer> level = tableLevel(entry);
			if (level.isPresent()) {
				return parseLevel(level.get()).term;
			}
			EntryState state = universes.get(universe).get(entry);
			if (state == null) {
				throw new ParsingError(peek().getOffset(), "unknown grammar entry " + universe + ":" + entry);
			}
			int save = pos;
			for (List<Production> productions : state.levels.values()) {
				for (Production production : productions) {
					try {
						return applySequence(production, new ArrayList<>(), 0);
					} catch (ParsingError e) {
						pos = save;
					}
				}
			}
			throw unexpected();
		}

		private List<Map.Entry<Integer, Production>> candidates(int maxLevel) {
			List<Map.Entry<Integer, Production>> result = new ArrayList<>();
			for (EntryState state : universes.get(table.getUniverse()).values()) {
				if (!table.levelOfEntry(state.entry.getName()).isPresent()) {
					continue;
				}
				for (Map.Entry<Integer, List<Production>> level : state.levels.headMap(maxLevel, true).entrySet()) {
					for (Production production : level.getValue()) {
						result.add(new AbstractMap.SimpleImmutableEntry<>(level.getKey(), production));
					}
				}
			}
			result.sort(Comparator.comparingInt(Map.Entry::getKey));
			return result;
		}

		private Term applySequence(Production production, List<Term> holes, int from) throws ParsingError {
			List<ProductionSymbol> symbols = production.getSymbols();
			for (int i = from; i < symbols.size(); ++i) {
				ProductionSymbol symbol = symbols.get(i);
				if (symbol instanceof ProductionTerminal) {
					expectTerminal(((ProductionTerminal) symbol).getText());
				} else {
					holes.add(parseEntry(((ProductionNonTerminal) symbol).getEntry()));
				}
			}
			return production.getAction().apply(holes);
		}

		Parsed parseLevel(int maxLevel) throws ParsingError {
			Parsed lhs = parsePrefix(maxLevel);
			while (true) {
				Parsed next = tryExtend(lhs, maxLevel);
				if (next == null) {
					next = tryApplication(lhs, maxLevel);
				}
				if (next == null) {
					return lhs;
				}
				lhs = next;
			}
		}

		private Parsed parsePrefix(int maxLevel) throws ParsingError {
			int save = pos;
			for (Map.Entry<Integer, Production> candidate : candidates(maxLevel)) {
				Production production = candidate.getValue();
				if (production.isLeftRecursive() || production.getSymbols().isEmpty()) {
					continue;
				}
				try {
					return new Parsed(applySequence(production, new ArrayList<>(), 0), candidate.getKey(), false);
				} catch (ParsingError e) {
					pos = save;
				}
			}
			TermToken token = peek();
			switch (token.getType()) {
				case IDENT:
					++pos;
					return new Parsed(new TermVariable(token.getValue()), 0, false);
				case NUMBER:
					++pos;
					return new Parsed(new TermNumber(token.getValue()), 0, false);
				case EVAR:
					++pos;
					return new Parsed(new TermEvar(), 0, false);
				case SYMBOL:
					if (token.getValue().equals("(")) {
						++pos;
						Term inner = parseLevel(PrecedenceLevel.MAX_LEVEL).term;
						expectTerminal(")");
						return new Parsed(inner, 0, false);
					}
					throw unexpected();
				default:
					throw unexpected();
			}
		}

		private Parsed tryExtend(Parsed lhs, int maxLevel) {
			int save = pos;
			for (Map.Entry<Integer, Production> candidate : candidates(maxLevel)) {
				Production production = candidate.getValue();
				if (!production.isLeftRecursive() || production.getSymbols().size() < 2) {
					continue;
				}
				String leftEntry = ((ProductionNonTerminal) production.getSymbols().get(0)).getEntry();
				int leftLevel = tableLevel(leftEntry).orElse(PrecedenceLevel.MAX_LEVEL);
				if (lhs.level > leftLevel) {
					continue;
				}
				List<Term> holes = new ArrayList<>();
				holes.add(lhs.term);
				try {
					return new Parsed(applySequence(production, holes, 1), candidate.getKey(), false);
				} catch (ParsingError e) {
					pos = save;
				}
			}
			return null;
		}

		private Parsed tryApplication(Parsed lhs, int maxLevel) {
			if (maxLevel < APPLICATION_LEVEL || !(lhs.level == 0 || lhs.juxtaposition)) {
				return null;
			}
			int save = pos;
			Term argument;
			try {
				argument = parseLevel(0).term;
			} catch (ParsingError e) {
				pos = save;
				return null;
			}
			if (lhs.juxtaposition) {
				TermApplication application = (TermApplication) lhs.term;
				List<Term> args = new ArrayList<>(application.getArguments());
				args.add(argument);
				return new Parsed(new TermApplication(application.getHead(), args), APPLICATION_LEVEL, true);
			}
			return new Parsed(new TermApplication(lhs.term, Collections.singletonList(argument)),
					APPLICATION_LEVEL, true);
		}
	}
}
