package mixfix.trans;

import mixfix.InternalCompilerError;
import mixfix.MixfixSession;
import mixfix.errors.Issue;
import mixfix.errors.IssueContext;
import mixfix.errors.IssueWithContext;
import mixfix.errors.TopLevelIssueContext;
import mixfix.grammar.*;
import mixfix.lexer.FormatTokenizer;
import mixfix.model.notation.*;
import mixfix.model.term.Term;
import mixfix.model.term.TermApplication;
import mixfix.model.term.TermVariable;
import mixfix.printer.PrintRule;
import mixfix.scope.EmptyDelimiterIssue;
import mixfix.trans.extension.*;
import mixfix.trans.passes.pattern.MacroPattern;
import mixfix.trans.passes.pattern.MacroPatternBuildingPass;
import mixfix.trans.passes.symbols.SymbolClassificationPass;
import mixfix.trans.passes.synthesis.GrammarRuleSynthesisPass;
import mixfix.trans.passes.synthesis.PrintRuleSynthesisPass;

import java.util.*;
import java.util.logging.Logger;

/**
 * <p>
 * The declaration commands of the notation subsystem. Every declaration is compiled completely, and checked,
 * before the resulting extension object is handed to the library, which installs it.
 * </p>
 *
 * <p>
 * Each command comes in two forms: one reporting problems to an {@link IssueContext}, in the context of the
 * declaration, and returning nothing on failure; and one throwing the first problem found.
 * </p>
 */
public class NotationCompiler {

	private static final Logger logger = Logger.getLogger("Mixfix Notations");

	public static final int MIN_INFIX_LEVEL = 1;

	private final MixfixSession session;

	public NotationCompiler(MixfixSession session) {
		this.session = session;
	}

	private static Issue unwrap(Issue issue) {
		while (issue instanceof IssueWithContext) {
			issue = ((IssueWithContext) issue).getIssue();
		}
		return issue;
	}

	private static <T> T orThrow(TopLevelIssueContext ctx, Optional<T> result) {
		if (ctx.hasErrors()) {
			throw unwrap(ctx.getIssues().get(0));
		}
		return result.orElseThrow(() -> new InternalCompilerError("declaration failed without reporting why"));
	}

	private static void forward(TopLevelIssueContext from, IssueContext to) {
		for (Issue issue : from.getIssues()) {
			to.error(issue);
		}
	}

	private String scopeOrDefault(String scope) {
		return scope == null ? session.getRegistry().getDefaultScope() : scope;
	}

	public NotationDescriptor addInfix(Associativity associativity, int level, String token, String operator,
	                                   String scope) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		return orThrow(ctx, addInfix(ctx, associativity, level, token, operator, scope));
	}

	/**
	 * Declares {@code x token y} as {@code operator x y}.
	 */
	public Optional<NotationDescriptor> addInfix(IssueContext ctx, Associativity associativity, int level,
	                                             String token, String operator, String scope) {
		String format = "x '" + token + "' y";
		if (level < MIN_INFIX_LEVEL || level > PrecedenceLevel.MAX_LEVEL) {
			ctx.withContext(new WhileDeclaringNotation("infix", format))
					.error(new PrecedenceRangeIssue(level, MIN_INFIX_LEVEL, PrecedenceLevel.MAX_LEVEL));
			return Optional.empty();
		}
		Term example = new TermApplication(new TermVariable(operator),
				Arrays.asList(new TermVariable("x"), new TermVariable("y")));
		return compile(ctx, "infix", associativity, level, format, example, Collections.emptyMap(), scope);
	}

	public NotationDescriptor addDistfix(Associativity associativity, int level, String format, Term head,
	                                     String scope) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		return orThrow(ctx, addDistfix(ctx, associativity, level, format, head, scope));
	}

	/**
	 * Declares a format whose holes are written {@code _} as {@code head} applied to the holes in order.
	 */
	public Optional<NotationDescriptor> addDistfix(IssueContext ctx, Associativity associativity, int level,
	                                               String format, Term head, String scope) {
		List<String> tokens = new ArrayList<>();
		List<Term> holes = new ArrayList<>();
		for (String token : FormatTokenizer.split(format)) {
			if (token.equals("_")) {
				String name = "x" + (holes.size() + 1);
				tokens.add(name);
				holes.add(new TermVariable(name));
			} else {
				tokens.add("'" + token + "'");
			}
		}
		Term example = holes.isEmpty() ? head : new TermApplication(head, holes);
		return compile(ctx, "distfix", associativity, level, FormatTokenizer.join(tokens), example,
				Collections.emptyMap(), scope);
	}

	public NotationDescriptor addNotation(Associativity associativity, int level, String format, Term example,
	                                      Map<String, Integer> pinned, String scope) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		return orThrow(ctx, addNotation(ctx, associativity, level, format, example, pinned, scope));
	}

	public Optional<NotationDescriptor> addNotation(IssueContext ctx, Associativity associativity, int level,
	                                                String format, Term example, Map<String, Integer> pinned,
	                                                String scope) {
		return compile(ctx, "notation", associativity, level, format, example, pinned, scope);
	}

	private Optional<NotationDescriptor> compile(IssueContext outer, String kind, Associativity associativity,
	                                             int level, String format, Term example,
	                                             Map<String, Integer> pinned, String scope) {
		IssueContext ctx = outer.withContext(new WhileDeclaringNotation(kind, format));
		if (level < PrecedenceLevel.MIN_LEVEL || level > PrecedenceLevel.MAX_LEVEL) {
			ctx.error(new PrecedenceRangeIssue(level, PrecedenceLevel.MIN_LEVEL, PrecedenceLevel.MAX_LEVEL));
			return Optional.empty();
		}
		String scopeName = scopeOrDefault(scope);
		TopLevelIssueContext local = new TopLevelIssueContext();

		List<NotationSymbol> symbols = SymbolClassificationPass.perform(local, FormatTokenizer.split(format), level,
				associativity, pinned);
		if (local.hasErrors()) {
			forward(local, ctx);
			return Optional.empty();
		}
		String key = SymbolClassificationPass.notationKey(symbols);
		NotationPrecedence precedence = SymbolClassificationPass.precedence(level, associativity, symbols);

		Optional<MacroPattern> pattern = MacroPatternBuildingPass.perform(local, session.getElaborator(),
				session.getEnvironment(), example, SymbolClassificationPass.holes(symbols));
		if (!pattern.isPresent()) {
			forward(local, ctx);
			return Optional.empty();
		}

		GrammarCommand command = GrammarRuleSynthesisPass.perform(session.getEntryTable(), key, level, symbols);
		PrintRule rule = PrintRuleSynthesisPass.perform(session.getEntryTable().getUniverse(), scopeName, key,
				level, symbols, pattern.get().getDisplayPattern(), session.getOptions().boxIndent);
		NotationDescriptor descriptor = new NotationDescriptor(scopeName, level, associativity, symbols,
				pattern.get().getInterpretation(), pattern.get().getDisplayPattern(), command, rule, key, precedence);

		try {
			session.getLibrary().addAnonymousLeaf(new NotationBundle(descriptor));
		} catch (Issue issue) {
			ctx.error(issue);
			return Optional.empty();
		}
		logger.fine("compiled " + descriptor);
		return Optional.of(session.getRegistry().interpretNotation(key, Collections.singletonList(scopeName)));
	}

	public void addDelimiters(String scope, String open, String close) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		orThrow(ctx, addDelimiters(ctx, scope, open, close));
	}

	/**
	 * Declares {@code open t close} as a way to read {@code t} in {@code scope}, in terms and in patterns.
	 *
	 * @return the pair now declared for the scope
	 */
	public Optional<DelimiterPair> addDelimiters(IssueContext outer, String scope, String open, String close) {
		DelimiterPair pair = new DelimiterPair(open, close);
		IssueContext ctx = outer.withContext(new WhileDeclaringNotation("delimiters", pair.toString()));
		if (pair.isEmpty()) {
			ctx.error(new EmptyDelimiterIssue(scope));
			return Optional.empty();
		}
		EntryTable table = session.getEntryTable();
		int inner = session.getOptions().delimiterInnerLevel;
		int outerLevel = session.getOptions().delimiterOuterLevel;
		GrammarCommand termRule = new GrammarCommand(table.getUniverse(), table.entryForLevel(outerLevel),
				EntryKind.TERM, outerLevel, new Production("delimiters " + scope,
				Arrays.asList(new ProductionTerminal(open), new ProductionNonTerminal(table.entryForLevel(inner), "e"),
						new ProductionTerminal(close)), new DelimiterAction(scope, false)));
		GrammarCommand patternRule = new GrammarCommand(table.getUniverse(), table.getPatternEntry(),
				EntryKind.PATTERN, PrecedenceLevel.PATTERN_LEVEL, new Production("pattern delimiters " + scope,
				Arrays.asList(new ProductionTerminal(open), new ProductionNonTerminal(table.getPatternEntry(), "e"),
						new ProductionTerminal(close)), new DelimiterAction(scope, true)));
		try {
			session.getLibrary().addAnonymousLeaf(new DelimiterBundle(scope, pair, termRule, patternRule));
		} catch (Issue issue) {
			ctx.error(issue);
			return Optional.empty();
		}
		return Optional.of(pair);
	}

	/**
	 * Makes {@code text} a keyword of the lexer.
	 */
	public void addToken(String text) {
		session.getLibrary().addAnonymousLeaf(new TokenObject(text));
	}

	/**
	 * Extends the grammar of {@code universe} with hand-written rules. Entries are created as needed.
	 *
	 * @throws NonExtensibleEntryIssue if a rule extends an entry that only takes generated rules
	 */
	public void addGrammar(String universe, List<GrammarCommand> commands) {
		for (GrammarCommand command : commands) {
			if (!command.getUniverse().equals(universe)) {
				throw new InternalCompilerError("rule for " + command.getUniverse() + " in grammar of " + universe);
			}
		}
		session.getLibrary().addAnonymousLeaf(new GrammarRuleObject(new ArrayList<>(commands)));
	}

	/**
	 * Adds hand-written printing rules.
	 *
	 * @throws mixfix.printer.FreeMetavariableIssue if a rule prints a sub-term its pattern does not bind
	 */
	public void addSyntax(List<PrintRule> rules) {
		for (PrintRule rule : rules) {
			rule.checkMetavariables();
		}
		session.getLibrary().addAnonymousLeaf(new PrintRuleObject(new ArrayList<>(rules)));
	}

	/**
	 * @return a listing of the productions of an entry, by level
	 */
	public String printGrammar(String universe, String entry) {
		return session.getGrammar().describeEntry(universe, entry);
	}
}
