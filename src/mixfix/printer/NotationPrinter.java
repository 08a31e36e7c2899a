package mixfix.printer;

import mixfix.Unreachable;
import mixfix.elaborator.Elaborator;
import mixfix.elaborator.GlobalEnvironment;
import mixfix.formatters.IndentingWriter;
import mixfix.formatters.PrintHunkFormattingVisitor;
import mixfix.model.notation.DelimiterPair;
import mixfix.model.notation.PrecedenceLevel;
import mixfix.model.term.*;
import mixfix.scope.ScopeRegistry;

import java.io.IOException;
import java.io.StringWriter;
import java.util.*;

/**
 * <p>
 * Prints resolved terms back to surface syntax through the printing rules in a {@link PrinterTable}.
 * </p>
 *
 * <p>
 * A term is first reified, then each node is matched against the display patterns of the universe's rules, most
 * recent first, preferring rules whose scope is open. A node no rule matches is printed as plain syntax. Levels
 * used for parenthesisation: atoms 0, application 1, abstraction 10, a notation its own level.
 * </p>
 */
public class NotationPrinter {
	public static final int ATOM_LEVEL = 0;
	public static final int APPLICATION_LEVEL = 1;
	public static final int LAMBDA_LEVEL = PrecedenceLevel.MAX_LEVEL;

	private final String universe;
	private final PrinterTable table;
	private final ScopeRegistry registry;
	private final GlobalEnvironment env;
	private final Elaborator elaborator;
	private final boolean compact;

	public NotationPrinter(String universe, PrinterTable table, ScopeRegistry registry, GlobalEnvironment env,
	                       Elaborator elaborator, boolean compact) {
		this.universe = universe;
		this.table = table;
		this.registry = registry;
		this.env = env;
		this.elaborator = elaborator;
		this.compact = compact;
	}

	private static class Laid {
		final List<PrintHunk> hunks;
		final int level;

		Laid(List<PrintHunk> hunks, int level) {
			this.hunks = hunks;
			this.level = level;
		}
	}

	public String print(Term resolved) {
		return render(layout(resolved));
	}

	public List<PrintHunk> layout(Term resolved) {
		return layoutReified(elaborator.reify(env, resolved)).hunks;
	}

	public String render(List<PrintHunk> hunks) {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		PrintHunkFormattingVisitor v = new PrintHunkFormattingVisitor(out, compact);
		try {
			for (PrintHunk hunk : hunks) {
				hunk.accept(v);
			}
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	private Laid layoutReified(Term term) {
		if (term instanceof TermNotation) {
			Optional<Laid> laid = layoutNotationNode((TermNotation) term);
			if (laid.isPresent()) {
				return laid.get();
			}
		}
		Optional<Laid> viaRule = layoutThroughRules(term);
		if (viaRule.isPresent()) {
			return viaRule.get();
		}
		return term.accept(new PlainLayoutVisitor());
	}

	private Optional<Laid> layoutNotationNode(TermNotation term) {
		Map<Integer, Term> bindings = new HashMap<>();
		for (int i = 0; i < term.getArguments().size(); ++i) {
			bindings.put(i + 1, term.getArguments().get(i));
		}
		for (PrintRule rule : table.getRules(universe)) {
			if (rule.getKey().equals(term.getKey())) {
				return Optional.of(new Laid(instantiate(rule.getHunks(), bindings), rule.getLevel()));
			}
		}
		return Optional.empty();
	}

	private Optional<Laid> layoutThroughRules(Term term) {
		List<PrintRule> rules = table.getRules(universe);
		for (PrintRule rule : rules) {
			if (usable(rule) && registry.isOpen(rule.getScope())) {
				Optional<Map<Integer, Term>> bindings = PatternMatchingVisitor.match(rule.getDisplayPattern(), term);
				if (bindings.isPresent()) {
					return Optional.of(new Laid(instantiate(rule.getHunks(), bindings.get()), rule.getLevel()));
				}
			}
		}
		for (PrintRule rule : rules) {
			if (!usable(rule) || registry.isOpen(rule.getScope())) {
				continue;
			}
			Optional<DelimiterPair> delimiters = table.getDelimiters(rule.getScope());
			if (!delimiters.isPresent()) {
				continue;
			}
			Optional<Map<Integer, Term>> bindings = PatternMatchingVisitor.match(rule.getDisplayPattern(), term);
			if (bindings.isPresent()) {
				List<PrintHunk> hunks = new ArrayList<>();
				hunks.add(new PrintLiteral(delimiters.get().getOpen()));
				hunks.addAll(instantiate(rule.getHunks(), bindings.get()));
				hunks.add(new PrintLiteral(delimiters.get().getClose()));
				return Optional.of(new Laid(hunks, ATOM_LEVEL));
			}
		}
		return Optional.empty();
	}

	// a pattern that is a bare hole would match every term, itself included
	private static boolean usable(PrintRule rule) {
		return !(rule.getDisplayPattern() instanceof TermMeta);
	}

	private List<PrintHunk> instantiate(List<PrintHunk> hunks, Map<Integer, Term> bindings) {
		List<PrintHunk> result = new ArrayList<>();
		for (PrintHunk hunk : hunks) {
			if (hunk instanceof PrintSubterm) {
				PrintSubterm subterm = (PrintSubterm) hunk;
				Term bound = bindings.get(subterm.getIndex());
				if (bound == null) {
					throw new FreeMetavariableIssue("<layout>", subterm.getIndex());
				}
				result.addAll(within(layoutReified(bound), subterm.getWindow().getEffectiveLevel()));
			} else if (hunk instanceof PrintBox) {
				PrintBox box = (PrintBox) hunk;
				result.add(new PrintBox(box.getIndent(), instantiate(box.getHunks(), bindings)));
			} else {
				result.add(hunk);
			}
		}
		return result;
	}

	private static List<PrintHunk> within(Laid laid, int maxLevel) {
		if (laid.level <= maxLevel) {
			return laid.hunks;
		}
		List<PrintHunk> result = new ArrayList<>();
		result.add(new PrintLiteral("("));
		result.addAll(laid.hunks);
		result.add(new PrintLiteral(")"));
		return result;
	}

	private static PrintBreak space() {
		return new PrintBreak(1, 0, true);
	}

	private class PlainLayoutVisitor extends TermVisitor<Laid, RuntimeException> {

		private Laid atom(String text) {
			return new Laid(Collections.singletonList(new PrintLiteral(text)), ATOM_LEVEL);
		}

		@Override
		public Laid visit(TermVariable termVariable) {
			return atom(termVariable.getName());
		}

		@Override
		public Laid visit(TermReference termReference) {
			return atom(env.shortestUnambiguousName(termReference.getName()));
		}

		@Override
		public Laid visit(TermApplication termApplication) {
			List<PrintHunk> hunks = new ArrayList<>();
			Term head = termApplication.getHead();
			Laid laidHead = layoutReified(head);
			hunks.addAll(within(laidHead, head instanceof TermApplication ? APPLICATION_LEVEL : ATOM_LEVEL));
			for (Term arg : termApplication.getArguments()) {
				hunks.add(space());
				hunks.addAll(within(layoutReified(arg), ATOM_LEVEL));
			}
			return new Laid(hunks, APPLICATION_LEVEL);
		}

		@Override
		public Laid visit(TermLambda termLambda) {
			List<PrintHunk> hunks = new ArrayList<>();
			hunks.add(new PrintLiteral("fun"));
			hunks.add(space());
			hunks.add(new PrintLiteral(termLambda.getBinder()));
			hunks.add(space());
			hunks.add(new PrintLiteral("=>"));
			hunks.add(space());
			hunks.addAll(within(layoutReified(termLambda.getBody()), LAMBDA_LEVEL));
			return new Laid(hunks, LAMBDA_LEVEL);
		}

		@Override
		public Laid visit(TermMeta termMeta) {
			return atom("$e" + termMeta.getIndex());
		}

		@Override
		public Laid visit(TermEvar termEvar) {
			return atom("_");
		}

		@Override
		public Laid visit(TermNumber termNumber) {
			return atom(termNumber.getValue());
		}

		@Override
		public Laid visit(TermNotation termNotation) {
			// no printing rule left for this key
			List<PrintHunk> hunks = new ArrayList<>();
			hunks.add(new PrintLiteral("<" + termNotation.getKey() + ">"));
			for (Term arg : termNotation.getArguments()) {
				hunks.add(space());
				hunks.addAll(within(layoutReified(arg), ATOM_LEVEL));
			}
			return new Laid(hunks, APPLICATION_LEVEL);
		}

		@Override
		public Laid visit(TermDelimited termDelimited) {
			Laid inner = layoutReified(termDelimited.getInner());
			List<PrintHunk> hunks = new ArrayList<>();
			Optional<DelimiterPair> delimiters = table.getDelimiters(termDelimited.getScope());
			if (delimiters.isPresent()) {
				hunks.add(new PrintLiteral(delimiters.get().getOpen()));
				hunks.addAll(inner.hunks);
				hunks.add(new PrintLiteral(delimiters.get().getClose()));
			} else {
				hunks.add(new PrintLiteral("("));
				hunks.addAll(inner.hunks);
				hunks.add(new PrintLiteral(")%" + termDelimited.getScope()));
			}
			return new Laid(hunks, ATOM_LEVEL);
		}
	}
}
