package mixfix.trans.passes.synthesis;

import static mixfix.model.term.TermBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import mixfix.MixfixOptions;
import mixfix.errors.TopLevelIssueContext;
import mixfix.grammar.*;
import mixfix.lexer.FormatTokenizer;
import mixfix.model.notation.Associativity;
import mixfix.model.notation.NotationSymbol;
import mixfix.model.notation.PrecedenceLevel;
import mixfix.printer.*;
import mixfix.trans.passes.symbols.SymbolClassificationPass;

public class SynthesisPassTest {

	private static List<NotationSymbol> symbols(String format, int level, Associativity associativity) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		List<NotationSymbol> result = SymbolClassificationPass.perform(ctx, FormatTokenizer.split(format), level,
				associativity, Collections.emptyMap());
		assertFalse(ctx.hasErrors());
		return result;
	}

	private static EntryTable table() {
		MixfixOptions options = MixfixOptions.defaults();
		return new EntryTable(options.universe, options.entryNames);
	}

	@Test
	public void testInfixProduction() {
		GrammarCommand command = GrammarRuleSynthesisPass.perform(table(), "_ + _", 4,
				symbols("x '+' y", 4, Associativity.LEFT));
		assertThat(command.getUniverse(), is("constr"));
		assertThat(command.getEntry(), is("lassoc_constr4"));
		assertThat(command.getEntryKind(), is(EntryKind.TERM));
		assertThat(command.getLevel(), is(4));
		assertThat(command.getProduction(), is(new Production("notation _ + _", Arrays.asList(
				new ProductionNonTerminal("lassoc_constr4", "x"),
				new ProductionTerminal("+"),
				new ProductionNonTerminal("constr3", "y")), new NotationAction("_ + _"))));
		assertTrue(command.getProduction().isLeftRecursive());
	}

	@Test
	public void testClosedProduction() {
		GrammarCommand command = GrammarRuleSynthesisPass.perform(table(), "[ _ ]", 0,
				symbols("'[' x ']'", 0, Associativity.NONE));
		assertThat(command.getEntry(), is("constr0"));
		assertThat(command.getProduction().getSymbols(), is(Arrays.asList(
				new ProductionTerminal("["),
				new ProductionNonTerminal("lconstr", "x"),
				new ProductionTerminal("]"))));
		assertFalse(command.getProduction().isLeftRecursive());
	}

	@Test
	public void testInfixHunks() {
		List<PrintHunk> hunks = PrintRuleSynthesisPass.hunks(symbols("x '+' y", 4, Associativity.LEFT), 1);
		assertThat(hunks, is(Collections.<PrintHunk>singletonList(new PrintBox(1, Arrays.asList(
				new PrintSubterm(1, PrecedenceLevel.exact(4)),
				new PrintBreak(1, 0, false),
				new PrintLiteral("+"),
				new PrintBreak(1, 0, false),
				new PrintSubterm(2, PrecedenceLevel.loose(4)))))));
	}

	@Test
	public void testGlueProtectingBreaks() {
		List<PrintHunk> hunks = PrintRuleSynthesisPass.hunks(
				symbols("'if' c 'then' t", 10, Associativity.RIGHT), 2);
		PrintBox box = (PrintBox) hunks.get(0);
		assertThat(box.getIndent(), is(2));
		List<PrintHunk> inner = box.getHunks();
		assertThat(inner.size(), is(7));
		// every break here touches a word
		assertThat(inner.get(1), is(new PrintBreak(1, 0, true)));
		assertThat(inner.get(3), is(new PrintBreak(1, 0, true)));
		assertThat(inner.get(5), is(new PrintBreak(1, 0, true)));
	}

	@Test
	public void testPrintRule() {
		PrintRule rule = PrintRuleSynthesisPass.perform("constr", "nat_scope", "_ + _", 4,
				symbols("x '+' y", 4, Associativity.LEFT), app(ref("Nat.add"), meta(1), meta(2)), 1);
		assertThat(rule.getName(), is("_ + __nat_scope_notation"));
		assertThat(rule.getScope(), is("nat_scope"));
		assertThat(rule.getLevel(), is(4));
		assertThat(rule.getKey(), is("_ + _"));
		rule.checkMetavariables();
	}
}
