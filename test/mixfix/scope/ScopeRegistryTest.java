package mixfix.scope;

import static mixfix.model.term.TermBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import mixfix.MixfixOptions;
import mixfix.errors.TopLevelIssueContext;
import mixfix.grammar.EntryTable;
import mixfix.lexer.FormatTokenizer;
import mixfix.model.notation.*;
import mixfix.model.term.Term;
import mixfix.trans.passes.symbols.SymbolClassificationPass;
import mixfix.trans.passes.synthesis.GrammarRuleSynthesisPass;
import mixfix.trans.passes.synthesis.PrintRuleSynthesisPass;

public class ScopeRegistryTest {

	private ScopeRegistry registry;

	@Before
	public void setup() {
		registry = new ScopeRegistry("core_scope");
	}

	private static NotationDescriptor plus(String scope, int level, Term interpretation) {
		MixfixOptions options = MixfixOptions.defaults();
		EntryTable table = new EntryTable(options.universe, options.entryNames);
		List<NotationSymbol> symbols = SymbolClassificationPass.perform(new TopLevelIssueContext(),
				FormatTokenizer.split("x '+' y"), level, Associativity.LEFT, Collections.emptyMap());
		String key = SymbolClassificationPass.notationKey(symbols);
		return new NotationDescriptor(scope, level, Associativity.LEFT, symbols, interpretation, interpretation,
				GrammarRuleSynthesisPass.perform(table, key, level, symbols),
				PrintRuleSynthesisPass.perform(table.getUniverse(), scope, key, level, symbols, interpretation, 1),
				key, SymbolClassificationPass.precedence(level, Associativity.LEFT, symbols));
	}

	@Test
	public void testDefaultScope() {
		assertTrue(registry.scopeExists("core_scope"));
		assertTrue(registry.isOpen("core_scope"));
		assertThat(registry.getOpenScopes(), is(Collections.singletonList("core_scope")));
		assertFalse(registry.scopeExists("nat_scope"));
	}

	@Test
	public void testDeclareNotation() {
		NotationDescriptor add = plus("nat_scope", 4, app(ref("Nat.add"), meta(1), meta(2)));
		assertFalse(registry.existsNotation(add.getPrecedence(), add.getKey()));
		assertThat(registry.declareNotation(add), is(sameInstance(add)));
		assertTrue(registry.scopeExists("nat_scope"));
		assertTrue(registry.existsNotation(add.getPrecedence(), add.getKey()));
		assertTrue(registry.existsNotationInScope("nat_scope", add.getPrecedence(), add.getKey(),
				add.getInterpretation()));
		assertFalse(registry.existsNotationInScope("core_scope", add.getPrecedence(), add.getKey(),
				add.getInterpretation()));
		assertFalse(registry.existsNotationInScope("nat_scope", add.getPrecedence(), add.getKey(),
				app(ref("Nat.mul"), meta(1), meta(2))));

		// identical redeclaration keeps the first descriptor
		NotationDescriptor again = plus("nat_scope", 4, app(ref("Nat.add"), meta(1), meta(2)));
		assertThat(registry.declareNotation(again), is(sameInstance(add)));
	}

	@Test
	public void testRedeclarationOverrides() {
		registry.declareNotation(plus("nat_scope", 4, app(ref("Nat.add"), meta(1), meta(2))));
		NotationDescriptor mul = plus("nat_scope", 4, app(ref("Nat.mul"), meta(1), meta(2)));
		assertThat(registry.declareNotation(mul), is(sameInstance(mul)));
		assertThat(registry.interpretNotation("_ + _", Collections.singletonList("nat_scope")), is(mul));
	}

	@Test
	public void testInterpretNotationSearchOrder() {
		NotationDescriptor nat = plus("nat_scope", 4, app(ref("Nat.add"), meta(1), meta(2)));
		NotationDescriptor bool = plus("bool_scope", 4, app(ref("Bool.or"), meta(1), meta(2)));
		registry.declareNotation(nat);
		registry.declareNotation(bool);

		try {
			registry.interpretNotation("_ + _", Collections.emptyList());
			fail("expected an unknown notation");
		} catch (UnknownNotationIssue e) {
			assertThat(e.getKey(), is("_ + _"));
			assertThat(e.getScopes(), is(Collections.singletonList("core_scope")));
		}

		registry.openScope("nat_scope");
		registry.openScope("bool_scope");
		assertThat(registry.getOpenScopes(), is(Arrays.asList("bool_scope", "nat_scope", "core_scope")));
		assertThat(registry.interpretNotation("_ + _", Collections.emptyList()), is(bool));
		assertThat(registry.interpretNotation("_ + _", Collections.singletonList("nat_scope")), is(nat));

		registry.closeScope("bool_scope");
		assertFalse(registry.isOpen("bool_scope"));
		assertThat(registry.interpretNotation("_ + _", Collections.emptyList()), is(nat));
		// closing a scope that is not open only warns
		registry.closeScope("bool_scope");
	}

	@Test
	public void testDelimiters() {
		DelimiterPair braces = new DelimiterPair("{{", "}}");
		assertFalse(registry.checkDelimiters("nat_scope", braces));
		registry.declareDelimiters("nat_scope", braces);
		assertThat(registry.getDelimiters("nat_scope"), is(java.util.Optional.of(braces)));
		assertTrue(registry.checkDelimiters("nat_scope", new DelimiterPair("{{", "}}")));
		try {
			registry.checkDelimiters("nat_scope", new DelimiterPair("<<", ">>"));
			fail("expected conflicting delimiters");
		} catch (DelimitersAlreadyDeclaredIssue e) {
			assertThat(e.getExisting(), is(braces));
			assertThat(e.getRequested(), is(new DelimiterPair("<<", ">>")));
		}
	}

	@Test(expected = EmptyDelimiterIssue.class)
	public void testEmptyDelimiter() {
		registry.checkDelimiters("nat_scope", new DelimiterPair("", "}"));
	}

	@Test
	public void testFreezeUnfreeze() {
		ScopeRegistry.Snapshot before = registry.freeze();
		registry.declareNotation(plus("nat_scope", 4, app(ref("Nat.add"), meta(1), meta(2))));
		registry.openScope("nat_scope");
		registry.unfreeze(before);
		assertFalse(registry.scopeExists("nat_scope"));
		assertFalse(registry.isOpen("nat_scope"));
	}
}
