package mixfix.trans.extension;

import static mixfix.model.term.TermBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;

import mixfix.MixfixSession;
import mixfix.errors.TopLevelIssueContext;
import mixfix.grammar.EntryTable;
import mixfix.lexer.FormatTokenizer;
import mixfix.library.ModuleSubstitution;
import mixfix.library.ObjectClassification;
import mixfix.model.notation.Associativity;
import mixfix.model.notation.NotationDescriptor;
import mixfix.model.notation.NotationSymbol;
import mixfix.model.term.Term;
import mixfix.trans.passes.symbols.SymbolClassificationPass;
import mixfix.trans.passes.synthesis.GrammarRuleSynthesisPass;
import mixfix.trans.passes.synthesis.PrintRuleSynthesisPass;

public class ExtensionLifecycleTest {

	private MixfixSession session;
	private ExtensionLifecycle lifecycle;

	@Before
	public void setup() {
		session = new MixfixSession();
		lifecycle = session.getLifecycle();
	}

	private NotationBundle plus(String scope, Term interpretation) {
		EntryTable table = session.getEntryTable();
		List<NotationSymbol> symbols = SymbolClassificationPass.perform(new TopLevelIssueContext(),
				FormatTokenizer.split("x '+' y"), 4, Associativity.LEFT, Collections.emptyMap());
		return new NotationBundle(new NotationDescriptor(scope, 4, Associativity.LEFT, symbols, interpretation,
				interpretation, GrammarRuleSynthesisPass.perform(table, "_ + _", 4, symbols),
				PrintRuleSynthesisPass.perform(table.getUniverse(), scope, "_ + _", 4, symbols, interpretation, 1),
				"_ + _", SymbolClassificationPass.precedence(4, Associativity.LEFT, symbols)));
	}

	@Test
	public void testLoadOnlyDeclaresTheScope() {
		lifecycle.load(1, plus("nat_scope", app(ref("F.add"), meta(1), meta(2))));
		assertTrue(session.getRegistry().scopeExists("nat_scope"));
		assertFalse(session.getGrammar().isToken("+"));
		assertTrue(session.getPrinterTable().getRules("constr").isEmpty());
	}

	@Test
	public void testOpenOnlyAtDepthOne() {
		NotationBundle bundle = plus("nat_scope", app(ref("F.add"), meta(1), meta(2)));
		lifecycle.open(2, bundle);
		assertFalse(session.getGrammar().isToken("+"));

		lifecycle.open(1, bundle);
		lifecycle.open(1, bundle);
		assertTrue(session.getGrammar().isToken("+"));
		assertThat(session.getPrinterTable().getRules("constr").size(), is(1));
		String grammar = session.getGrammar().describeEntry("constr", "lassoc_constr4");
		assertThat(grammar.indexOf("notation _ + _"), is(grammar.lastIndexOf("notation _ + _")));
	}

	@Test
	public void testTokenObject() {
		lifecycle.load(1, new TokenObject("|>"));
		assertFalse(session.getGrammar().isToken("|>"));
		lifecycle.cache(new TokenObject("|>"));
		assertTrue(session.getGrammar().isToken("|>"));
	}

	@Test
	public void testSubstitution() {
		NotationBundle bundle = plus("nat_scope", app(ref("F.add"), meta(1), meta(2)));
		assertThat(lifecycle.subst(ModuleSubstitution.identity(), bundle), is(sameInstance((ExtensionObject) bundle)));
		assertThat(lifecycle.subst(ModuleSubstitution.of("H", "K"), bundle),
				is(sameInstance((ExtensionObject) bundle)));

		NotationBundle moved = (NotationBundle) lifecycle.subst(ModuleSubstitution.of("F", "G"), bundle);
		assertThat(moved.getDescriptor().getInterpretation(), is(app(ref("G.add"), meta(1), meta(2))));
		assertThat(moved.getDescriptor().getPrintRule().getDisplayPattern(),
				is(app(ref("G.add"), meta(1), meta(2))));
		assertThat(moved.getDescriptor().getGrammarCommand(), is(bundle.getDescriptor().getGrammarCommand()));

		TokenObject token = new TokenObject("|>");
		assertThat(lifecycle.subst(ModuleSubstitution.of("F", "G"), token), is(sameInstance((ExtensionObject) token)));
	}

	@Test
	public void testClassifyAndExport() {
		NotationBundle bundle = plus("nat_scope", app(ref("F.add"), meta(1), meta(2)));
		assertThat(lifecycle.classify(bundle), is(ObjectClassification.SUBSTITUTE));
		assertThat(lifecycle.export(bundle), is(Optional.<ExtensionObject>of(bundle)));
	}
}
