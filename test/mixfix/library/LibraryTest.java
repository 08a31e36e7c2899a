package mixfix.library;

import static mixfix.model.term.TermBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import mixfix.MixfixSession;
import mixfix.model.notation.Associativity;
import mixfix.trans.NotationCompiler;

public class LibraryTest {

	private MixfixSession session;
	private NotationCompiler compiler;
	private Library library;

	@Before
	public void setup() {
		session = new MixfixSession();
		compiler = session.getCompiler();
		library = session.getLibrary();
		for (String name : Arrays.asList("a", "b", "Nat.add")) {
			session.getEnvironment().addConstant(name, 0);
		}
	}

	@Test
	public void testSectionExportsItsNotations() {
		library.openSection("S");
		compiler.addInfix(Associativity.LEFT, 4, "+", "Nat.add", "nat_scope");
		session.getRegistry().openScope("nat_scope");
		assertThat(session.read("a + b"), is(app(ref("Nat.add"), ref("a"), ref("b"))));
		library.closeSection("S");

		// the notation survives, opening its scope does not
		assertTrue(session.getGrammar().isToken("+"));
		assertFalse(session.getRegistry().isOpen("nat_scope"));
		assertTrue(session.getRegistry().scopeExists("nat_scope"));
		assertThat(session.getPrinterTable().getRules("constr").size(), is(1));
		session.getRegistry().openScope("nat_scope");
		assertThat(session.read("a + b"), is(app(ref("Nat.add"), ref("a"), ref("b"))));
	}

	@Test
	public void testModuleSyntaxNeedsImport() {
		library.beginModule("M");
		assertThat(library.currentModulePath(), is(Collections.singletonList("M")));
		session.getEnvironment().addConstant("M.op", 0);
		compiler.addInfix(Associativity.LEFT, 4, "++", "M.op", null);
		assertTrue(session.getGrammar().isToken("++"));
		Library.ModuleRecord record = library.endModule("M");

		assertThat(record.getPath(), is(Collections.singletonList("M")));
		assertThat(record.getObjects().size(), is(1));
		assertTrue(library.currentModulePath().isEmpty());
		assertFalse(session.getGrammar().isToken("++"));

		library.importModule("M");
		assertThat(session.read("a ++ b"), is(app(ref("M.op"), ref("a"), ref("b"))));
		assertThat(session.print(session.read("a ++ b")), is("a ++ b"));
		// importing twice installs nothing new
		library.importModule("M");
		assertThat(session.getPrinterTable().getRules("constr").size(), is(1));
	}

	@Test
	public void testFunctorInstantiation() {
		library.beginModule("F");
		session.getEnvironment().addConstant("F.op", 0);
		compiler.addInfix(Associativity.LEFT, 4, "++", "F.op", null);
		library.endModule("F");

		Library.ModuleRecord instance = library.instantiateFunctor("F", "G", ModuleSubstitution.identity());
		assertThat(instance.getPath(), is(Collections.singletonList("G")));
		assertTrue(session.getEnvironment().lookup("G.op").isPresent());
		assertFalse(session.getGrammar().isToken("++"));

		library.importModule("G");
		assertThat(session.read("a ++ b"), is(app(ref("G.op"), ref("a"), ref("b"))));
		assertThat(session.print(app(ref("G.op"), ref("a"), ref("b"))), is("a ++ b"));
		assertThat(session.print(app(ref("F.op"), ref("a"), ref("b"))), is("F.op a b"));
	}

	@Test
	public void testFunctorArguments() {
		session.getEnvironment().addConstant("P.add", 0);
		session.getEnvironment().addConstant("Q.add", 0);
		library.beginModule("F");
		compiler.addInfix(Associativity.LEFT, 4, "+", "P.add", null);
		library.endModule("F");

		library.instantiateFunctor("F", "G", ModuleSubstitution.of("P", "Q"));
		library.importModule("G");
		assertThat(session.read("a + b"), is(app(ref("Q.add"), ref("a"), ref("b"))));
	}

	@Test
	public void testFunctorWithNestedModule() {
		library.beginModule("F");
		library.beginModule("Inner");
		session.getEnvironment().addConstant("F.Inner.op", 0);
		compiler.addInfix(Associativity.LEFT, 4, "**", "F.Inner.op", null);
		library.endModule("Inner");
		library.endModule("F");

		Library.ModuleRecord instance = library.instantiateFunctor("F", "G", ModuleSubstitution.identity());
		assertThat(instance.getSubmodules(), is(Collections.singletonList(Arrays.asList("G", "Inner"))));
		assertTrue(library.getModule("G.Inner").isPresent());
		assertTrue(session.getEnvironment().lookup("G.Inner.op").isPresent());

		library.importModule("G");
		assertFalse(session.getGrammar().isToken("**"));
		library.importModule("G.Inner");
		assertThat(session.read("a ** b"), is(app(ref("G.Inner.op"), ref("a"), ref("b"))));
	}

	@Test
	public void testSubmodulesAreOnlyLoaded() {
		library.beginModule("Outer");
		library.beginModule("Inner");
		assertThat(library.currentModulePath(), is(Arrays.asList("Outer", "Inner")));
		session.getEnvironment().addConstant("Outer.Inner.op", 0);
		compiler.addInfix(Associativity.LEFT, 4, "**", "Outer.Inner.op", "inner_scope");
		library.endModule("Inner");
		library.endModule("Outer");

		library.importModule("Outer");
		assertTrue(session.getRegistry().scopeExists("inner_scope"));
		assertFalse(session.getGrammar().isToken("**"));

		library.importModule("Outer.Inner");
		assertTrue(session.getGrammar().isToken("**"));
	}

	@Test(expected = IllegalStateException.class)
	public void testMismatchedClose() {
		library.openSection("S");
		library.endModule("S");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownModule() {
		library.importModule("Nowhere");
	}
}
