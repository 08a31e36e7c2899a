package mixfix.trans;

import static mixfix.model.term.TermBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;

import mixfix.MixfixSession;
import mixfix.errors.TopLevelIssueContext;
import mixfix.grammar.*;
import mixfix.model.notation.Associativity;
import mixfix.model.notation.DelimiterPair;
import mixfix.model.notation.NotationDescriptor;
import mixfix.model.notation.NotationSymbol;
import mixfix.model.notation.NotationVariable;
import mixfix.model.notation.PrecedenceLevel;
import mixfix.printer.*;
import mixfix.scope.DelimitersAlreadyDeclaredIssue;
import mixfix.scope.EmptyDelimiterIssue;
import mixfix.trans.passes.symbols.DuplicateVariableIssue;

public class NotationCompilerTest {

	private MixfixSession session;
	private NotationCompiler compiler;

	@Before
	public void setup() {
		session = new MixfixSession();
		compiler = session.getCompiler();
		for (String name : Arrays.asList("a", "b", "c", "Nat.add", "Nat.mul", "Nat.neg")) {
			session.getEnvironment().addConstant(name, 0);
		}
		session.getEnvironment().addConstant("Prod.pair", 2);
	}

	private static int occurrences(String text, String needle) {
		int count = 0;
		for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
			++count;
		}
		return count;
	}

	@Test
	public void testInfix() {
		NotationDescriptor descriptor = compiler.addInfix(Associativity.LEFT, 4, "+", "Nat.add", null);
		assertThat(descriptor.getKey(), is("_ + _"));
		assertThat(descriptor.getScope(), is("core_scope"));
		assertThat(descriptor.getInterpretation(), is(app(ref("Nat.add"), meta(1), meta(2))));
		assertThat(descriptor.getPrecedence().getHoleLevels(), is(Arrays.asList(4, 3)));
		assertTrue(session.getGrammar().isToken("+"));

		assertThat(session.parse("a + b"), is(ntn("_ + _", var("a"), var("b"))));
		assertThat(session.read("a + b + c"),
				is(app(ref("Nat.add"), app(ref("Nat.add"), ref("a"), ref("b")), ref("c"))));
		assertThat(session.print(session.read("a + b")), is("a + b"));
	}

	@Test
	public void testIdenticalDeclarationInstallsOnce() {
		NotationDescriptor first = compiler.addInfix(Associativity.LEFT, 4, "+", "Nat.add", null);
		NotationDescriptor second = compiler.addInfix(Associativity.LEFT, 4, "+", "Nat.add", null);
		assertThat(second, is(sameInstance(first)));
		String grammar = compiler.printGrammar("constr", "lassoc_constr4");
		assertThat(occurrences(grammar, "notation _ + _"), is(1));
		assertThat(session.getPrinterTable().getRules("constr").size(), is(1));
	}

	@Test
	public void testSameNotationInAnotherScope() {
		compiler.addInfix(Associativity.LEFT, 4, "+", "Nat.add", "nat_scope");
		compiler.addInfix(Associativity.LEFT, 4, "+", "Nat.mul", "other_scope");
		String grammar = compiler.printGrammar("constr", "lassoc_constr4");
		// one production serves both scopes
		assertThat(occurrences(grammar, "notation _ + _"), is(1));
		assertThat(session.getPrinterTable().getRules("constr").size(), is(2));
		assertThat(session.elaborate(delim("other_scope", ntn("_ + _", var("a"), var("b")))),
				is(app(ref("Nat.mul"), ref("a"), ref("b"))));
	}

	@Test
	public void testDuplicateVariableInstallsNothing() {
		try {
			compiler.addNotation(Associativity.LEFT, 4, "x '+' x", app(var("add"), var("x"), var("x")),
					Collections.emptyMap(), null);
			fail("expected a duplicate variable");
		} catch (DuplicateVariableIssue e) {
			assertThat(e.getName(), is("x"));
		}
		assertFalse(session.getGrammar().isToken("+"));
		assertTrue(session.getPrinterTable().getRules("constr").isEmpty());
	}

	@Test
	public void testPrecedenceRange() {
		try {
			compiler.addInfix(Associativity.LEFT, 0, "+", "Nat.add", null);
			fail("expected a precedence out of range");
		} catch (PrecedenceRangeIssue e) {
			assertThat(e.getLevel(), is(0));
			assertThat(e.getMin(), is(1));
		}
		try {
			compiler.addNotation(Associativity.NONE, 11, "'[' x ']'", var("x"), Collections.emptyMap(), null);
			fail("expected a precedence out of range");
		} catch (PrecedenceRangeIssue e) {
			assertThat(e.getLevel(), is(11));
			assertThat(e.getMax(), is(10));
		}
	}

	@Test
	public void testDistfixWithImplicitArguments() {
		NotationDescriptor descriptor = compiler.addDistfix(Associativity.NONE, 0, "< _ , _ >", var("pair"), null);
		assertThat(descriptor.getKey(), is("< _ , _ >"));
		assertThat(descriptor.getInterpretation(), is(app(ref("Prod.pair"), evar(), evar(), meta(1), meta(2))));
		assertThat(descriptor.getDisplayPattern(), is(app(ref("Prod.pair"), meta(1), meta(2))));
		assertThat(session.read("< a , b >"), is(app(ref("Prod.pair"), evar(), evar(), ref("a"), ref("b"))));
		assertThat(session.print(session.read("< a , b >")), is("< a , b >"));
	}

	@Test
	public void testDistfixPair() {
		session.getEnvironment().addConstant("Lists.mkpair", 0);
		NotationDescriptor descriptor = compiler.addDistfix(Associativity.NONE, 0, "[ _ , _ ]", var("mkpair"),
				null);
		for (NotationSymbol symbol : descriptor.getSymbols()) {
			if (symbol instanceof NotationVariable) {
				assertThat(((NotationVariable) symbol).getWindow(), is(PrecedenceLevel.exact(10)));
			}
		}
		assertThat(session.read("[ a , b ]"), is(app(ref("Lists.mkpair"), ref("a"), ref("b"))));
	}

	@Test
	public void testPinnedLevel() {
		compiler.addNotation(Associativity.NONE, 0, "'[' x ']'", app(var("neg"), var("x")),
				Collections.singletonMap("x", 0), null);
		compiler.addInfix(Associativity.LEFT, 4, "+", "Nat.add", null);
		assertThat(session.read("[ a ]"), is(app(ref("Nat.neg"), ref("a"))));
		// x is pinned to level 0, so a sum needs parentheses
		assertThat(session.print(session.read("[ (a + b) ]")), is("[ (a + b) ]"));
	}

	@Test(expected = EmptyDelimiterIssue.class)
	public void testEmptyDelimiters() {
		compiler.addDelimiters("nat_scope", "", "}}");
	}

	@Test
	public void testDelimiters() {
		compiler.addInfix(Associativity.LEFT, 4, "+", "Nat.add", "nat_scope");
		compiler.addDelimiters("nat_scope", "{{", "}}");
		assertThat(session.parse("{{a + b}}"), is(delim("nat_scope", ntn("_ + _", var("a"), var("b")))));
		assertThat(session.parsePattern("{{a}}"), is(delim("nat_scope", var("a"))));
		assertThat(session.read("{{a + b}}"), is(app(ref("Nat.add"), ref("a"), ref("b"))));

		// identical pair again is a no-op
		compiler.addDelimiters("nat_scope", "{{", "}}");
		assertThat(occurrences(compiler.printGrammar("constr", "constr0"), "delimiters nat_scope"), is(1));

		try {
			compiler.addDelimiters("nat_scope", "<<", ">>");
			fail("expected conflicting delimiters");
		} catch (DelimitersAlreadyDeclaredIssue e) {
			assertThat(e.getExisting(), is(new DelimiterPair("{{", "}}")));
		}
		assertFalse(session.getGrammar().isToken("<<"));
	}

	@Test
	public void testIssuesAreReportedInContext() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertFalse(compiler.addInfix(ctx, Associativity.LEFT, 0, "+", "Nat.add", null).isPresent());
		assertFalse(compiler.addNotation(ctx, Associativity.LEFT, 4, "x '+' x", var("x"), Collections.emptyMap(),
				null).isPresent());
		Optional<NotationDescriptor> ok = compiler.addInfix(ctx, Associativity.LEFT, 3, "*", "Nat.mul", null);
		assertTrue(ok.isPresent());

		assertThat(ctx.getIssues().size(), is(2));
		String report = ctx.format();
		assertThat(report, startsWith("Detected 2 issue(s):"));
		assertThat(report, containsString("while declaring infix \"x '+' y\""));
		assertThat(report, containsString("Precedence must be between 1 and 10, found 0"));
		assertThat(report, containsString("while declaring notation \"x '+' x\""));
		assertThat(report, containsString("Variable x occurs more than once"));
	}

	@Test
	public void testPinnedLevelOutOfRange() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertFalse(compiler.addNotation(ctx, Associativity.NONE, 0, "'[' x ']'", app(var("neg"), var("x")),
				Collections.singletonMap("x", 15), null).isPresent());
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.format(), containsString("Precedence must be between 0 and 10, found 15"));
		assertFalse(session.getGrammar().isToken("["));
	}

	@Test
	public void testToken() {
		assertFalse(session.getGrammar().isToken("==>"));
		compiler.addToken("==>");
		assertTrue(session.getGrammar().isToken("==>"));
	}

	@Test
	public void testGrammarRules() {
		Production tt = new Production("tt", Collections.singletonList(new ProductionTerminal("tt")),
				new TemplateAction(ref("Bool.true")));
		compiler.addGrammar("constr", Collections.singletonList(
				new GrammarCommand("constr", "constr0", EntryKind.TERM, 0, tt)));
		assertThat(session.parse("tt"), is(ref("Bool.true")));
		assertThat(session.parse("f tt"), is(app(var("f"), ref("Bool.true"))));
	}

	@Test
	public void testGrammarRuleForNonTermEntry() {
		Production p = new Production("bit", Collections.singletonList(new ProductionTerminal("#0")),
				new TemplateAction(num(0)));
		try {
			compiler.addGrammar("constr", Collections.singletonList(
					new GrammarCommand("constr", "bits", EntryKind.OTHER, 0, p)));
			fail("expected a non extensible entry");
		} catch (NonExtensibleEntryIssue e) {
			assertThat(e.getEntry(), is("bits"));
			assertThat(e.getKind(), is(EntryKind.OTHER));
		}
		assertFalse(session.getGrammar().entryExists("constr", "bits"));
		assertFalse(session.getGrammar().isToken("#0"));

		// the existing entry's kind wins over the one the rule asks for
		try {
			compiler.addGrammar("constr", Collections.singletonList(
					new GrammarCommand("constr", "pattern", EntryKind.TERM, 0, p)));
			fail("expected a non extensible entry");
		} catch (NonExtensibleEntryIssue e) {
			assertThat(e.getKind(), is(EntryKind.PATTERN));
		}
	}

	@Test
	public void testSyntaxRules() {
		PrintRule bad = new PrintRule("bad_neg", "constr", 0, "core_scope", "~ _", app(ref("Nat.neg"), meta(1)),
				Arrays.<PrintHunk>asList(new PrintLiteral("~"), new PrintSubterm(2, PrecedenceLevel.exact(0))));
		try {
			compiler.addSyntax(Collections.singletonList(bad));
			fail("expected a free metavariable");
		} catch (FreeMetavariableIssue e) {
			assertThat(e.getRuleName(), is("bad_neg"));
			assertThat(e.getIndex(), is(2));
		}
		assertTrue(session.getPrinterTable().getRules("constr").isEmpty());

		PrintRule neg = new PrintRule("neg", "constr", 0, "core_scope", "~ _", app(ref("Nat.neg"), meta(1)),
				Arrays.<PrintHunk>asList(new PrintLiteral("~"), new PrintSubterm(1, PrecedenceLevel.exact(0))));
		compiler.addSyntax(Collections.singletonList(neg));
		assertThat(session.print(app(ref("Nat.neg"), ref("a"))), is("~a"));
		assertThat(session.print(app(ref("Nat.neg"), app(ref("Nat.neg"), ref("a")))), is("~~a"));
	}

	@Test
	public void testPrintGrammar() {
		compiler.addInfix(Associativity.LEFT, 4, "+", "Nat.add", null);
		String grammar = compiler.printGrammar("constr", "lassoc_constr4");
		assertThat(grammar, startsWith("constr:lassoc_constr4"));
		assertThat(grammar, containsString("level 4"));
		assertThat(compiler.printGrammar("constr", "binders"), is("constr:binders does not exist"));
	}
}
