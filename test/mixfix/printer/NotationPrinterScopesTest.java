package mixfix.printer;

import static mixfix.model.term.TermBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import mixfix.MixfixOptions;
import mixfix.MixfixSession;
import mixfix.model.notation.Associativity;
import mixfix.model.term.Term;

public class NotationPrinterScopesTest {

	private static MixfixSession session(MixfixOptions options) {
		MixfixSession session = new MixfixSession(options);
		for (String name : Arrays.asList("a", "b", "c", "Nat.add", "Nat.succ")) {
			session.getEnvironment().addConstant(name, 0);
		}
		return session;
	}

	private static void collectLiterals(List<PrintHunk> hunks, List<String> literals) {
		for (PrintHunk hunk : hunks) {
			if (hunk instanceof PrintLiteral) {
				literals.add(((PrintLiteral) hunk).getText());
			} else if (hunk instanceof PrintBox) {
				collectLiterals(((PrintBox) hunk).getHunks(), literals);
			}
		}
	}

	@Test
	public void testLayout() {
		MixfixSession session = session(MixfixOptions.defaults());
		session.getCompiler().addInfix(Associativity.LEFT, 4, "+", "Nat.add", null);
		List<PrintHunk> hunks = session.getPrinter().layout(session.read("a + b"));
		assertThat(hunks.size(), is(1));
		assertThat(hunks.get(0), instanceOf(PrintBox.class));
		assertThat(((PrintBox) hunks.get(0)).getIndent(), is(1));
		List<String> literals = new ArrayList<>();
		collectLiterals(hunks, literals);
		assertThat(literals, is(Arrays.asList("a", "+", "b")));
	}

	@Test
	public void testPlainTerms() {
		MixfixSession session = session(MixfixOptions.defaults());
		assertThat(session.print(app(ref("Nat.succ"), app(ref("Nat.succ"), num(0)))), is("succ (succ 0)"));
		assertThat(session.print(lam("x", app(ref("Nat.add"), var("x"), ref("a")))), is("fun x => add x a"));
		assertThat(session.print(app(ref("Nat.succ"), lam("x", var("x")))), is("succ (fun x => x)"));
		assertThat(session.print(app(ref("Nat.add"), evar(), meta(2))), is("add _ $e2"));
	}

	@Test
	public void testCompactSymbols() {
		MixfixOptions options = MixfixOptions.fromJSON("{\"printer\": {\"compact_symbols\": true}}");
		MixfixSession session = session(options);
		session.getCompiler().addInfix(Associativity.LEFT, 4, "+", "Nat.add", null);
		assertThat(session.print(session.read("a + b + c")), is("a+b+c"));
	}

	@Test
	public void testCompactKeepsWordsApart() {
		MixfixOptions options = MixfixOptions.fromJSON("{\"printer\": {\"compact_symbols\": true}}");
		MixfixSession session = session(options);
		session.getCompiler().addNotation(Associativity.NONE, 0, "'plus' x 'with' y",
				app(var("add"), var("x"), var("y")), java.util.Collections.emptyMap(), null);
		assertThat(session.print(session.read("plus a with b")), is("plus a with b"));
	}

	@Test
	public void testClosedScopeWithoutDelimiters() {
		MixfixSession session = session(MixfixOptions.defaults());
		session.getCompiler().addInfix(Associativity.LEFT, 4, "+", "Nat.add", "nat_scope");
		Term sum = app(ref("Nat.add"), ref("a"), ref("b"));
		assertThat(session.print(sum), is("add a b"));

		session.getRegistry().openScope("nat_scope");
		assertThat(session.print(sum), is("a + b"));
		session.getRegistry().closeScope("nat_scope");
		assertThat(session.print(sum), is("add a b"));
	}

	@Test
	public void testClosedScopeWithDelimiters() {
		MixfixSession session = session(MixfixOptions.defaults());
		session.getCompiler().addInfix(Associativity.LEFT, 4, "+", "Nat.add", "nat_scope");
		session.getCompiler().addDelimiters("nat_scope", "{{", "}}");
		Term sum = app(ref("Nat.add"), ref("a"), ref("b"));
		assertThat(session.print(sum), is("{{a + b}}"));
		assertThat(session.read(session.print(sum)), is(sum));

		session.getRegistry().openScope("nat_scope");
		assertThat(session.print(sum), is("a + b"));
	}

	@Test
	public void testDelimitedNode() {
		MixfixSession session = session(MixfixOptions.defaults());
		assertThat(session.print(delim("nat_scope", ref("a"))), is("(a)%nat_scope"));
		session.getCompiler().addDelimiters("nat_scope", "{{", "}}");
		assertThat(session.print(delim("nat_scope", ref("a"))), is("{{a}}"));
	}

	@Test
	public void testDefaultScopeFromConfiguration() throws Exception {
		String path = new java.io.File(getClass().getResource("/mixfix-compact.json").toURI()).getPath();
		MixfixSession session = session(MixfixOptions.fromFile(path));
		session.getCompiler().addInfix(Associativity.LEFT, 4, "+", "Nat.add", null);
		assertThat(session.getRegistry().getDefaultScope(), is("nat_scope"));
		assertThat(session.print(session.read("a + b")), is("a+b"));
	}
}
