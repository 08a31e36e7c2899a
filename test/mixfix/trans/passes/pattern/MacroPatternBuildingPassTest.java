package mixfix.trans.passes.pattern;

import static mixfix.model.term.TermBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;

import mixfix.elaborator.DefaultElaborator;
import mixfix.elaborator.Elaborator;
import mixfix.elaborator.GlobalEnvironment;
import mixfix.elaborator.UnresolvableIdentifierIssue;
import mixfix.errors.TopLevelIssueContext;
import mixfix.model.notation.NotationVariable;
import mixfix.model.notation.PrecedenceLevel;
import mixfix.model.term.Term;
import mixfix.scope.ScopeRegistry;

public class MacroPatternBuildingPassTest {

	private GlobalEnvironment env;
	private Elaborator elaborator;
	private TopLevelIssueContext ctx;

	private static final List<NotationVariable> XY = Arrays.asList(
			new NotationVariable("x", PrecedenceLevel.exact(4), 1),
			new NotationVariable("y", PrecedenceLevel.loose(4), 2));

	@Before
	public void setup() {
		env = new GlobalEnvironment();
		env.addConstant("Nat.add", 0);
		env.addConstant("Prod.pair", 2);
		elaborator = new DefaultElaborator(new ScopeRegistry("core_scope"));
		ctx = new TopLevelIssueContext();
	}

	private Optional<MacroPattern> build(Term example) {
		return MacroPatternBuildingPass.perform(ctx, elaborator, env, example, XY);
	}

	@Test
	public void testHolesBecomeMetas() {
		Optional<MacroPattern> pattern = build(app(var("add"), var("x"), var("y")));
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(pattern.get().getInterpretation(), is(app(ref("Nat.add"), meta(1), meta(2))));
		assertThat(pattern.get().getDisplayPattern(), is(app(ref("Nat.add"), meta(1), meta(2))));
	}

	@Test
	public void testImplicitArgumentsLeaveTheDisplayPattern() {
		Optional<MacroPattern> pattern = build(app(var("pair"), var("x"), var("y")));
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(pattern.get().getInterpretation(),
				is(app(ref("Prod.pair"), evar(), evar(), meta(1), meta(2))));
		assertThat(pattern.get().getDisplayPattern(), is(app(ref("Prod.pair"), meta(1), meta(2))));
	}

	@Test
	public void testUnboundHole() {
		Optional<MacroPattern> pattern = build(app(var("add"), var("x"), var("x")));
		assertFalse(pattern.isPresent());
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(((UnboundHoleIssue) ctx.getIssues().get(0)).getName(), is("y"));
	}

	@Test
	public void testShadowedHoleIsUnbound() {
		Optional<MacroPattern> pattern = build(lam("x", app(var("add"), var("x"), var("y"))));
		assertFalse(pattern.isPresent());
		assertThat(((UnboundHoleIssue) ctx.getIssues().get(0)).getName(), is("x"));
	}

	@Test
	public void testMetaInExample() {
		Optional<MacroPattern> pattern = build(app(var("add"), meta(3), var("x"), var("y")));
		assertFalse(pattern.isPresent());
		assertThat(ctx.getIssues().get(0), instanceOf(UnexpectedMetavariableIssue.class));
		assertThat(((UnexpectedMetavariableIssue) ctx.getIssues().get(0)).getMeta(), is(meta(3)));
	}

	@Test
	public void testUnresolvableIdentifier() {
		Optional<MacroPattern> pattern = build(app(var("mul"), var("x"), var("y")));
		assertFalse(pattern.isPresent());
		UnresolvableIdentifierIssue issue = (UnresolvableIdentifierIssue) ctx.getIssues().get(0);
		assertThat(issue.getName(), is("mul"));
		assertTrue(issue.getCandidates().isEmpty());
	}

	@Test
	public void testElaboratorProducingMeta() {
		Elaborator leaky = new Elaborator() {
			@Override
			public Term elaborate(GlobalEnvironment env, List<String> localNames, Term term) {
				return app(ref("Nat.add"), meta(7), var("x"), var("y"));
			}

			@Override
			public Term reify(GlobalEnvironment env, Term resolved) {
				return resolved;
			}
		};
		Optional<MacroPattern> pattern = MacroPatternBuildingPass.perform(ctx, leaky, env,
				app(var("add"), var("x"), var("y")), XY);
		assertFalse(pattern.isPresent());
		assertThat(ctx.getIssues().get(0), instanceOf(UnexpectedBoundFormIssue.class));
	}
}
