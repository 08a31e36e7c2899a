package mixfix.elaborator;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;

import mixfix.model.term.QualifiedName;

public class GlobalEnvironmentTest {

	private GlobalEnvironment env;

	@Before
	public void setup() {
		env = new GlobalEnvironment();
		env.addConstant("Nat.add", 0);
		env.addConstant("Z.add", 0);
		env.addConstant("Nat.zero", 0);
		env.addConstant("Lists.List.cons", 1);
	}

	@Test
	public void testLookup() {
		assertThat(env.lookup("Nat.add"), is(Optional.of(QualifiedName.parse("Nat.add"))));
		assertThat(env.lookup("zero"), is(Optional.of(QualifiedName.parse("Nat.zero"))));
		assertThat(env.lookup("List.cons"), is(Optional.of(QualifiedName.parse("Lists.List.cons"))));
		assertThat(env.lookup("add"), is(Optional.<QualifiedName>empty()));
		assertThat(env.lookup("succ"), is(Optional.<QualifiedName>empty()));
	}

	@Test
	public void testAmbiguousName() {
		try {
			env.resolve("add");
			fail("expected an unresolvable identifier");
		} catch (UnresolvableIdentifierIssue e) {
			assertThat(e.getName(), is("add"));
			assertThat(e.getCandidates(), is(Arrays.asList(QualifiedName.parse("Nat.add"),
					QualifiedName.parse("Z.add"))));
		}
	}

	@Test
	public void testShortestUnambiguousName() {
		assertThat(env.shortestUnambiguousName(QualifiedName.parse("Nat.add")), is("Nat.add"));
		assertThat(env.shortestUnambiguousName(QualifiedName.parse("Nat.zero")), is("zero"));
		assertThat(env.shortestUnambiguousName(QualifiedName.parse("Lists.List.cons")), is("cons"));
	}

	@Test
	public void testModules() {
		assertThat(env.getImplicitArguments(QualifiedName.parse("Lists.List.cons")), is(1));
		assertThat(env.getImplicitArguments(QualifiedName.parse("Nat.succ")), is(0));
		assertThat(env.constantsInModule(Arrays.asList("Nat")).size(), is(2));
		assertThat(env.constantsInModule(Arrays.asList("Lists")).size(), is(1));
	}
}
