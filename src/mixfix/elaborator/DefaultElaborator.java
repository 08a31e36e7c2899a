package mixfix.elaborator;

import mixfix.model.notation.NotationDescriptor;
import mixfix.model.term.*;
import mixfix.scope.ScopeRegistry;

import java.util.*;

/**
 * An elaborator that resolves names and expands notations but does no type checking. Implicit arguments are
 * inserted as {@code _}, as many as the constant declares, in front of the written arguments.
 */
public class DefaultElaborator implements Elaborator {

	private final ScopeRegistry registry;

	public DefaultElaborator(ScopeRegistry registry) {
		this.registry = registry;
	}

	@Override
	public Term elaborate(GlobalEnvironment env, List<String> localNames, Term term) {
		return term.accept(new ElaborationVisitor(env, localNames));
	}

	@Override
	public Term reify(GlobalEnvironment env, Term resolved) {
		return resolved.accept(new ReificationVisitor(env));
	}

	private class ElaborationVisitor extends TermVisitor<Term, RuntimeException> {
		private final GlobalEnvironment env;
		private final Deque<String> locals;
		private final Deque<String> extraScopes;

		ElaborationVisitor(GlobalEnvironment env, List<String> localNames) {
			this.env = env;
			this.locals = new ArrayDeque<>(localNames);
			this.extraScopes = new ArrayDeque<>();
		}

		private List<Term> elaborateAll(List<Term> terms) {
			List<Term> result = new ArrayList<>(terms.size());
			for (Term t : terms) {
				result.add(t.accept(this));
			}
			return result;
		}

		private Term applyConstant(QualifiedName name, List<Term> explicit) {
			List<Term> args = new ArrayList<>();
			for (int i = 0; i < env.getImplicitArguments(name); ++i) {
				args.add(new TermEvar());
			}
			args.addAll(explicit);
			TermReference head = new TermReference(name);
			return args.isEmpty() ? head : new TermApplication(head, args);
		}

		@Override
		public Term visit(TermVariable termVariable) {
			if (locals.contains(termVariable.getName())) {
				return termVariable;
			}
			return applyConstant(env.resolve(termVariable.getName()), Collections.emptyList());
		}

		@Override
		public Term visit(TermReference termReference) {
			return termReference;
		}

		@Override
		public Term visit(TermApplication termApplication) {
			Term head = termApplication.getHead();
			List<Term> args = elaborateAll(termApplication.getArguments());
			if (head instanceof TermVariable && !locals.contains(((TermVariable) head).getName())) {
				return applyConstant(env.resolve(((TermVariable) head).getName()), args);
			}
			Term elaboratedHead = head.accept(this);
			if (elaboratedHead instanceof TermApplication) {
				TermApplication inner = (TermApplication) elaboratedHead;
				List<Term> all = new ArrayList<>(inner.getArguments());
				all.addAll(args);
				return new TermApplication(inner.getHead(), all);
			}
			return new TermApplication(elaboratedHead, args);
		}

		@Override
		public Term visit(TermLambda termLambda) {
			locals.push(termLambda.getBinder());
			try {
				return new TermLambda(termLambda.getBinder(), termLambda.getBody().accept(this));
			} finally {
				locals.pop();
			}
		}

		@Override
		public Term visit(TermMeta termMeta) {
			return termMeta;
		}

		@Override
		public Term visit(TermEvar termEvar) {
			return termEvar;
		}

		@Override
		public Term visit(TermNumber termNumber) {
			return termNumber;
		}

		@Override
		public Term visit(TermNotation termNotation) {
			NotationDescriptor descriptor = registry.interpretNotation(termNotation.getKey(),
					new ArrayList<>(extraScopes));
			List<Term> args = elaborateAll(termNotation.getArguments());
			return PatternInstantiationVisitor.instantiate(descriptor.getInterpretation(), args);
		}

		@Override
		public Term visit(TermDelimited termDelimited) {
			extraScopes.push(termDelimited.getScope());
			try {
				return termDelimited.getInner().accept(this);
			} finally {
				extraScopes.pop();
			}
		}
	}

	private static class ReificationVisitor extends TermVisitor<Term, RuntimeException> {
		private final GlobalEnvironment env;

		ReificationVisitor(GlobalEnvironment env) {
			this.env = env;
		}

		@Override
		public Term visit(TermVariable termVariable) {
			return termVariable;
		}

		@Override
		public Term visit(TermReference termReference) {
			return termReference;
		}

		@Override
		public Term visit(TermApplication termApplication) {
			Term head = termApplication.getHead().accept(this);
			List<Term> args = termApplication.getArguments();
			if (head instanceof TermReference) {
				int implicit = env.getImplicitArguments(((TermReference) head).getName());
				args = args.subList(Math.min(implicit, args.size()), args.size());
			}
			if (args.isEmpty()) {
				return head;
			}
			List<Term> reified = new ArrayList<>(args.size());
			for (Term arg : args) {
				reified.add(arg.accept(this));
			}
			return new TermApplication(head, reified);
		}

		@Override
		public Term visit(TermLambda termLambda) {
			return new TermLambda(termLambda.getBinder(), termLambda.getBody().accept(this));
		}

		@Override
		public Term visit(TermMeta termMeta) {
			return termMeta;
		}

		@Override
		public Term visit(TermEvar termEvar) {
			return termEvar;
		}

		@Override
		public Term visit(TermNumber termNumber) {
			return termNumber;
		}

		@Override
		public Term visit(TermNotation termNotation) {
			List<Term> args = new ArrayList<>();
			for (Term arg : termNotation.getArguments()) {
				args.add(arg.accept(this));
			}
			return new TermNotation(termNotation.getKey(), args);
		}

		@Override
		public Term visit(TermDelimited termDelimited) {
			return new TermDelimited(termDelimited.getScope(), termDelimited.getInner().accept(this));
		}
	}
}
