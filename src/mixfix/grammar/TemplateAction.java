package mixfix.grammar;

import mixfix.model.term.ModuleSubstitutionVisitor;
import mixfix.model.term.PatternInstantiationVisitor;
import mixfix.model.term.Term;

import java.util.List;

/**
 * The action of a hand-written grammar rule: a term in which {@code $eN} stands for the N-th non-terminal.
 */
public class TemplateAction extends ProductionAction {
	private final Term template;

	public TemplateAction(Term template) {
		this.template = template;
	}

	public Term getTemplate() {
		return template;
	}

	@Override
	public Term apply(List<Term> holes) {
		return PatternInstantiationVisitor.instantiate(template, holes);
	}

	@Override
	public ProductionAction substitute(ModuleSubstitutionVisitor substitution) {
		Term substituted = template.accept(substitution);
		return substituted == template ? this : new TemplateAction(substituted);
	}

	@Override
	public int hashCode() {
		return template.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return template.equals(((TemplateAction) obj).template);
	}

	@Override
	public String toString() {
		return template.toString();
	}
}
