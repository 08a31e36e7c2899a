package mixfix.trans.extension;

import mixfix.printer.PrintRule;

import java.util.Collections;
import java.util.List;

public class PrintRuleObject extends ExtensionObject {
	private final List<PrintRule> rules;

	public PrintRuleObject(List<PrintRule> rules) {
		this.rules = Collections.unmodifiableList(rules);
	}

	public List<PrintRule> getRules() {
		return rules;
	}

	@Override
	public <T, E extends Throwable> T accept(ExtensionObjectVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return rules.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return rules.equals(((PrintRuleObject) obj).rules);
	}

	@Override
	public String toString() {
		return "syntax " + rules;
	}
}
