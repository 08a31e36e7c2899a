package mixfix.trans.extension;

import mixfix.grammar.GrammarCommand;

import java.util.Collections;
import java.util.List;

/**
 * Hand-written grammar extensions, installed all together.
 */
public class GrammarRuleObject extends ExtensionObject {
	private final List<GrammarCommand> commands;

	public GrammarRuleObject(List<GrammarCommand> commands) {
		this.commands = Collections.unmodifiableList(commands);
	}

	public List<GrammarCommand> getCommands() {
		return commands;
	}

	@Override
	public <T, E extends Throwable> T accept(ExtensionObjectVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return commands.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return commands.equals(((GrammarRuleObject) obj).commands);
	}

	@Override
	public String toString() {
		return "grammar " + commands;
	}
}
