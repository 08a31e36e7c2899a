package mixfix.trans.extension;

import mixfix.grammar.EntryKind;
import mixfix.grammar.GrammarCommand;
import mixfix.grammar.GrammarEngine;
import mixfix.grammar.GrammarEntry;
import mixfix.grammar.NonExtensibleEntryIssue;
import mixfix.library.ModuleSubstitution;
import mixfix.library.ObjectClassification;
import mixfix.model.notation.NotationDescriptor;
import mixfix.model.term.ModuleSubstitutionVisitor;
import mixfix.printer.PrintRule;
import mixfix.printer.PrinterTable;
import mixfix.scope.ScopeRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * <p>
 * The operations the library performs on extension objects.
 * </p>
 *
 * <ul>
 *     <li>{@link #load} only declares scopes, at any depth.</li>
 *     <li>{@link #open} installs grammar, tokens and printing rules, and only at depth 1.</li>
 *     <li>{@link #cache} is a first load and open.</li>
 *     <li>{@link #subst} rewrites resolved names without installing anything.</li>
 * </ul>
 *
 * <p>
 * Opening is idempotent. Everything that can fail is checked before anything is installed. Only hand-written
 * grammar rules are restricted to extensible entries; notations and delimiters extend the entries they were
 * compiled for.
 * </p>
 */
public class ExtensionLifecycle {

	private static final Logger logger = Logger.getLogger("Mixfix Notations");

	private final GrammarEngine engine;
	private final PrinterTable printer;
	private final ScopeRegistry registry;

	public ExtensionLifecycle(GrammarEngine engine, PrinterTable printer, ScopeRegistry registry) {
		this.engine = engine;
		this.printer = printer;
		this.registry = registry;
	}

	public void load(int depth, ExtensionObject obj) {
		obj.accept(new LoadVisitor());
	}

	public void open(int depth, ExtensionObject obj) {
		if (depth == 1) {
			obj.accept(new OpenVisitor());
		}
	}

	public void cache(ExtensionObject obj) {
		load(1, obj);
		open(1, obj);
	}

	public ExtensionObject subst(ModuleSubstitution substitution, ExtensionObject obj) {
		return obj.accept(new SubstitutionVisitor(new ModuleSubstitutionVisitor(substitution)));
	}

	public Optional<ExtensionObject> export(ExtensionObject obj) {
		return Optional.of(obj);
	}

	public ObjectClassification classify(ExtensionObject obj) {
		return ObjectClassification.SUBSTITUTE;
	}

	private void checkExtensible(GrammarCommand command) {
		Optional<GrammarEntry> existing = engine.getEntry(command.getUniverse(), command.getEntry());
		EntryKind kind = existing.isPresent() ? existing.get().getKind() : command.getEntryKind();
		if (!kind.isExtensible()) {
			throw new NonExtensibleEntryIssue(command.getUniverse(), command.getEntry(), kind);
		}
	}

	private void extendGrammar(GrammarCommand command) {
		GrammarEntry entry = engine.getEntry(command.getUniverse(), command.getEntry()).orElseGet(() ->
				engine.createEntry(command.getUniverse(), command.getEntry(), command.getEntryKind()));
		if (engine.hasProduction(entry, command.getLevel(), command.getProduction())) {
			logger.fine("grammar already has " + command);
			return;
		}
		engine.addProduction(entry, command.getLevel(), command.getProduction());
	}

	private class LoadVisitor extends ExtensionObjectVisitor<Void, RuntimeException> {

		@Override
		public Void visit(TokenObject tokenObject) {
			return null;
		}

		@Override
		public Void visit(GrammarRuleObject grammarRuleObject) {
			return null;
		}

		@Override
		public Void visit(PrintRuleObject printRuleObject) {
			return null;
		}

		@Override
		public Void visit(NotationBundle notationBundle) {
			registry.declareScope(notationBundle.getDescriptor().getScope());
			return null;
		}

		@Override
		public Void visit(DelimiterBundle delimiterBundle) {
			registry.declareScope(delimiterBundle.getScope());
			return null;
		}
	}

	private class OpenVisitor extends ExtensionObjectVisitor<Void, RuntimeException> {

		@Override
		public Void visit(TokenObject tokenObject) {
			engine.registerToken(tokenObject.getText());
			return null;
		}

		@Override
		public Void visit(GrammarRuleObject grammarRuleObject) {
			for (GrammarCommand command : grammarRuleObject.getCommands()) {
				checkExtensible(command);
			}
			for (GrammarCommand command : grammarRuleObject.getCommands()) {
				extendGrammar(command);
			}
			return null;
		}

		@Override
		public Void visit(PrintRuleObject printRuleObject) {
			for (PrintRule rule : printRuleObject.getRules()) {
				rule.checkMetavariables();
			}
			for (PrintRule rule : printRuleObject.getRules()) {
				if (!printer.hasRule(rule)) {
					printer.addRule(rule);
				}
			}
			return null;
		}

		@Override
		public Void visit(NotationBundle notationBundle) {
			NotationDescriptor descriptor = notationBundle.getDescriptor();
			boolean inScope = registry.existsNotationInScope(descriptor.getScope(), descriptor.getPrecedence(),
					descriptor.getKey(), descriptor.getInterpretation());
			if (!inScope) {
				printer.addRule(descriptor.getPrintRule());
			}
			if (!registry.existsNotation(descriptor.getPrecedence(), descriptor.getKey())) {
				extendGrammar(descriptor.getGrammarCommand());
			}
			if (inScope) {
				logger.fine("notation \"" + descriptor.getKey() + "\" is already active in " + descriptor.getScope());
			} else {
				registry.declareNotation(descriptor);
				logger.info("installed notation \"" + descriptor.getKey() + "\" in " + descriptor.getScope());
			}
			return null;
		}

		@Override
		public Void visit(DelimiterBundle delimiterBundle) {
			if (registry.checkDelimiters(delimiterBundle.getScope(), delimiterBundle.getDelimiters())) {
				logger.fine("delimiters " + delimiterBundle.getDelimiters() + " are already declared for " +
						delimiterBundle.getScope());
				return null;
			}
			extendGrammar(delimiterBundle.getTermRule());
			extendGrammar(delimiterBundle.getPatternRule());
			printer.addDelimiters(delimiterBundle.getScope(), delimiterBundle.getDelimiters());
			registry.declareDelimiters(delimiterBundle.getScope(), delimiterBundle.getDelimiters());
			logger.info("installed delimiters " + delimiterBundle.getDelimiters() + " for " +
					delimiterBundle.getScope());
			return null;
		}
	}

	private static class SubstitutionVisitor extends ExtensionObjectVisitor<ExtensionObject, RuntimeException> {
		private final ModuleSubstitutionVisitor substitution;

		SubstitutionVisitor(ModuleSubstitutionVisitor substitution) {
			this.substitution = substitution;
		}

		@Override
		public ExtensionObject visit(TokenObject tokenObject) {
			return tokenObject;
		}

		@Override
		public ExtensionObject visit(GrammarRuleObject grammarRuleObject) {
			List<GrammarCommand> commands = new ArrayList<>();
			boolean changed = false;
			for (GrammarCommand command : grammarRuleObject.getCommands()) {
				GrammarCommand substituted = command.substitute(substitution);
				changed |= substituted != command;
				commands.add(substituted);
			}
			return changed ? new GrammarRuleObject(commands) : grammarRuleObject;
		}

		@Override
		public ExtensionObject visit(PrintRuleObject printRuleObject) {
			List<PrintRule> rules = new ArrayList<>();
			boolean changed = false;
			for (PrintRule rule : printRuleObject.getRules()) {
				PrintRule substituted = rule.substitute(substitution);
				changed |= substituted != rule;
				rules.add(substituted);
			}
			return changed ? new PrintRuleObject(rules) : printRuleObject;
		}

		@Override
		public ExtensionObject visit(NotationBundle notationBundle) {
			NotationDescriptor substituted = notationBundle.getDescriptor().substitute(substitution);
			return substituted == notationBundle.getDescriptor() ? notationBundle : new NotationBundle(substituted);
		}

		@Override
		public ExtensionObject visit(DelimiterBundle delimiterBundle) {
			GrammarCommand termRule = delimiterBundle.getTermRule().substitute(substitution);
			GrammarCommand patternRule = delimiterBundle.getPatternRule().substitute(substitution);
			if (termRule == delimiterBundle.getTermRule() && patternRule == delimiterBundle.getPatternRule()) {
				return delimiterBundle;
			}
			return new DelimiterBundle(delimiterBundle.getScope(), delimiterBundle.getDelimiters(), termRule,
					patternRule);
		}
	}
}
