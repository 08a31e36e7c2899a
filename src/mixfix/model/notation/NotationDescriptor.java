package mixfix.model.notation;

import mixfix.grammar.GrammarCommand;
import mixfix.model.term.ModuleSubstitutionVisitor;
import mixfix.model.term.Term;
import mixfix.printer.PrintRule;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything a notation declaration compiles to. The interpretation is the elaborated example term with one
 * {@code $eN} per hole; the display pattern is its reified form, which the printing rule matches against.
 */
public class NotationDescriptor {
	private final String scope;
	private final int level;
	private final Associativity associativity;
	private final List<NotationSymbol> symbols;
	private final Term interpretation;
	private final Term displayPattern;
	private final GrammarCommand grammarCommand;
	private final PrintRule printRule;
	private final String key;
	private final NotationPrecedence precedence;

	public NotationDescriptor(String scope, int level, Associativity associativity, List<NotationSymbol> symbols,
	                          Term interpretation, Term displayPattern, GrammarCommand grammarCommand,
	                          PrintRule printRule, String key, NotationPrecedence precedence) {
		this.scope = scope;
		this.level = level;
		this.associativity = associativity;
		this.symbols = Collections.unmodifiableList(symbols);
		this.interpretation = interpretation;
		this.displayPattern = displayPattern;
		this.grammarCommand = grammarCommand;
		this.printRule = printRule;
		this.key = key;
		this.precedence = precedence;
	}

	public String getScope() {
		return scope;
	}

	public int getLevel() {
		return level;
	}

	public Associativity getAssociativity() {
		return associativity;
	}

	public List<NotationSymbol> getSymbols() {
		return symbols;
	}

	public Term getInterpretation() {
		return interpretation;
	}

	public Term getDisplayPattern() {
		return displayPattern;
	}

	public GrammarCommand getGrammarCommand() {
		return grammarCommand;
	}

	public PrintRule getPrintRule() {
		return printRule;
	}

	public String getKey() {
		return key;
	}

	public NotationPrecedence getPrecedence() {
		return precedence;
	}

	/**
	 * @return this descriptor with every resolved reference rewritten, or this very instance if none change
	 */
	public NotationDescriptor substitute(ModuleSubstitutionVisitor substitution) {
		Term newInterpretation = interpretation.accept(substitution);
		Term newDisplay = displayPattern.accept(substitution);
		GrammarCommand newCommand = grammarCommand.substitute(substitution);
		PrintRule newRule = printRule.substitute(substitution);
		if (newInterpretation == interpretation && newDisplay == displayPattern && newCommand == grammarCommand &&
				newRule == printRule) {
			return this;
		}
		return new NotationDescriptor(scope, level, associativity, symbols, newInterpretation, newDisplay,
				newCommand, newRule, key, precedence);
	}

	@Override
	public int hashCode() {
		return Objects.hash(scope, level, associativity, symbols, interpretation, displayPattern, grammarCommand,
				printRule, key, precedence);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		NotationDescriptor other = (NotationDescriptor) obj;
		return level == other.level && scope.equals(other.scope) && associativity == other.associativity &&
				symbols.equals(other.symbols) && interpretation.equals(other.interpretation) &&
				displayPattern.equals(other.displayPattern) && grammarCommand.equals(other.grammarCommand) &&
				printRule.equals(other.printRule) && key.equals(other.key) && precedence.equals(other.precedence);
	}

	@Override
	public String toString() {
		return "notation \"" + key + "\" in " + scope + " (" + precedence + ") := " + interpretation;
	}
}
