package mixfix;

import mixfix.elaborator.DefaultElaborator;
import mixfix.elaborator.Elaborator;
import mixfix.elaborator.GlobalEnvironment;
import mixfix.grammar.EntryTable;
import mixfix.grammar.GrammarEngine;
import mixfix.grammar.ParsingError;
import mixfix.grammar.ParsingIssue;
import mixfix.grammar.PrattGrammarEngine;
import mixfix.library.Library;
import mixfix.library.Summary;
import mixfix.model.notation.PrecedenceLevel;
import mixfix.model.term.Term;
import mixfix.printer.NotationPrinter;
import mixfix.printer.PrinterTable;
import mixfix.scope.ScopeRegistry;
import mixfix.trans.NotationCompiler;
import mixfix.trans.extension.ExtensionLifecycle;

import java.util.Arrays;
import java.util.Collections;
import java.util.logging.Logger;

/**
 * All process-wide state of the notation subsystem, wired together. Components receive the pieces they need by
 * reference; nothing here is static.
 */
public class MixfixSession {

	private static final Logger logger = Logger.getLogger("Mixfix Notations");

	private final MixfixOptions options;
	private final EntryTable entryTable;
	private final GrammarEngine grammar;
	private final PrinterTable printerTable;
	private final ScopeRegistry registry;
	private final GlobalEnvironment environment;
	private final Elaborator elaborator;
	private final ExtensionLifecycle lifecycle;
	private final Library library;
	private final NotationPrinter printer;
	private final NotationCompiler compiler;

	public MixfixSession(MixfixOptions options) {
		this.options = options;
		this.entryTable = new EntryTable(options.universe, options.entryNames);
		this.grammar = new PrattGrammarEngine(entryTable);
		this.printerTable = new PrinterTable();
		this.registry = new ScopeRegistry(options.defaultScope);
		this.environment = new GlobalEnvironment();
		this.elaborator = new DefaultElaborator(registry);
		this.lifecycle = new ExtensionLifecycle(grammar, printerTable, registry);
		this.library = new Library(lifecycle, environment,
				Arrays.<Summary<?>>asList(grammar, printerTable, registry));
		this.printer = new NotationPrinter(options.universe, printerTable, registry, environment, elaborator,
				options.compactSymbols);
		this.compiler = new NotationCompiler(this);
		logger.fine("started session with default scope " + options.defaultScope);
	}

	public MixfixSession() {
		this(MixfixOptions.defaults());
	}

	public MixfixOptions getOptions() {
		return options;
	}

	public EntryTable getEntryTable() {
		return entryTable;
	}

	public GrammarEngine getGrammar() {
		return grammar;
	}

	public PrinterTable getPrinterTable() {
		return printerTable;
	}

	public ScopeRegistry getRegistry() {
		return registry;
	}

	public GlobalEnvironment getEnvironment() {
		return environment;
	}

	public Elaborator getElaborator() {
		return elaborator;
	}

	public ExtensionLifecycle getLifecycle() {
		return lifecycle;
	}

	public Library getLibrary() {
		return library;
	}

	public NotationPrinter getPrinter() {
		return printer;
	}

	public NotationCompiler getCompiler() {
		return compiler;
	}

	/**
	 * Parses a term with the current grammar, at the loosest level.
	 *
	 * @throws ParsingIssue if the text is not a term
	 */
	public Term parse(String text) {
		return parse(entryTable.entryForLevel(PrecedenceLevel.MAX_LEVEL), text);
	}

	public Term parsePattern(String text) {
		return parse(entryTable.getPatternEntry(), text);
	}

	private Term parse(String entry, String text) {
		try {
			return grammar.parse(entryTable.getUniverse(), entry, text);
		} catch (ParsingError e) {
			throw new ParsingIssue(text, e);
		}
	}

	public Term elaborate(Term term) {
		return elaborator.elaborate(environment, Collections.emptyList(), term);
	}

	/**
	 * Parses and elaborates a term.
	 */
	public Term read(String text) {
		return elaborate(parse(text));
	}

	public String print(Term resolved) {
		return printer.print(resolved);
	}
}
