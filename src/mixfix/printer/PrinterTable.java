package mixfix.printer;

import mixfix.library.Summary;
import mixfix.model.notation.DelimiterPair;

import java.util.*;
import java.util.logging.Logger;

/**
 * The printing rules of every universe, newest last, and the delimiters the printer may wrap a notation in when
 * its scope is closed.
 */
public class PrinterTable implements Summary<PrinterTable.Snapshot> {

	private static final Logger logger = Logger.getLogger("Mixfix Notations");

	private Map<String, List<PrintRule>> rules;
	private Map<String, DelimiterPair> delimiters;

	public static class Snapshot {
		private final Map<String, List<PrintRule>> rules;
		private final Map<String, DelimiterPair> delimiters;

		private Snapshot(Map<String, List<PrintRule>> rules, Map<String, DelimiterPair> delimiters) {
			this.rules = rules;
			this.delimiters = delimiters;
		}
	}

	public PrinterTable() {
		init();
	}

	@Override
	public void init() {
		rules = new HashMap<>();
		delimiters = new HashMap<>();
	}

	@Override
	public Snapshot freeze() {
		return new Snapshot(copyRules(rules), new HashMap<>(delimiters));
	}

	@Override
	public void unfreeze(Snapshot frozen) {
		rules = copyRules(frozen.rules);
		delimiters = new HashMap<>(frozen.delimiters);
	}

	private static Map<String, List<PrintRule>> copyRules(Map<String, List<PrintRule>> from) {
		Map<String, List<PrintRule>> result = new HashMap<>();
		for (Map.Entry<String, List<PrintRule>> entry : from.entrySet()) {
			result.put(entry.getKey(), new ArrayList<>(entry.getValue()));
		}
		return result;
	}

	public void addRule(PrintRule rule) {
		rules.computeIfAbsent(rule.getUniverse(), u -> new ArrayList<>()).add(rule);
		logger.fine("added printing rule " + rule.getName());
	}

	public boolean hasRule(PrintRule rule) {
		return rules.getOrDefault(rule.getUniverse(), Collections.emptyList()).contains(rule);
	}

	/**
	 * @return the rules of a universe, most recently added first
	 */
	public List<PrintRule> getRules(String universe) {
		List<PrintRule> result = new ArrayList<>(rules.getOrDefault(universe, Collections.emptyList()));
		Collections.reverse(result);
		return result;
	}

	public void addDelimiters(String scope, DelimiterPair pair) {
		delimiters.put(scope, pair);
	}

	public Optional<DelimiterPair> getDelimiters(String scope) {
		return Optional.ofNullable(delimiters.get(scope));
	}
}
