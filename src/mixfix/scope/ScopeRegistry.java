package mixfix.scope;

import mixfix.library.Summary;
import mixfix.model.notation.DelimiterPair;
import mixfix.model.notation.NotationDescriptor;
import mixfix.model.notation.NotationPrecedence;
import mixfix.model.term.Term;

import java.util.*;
import java.util.logging.Logger;

/**
 * <p>
 * Process-wide record of which notations and delimiters are declared in which scope, and of which scopes are
 * open for interpretation. It is what makes registration idempotent: a notation is identified by its
 * {@link NotationSignature} within a scope.
 * </p>
 *
 * <p>
 * The default scope is always open. Other scopes are opened and closed in stack order; lookups search the
 * innermost scope first.
 * </p>
 */
public class ScopeRegistry implements Summary<ScopeRegistry.Snapshot> {

	private static final Logger logger = Logger.getLogger("Mixfix Notations");

	private final String defaultScope;
	private Map<String, NotationScope> scopes;
	private Deque<String> openScopes;

	public static class Snapshot {
		private final Map<String, NotationScope> scopes;
		private final Deque<String> openScopes;

		private Snapshot(Map<String, NotationScope> scopes, Deque<String> openScopes) {
			this.scopes = scopes;
			this.openScopes = openScopes;
		}
	}

	public ScopeRegistry(String defaultScope) {
		this.defaultScope = defaultScope;
		init();
	}

	public String getDefaultScope() {
		return defaultScope;
	}

	@Override
	public void init() {
		scopes = new LinkedHashMap<>();
		openScopes = new ArrayDeque<>();
		declareScope(defaultScope);
	}

	@Override
	public Snapshot freeze() {
		return new Snapshot(copyScopes(scopes), new ArrayDeque<>(openScopes));
	}

	@Override
	public void unfreeze(Snapshot frozen) {
		scopes = copyScopes(frozen.scopes);
		openScopes = new ArrayDeque<>(frozen.openScopes);
	}

	private static Map<String, NotationScope> copyScopes(Map<String, NotationScope> from) {
		Map<String, NotationScope> result = new LinkedHashMap<>();
		for (Map.Entry<String, NotationScope> entry : from.entrySet()) {
			result.put(entry.getKey(), entry.getValue().copy());
		}
		return result;
	}

	public NotationScope declareScope(String name) {
		NotationScope scope = scopes.get(name);
		if (scope == null) {
			scope = new NotationScope(name);
			scopes.put(name, scope);
			logger.fine("declared scope " + name);
		}
		return scope;
	}

	public boolean scopeExists(String name) {
		return scopes.containsKey(name);
	}

	public Optional<NotationScope> getScope(String name) {
		return Optional.ofNullable(scopes.get(name));
	}

	/**
	 * @return whether {@code scope} already interprets the notation with this signature as {@code interpretation}
	 */
	public boolean existsNotationInScope(String scope, NotationPrecedence precedence, String key,
	                                     Term interpretation) {
		NotationScope s = scopes.get(scope);
		if (s == null || !s.hasSignature(new NotationSignature(precedence, key))) {
			return false;
		}
		Optional<NotationDescriptor> existing = s.getInterpretation(key);
		return existing.isPresent() && existing.get().getInterpretation().equals(interpretation);
	}

	/**
	 * @return whether any scope has a notation with this signature, i.e. its grammar rule is already installed
	 */
	public boolean existsNotation(NotationPrecedence precedence, String key) {
		NotationSignature signature = new NotationSignature(precedence, key);
		for (NotationScope scope : scopes.values()) {
			if (scope.hasSignature(signature)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Records a notation's interpretation in its scope.
	 *
	 * @return the descriptor now canonical for this notation: an identical one declared earlier if there is one,
	 * otherwise {@code descriptor}
	 */
	public NotationDescriptor declareNotation(NotationDescriptor descriptor) {
		NotationScope scope = declareScope(descriptor.getScope());
		Optional<NotationDescriptor> existing = scope.getInterpretation(descriptor.getKey());
		if (existing.isPresent()) {
			NotationDescriptor old = existing.get();
			if (old.getPrecedence().equals(descriptor.getPrecedence()) &&
					old.getInterpretation().equals(descriptor.getInterpretation())) {
				logger.fine("notation \"" + descriptor.getKey() + "\" is already declared in " + scope.getName());
				return old;
			}
			logger.warning("notation \"" + descriptor.getKey() + "\" was already used in scope " +
					scope.getName() + ", overriding its interpretation");
		}
		scope.put(descriptor);
		return descriptor;
	}

	/**
	 * Validates a delimiter declaration without changing anything.
	 *
	 * @return true if exactly these delimiters are already declared for the scope
	 * @throws EmptyDelimiterIssue if either delimiter is empty
	 * @throws DelimitersAlreadyDeclaredIssue if the scope has different delimiters
	 */
	public boolean checkDelimiters(String scope, DelimiterPair pair) {
		if (pair.isEmpty()) {
			throw new EmptyDelimiterIssue(scope);
		}
		NotationScope s = scopes.get(scope);
		if (s == null || !s.getDelimiters().isPresent()) {
			return false;
		}
		DelimiterPair existing = s.getDelimiters().get();
		if (existing.equals(pair)) {
			return true;
		}
		throw new DelimitersAlreadyDeclaredIssue(scope, existing, pair);
	}

	public void declareDelimiters(String scope, DelimiterPair pair) {
		if (checkDelimiters(scope, pair)) {
			logger.fine("delimiters " + pair + " are already declared for " + scope);
			return;
		}
		declareScope(scope).setDelimiters(pair);
	}

	public Optional<DelimiterPair> getDelimiters(String scope) {
		NotationScope s = scopes.get(scope);
		return s == null ? Optional.empty() : s.getDelimiters();
	}

	public void openScope(String name) {
		declareScope(name);
		openScopes.push(name);
	}

	public void closeScope(String name) {
		if (!openScopes.remove(name)) {
			logger.warning("scope " + name + " is not open");
		}
	}

	public boolean isOpen(String name) {
		return defaultScope.equals(name) || openScopes.contains(name);
	}

	/**
	 * @return the open scopes, innermost first, ending with the default scope
	 */
	public List<String> getOpenScopes() {
		List<String> result = new ArrayList<>(openScopes);
		result.removeIf(defaultScope::equals);
		result.add(defaultScope);
		return result;
	}

	/**
	 * Finds the interpretation of a notation key, searching {@code extraScopes} (innermost first) before the open
	 * scopes.
	 *
	 * @throws UnknownNotationIssue if no searched scope has the key
	 */
	public NotationDescriptor interpretNotation(String key, List<String> extraScopes) {
		List<String> searched = new ArrayList<>(extraScopes);
		for (String scope : getOpenScopes()) {
			if (!searched.contains(scope)) {
				searched.add(scope);
			}
		}
		for (String scope : searched) {
			NotationScope s = scopes.get(scope);
			if (s != null) {
				Optional<NotationDescriptor> found = s.getInterpretation(key);
				if (found.isPresent()) {
					return found.get();
				}
			}
		}
		throw new UnknownNotationIssue(key, searched);
	}
}
