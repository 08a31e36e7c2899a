package mixfix.elaborator;

import mixfix.model.term.QualifiedName;

import java.util.*;

/**
 * The global constants names can resolve to. A dotted name resolves to the constant whose full name it is, or
 * else to the unique constant whose full name ends with it.
 */
public class GlobalEnvironment {
	private final Map<QualifiedName, GlobalConstant> constants;

	public GlobalEnvironment() {
		this.constants = new LinkedHashMap<>();
	}

	public GlobalConstant addConstant(String dotted, int implicitArguments) {
		return addConstant(QualifiedName.parse(dotted), implicitArguments);
	}

	public GlobalConstant addConstant(QualifiedName name, int implicitArguments) {
		GlobalConstant constant = new GlobalConstant(name, implicitArguments);
		constants.put(name, constant);
		return constant;
	}

	public Optional<GlobalConstant> getConstant(QualifiedName name) {
		return Optional.ofNullable(constants.get(name));
	}

	public int getImplicitArguments(QualifiedName name) {
		GlobalConstant constant = constants.get(name);
		return constant == null ? 0 : constant.getImplicitArguments();
	}

	/**
	 * @return every constant defined in the module {@code modulePath} or its sub-modules
	 */
	public List<GlobalConstant> constantsInModule(List<String> modulePath) {
		List<GlobalConstant> result = new ArrayList<>();
		for (GlobalConstant constant : constants.values()) {
			if (constant.getName().isInModule(modulePath)) {
				result.add(constant);
			}
		}
		return result;
	}

	private List<QualifiedName> candidates(String dotted) {
		List<String> suffix = Arrays.asList(dotted.split("\\."));
		List<QualifiedName> result = new ArrayList<>();
		for (QualifiedName name : constants.keySet()) {
			if (name.hasSuffix(suffix)) {
				result.add(name);
			}
		}
		return result;
	}

	public Optional<QualifiedName> lookup(String dotted) {
		QualifiedName exact = QualifiedName.parse(dotted);
		if (constants.containsKey(exact)) {
			return Optional.of(exact);
		}
		List<QualifiedName> found = candidates(dotted);
		return found.size() == 1 ? Optional.of(found.get(0)) : Optional.empty();
	}

	/**
	 * @throws UnresolvableIdentifierIssue if the name is unknown or ambiguous
	 */
	public QualifiedName resolve(String dotted) {
		Optional<QualifiedName> found = lookup(dotted);
		if (found.isPresent()) {
			return found.get();
		}
		throw new UnresolvableIdentifierIssue(dotted, candidates(dotted));
	}

	/**
	 * @return the shortest suffix of {@code name} that resolves back to it
	 */
	public String shortestUnambiguousName(QualifiedName name) {
		List<String> components = name.components();
		for (int i = components.size() - 1; i >= 0; --i) {
			String candidate = String.join(".", components.subList(i, components.size()));
			Optional<QualifiedName> found = lookup(candidate);
			if (found.isPresent() && found.get().equals(name)) {
				return candidate;
			}
		}
		return name.toString();
	}
}
