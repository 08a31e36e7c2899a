package mixfix.library;

import mixfix.model.term.QualifiedName;

import java.util.*;

/**
 * What a functor instantiation does to names: each mapped module path is replaced by another. When several mapped
 * paths prefix a name, the longest one applies.
 */
public class ModuleSubstitution {
	private final Map<List<String>, List<String>> mappings;

	private ModuleSubstitution(Map<List<String>, List<String>> mappings) {
		this.mappings = mappings;
	}

	public static ModuleSubstitution identity() {
		return new ModuleSubstitution(Collections.emptyMap());
	}

	public static ModuleSubstitution of(String from, String to) {
		return identity().and(from, to);
	}

	public ModuleSubstitution and(String from, String to) {
		Map<List<String>, List<String>> result = new LinkedHashMap<>(mappings);
		result.put(Arrays.asList(from.split("\\.")), Arrays.asList(to.split("\\.")));
		return new ModuleSubstitution(result);
	}

	public Map<List<String>, List<String>> getMappings() {
		return Collections.unmodifiableMap(mappings);
	}

	public QualifiedName apply(QualifiedName name) {
		List<String> best = null;
		for (List<String> from : mappings.keySet()) {
			if (name.isInModule(from) && (best == null || from.size() > best.size())) {
				best = from;
			}
		}
		if (best == null) {
			return name;
		}
		return name.replaceModulePrefix(best, mappings.get(best));
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("[");
		boolean first = true;
		for (Map.Entry<List<String>, List<String>> mapping : mappings.entrySet()) {
			if (!first) {
				sb.append(", ");
			}
			first = false;
			sb.append(String.join(".", mapping.getKey())).append(" := ").append(String.join(".", mapping.getValue()));
		}
		return sb.append("]").toString();
	}
}
