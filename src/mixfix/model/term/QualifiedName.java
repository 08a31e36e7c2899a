package mixfix.model.term;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The full name of a global constant: the path of the module that defines it followed by its base name.
 */
public class QualifiedName {
	private final List<String> modulePath;
	private final String base;

	public QualifiedName(List<String> modulePath, String base) {
		this.modulePath = Collections.unmodifiableList(new ArrayList<>(modulePath));
		this.base = base;
	}

	public static QualifiedName parse(String dotted) {
		List<String> parts = Arrays.asList(dotted.split("\\."));
		return new QualifiedName(parts.subList(0, parts.size() - 1), parts.get(parts.size() - 1));
	}

	public List<String> getModulePath() {
		return modulePath;
	}

	public String getBase() {
		return base;
	}

	/**
	 * @return whether {@code suffix}, written as dotted components, names this constant from some enclosing module
	 */
	public boolean hasSuffix(List<String> suffix) {
		List<String> all = components();
		if (suffix.size() > all.size()) {
			return false;
		}
		return all.subList(all.size() - suffix.size(), all.size()).equals(suffix);
	}

	public List<String> components() {
		List<String> all = new ArrayList<>(modulePath);
		all.add(base);
		return all;
	}

	public boolean isInModule(List<String> path) {
		return modulePath.size() >= path.size() && modulePath.subList(0, path.size()).equals(path);
	}

	public QualifiedName replaceModulePrefix(List<String> from, List<String> to) {
		List<String> path = new ArrayList<>(to);
		path.addAll(modulePath.subList(from.size(), modulePath.size()));
		return new QualifiedName(path, base);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + base.hashCode();
		result = prime * result + modulePath.hashCode();
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		QualifiedName other = (QualifiedName) obj;
		return base.equals(other.base) && modulePath.equals(other.modulePath);
	}

	@Override
	public String toString() {
		return String.join(".", components());
	}
}
