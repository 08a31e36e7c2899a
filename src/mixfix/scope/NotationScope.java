package mixfix.scope;

import mixfix.model.notation.DelimiterPair;
import mixfix.model.notation.NotationDescriptor;

import java.util.*;

/**
 * A named bucket of notations sharing a display style, with at most one pair of delimiters.
 */
public class NotationScope {
	private final String name;
	private final Map<String, NotationDescriptor> interpretations;
	private final Set<NotationSignature> signatures;
	private DelimiterPair delimiters;

	public NotationScope(String name) {
		this.name = name;
		this.interpretations = new LinkedHashMap<>();
		this.signatures = new HashSet<>();
	}

	public String getName() {
		return name;
	}

	public Optional<NotationDescriptor> getInterpretation(String key) {
		return Optional.ofNullable(interpretations.get(key));
	}

	public Collection<NotationDescriptor> getInterpretations() {
		return Collections.unmodifiableCollection(interpretations.values());
	}

	public boolean hasSignature(NotationSignature signature) {
		return signatures.contains(signature);
	}

	void put(NotationDescriptor descriptor) {
		interpretations.put(descriptor.getKey(), descriptor);
		signatures.add(new NotationSignature(descriptor.getPrecedence(), descriptor.getKey()));
	}

	public Optional<DelimiterPair> getDelimiters() {
		return Optional.ofNullable(delimiters);
	}

	void setDelimiters(DelimiterPair delimiters) {
		this.delimiters = delimiters;
	}

	NotationScope copy() {
		NotationScope result = new NotationScope(name);
		result.interpretations.putAll(interpretations);
		result.signatures.addAll(signatures);
		result.delimiters = delimiters;
		return result;
	}
}
