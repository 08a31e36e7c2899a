package mixfix.trans.extension;

import mixfix.model.notation.NotationDescriptor;

/**
 * A compiled notation: its grammar rule, printing rule and interpretation travel together.
 */
public class NotationBundle extends ExtensionObject {
	private final NotationDescriptor descriptor;

	public NotationBundle(NotationDescriptor descriptor) {
		this.descriptor = descriptor;
	}

	public NotationDescriptor getDescriptor() {
		return descriptor;
	}

	@Override
	public <T, E extends Throwable> T accept(ExtensionObjectVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return descriptor.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		return descriptor.equals(((NotationBundle) obj).descriptor);
	}

	@Override
	public String toString() {
		return descriptor.toString();
	}
}
