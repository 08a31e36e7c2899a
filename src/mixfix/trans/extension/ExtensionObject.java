package mixfix.trans.extension;

/**
 * A unit of syntax registration, as stored by the library and replayed through an {@link ExtensionLifecycle}.
 */
public abstract class ExtensionObject {

	public abstract <T, E extends Throwable> T accept(ExtensionObjectVisitor<T, E> v) throws E;

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);
}
