package mixfix.library;

/**
 * A piece of process-wide state that the library can snapshot and restore, e.g. around a section.
 *
 * @param <S> the type of a snapshot
 */
public interface Summary<S> {

	S freeze();

	void unfreeze(S frozen);

	/**
	 * Resets to the state of a fresh session.
	 */
	void init();
}
