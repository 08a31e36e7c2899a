package mixfix.library;

/**
 * What becomes of a library object when the functor defining it is instantiated.
 */
public enum ObjectClassification {
	SUBSTITUTE,
	KEEP,
	DISPOSE,
}
