package elan2py;

/**
 * A translation run that could not complete: bad paths, I/O or decoding failures, or an
 * unexpected error inside the translator.
 */
public class TranslationException extends Exception {
	public TranslationException(String message) {
		super(message);
	}

	public TranslationException(String message, Throwable cause) {
		super(message, cause);
	}
}
