package works.toon.exceptions;

/**
 * The encoder found a structure that contradicts a decision it already made,
 * like a row that doesn't match the header of the table being emitted.
 * <p>
 * This does not indicate a problem with the value being encoded.
 * A correctly written encoder would not throw this exception.
 */
public final class EncodingInvariantException extends ToonException {
	public EncodingInvariantException(String message) {
		super(message);
	}

	EncodingInvariantException(String message, Throwable cause) {
		super(message, cause);
	}
}
