package works.toon.exceptions;

/**
 * A line can't be parsed: malformed header, bad indentation, unterminated quote, and so on.
 */
public final class ToonSyntaxException extends ToonFormatException {
	public ToonSyntaxException(int lineNumber, String message) {
		super(lineNumber, message);
	}

	ToonSyntaxException(int lineNumber, String message, Throwable cause) {
		super(lineNumber, message, cause);
	}
}
