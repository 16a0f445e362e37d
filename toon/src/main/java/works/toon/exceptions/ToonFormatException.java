package works.toon.exceptions;

/**
 * The input text is not a valid TOON document.
 * <p>
 * The message of every subtype starts with the offending line number, when it's known.
 */
public sealed abstract class ToonFormatException extends ToonException permits
	ToonSyntaxException,
	SchemaMismatchException,
	CellTypeException
{
	private final int lineNumber;
	private final String detail;

	protected ToonFormatException(int lineNumber, String message) {
		super(withLineNumber(lineNumber, message));
		this.lineNumber = lineNumber;
		this.detail = message;
	}

	protected ToonFormatException(int lineNumber, String message, Throwable cause) {
		super(withLineNumber(lineNumber, message), cause);
		this.lineNumber = lineNumber;
		this.detail = message;
	}

	/**
	 * @return the 1-based line on which the problem was found, or zero if unknown
	 */
	public int lineNumber() {
		return lineNumber;
	}

	/**
	 * @return the message without the line number
	 */
	public String detail() {
		return detail;
	}

	private static String withLineNumber(int lineNumber, String message) {
		return (lineNumber > 0) ? "Line " + lineNumber + ": " + message : message;
	}
}
