package works.toon.exceptions;

/**
 * A table cell doesn't conform to the type its column was given by the table's first row.
 */
public final class CellTypeException extends ToonFormatException {
	public CellTypeException(int lineNumber, String message) {
		super(lineNumber, message);
	}

	CellTypeException(int lineNumber, String message, Throwable cause) {
		super(lineNumber, message, cause);
	}
}
