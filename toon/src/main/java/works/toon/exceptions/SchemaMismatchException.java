package works.toon.exceptions;

/**
 * The declared shape of an array disagrees with its contents:
 * the length in the header differs from the number of rows or elements,
 * a row has the wrong number of cells,
 * or a table names the same column twice.
 */
public final class SchemaMismatchException extends ToonFormatException {
	public SchemaMismatchException(int lineNumber, String message) {
		super(lineNumber, message);
	}

	SchemaMismatchException(int lineNumber, String message, Throwable cause) {
		super(lineNumber, message, cause);
	}
}
