package works.toon.exceptions;

/**
 * Base of everything the codec throws on account of its input.
 * All subtypes are unchecked: decoding is all-or-nothing,
 * and there is nothing a caller could do to recover a partial result.
 */
public sealed abstract class ToonException extends RuntimeException permits ToonFormatException, EncodingInvariantException {
	protected ToonException(String message) {
		super(message);
	}

	protected ToonException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * @return an exception of the same type as {@code exception}
	 * whose message is prefixed by {@code context}.
	 * For {@link ToonFormatException}s, the line number stays at the front.
	 */
	@SuppressWarnings("unchecked")
	public static <T extends ToonException> T wrap(T exception, String context) {
		if (exception instanceof ToonFormatException f) {
			String newDetail = context + ": " + f.detail();
			if (f instanceof ToonSyntaxException e) {
				return (T) new ToonSyntaxException(e.lineNumber(), newDetail, e);
			} else if (f instanceof SchemaMismatchException e) {
				return (T) new SchemaMismatchException(e.lineNumber(), newDetail, e);
			} else if (f instanceof CellTypeException e) {
				return (T) new CellTypeException(e.lineNumber(), newDetail, e);
			}
		} else if (exception instanceof EncodingInvariantException e) {
			return (T) new EncodingInvariantException(context + ": " + e.getMessage(), e);
		}
		throw new IllegalStateException("Unexpected exception type", exception);
	}
}
