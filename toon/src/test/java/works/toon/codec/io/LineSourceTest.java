package works.toon.codec.io;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.provider.MethodSource;
import works.toon.codec.AbstractLineSourceTest;
import works.toon.codec.Line;
import works.toon.codec.LineSource;
import works.toon.exceptions.ToonSyntaxException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@ParameterizedClass
@MethodSource("sourceSuppliers")
class LineSourceTest extends AbstractLineSourceTest {

	@Test
	void depthsAndNumbers() {
		assertEquals(List.of(
				new Line("a:", 0, 1),
				new Line("b:", 1, 2),
				new Line("c: 1", 2, 3),
				new Line("d: 2", 0, 4)
			),
			readAll("""
				a:
				  b:
				    c: 1
				d: 2
				"""));
	}

	@Test
	void blankAndCommentLinesAreSkippedButCounted() {
		assertEquals(List.of(
				new Line("a: 1", 0, 2),
				new Line("b: 2", 0, 5)
			),
			readAll("""

				a: 1
				    # comment
				      \s
				b: 2
				"""));
	}

	@Test
	void trailingWhitespaceIsRemoved() {
		assertEquals(List.of(new Line("a: 1", 0, 1)), readAll("a: 1   \t"));
	}

	@Test
	void indentUnitComesFromFirstIndentedLine() {
		assertEquals(List.of(
				new Line("a:", 0, 1),
				new Line("b:", 1, 2),
				new Line("c: 1", 2, 3)
			),
			readAll("a:\n   b:\n      c: 1"));
	}

	@Test
	void indentNotAMultipleOfUnit_throws() {
		try (LineSource lines = sourceFor("a:\n  b:\n     c: 1")) {
			lines.next();
			lines.next();
			ToonSyntaxException e = assertThrows(ToonSyntaxException.class, lines::next);
			assertEquals(3, e.lineNumber());
		}
	}

	@Test
	void tabInIndentation_throws() {
		try (LineSource lines = sourceFor("a:\n  \tb: 1")) {
			lines.next();
			assertThrows(ToonSyntaxException.class, lines::next);
		}
	}

	@Test
	void pushback() {
		try (LineSource lines = sourceFor("a: 1\nb: 2")) {
			Line first = lines.next();
			lines.pushback(first);
			assertThrows(IllegalStateException.class, () -> lines.pushback(first));
			assertSame(first, lines.peek());
			assertSame(first, lines.next());
			assertEquals(new Line("b: 2", 0, 2), lines.next());
			assertNull(lines.peek());
			assertNull(lines.next());
		}
	}

	private List<Line> readAll(String text) {
		List<Line> result = new ArrayList<>();
		try (LineSource lines = sourceFor(text)) {
			Line line;
			while ((line = lines.next()) != null) {
				result.add(line);
			}
		}
		return result;
	}
}
