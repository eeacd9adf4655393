package works.bsonic.exceptions;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The location of a value within a nested document, rendered as
 * dot-separated field names and bracketed array indices, like {@code two.value} or {@code items[3].name}.
 */
public record ErrorPath(List<Segment> segments) {
	public ErrorPath {
		segments = List.copyOf(segments);
	}

	public sealed interface Segment permits Field, Index { }

	public record Field(String name) implements Segment {
		public Field {
			requireNonNull(name);
		}
	}

	public record Index(int index) implements Segment { }

	public static ErrorPath of(Segment segment) {
		return new ErrorPath(List.of(segment));
	}

	public ErrorPath prepend(Segment segment) {
		List<Segment> result = new ArrayList<>(segments.size() + 1);
		result.add(segment);
		result.addAll(segments);
		return new ErrorPath(result);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Segment segment : segments) {
			if (segment instanceof Field f) {
				if (!sb.isEmpty()) {
					sb.append('.');
				}
				sb.append(f.name());
			} else if (segment instanceof Index i) {
				sb.append('[').append(i.index()).append(']');
			}
		}
		return sb.toString();
	}
}
