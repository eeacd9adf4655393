package works.bsonic.types;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import works.bsonic.exceptions.BsonConversionException;
import works.bsonic.spec.ElementType;

/**
 * A UTC instant with millisecond precision, stored as signed milliseconds since the Unix epoch.
 * <p>
 * Every {@code long} is a valid value, including those far outside the range
 * a calendar can display; such values round-trip through bytes unchanged
 * even though {@link #tryToRfc3339String()} rejects them.
 */
public record DateTime(long millis) implements Bson, Comparable<DateTime> {
	public static final DateTime MIN = new DateTime(Long.MIN_VALUE);
	public static final DateTime MAX = new DateTime(Long.MAX_VALUE);

	private static final long MIN_RFC3339_MILLIS = OffsetDateTime.of(0, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC).toInstant().toEpochMilli();
	private static final long MAX_RFC3339_MILLIS = OffsetDateTime.of(9999, 12, 31, 23, 59, 59, 999_000_000, ZoneOffset.UTC).toInstant().toEpochMilli();

	public static DateTime fromMillis(long millis) {
		return new DateTime(millis);
	}

	public static DateTime now() {
		return new DateTime(System.currentTimeMillis());
	}

	/**
	 * Truncates to milliseconds. Instants beyond the range of {@code long} milliseconds
	 * saturate to {@link #MIN} or {@link #MAX}.
	 */
	public static DateTime fromInstant(Instant instant) {
		Instant truncated = instant.truncatedTo(ChronoUnit.MILLIS);
		try {
			return new DateTime(truncated.toEpochMilli());
		} catch (ArithmeticException e) {
			return instant.isBefore(Instant.EPOCH) ? MIN : MAX;
		}
	}

	/**
	 * Always exact: {@link Instant} covers a wider range than {@code long} milliseconds.
	 */
	public Instant toInstant() {
		return Instant.ofEpochMilli(millis);
	}

	/**
	 * @throws BsonConversionException if the year is outside 0000 to 9999,
	 * which RFC 3339 cannot express
	 */
	public String tryToRfc3339String() {
		if (millis < MIN_RFC3339_MILLIS || millis > MAX_RFC3339_MILLIS) {
			throw new BsonConversionException("DateTime " + millis + "ms is outside the range representable in RFC 3339");
		}
		return DateTimeFormatter.ISO_INSTANT.format(toInstant());
	}

	/**
	 * Accepts any RFC 3339 offset. Sub-millisecond precision is truncated.
	 */
	public static DateTime parseRfc3339(String text) {
		OffsetDateTime parsed;
		try {
			parsed = OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
		} catch (DateTimeParseException e) {
			throw new BsonConversionException("Not an RFC 3339 date-time: \"" + text + "\"", e);
		}
		return fromInstant(parsed.toInstant());
	}

	@Override
	public int compareTo(DateTime other) {
		return Long.compare(millis, other.millis);
	}

	@Override
	public ElementType elementType() {
		return ElementType.DATE_TIME;
	}

	@Override
	public String toString() {
		if (millis >= MIN_RFC3339_MILLIS && millis <= MAX_RFC3339_MILLIS) {
			return "DateTime(\"" + tryToRfc3339String() + "\")";
		} else {
			return "DateTime(" + millis + "ms)";
		}
	}
}
