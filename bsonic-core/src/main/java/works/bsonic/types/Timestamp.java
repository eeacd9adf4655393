package works.bsonic.types;

import works.bsonic.spec.ElementType;

/**
 * Internal replication timestamp: unsigned 32-bit seconds plus an unsigned 32-bit ordinal.
 * Ordered by {@code time}, then {@code increment}.
 * <p>
 * On the wire, the increment comes first.
 */
public record Timestamp(long time, long increment) implements Bson, Comparable<Timestamp> {
	private static final long MAX_U32 = 0xFFFF_FFFFL;

	public Timestamp {
		if (time < 0 || time > MAX_U32) {
			throw new IllegalArgumentException("Timestamp time out of unsigned 32-bit range: " + time);
		}
		if (increment < 0 || increment > MAX_U32) {
			throw new IllegalArgumentException("Timestamp increment out of unsigned 32-bit range: " + increment);
		}
	}

	/**
	 * Interprets the given ints as unsigned.
	 */
	public static Timestamp fromBits(int time, int increment) {
		return new Timestamp(Integer.toUnsignedLong(time), Integer.toUnsignedLong(increment));
	}

	@Override
	public int compareTo(Timestamp other) {
		int result = Long.compare(time, other.time);
		return result != 0 ? result : Long.compare(increment, other.increment);
	}

	@Override
	public ElementType elementType() {
		return ElementType.TIMESTAMP;
	}
}
