package works.bsonic.types;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.concurrent.atomic.AtomicInteger;
import works.bsonic.spec.ElementType;

/**
 * A 12-byte identifier: 4 bytes of big-endian seconds since the epoch,
 * 5 bytes of per-process random salt, and a 3-byte big-endian counter.
 */
public final class ObjectId implements Bson, Comparable<ObjectId> {
	public static final int LENGTH = 12;

	private final byte[] bytes;

	private static final byte[] PROCESS_UNIQUE;
	private static final AtomicInteger COUNTER;
	private static final HexFormat HEX = HexFormat.of();

	static {
		SecureRandom random = new SecureRandom();
		PROCESS_UNIQUE = new byte[5];
		random.nextBytes(PROCESS_UNIQUE);
		COUNTER = new AtomicInteger(random.nextInt(0x100_0000));
	}

	/**
	 * Generates a new id.
	 */
	public ObjectId() {
		this((int) (System.currentTimeMillis() / 1000), COUNTER.getAndIncrement());
	}

	private ObjectId(int seconds, int counter) {
		bytes = new byte[LENGTH];
		bytes[0] = (byte) (seconds >>> 24);
		bytes[1] = (byte) (seconds >>> 16);
		bytes[2] = (byte) (seconds >>> 8);
		bytes[3] = (byte) seconds;
		System.arraycopy(PROCESS_UNIQUE, 0, bytes, 4, 5);
		bytes[9] = (byte) (counter >>> 16);
		bytes[10] = (byte) (counter >>> 8);
		bytes[11] = (byte) counter;
	}

	public ObjectId(byte[] bytes) {
		if (bytes.length != LENGTH) {
			throw new IllegalArgumentException("ObjectId requires exactly " + LENGTH + " bytes; got " + bytes.length);
		}
		this.bytes = bytes.clone();
	}

	/**
	 * Copies {@link #LENGTH} bytes starting at {@code offset}.
	 */
	public static ObjectId fromBytes(byte[] source, int offset) {
		if (offset < 0 || source.length - offset < LENGTH) {
			throw new IllegalArgumentException("ObjectId requires " + LENGTH + " bytes at offset " + offset);
		}
		return new ObjectId(Arrays.copyOfRange(source, offset, offset + LENGTH));
	}

	/**
	 * @throws IllegalArgumentException if {@code hex} is not exactly 24 hexadecimal digits
	 */
	public static ObjectId parse(String hex) {
		if (!isValid(hex)) {
			throw new IllegalArgumentException("Invalid ObjectId hex string: \"" + hex + "\"");
		}
		return new ObjectId(HEX.parseHex(hex));
	}

	public static boolean isValid(String hex) {
		if (hex == null || hex.length() != 2 * LENGTH) {
			return false;
		}
		for (int i = 0; i < hex.length(); i++) {
			if (Character.digit(hex.charAt(i), 16) < 0) {
				return false;
			}
		}
		return true;
	}

	public byte[] toByteArray() {
		return bytes.clone();
	}

	public String toHex() {
		return HEX.formatHex(bytes);
	}

	/**
	 * @return the generation time embedded in the first four bytes
	 */
	public DateTime timestamp() {
		long seconds = ((bytes[0] & 0xFFL) << 24) | ((bytes[1] & 0xFFL) << 16) | ((bytes[2] & 0xFFL) << 8) | (bytes[3] & 0xFFL);
		return DateTime.fromMillis(seconds * 1000);
	}

	@Override
	public ElementType elementType() {
		return ElementType.OBJECT_ID;
	}

	@Override
	public int compareTo(ObjectId other) {
		return Arrays.compareUnsigned(bytes, other.bytes);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ObjectId other && Arrays.equals(bytes, other.bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "ObjectId(\"" + toHex() + "\")";
	}
}
