package works.bsonic.types;

import java.util.Arrays;
import java.util.HexFormat;
import works.bsonic.spec.ElementType;

/**
 * An IEEE 754-2008 128-bit decimal, kept as its 16 little-endian wire bytes.
 * No arithmetic is offered.
 */
public final class Decimal128 implements Bson {
	public static final int LENGTH = 16;

	private final byte[] bytes;

	public Decimal128(byte[] bytes) {
		if (bytes.length != LENGTH) {
			throw new IllegalArgumentException("Decimal128 requires exactly " + LENGTH + " bytes; got " + bytes.length);
		}
		this.bytes = bytes.clone();
	}

	public byte[] bytes() {
		return bytes.clone();
	}

	@Override
	public ElementType elementType() {
		return ElementType.DECIMAL128;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Decimal128 other && Arrays.equals(bytes, other.bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "Decimal128(0x" + HexFormat.of().formatHex(bytes) + ")";
	}
}
