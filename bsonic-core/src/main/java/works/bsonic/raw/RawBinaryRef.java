package works.bsonic.raw;

import java.util.Arrays;
import works.bsonic.spec.BinarySubtype;
import works.bsonic.types.Binary;

/**
 * A view of a binary value's payload.
 * For {@link BinarySubtype#BINARY_OLD} the redundant inner length is excluded.
 */
public final class RawBinaryRef {
	private final BinarySubtype subtype;
	private final byte[] bytes;
	private final int offset;
	private final int length;

	RawBinaryRef(BinarySubtype subtype, byte[] bytes, int offset, int length) {
		this.subtype = subtype;
		this.bytes = bytes;
		this.offset = offset;
		this.length = length;
	}

	public BinarySubtype subtype() {
		return subtype;
	}

	public int length() {
		return length;
	}

	public byte byteAt(int index) {
		if (index < 0 || index >= length) {
			throw new IndexOutOfBoundsException(index);
		}
		return bytes[offset + index];
	}

	public byte[] toByteArray() {
		return Arrays.copyOfRange(bytes, offset, offset + length);
	}

	public Binary toBinary() {
		return new Binary(subtype, toByteArray());
	}

	@Override
	public String toString() {
		return "RawBinaryRef(" + subtype + ", " + length + " bytes)";
	}
}
