package works.bsonic.types;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.UUID;
import works.bsonic.exceptions.BsonConversionException;
import works.bsonic.spec.BinarySubtype;
import works.bsonic.spec.ElementType;

import static java.util.Objects.requireNonNull;

/**
 * Binary data tagged with a {@link BinarySubtype}.
 * <p>
 * For {@link BinarySubtype#BINARY_OLD}, {@link #bytes()} excludes the redundant inner length prefix
 * that appears on the wire.
 */
public final class Binary implements Bson {
	private final BinarySubtype subtype;
	private final byte[] bytes;

	public Binary(BinarySubtype subtype, byte[] bytes) {
		this.subtype = requireNonNull(subtype);
		this.bytes = bytes.clone();
	}

	public static Binary generic(byte[] bytes) {
		return new Binary(BinarySubtype.GENERIC, bytes);
	}

	public static Binary fromUuid(UUID uuid) {
		return fromUuidWithRepresentation(uuid, UuidRepresentation.STANDARD);
	}

	public static Binary fromUuidWithRepresentation(UUID uuid, UuidRepresentation representation) {
		byte[] result = ByteBuffer.allocate(16)
			.putLong(uuid.getMostSignificantBits())
			.putLong(uuid.getLeastSignificantBits())
			.array();
		representation.reorder(result);
		return new Binary(representation.subtype(), result);
	}

	/**
	 * @throws BsonConversionException unless this is a 16-byte binary of subtype {@link BinarySubtype#UUID}
	 */
	public UUID toUuid() {
		return toUuidWithRepresentation(UuidRepresentation.STANDARD);
	}

	/**
	 * @throws BsonConversionException if the subtype does not match {@code representation},
	 * or the length is not 16
	 */
	public UUID toUuidWithRepresentation(UuidRepresentation representation) {
		if (!subtype.equals(representation.subtype())) {
			throw new BsonConversionException("Expected binary subtype " + representation.subtype()
				+ " for " + representation + " UUID, but found " + subtype);
		}
		if (bytes.length != 16) {
			throw new BsonConversionException("Expected 16 bytes for UUID, but found " + bytes.length);
		}
		byte[] standard = bytes.clone();
		representation.reorder(standard);
		ByteBuffer buffer = ByteBuffer.wrap(standard);
		return new UUID(buffer.getLong(), buffer.getLong());
	}

	public BinarySubtype subtype() {
		return subtype;
	}

	public byte[] bytes() {
		return bytes.clone();
	}

	public int length() {
		return bytes.length;
	}

	@Override
	public ElementType elementType() {
		return ElementType.BINARY;
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Binary other
			&& subtype.equals(other.subtype)
			&& Arrays.equals(bytes, other.bytes);
	}

	@Override
	public int hashCode() {
		return 31 * subtype.hashCode() + Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "Binary(" + subtype + ", 0x" + HexFormat.of().formatHex(bytes) + ")";
	}
}
