package works.bsonic.types;

import works.bsonic.spec.BinarySubtype;

/**
 * Byte orders in which drivers have historically stored a 16-byte UUID.
 * <p>
 * Only {@link #STANDARD} uses subtype 4. The legacy representations all use subtype 3,
 * so the bytes alone cannot tell you which one was used.
 */
public enum UuidRepresentation {
	/**
	 * Big-endian bytes of the UUID, subtype 4.
	 */
	STANDARD,
	/**
	 * The legacy Java driver stored each 8-byte half in little-endian order.
	 */
	JAVA_LEGACY,
	/**
	 * The legacy Python driver used the standard byte order, but subtype 3.
	 */
	PYTHON_LEGACY,
	/**
	 * The legacy C# driver used the .NET {@code Guid} layout: the first three fields little-endian.
	 */
	C_SHARP_LEGACY,
	;

	public BinarySubtype subtype() {
		return this == STANDARD ? BinarySubtype.UUID : BinarySubtype.UUID_OLD;
	}

	/**
	 * Converts between standard and this representation's byte order, in place.
	 * Each reordering is its own inverse.
	 */
	void reorder(byte[] bytes) {
		switch (this) {
			case STANDARD, PYTHON_LEGACY -> { }
			case JAVA_LEGACY -> {
				reverse(bytes, 0, 8);
				reverse(bytes, 8, 8);
			}
			case C_SHARP_LEGACY -> {
				reverse(bytes, 0, 4);
				reverse(bytes, 4, 2);
				reverse(bytes, 6, 2);
			}
		}
	}

	private static void reverse(byte[] bytes, int start, int length) {
		for (int i = start, j = start + length - 1; i < j; i++, j--) {
			byte tmp = bytes[i];
			bytes[i] = bytes[j];
			bytes[j] = tmp;
		}
	}
}
