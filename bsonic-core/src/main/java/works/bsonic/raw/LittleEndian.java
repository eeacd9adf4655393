package works.bsonic.raw;

final class LittleEndian {
	private LittleEndian() { }

	static int readInt32(byte[] bytes, int offset) {
		return (bytes[offset] & 0xFF)
			| (bytes[offset + 1] & 0xFF) << 8
			| (bytes[offset + 2] & 0xFF) << 16
			| (bytes[offset + 3] & 0xFF) << 24;
	}

	static long readInt64(byte[] bytes, int offset) {
		return (readInt32(bytes, offset) & 0xFFFF_FFFFL)
			| ((long) readInt32(bytes, offset + 4)) << 32;
	}

	static double readDouble(byte[] bytes, int offset) {
		return Double.longBitsToDouble(readInt64(bytes, offset));
	}

	static void writeInt32(byte[] bytes, int offset, int value) {
		bytes[offset] = (byte) value;
		bytes[offset + 1] = (byte) (value >>> 8);
		bytes[offset + 2] = (byte) (value >>> 16);
		bytes[offset + 3] = (byte) (value >>> 24);
	}
}
