package works.bsonic.raw;

import works.bsonic.exceptions.BsonFormatException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static works.bsonic.exceptions.BsonFormatException.Kind.INVALID_UTF8;

/**
 * Strict UTF-8 validation: rejects overlong encodings, surrogates, and code points above U+10FFFF.
 */
final class Utf8 {
	private Utf8() { }

	/**
	 * @return the index of the first byte of the first invalid sequence, or -1 if all valid
	 */
	static int firstInvalid(byte[] bytes, int start, int length) {
		int i = start;
		int end = start + length;
		while (i < end) {
			int b = bytes[i] & 0xFF;
			if (b < 0x80) {
				// ASCII fast path
				i++;
				continue;
			}
			int sequenceLength;
			int codePoint;
			int minimum;
			if ((b & 0xE0) == 0xC0) {
				sequenceLength = 2;
				codePoint = b & 0x1F;
				minimum = 0x80;
			} else if ((b & 0xF0) == 0xE0) {
				sequenceLength = 3;
				codePoint = b & 0x0F;
				minimum = 0x800;
			} else if ((b & 0xF8) == 0xF0) {
				sequenceLength = 4;
				codePoint = b & 0x07;
				minimum = 0x10000;
			} else {
				return i;
			}
			if (end - i < sequenceLength) {
				return i;
			}
			for (int j = 1; j < sequenceLength; j++) {
				int bx = bytes[i + j] & 0xFF;
				if ((bx & 0xC0) != 0x80) {
					return i;
				}
				codePoint = (codePoint << 6) | (bx & 0x3F);
			}
			if (codePoint < minimum || codePoint > 0x10FFFF || (codePoint >= 0xD800 && codePoint <= 0xDFFF)) {
				return i;
			}
			i += sequenceLength;
		}
		return -1;
	}

	static String decodeStrict(byte[] bytes, int start, int length) {
		int bad = firstInvalid(bytes, start, length);
		if (bad >= 0) {
			throw new BsonFormatException(INVALID_UTF8, bad, "invalid UTF-8 byte 0x" + Integer.toHexString(bytes[bad] & 0xFF));
		}
		return new String(bytes, start, length, UTF_8);
	}

	/**
	 * The JDK decoder substitutes U+FFFD for each malformed sequence.
	 */
	static String decodeLossy(byte[] bytes, int start, int length) {
		return new String(bytes, start, length, UTF_8);
	}
}
