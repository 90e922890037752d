package github.sarthakdev143.hdr_merge.integration.dng;

/**
 * Little-endian floating point sample formats allowed in DNG: IEEE half and single precision and
 * the 24-bit DNG format (1 sign bit, 7 exponent bits biased by 63, 16 mantissa bits).
 */
final class FloatSampleEncoder {

    private FloatSampleEncoder() {
    }

    static int bytesPerSample(int bitsPerSample) {
        return switch (bitsPerSample) {
            case 16 -> 2;
            case 24 -> 3;
            case 32 -> 4;
            default -> throw new IllegalArgumentException("Unsupported bits per sample: " + bitsPerSample);
        };
    }

    static void encode(float value, int bitsPerSample, byte[] out, int offset) {
        switch (bitsPerSample) {
            case 16 -> putLittleEndian(toHalf(value), 2, out, offset);
            case 24 -> putLittleEndian(toFp24(value), 3, out, offset);
            case 32 -> putLittleEndian(Float.floatToRawIntBits(value), 4, out, offset);
            default -> throw new IllegalArgumentException("Unsupported bits per sample: " + bitsPerSample);
        }
    }

    static int toHalf(float value) {
        int bits = Float.floatToRawIntBits(value);
        int sign = (bits >>> 16) & 0x8000;
        int rawExponent = (bits >>> 23) & 0xFF;
        int mantissa = bits & 0x7FFFFF;

        if (rawExponent == 0xFF) {
            return sign | 0x7C00 | (mantissa != 0 ? 0x200 : 0);
        }
        int exponent = rawExponent - 127 + 15;
        if (exponent >= 0x1F) {
            return sign | 0x7BFF;
        }
        if (exponent <= 0) {
            if (exponent < -10) {
                return sign;
            }
            mantissa |= 0x800000;
            int shift = 14 - exponent;
            int half = mantissa >> shift;
            if (((mantissa >> (shift - 1)) & 1) != 0) {
                half++;
            }
            return sign | half;
        }

        int half = sign | (exponent << 10) | (mantissa >> 13);
        if ((mantissa & 0x1000) != 0 && (half & 0x7FFF) < 0x7BFF) {
            half++;
        }
        return half;
    }

    static int toFp24(float value) {
        int bits = Float.floatToRawIntBits(value);
        int sign = (bits >>> 31) & 1;
        int rawExponent = (bits >>> 23) & 0xFF;
        int mantissa = bits & 0x7FFFFF;

        if (rawExponent == 0xFF) {
            return (sign << 23) | (0x7F << 16) | (mantissa != 0 ? 0x8000 : 0);
        }
        int exponent = rawExponent == 0 ? 0 : rawExponent - 127 + 63;
        if (exponent <= 0) {
            return sign << 23;
        }
        int mantissa16 = (mantissa >> 7) + ((mantissa >> 6) & 1);
        if (mantissa16 > 0xFFFF) {
            mantissa16 = 0;
            exponent++;
        }
        if (exponent >= 0x7F) {
            return (sign << 23) | (0x7E << 16) | 0xFFFF;
        }
        return (sign << 23) | (exponent << 16) | mantissa16;
    }

    private static void putLittleEndian(int value, int byteCount, byte[] out, int offset) {
        for (int i = 0; i < byteCount; i++) {
            out[offset + i] = (byte) (value >>> (8 * i));
        }
    }
}
