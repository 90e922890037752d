package github.sarthakdev143.hdr_merge.integration.dng;

final class TiffTags {

    static final int NEW_SUBFILE_TYPE = 254;
    static final int IMAGE_WIDTH = 256;
    static final int IMAGE_LENGTH = 257;
    static final int BITS_PER_SAMPLE = 258;
    static final int COMPRESSION = 259;
    static final int PHOTOMETRIC_INTERPRETATION = 262;
    static final int MAKE = 271;
    static final int MODEL = 272;
    static final int STRIP_OFFSETS = 273;
    static final int ORIENTATION = 274;
    static final int SAMPLES_PER_PIXEL = 277;
    static final int ROWS_PER_STRIP = 278;
    static final int STRIP_BYTE_COUNTS = 279;
    static final int PLANAR_CONFIGURATION = 284;
    static final int SOFTWARE = 305;
    static final int SUB_IFDS = 330;
    static final int SAMPLE_FORMAT = 339;
    static final int CFA_REPEAT_PATTERN_DIM = 33421;
    static final int CFA_PATTERN = 33422;
    static final int DNG_VERSION = 50706;
    static final int DNG_BACKWARD_VERSION = 50707;
    static final int UNIQUE_CAMERA_MODEL = 50708;
    static final int CFA_PLANE_COLOR = 50710;
    static final int CFA_LAYOUT = 50711;
    static final int BLACK_LEVEL = 50714;
    static final int WHITE_LEVEL = 50717;
    static final int COLOR_MATRIX_1 = 50721;
    static final int AS_SHOT_NEUTRAL = 50728;
    static final int CALIBRATION_ILLUMINANT_1 = 50778;

    static final int TYPE_BYTE = 1;
    static final int TYPE_ASCII = 2;
    static final int TYPE_SHORT = 3;
    static final int TYPE_LONG = 4;
    static final int TYPE_RATIONAL = 5;
    static final int TYPE_SRATIONAL = 10;

    static final int PHOTOMETRIC_RGB = 2;
    static final int PHOTOMETRIC_CFA = 32803;
    static final int SAMPLE_FORMAT_FLOAT = 3;
    static final int ILLUMINANT_D65 = 21;

    private TiffTags() {
    }

    static int typeSize(int type) {
        return switch (type) {
            case TYPE_BYTE, TYPE_ASCII -> 1;
            case TYPE_SHORT -> 2;
            case TYPE_LONG -> 4;
            case TYPE_RATIONAL, TYPE_SRATIONAL -> 8;
            default -> throw new IllegalArgumentException("Unsupported TIFF type " + type);
        };
    }
}
