package github.sarthakdev143.hdr_merge.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Geometry and calibration of one decoded frame.
 * <p>
 * The color filter layout is kept as the row-major letters of its repeat tile: a 2x2 Bayer tile
 * such as {@code RGGB}, a 6x6 X-Trans tile, or the longer description of other mosaics as the
 * decoder reports it.
 */
public class ExposureParameters {

    private static final int BAYER_TILE = 2;
    private static final int XTRANS_TILE = 6;

    private final String fileName;
    private int rawWidth;
    private int rawHeight;
    private int topMargin;
    private int leftMargin;
    private int width;
    private int height;
    private String cfaPattern = "";
    private int flip;
    private int black;
    private int[] cblack = new int[4];
    private int max;
    private float[] camMul = {1.0f, 1.0f, 1.0f, 1.0f};
    private String make = "";
    private String model = "";
    private Instant timestamp;
    private double shutterSeconds;

    public ExposureParameters(String fileName) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
    }

    public ExposureParameters copy() {
        ExposureParameters copy = new ExposureParameters(fileName);
        copy.rawWidth = rawWidth;
        copy.rawHeight = rawHeight;
        copy.topMargin = topMargin;
        copy.leftMargin = leftMargin;
        copy.width = width;
        copy.height = height;
        copy.cfaPattern = cfaPattern;
        copy.flip = flip;
        copy.black = black;
        copy.cblack = cblack.clone();
        copy.max = max;
        copy.camMul = camMul.clone();
        copy.make = make;
        copy.model = model;
        copy.timestamp = timestamp;
        copy.shutterSeconds = shutterSeconds;
        return copy;
    }

    /**
     * Frames can be stacked only when the sensor geometry and filter layout agree.
     */
    public boolean isSameFormat(ExposureParameters other) {
        return rawWidth == other.rawWidth
                && rawHeight == other.rawHeight
                && topMargin == other.topMargin
                && leftMargin == other.leftMargin
                && cfaPattern.equals(other.cfaPattern);
    }

    /**
     * Only a plain 2x2 Bayer tile keeps its phase under the even translations alignment uses.
     */
    public boolean canAlign() {
        return cfaPattern.length() == BAYER_TILE * BAYER_TILE;
    }

    public int tileSize() {
        if (cfaPattern.length() == XTRANS_TILE * XTRANS_TILE) {
            return XTRANS_TILE;
        }
        return BAYER_TILE;
    }

    public char colorAt(int x, int y) {
        if (cfaPattern.isEmpty()) {
            return 'G';
        }
        int tile = tileSize();
        return cfaPattern.charAt(Math.floorMod(y, tile) * tile + Math.floorMod(x, tile));
    }

    public int blackAt(int x, int y) {
        return black + cblack[(y & 1) * 2 + (x & 1)];
    }

    public Optional<CreationInterval> creationInterval() {
        if (timestamp == null) {
            return Optional.empty();
        }
        return Optional.of(CreationInterval.endingAt(timestamp, shutterSeconds));
    }

    /**
     * Lowers the white level to {@code ceiling}; never raises it.
     */
    public void applyWhiteLevelCeiling(int ceiling) {
        if (ceiling < max) {
            max = ceiling;
        }
    }

    /**
     * Lowers the white level to the brightest sample the exposure actually holds.
     */
    public void adjustWhite(RawImage image) {
        applyWhiteLevelCeiling(image.maxSample());
    }

    public String getFileName() {
        return fileName;
    }

    public int getRawWidth() {
        return rawWidth;
    }

    public void setRawWidth(int rawWidth) {
        this.rawWidth = rawWidth;
    }

    public int getRawHeight() {
        return rawHeight;
    }

    public void setRawHeight(int rawHeight) {
        this.rawHeight = rawHeight;
    }

    public int getTopMargin() {
        return topMargin;
    }

    public void setTopMargin(int topMargin) {
        this.topMargin = topMargin;
    }

    public int getLeftMargin() {
        return leftMargin;
    }

    public void setLeftMargin(int leftMargin) {
        this.leftMargin = leftMargin;
    }

    public int getWidth() {
        return width;
    }

    public void setWidth(int width) {
        this.width = width;
    }

    public int getHeight() {
        return height;
    }

    public void setHeight(int height) {
        this.height = height;
    }

    public String getCfaPattern() {
        return cfaPattern;
    }

    public void setCfaPattern(String cfaPattern) {
        this.cfaPattern = cfaPattern == null ? "" : cfaPattern;
    }

    public int getFlip() {
        return flip;
    }

    public void setFlip(int flip) {
        this.flip = flip;
    }

    public int getBlack() {
        return black;
    }

    public void setBlack(int black) {
        this.black = black;
    }

    public int[] getCblack() {
        return cblack.clone();
    }

    public void setCblack(int[] cblack) {
        if (cblack == null || cblack.length != 4) {
            throw new IllegalArgumentException("Per-channel black levels need 4 values.");
        }
        this.cblack = cblack.clone();
    }

    public int getMax() {
        return max;
    }

    public void setMax(int max) {
        this.max = max;
    }

    public float[] getCamMul() {
        return camMul.clone();
    }

    public void setCamMul(float[] camMul) {
        if (camMul == null || camMul.length != 4) {
            throw new IllegalArgumentException("Camera multipliers need 4 values.");
        }
        this.camMul = camMul.clone();
    }

    public String getMake() {
        return make;
    }

    public void setMake(String make) {
        this.make = make == null ? "" : make;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model == null ? "" : model;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public double getShutterSeconds() {
        return shutterSeconds;
    }

    public void setShutterSeconds(double shutterSeconds) {
        this.shutterSeconds = shutterSeconds;
    }

    @Override
    public String toString() {
        return "ExposureParameters{" + fileName + ", " + rawWidth + "x" + rawHeight
                + ", cfa=" + cfaPattern + ", black=" + black + Arrays.toString(cblack)
                + ", max=" + max + "}";
    }
}
