package github.sarthakdev143.hdr_merge.integration.stack;

import github.sarthakdev143.hdr_merge.model.DecodedExposure;
import github.sarthakdev143.hdr_merge.model.ExposureMask;
import github.sarthakdev143.hdr_merge.model.ExposureParameters;
import github.sarthakdev143.hdr_merge.model.FloatImage;
import github.sarthakdev143.hdr_merge.model.RawImage;
import github.sarthakdev143.hdr_merge.service.ExposureStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Exposure stack that keeps every mosaic in memory, brightest first.
 * <p>
 * Alignment searches even translations against the brightest exposure on median threshold
 * bitmaps. Each exposure's response is a single linear gain relative to the next brighter one.
 * The mask picks, per pixel, the brightest exposure below the saturation threshold, and
 * composition blends neighbouring exposures across a box-feathered mask.
 */
public class InMemoryExposureStack implements ExposureStack {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryExposureStack.class);
    private static final int SAMPLE_STEP = 16;
    private static final double SATURATION_MARGIN = 0.99;
    private static final double MEDIAN_NOISE_FRACTION = 0.01;

    private final int alignSearchRadius;
    private final List<Layer> layers = new ArrayList<>();
    private double saturationThreshold = Double.MAX_VALUE;
    private int cropX;
    private int cropY;
    private int cropWidth;
    private int cropHeight;
    private ExposureMask mask;

    public InMemoryExposureStack(int alignSearchRadius) {
        this.alignSearchRadius = alignSearchRadius;
    }

    @Override
    public int insert(long exposureId, DecodedExposure exposure) {
        if (layers.size() >= MAX_EXPOSURES) {
            throw new IllegalStateException("Stack already holds " + MAX_EXPOSURES + " exposures.");
        }
        RawImage image = exposure.image();
        if (!layers.isEmpty() && (image.width() != layers.get(0).image.width()
                || image.height() != layers.get(0).image.height())) {
            throw new IllegalArgumentException("Exposure size differs from the stack.");
        }

        Layer layer = new Layer(exposureId, image, exposure.parameters(), brightness(image, exposure.parameters()));
        int position = 0;
        while (position < layers.size() && layers.get(position).brightness >= layer.brightness) {
            position++;
        }
        layers.add(position, layer);
        if (layers.size() == 1) {
            resetCrop();
        }
        mask = null;
        return position;
    }

    @Override
    public List<Long> order() {
        return layers.stream().map(layer -> layer.id).toList();
    }

    @Override
    public int size() {
        return layers.size();
    }

    @Override
    public void clear() {
        layers.clear();
        mask = null;
        saturationThreshold = Double.MAX_VALUE;
        cropX = 0;
        cropY = 0;
        cropWidth = 0;
        cropHeight = 0;
    }

    @Override
    public void setFlip(int flip) {
        // Layers keep sensor orientation; the writer records the flip in the output.
        logger.debug("Stack flip {}", flip);
    }

    @Override
    public void calculateSaturationLevel(ExposureParameters params, boolean useCustomWl) {
        saturationThreshold = useCustomWl ? params.getMax() : params.getMax() * SATURATION_MARGIN;
        logger.debug("Saturation threshold {}", saturationThreshold);
    }

    @Override
    public void align() {
        if (layers.isEmpty()) {
            return;
        }
        Layer reference = layers.get(0);
        Bitmap referenceBitmap = Bitmap.of(reference.image, reference.params);
        for (int i = 1; i < layers.size(); i++) {
            Layer layer = layers.get(i);
            Bitmap bitmap = Bitmap.of(layer.image, layer.params);
            double bestError = Double.MAX_VALUE;
            int bestX = 0;
            int bestY = 0;
            // Even offsets keep the filter pattern in phase.
            int radius = alignSearchRadius & ~1;
            for (int dy = -radius; dy <= radius; dy += 2) {
                for (int dx = -radius; dx <= radius; dx += 2) {
                    double error = referenceBitmap.difference(bitmap, dx, dy);
                    if (error < bestError || (error == bestError && Math.abs(dx) + Math.abs(dy) < Math.abs(bestX) + Math.abs(bestY))) {
                        bestError = error;
                        bestX = dx;
                        bestY = dy;
                    }
                }
            }
            layer.dx = bestX;
            layer.dy = bestY;
            logger.debug("Exposure {} aligned with offset ({}, {})", layer.id, bestX, bestY);
        }
        mask = null;
    }

    @Override
    public void crop() {
        if (layers.isEmpty()) {
            return;
        }
        int fullWidth = layers.get(0).image.width();
        int fullHeight = layers.get(0).image.height();
        int left = 0;
        int top = 0;
        int right = fullWidth;
        int bottom = fullHeight;
        for (Layer layer : layers) {
            left = Math.max(left, -layer.dx);
            top = Math.max(top, -layer.dy);
            right = Math.min(right, fullWidth - layer.dx);
            bottom = Math.min(bottom, fullHeight - layer.dy);
        }
        cropX = left;
        cropY = top;
        cropWidth = Math.max(0, (right - left) & ~1);
        cropHeight = Math.max(0, (bottom - top) & ~1);
        if (cropWidth == 0 || cropHeight == 0) {
            logger.warn("Exposures do not overlap after alignment; keeping the full frame");
            resetCrop();
        }
        mask = null;
    }

    @Override
    public void computeResponseFunctions() {
        if (layers.isEmpty()) {
            return;
        }
        layers.get(0).relativeExposure = 1.0;
        for (int i = 1; i < layers.size(); i++) {
            Layer brighter = layers.get(i - 1);
            Layer darker = layers.get(i);
            double brightSum = 0.0;
            double darkSum = 0.0;
            for (int y = 0; y < cropHeight; y += SAMPLE_STEP / 2) {
                for (int x = 0; x < cropWidth; x += SAMPLE_STEP / 2) {
                    int refX = x + cropX;
                    int refY = y + cropY;
                    double bright = brighter.sample(refX, refY);
                    double dark = darker.sample(refX, refY);
                    if (Double.isNaN(bright) || Double.isNaN(dark) || bright >= saturationThreshold) {
                        continue;
                    }
                    double brightSignal = bright - brighter.params.blackAt(refX + brighter.dx, refY + brighter.dy);
                    double darkSignal = dark - darker.params.blackAt(refX + darker.dx, refY + darker.dy);
                    if (brightSignal > 0 && darkSignal > 0) {
                        brightSum += brightSignal;
                        darkSum += darkSignal;
                    }
                }
            }
            double ratio = darkSum > 0 ? Math.max(1.0, brightSum / darkSum) : 1.0;
            darker.relativeExposure = brighter.relativeExposure * ratio;
            logger.debug("Exposure {} is {}x darker than the brightest", darker.id, darker.relativeExposure);
        }
    }

    @Override
    public void generateMask() {
        byte[] indexes = new byte[cropWidth * cropHeight];
        for (int y = 0; y < cropHeight; y++) {
            for (int x = 0; x < cropWidth; x++) {
                indexes[y * cropWidth + x] = (byte) chooseExposure(x + cropX, y + cropY);
            }
        }
        mask = new ExposureMask(cropWidth, cropHeight, indexes);
    }

    @Override
    public FloatImage compose(ExposureParameters params, int featherRadius) {
        if (mask == null) {
            generateMask();
        }
        float[] blend = featherRadius > 0 ? boxBlur(maskAsFloat(), cropWidth, cropHeight, featherRadius) : maskAsFloat();
        Layer darkest = layers.get(layers.size() - 1);
        double scale = (params.getMax() - params.getBlack()) * darkest.relativeExposure;
        if (scale <= 0) {
            scale = 1.0;
        }

        float[] data = new float[cropWidth * cropHeight];
        for (int y = 0; y < cropHeight; y++) {
            for (int x = 0; x < cropWidth; x++) {
                int refX = x + cropX;
                int refY = y + cropY;
                int chosen = mask.get(x, y);
                double weight = blend[y * cropWidth + x];
                int lower = Math.min((int) Math.floor(weight), layers.size() - 1);
                int upper = Math.min(lower + 1, layers.size() - 1);
                double fraction = weight - lower;

                double chosenValue = linearValue(chosen, refX, refY, chosen);
                double lowerValue = linearValue(lower, refX, refY, chosen);
                double upperValue = linearValue(upper, refX, refY, chosen);
                double value = Double.isNaN(lowerValue) || Double.isNaN(upperValue)
                        ? chosenValue
                        : lowerValue * (1.0 - fraction) + upperValue * fraction;
                data[y * cropWidth + x] = (float) Math.max(0.0, value / scale);
            }
        }
        return new FloatImage(cropWidth, cropHeight, data);
    }

    @Override
    public int width() {
        return cropWidth;
    }

    @Override
    public int height() {
        return cropHeight;
    }

    @Override
    public double maxExposure() {
        return layers.isEmpty() ? 1.0 : layers.get(layers.size() - 1).relativeExposure;
    }

    @Override
    public ExposureMask mask() {
        if (mask == null) {
            generateMask();
        }
        return mask;
    }

    @Override
    public RawImage exposure(int position) {
        return layers.get(position).image;
    }

    private int chooseExposure(int refX, int refY) {
        int lastInRange = 0;
        for (int i = 0; i < layers.size(); i++) {
            double value = layers.get(i).sample(refX, refY);
            if (Double.isNaN(value)) {
                continue;
            }
            if (value < saturationThreshold) {
                return i;
            }
            lastInRange = i;
        }
        return lastInRange;
    }

    /**
     * Sample of exposure {@code index} in the brightest exposure's scale. Saturated or missing
     * samples are NaN unless {@code index} is the exposure the mask chose.
     */
    private double linearValue(int index, int refX, int refY, int chosen) {
        Layer layer = layers.get(index);
        double raw = layer.sample(refX, refY);
        if (Double.isNaN(raw) || (index != chosen && raw >= saturationThreshold)) {
            return Double.NaN;
        }
        double signal = raw - layer.params.blackAt(refX + layer.dx, refY + layer.dy);
        return signal * layer.relativeExposure;
    }

    private float[] maskAsFloat() {
        float[] values = new float[cropWidth * cropHeight];
        for (int i = 0; i < values.length; i++) {
            values[i] = mask.indexes()[i] & 0xFF;
        }
        return values;
    }

    static float[] boxBlur(float[] values, int width, int height, int radius) {
        float[] horizontal = new float[values.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                float sum = 0;
                int count = 0;
                for (int k = Math.max(0, x - radius); k <= Math.min(width - 1, x + radius); k++) {
                    sum += values[y * width + k];
                    count++;
                }
                horizontal[y * width + x] = sum / count;
            }
        }
        float[] blurred = new float[values.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                float sum = 0;
                int count = 0;
                for (int k = Math.max(0, y - radius); k <= Math.min(height - 1, y + radius); k++) {
                    sum += horizontal[k * width + x];
                    count++;
                }
                blurred[y * width + x] = sum / count;
            }
        }
        return blurred;
    }

    private void resetCrop() {
        RawImage reference = layers.get(0).image;
        cropX = 0;
        cropY = 0;
        cropWidth = reference.width();
        cropHeight = reference.height();
    }

    private static double brightness(RawImage image, ExposureParameters params) {
        double sum = 0.0;
        long count = 0;
        for (int y = 0; y < image.height(); y += SAMPLE_STEP) {
            for (int x = 0; x < image.width(); x += SAMPLE_STEP) {
                sum += Math.max(0, image.get(x, y) - params.blackAt(x, y));
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    private static final class Layer {
        private final long id;
        private final RawImage image;
        private final ExposureParameters params;
        private final double brightness;
        private int dx;
        private int dy;
        private double relativeExposure = 1.0;

        private Layer(long id, RawImage image, ExposureParameters params, double brightness) {
            this.id = id;
            this.image = image;
            this.params = params;
            this.brightness = brightness;
        }

        private double sample(int refX, int refY) {
            int x = refX + dx;
            int y = refY + dy;
            return image.contains(x, y) ? image.get(x, y) : Double.NaN;
        }
    }

    /**
     * Median threshold bitmap over a sparse grid, with samples near the median excluded.
     */
    private static final class Bitmap {
        private final RawImage image;
        private final double median;
        private final double tolerance;

        private Bitmap(RawImage image, double median, double tolerance) {
            this.image = image;
            this.median = median;
            this.tolerance = tolerance;
        }

        static Bitmap of(RawImage image, ExposureParameters params) {
            int columns = (image.width() + SAMPLE_STEP - 1) / SAMPLE_STEP;
            int rows = (image.height() + SAMPLE_STEP - 1) / SAMPLE_STEP;
            int[] samples = new int[columns * rows];
            int n = 0;
            for (int y = 0; y < image.height(); y += SAMPLE_STEP) {
                for (int x = 0; x < image.width(); x += SAMPLE_STEP) {
                    samples[n++] = image.get(x, y);
                }
            }
            Arrays.sort(samples, 0, n);
            double median = n == 0 ? 0 : samples[n / 2];
            double tolerance = Math.max(1.0, (params.getMax() - params.getBlack()) * MEDIAN_NOISE_FRACTION);
            return new Bitmap(image, median, tolerance);
        }

        /**
         * Fraction of comparable grid points whose bits differ when {@code other} is shifted by
         * {@code (dx, dy)}.
         */
        double difference(Bitmap other, int dx, int dy) {
            long compared = 0;
            long different = 0;
            for (int y = 0; y < image.height(); y += SAMPLE_STEP) {
                for (int x = 0; x < image.width(); x += SAMPLE_STEP) {
                    int ox = x + dx;
                    int oy = y + dy;
                    if (!other.image.contains(ox, oy)) {
                        continue;
                    }
                    int mine = bit(image.get(x, y));
                    int theirs = other.bit(other.image.get(ox, oy));
                    if (mine < 0 || theirs < 0) {
                        continue;
                    }
                    compared++;
                    if (mine != theirs) {
                        different++;
                    }
                }
            }
            return compared == 0 ? Double.MAX_VALUE : (double) different / compared;
        }

        private int bit(int value) {
            if (Math.abs(value - median) < tolerance) {
                return -1;
            }
            return value > median ? 1 : 0;
        }
    }
}
