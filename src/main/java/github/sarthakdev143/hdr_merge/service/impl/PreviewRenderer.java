package github.sarthakdev143.hdr_merge.service.impl;

import github.sarthakdev143.hdr_merge.model.ExposureParameters;
import github.sarthakdev143.hdr_merge.model.FloatImage;
import github.sarthakdev143.hdr_merge.model.PreviewSize;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * Renders a quick sRGB-like preview of a composed mosaic by collapsing each 2x2 filter tile into
 * one RGB value. White balance comes from the camera multipliers.
 */
@Component
public class PreviewRenderer {

    private static final double GAMMA = 1.0 / 2.2;

    /**
     * @param exposureShift linear gain applied before gamma, typically the stack's maximum exposure
     * @return the preview, or {@code null} when {@code size} disables it
     */
    public BufferedImage render(FloatImage image, ExposureParameters params, double exposureShift, PreviewSize size) {
        if (size.previewWidth(image.width()) == 0) {
            return null;
        }

        boolean half = size == PreviewSize.HALF;
        int tilesX = Math.max(1, image.width() / 2);
        int tilesY = Math.max(1, image.height() / 2);
        int outWidth = half ? tilesX : image.width();
        int outHeight = half ? tilesY : image.height();
        double[] balance = whiteBalance(params);

        BufferedImage preview = new BufferedImage(outWidth, outHeight, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < outHeight; y++) {
            int tileY = Math.min(half ? y : y / 2, tilesY - 1);
            for (int x = 0; x < outWidth; x++) {
                int tileX = Math.min(half ? x : x / 2, tilesX - 1);
                preview.setRGB(x, y, tileColor(image, params, tileX * 2, tileY * 2, exposureShift, balance));
            }
        }
        return preview;
    }

    private static int tileColor(
            FloatImage image,
            ExposureParameters params,
            int originX,
            int originY,
            double exposureShift,
            double[] balance) {
        double[] sums = new double[3];
        int[] counts = new int[3];
        for (int dy = 0; dy < 2; dy++) {
            for (int dx = 0; dx < 2; dx++) {
                int x = Math.min(originX + dx, image.width() - 1);
                int y = Math.min(originY + dy, image.height() - 1);
                int channel = channelOf(params.colorAt(x, y));
                sums[channel] += image.get(x, y);
                counts[channel]++;
            }
        }

        int rgb = 0;
        for (int channel = 0; channel < 3; channel++) {
            double value = counts[channel] == 0 ? 0.0 : sums[channel] / counts[channel];
            rgb = (rgb << 8) | toByte(value * exposureShift * balance[channel]);
        }
        return rgb;
    }

    private static double[] whiteBalance(ExposureParameters params) {
        float[] camMul = params.getCamMul();
        double green = camMul[1] > 0 ? camMul[1] : 1.0;
        return new double[] {
                camMul[0] > 0 ? camMul[0] / green : 1.0,
                1.0,
                camMul[2] > 0 ? camMul[2] / green : 1.0
        };
    }

    private static int channelOf(char color) {
        return switch (color) {
            case 'R' -> 0;
            case 'B' -> 2;
            default -> 1;
        };
    }

    private static int toByte(double linear) {
        double clamped = Math.max(0.0, Math.min(1.0, linear));
        return (int) Math.round(Math.pow(clamped, GAMMA) * 255.0);
    }
}
