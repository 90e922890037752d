package github.sarthakdev143.hdr_merge.integration.image;

import github.sarthakdev143.hdr_merge.model.ExposureMask;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes an exposure mask as an indexed grayscale PNG. Index {@code c} of {@code n} exposures is
 * drawn as gray {@code 256 * c / (n - 1)}, and the darkest exposure as white.
 */
@Component
public class MaskImageWriter {

    public void write(ExposureMask mask, int exposureCount, Path file) throws IOException {
        if (exposureCount < 1 || exposureCount > 256) {
            throw new IllegalArgumentException("Mask needs between 1 and 256 exposures, got " + exposureCount);
        }

        BufferedImage image = new BufferedImage(
                mask.width(),
                mask.height(),
                BufferedImage.TYPE_BYTE_INDEXED,
                palette(exposureCount));
        WritableRaster raster = image.getRaster();
        for (int y = 0; y < mask.height(); y++) {
            for (int x = 0; x < mask.width(); x++) {
                raster.setSample(x, y, 0, Math.min(mask.get(x, y), exposureCount - 1));
            }
        }

        if (!ImageIO.write(image, "png", file.toFile())) {
            throw new IOException("No PNG writer available for " + file);
        }
    }

    static IndexColorModel palette(int exposureCount) {
        int grays = exposureCount - 1;
        byte[] levels = new byte[exposureCount];
        for (int c = 0; c < grays; c++) {
            levels[c] = (byte) (256 * c / grays);
        }
        levels[grays] = (byte) 255;
        return new IndexColorModel(8, exposureCount, levels, levels, levels);
    }
}
