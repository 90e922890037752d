package github.sarthakdev143.hdr_merge.service;

import github.sarthakdev143.hdr_merge.model.ExposureParameters;
import github.sarthakdev143.hdr_merge.model.FloatImage;

import java.awt.image.BufferedImage;
import java.io.IOException;

public interface DngWriter {

    /**
     * Serializes a composed mosaic into a DNG container.
     *
     * @param preview RGB preview stored as the main image, or {@code null} for none
     * @return the container bytes
     */
    byte[] write(FloatImage image, ExposureParameters params, int bitsPerSample, BufferedImage preview)
            throws IOException;
}
