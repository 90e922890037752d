package github.sarthakdev143.hdr_merge.service.impl;

import github.sarthakdev143.hdr_merge.model.ExposureParameters;
import github.sarthakdev143.hdr_merge.model.FloatImage;
import github.sarthakdev143.hdr_merge.model.PreviewSize;
import github.sarthakdev143.hdr_merge.support.TestExposures;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class PreviewRendererTest {

    private final PreviewRenderer renderer = new PreviewRenderer();
    private final ExposureParameters params = TestExposures.parameters("/s/a.CR2", 4, 4);

    @Test
    void noPreviewWhenDisabled() {
        assertThat(renderer.render(filled(4, 4, 0.5f), params, 1.0, PreviewSize.NONE)).isNull();
    }

    @Test
    void halfPreviewCollapsesEachTile() {
        BufferedImage preview = renderer.render(filled(4, 4, 1.0f), params, 1.0, PreviewSize.HALF);

        assertThat(preview.getWidth()).isEqualTo(2);
        assertThat(preview.getHeight()).isEqualTo(2);
        assertThat(preview.getRGB(1, 1) & 0xFFFFFF).isEqualTo(0xFFFFFF);
    }

    @Test
    void fullPreviewKeepsImageSizeAndAppliesExposureShift() {
        BufferedImage preview = renderer.render(filled(4, 4, 0.125f), params, 8.0, PreviewSize.FULL);

        assertThat(preview.getWidth()).isEqualTo(4);
        assertThat(preview.getRGB(3, 3) & 0xFFFFFF).isEqualTo(0xFFFFFF);
    }

    @Test
    void cameraMultipliersTintTheChannels() {
        params.setCamMul(new float[] {2.0f, 1.0f, 0.5f, 1.0f});

        BufferedImage preview = renderer.render(filled(4, 4, 0.25f), params, 1.0, PreviewSize.HALF);

        int rgb = preview.getRGB(0, 0);
        int red = (rgb >> 16) & 0xFF;
        int green = (rgb >> 8) & 0xFF;
        int blue = rgb & 0xFF;
        assertThat(red).isGreaterThan(green);
        assertThat(green).isGreaterThan(blue);
    }

    private static FloatImage filled(int width, int height, float value) {
        float[] data = new float[width * height];
        Arrays.fill(data, value);
        return new FloatImage(width, height, data);
    }
}
