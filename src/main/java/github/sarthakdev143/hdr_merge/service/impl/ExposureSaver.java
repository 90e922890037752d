package github.sarthakdev143.hdr_merge.service.impl;

import github.sarthakdev143.hdr_merge.integration.image.MaskImageWriter;
import github.sarthakdev143.hdr_merge.model.ExposureParameters;
import github.sarthakdev143.hdr_merge.model.FloatImage;
import github.sarthakdev143.hdr_merge.model.SaveOptions;
import github.sarthakdev143.hdr_merge.model.SaveReport;
import github.sarthakdev143.hdr_merge.model.metadata.FusionReport;
import github.sarthakdev143.hdr_merge.service.DngWriter;
import github.sarthakdev143.hdr_merge.service.ExposureStack;
import github.sarthakdev143.hdr_merge.service.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Composes a loaded stack and writes it as a DNG, with metadata from the darkest source file and
 * an optional blend mask.
 */
@Component
public class ExposureSaver {

    private static final Logger logger = LoggerFactory.getLogger(ExposureSaver.class);

    private final DngWriter dngWriter;
    private final MetadataFusionEngine fusionEngine;
    private final PreviewRenderer previewRenderer;
    private final MaskImageWriter maskImageWriter;

    public ExposureSaver(
            DngWriter dngWriter,
            MetadataFusionEngine fusionEngine,
            PreviewRenderer previewRenderer,
            MaskImageWriter maskImageWriter) {
        this.dngWriter = dngWriter;
        this.fusionEngine = fusionEngine;
        this.previewRenderer = previewRenderer;
        this.maskImageWriter = maskImageWriter;
    }

    public SaveReport save(ExposureLoader loaded, SaveOptions options, ProgressListener progress) throws IOException {
        List<ExposureParameters> parameters = loaded.parameters();
        if (parameters.isEmpty()) {
            throw new IllegalStateException("No exposures loaded.");
        }
        if (options.fileName().isBlank()) {
            throw new IllegalArgumentException("Output file name is required.");
        }

        ExposureStack stack = loaded.stack();
        ExposureParameters params = parameters.get(parameters.size() - 1).copy();
        params.setWidth(stack.width());
        params.setHeight(stack.height());
        params.adjustWhite(stack.exposure(stack.size() - 1));

        progress.onProgress(0, "Rendering image", null);
        FloatImage composed = stack.compose(params, options.featherRadius());

        progress.onProgress(33, "Rendering preview", null);
        BufferedImage preview = previewRenderer.render(composed, params, stack.maxExposure(), options.previewSize());

        progress.onProgress(66, "Writing output", null);
        byte[] container = dngWriter.write(composed, params, options.bps(), preview);
        Path outputPath = Path.of(options.fileName());
        FusionReport fusion = fusionEngine.fuse(Path.of(params.getFileName()), container, outputPath);
        List<String> warnings = new ArrayList<>(fusion.failures());
        if (!fusion.written()) {
            logger.warn("Writing {} without source metadata", outputPath);
            Files.write(outputPath, container);
        }
        progress.onProgress(100, "Done writing!", null);

        String maskFile = null;
        if (options.saveMask()) {
            maskFile = saveMask(loaded, options, warnings);
        }

        logger.info("Wrote {} from {} exposures ({}x{}, {} bps)",
                outputPath, stack.size(), stack.width(), stack.height(), options.bps());
        return new SaveReport(outputPath.toString(), fusion, maskFile, warnings);
    }

    private String saveMask(ExposureLoader loaded, SaveOptions options, List<String> warnings) {
        List<String> fileNames = loaded.parameters().stream().map(ExposureParameters::getFileName).toList();
        String maskPath = new OutputPathResolver(fileNames).resolve(options.maskFileName(), options.fileName());
        try {
            maskImageWriter.write(loaded.stack().mask(), loaded.stack().size(), Path.of(maskPath));
            return maskPath;
        } catch (IOException e) {
            logger.warn("Failed to write blend mask {}", maskPath, e);
            warnings.add("Mask could not be written to " + maskPath + ".");
            return null;
        }
    }
}
