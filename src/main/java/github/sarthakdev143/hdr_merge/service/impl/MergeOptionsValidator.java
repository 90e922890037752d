package github.sarthakdev143.hdr_merge.service.impl;

import github.sarthakdev143.hdr_merge.dto.MergeRequest;
import github.sarthakdev143.hdr_merge.model.LoadOptions;
import github.sarthakdev143.hdr_merge.model.MergePlan;
import github.sarthakdev143.hdr_merge.model.PreviewSize;
import github.sarthakdev143.hdr_merge.model.SaveOptions;
import github.sarthakdev143.hdr_merge.service.ExposureStack;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class MergeOptionsValidator {

    private static final int MAX_INPUT_FILES = 1000;
    private static final int MAX_FEATHER_RADIUS = 64;
    private static final int MAX_WHITE_LEVEL = 65535;
    private static final double MAX_BATCH_GAP_SECONDS = 24.0 * 60.0 * 60.0;

    public MergePlan normalizeAndValidate(MergeRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required.");
        }

        List<String> fileNames = normalizeFileNames(request.fileNames());
        boolean useCustomWl = request.customWhiteLevel() != null;
        int customWl = 0;
        if (useCustomWl) {
            customWl = request.customWhiteLevel();
            if (customWl <= 0 || customWl > MAX_WHITE_LEVEL) {
                throw new IllegalArgumentException("customWhiteLevel must be between 1 and " + MAX_WHITE_LEVEL + ".");
            }
        }

        double batchGap = request.batchGapSeconds() == null
                ? LoadOptions.DEFAULT_BATCH_GAP_SECONDS
                : request.batchGapSeconds();
        if (!Double.isFinite(batchGap) || batchGap < 0.0 || batchGap > MAX_BATCH_GAP_SECONDS) {
            throw new IllegalArgumentException("batchGapSeconds must be between 0 and " + MAX_BATCH_GAP_SECONDS + ".");
        }

        boolean batch = orDefault(request.batch(), false);
        if (!batch && fileNames.size() > ExposureStack.MAX_EXPOSURES) {
            throw new IllegalArgumentException(
                    "A merge without batch mode supports at most " + ExposureStack.MAX_EXPOSURES + " files.");
        }

        LoadOptions loadOptions = new LoadOptions(
                fileNames,
                orDefault(request.align(), true),
                orDefault(request.crop(), true),
                useCustomWl,
                customWl,
                batch,
                batchGap,
                orDefault(request.withSingles(), false));

        int bps = request.bitsPerSample() == null ? SaveOptions.DEFAULT_BITS_PER_SAMPLE : request.bitsPerSample();
        if (!SaveOptions.SUPPORTED_BITS_PER_SAMPLE.contains(bps)) {
            throw new IllegalArgumentException("bitsPerSample must be one of 16, 24, 32.");
        }

        int featherRadius = request.featherRadius() == null
                ? SaveOptions.DEFAULT_FEATHER_RADIUS
                : request.featherRadius();
        if (featherRadius < 0 || featherRadius > MAX_FEATHER_RADIUS) {
            throw new IllegalArgumentException("featherRadius must be between 0 and " + MAX_FEATHER_RADIUS + ".");
        }

        String maskFileName = trimToEmpty(request.maskFileName());
        SaveOptions saveOptions = new SaveOptions(
                bps,
                featherRadius,
                PreviewSize.fromInput(request.previewSize()),
                !maskFileName.isEmpty(),
                maskFileName,
                trimToEmpty(request.outputFileName()));

        return new MergePlan(loadOptions, saveOptions);
    }

    private List<String> normalizeFileNames(List<String> fileNames) {
        if (fileNames == null || fileNames.isEmpty()) {
            throw new IllegalArgumentException("fileNames must contain at least one file.");
        }
        if (fileNames.size() > MAX_INPUT_FILES) {
            throw new IllegalArgumentException("fileNames supports at most " + MAX_INPUT_FILES + " files.");
        }

        List<String> normalized = new ArrayList<>();
        for (int index = 0; index < fileNames.size(); index++) {
            String fileName = fileNames.get(index);
            if (fileName == null || fileName.isBlank()) {
                throw new IllegalArgumentException("fileNames[" + index + "] must not be blank.");
            }
            normalized.add(fileName.trim());
        }
        return normalized;
    }

    private static boolean orDefault(Boolean value, boolean defaultValue) {
        return value == null ? defaultValue : value;
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
