package github.sarthakdev143.hdr_merge.service.impl;

import github.sarthakdev143.hdr_merge.model.DecodedExposure;
import github.sarthakdev143.hdr_merge.model.ExposureParameters;
import github.sarthakdev143.hdr_merge.model.LoadOptions;
import github.sarthakdev143.hdr_merge.model.LoadResult;
import github.sarthakdev143.hdr_merge.service.ExposureStack;
import github.sarthakdev143.hdr_merge.service.ProgressListener;
import github.sarthakdev143.hdr_merge.service.RawDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads one bracketed set into an exposure stack.
 * <p>
 * Parameters are held per exposure id; their order is always read from the stack, so the two can
 * never disagree. Instances are not thread safe and serve a single set at a time.
 */
public class ExposureLoader {

    private static final Logger logger = LoggerFactory.getLogger(ExposureLoader.class);
    private static final int MAX_FRAMES_PER_FILE = 4;

    private final RawDecoder decoder;
    private final ExposureStack stack;
    private final Map<Long, ExposureParameters> parametersById = new HashMap<>();
    private long nextExposureId;

    public ExposureLoader(RawDecoder decoder, ExposureStack stack) {
        this.decoder = decoder;
        this.stack = stack;
    }

    public LoadResult load(LoadOptions options, ProgressListener progress) {
        clear();
        List<String> fileNames = options.fileNames();
        LoadResult result;
        if (fileNames.size() == 1) {
            result = loadFrames(fileNames.get(0), progress);
        } else {
            result = loadFiles(fileNames, progress);
        }

        if (!result.isSuccess()) {
            clear();
            return result;
        }
        if (stack.size() == 0) {
            logger.warn("No usable frames in {}", fileNames);
            return LoadResult.success(0);
        }

        int loaded = fileNames.size() == 1 ? stack.size() : fileNames.size();
        progress.onProgress(100 / (loaded + 1) * loaded, "Processing stack", null);
        processStack(options);
        progress.onProgress(100, "Done loading!", null);
        return LoadResult.success(stack.size());
    }

    /**
     * Parameters in stack order, brightest exposure first.
     */
    public List<ExposureParameters> parameters() {
        return stack.order().stream().map(parametersById::get).toList();
    }

    public ExposureStack stack() {
        return stack;
    }

    public void clear() {
        stack.clear();
        parametersById.clear();
    }

    private LoadResult loadFrames(String fileName, ProgressListener progress) {
        Path file = Path.of(fileName);
        int frameCount = decoder.probeFrameCount(file);
        if (frameCount < 1 || frameCount > MAX_FRAMES_PER_FILE) {
            logger.info("{} holds {} raw frames; nothing to merge", fileName, frameCount);
            return LoadResult.success(0);
        }

        int step = 100 / (frameCount + 1);
        for (int frame = 0; frame < frameCount; frame++) {
            progress.onProgress(step * frame, "Loading %1", fileName);
            Optional<LoadResult> failure = loadExposure(file, frame, frame);
            if (failure.isPresent()) {
                return failure.get();
            }
        }
        return LoadResult.success(frameCount);
    }

    private LoadResult loadFiles(List<String> fileNames, ProgressListener progress) {
        int step = 100 / (fileNames.size() + 1);
        for (int index = 0; index < fileNames.size(); index++) {
            String fileName = fileNames.get(index);
            progress.onProgress(step * index, "Loading %1", fileName);
            Optional<LoadResult> failure = loadExposure(Path.of(fileName), 0, index);
            if (failure.isPresent()) {
                return failure.get();
            }
        }
        return LoadResult.success(fileNames.size());
    }

    private Optional<LoadResult> loadExposure(Path file, int frame, int index) {
        Optional<DecodedExposure> decoded;
        try {
            decoded = decoder.decode(file, frame);
        } catch (IOException e) {
            logger.warn("Decoding {} frame {} failed", file, frame, e);
            return Optional.of(LoadResult.decodeFailed(index));
        }
        if (decoded.isEmpty()) {
            logger.warn("{} frame {} has no usable raw data", file, frame);
            return Optional.of(LoadResult.decodeFailed(index));
        }

        ExposureParameters params = decoded.get().parameters();
        if (stack.size() > 0 && !params.isSameFormat(front())) {
            logger.warn("{} does not match the format of {}", file, front().getFileName());
            return Optional.of(LoadResult.formatMismatch(index));
        }

        long exposureId = nextExposureId++;
        parametersById.put(exposureId, params);
        int position = stack.insert(exposureId, decoded.get());
        logger.debug("Inserted {} frame {} at stack position {}", file, frame, position);
        return Optional.empty();
    }

    private void processStack(LoadOptions options) {
        ExposureParameters params = front();
        if (options.useCustomWl()) {
            params.applyWhiteLevelCeiling(options.customWl());
        }
        stack.setFlip(params.getFlip());
        stack.calculateSaturationLevel(params, options.useCustomWl());
        if (options.align() && params.canAlign()) {
            stack.align();
            if (options.crop()) {
                stack.crop();
            }
        }
        stack.computeResponseFunctions();
        stack.generateMask();
    }

    private ExposureParameters front() {
        return parametersById.get(stack.order().get(0));
    }
}
