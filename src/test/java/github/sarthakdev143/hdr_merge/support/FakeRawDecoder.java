package github.sarthakdev143.hdr_merge.support;

import github.sarthakdev143.hdr_merge.model.CreationInterval;
import github.sarthakdev143.hdr_merge.model.DecodedExposure;
import github.sarthakdev143.hdr_merge.service.RawDecoder;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decoder backed by in-memory frames, keyed by file name.
 */
public class FakeRawDecoder implements RawDecoder {

    private final Map<String, List<DecodedExposure>> frames = new HashMap<>();
    private final Map<String, CreationInterval> intervals = new HashMap<>();
    private final Map<String, Integer> frameCounts = new HashMap<>();
    private final Set<String> failing = new HashSet<>();
    private final List<String> decoded = new ArrayList<>();

    public FakeRawDecoder add(String fileName, DecodedExposure... exposures) {
        frames.put(fileName, List.of(exposures));
        return this;
    }

    public FakeRawDecoder failing(String fileName) {
        failing.add(fileName);
        return this;
    }

    public FakeRawDecoder frameCount(String fileName, int count) {
        frameCounts.put(fileName, count);
        return this;
    }

    public FakeRawDecoder interval(String fileName, CreationInterval interval) {
        intervals.put(fileName, interval);
        return this;
    }

    public List<String> decoded() {
        return decoded;
    }

    @Override
    public Optional<DecodedExposure> decode(Path file, int frame) throws IOException {
        String key = file.toString();
        decoded.add(key + "#" + frame);
        if (failing.contains(key)) {
            throw new IOException("cannot decode " + key);
        }
        List<DecodedExposure> available = frames.get(key);
        if (available == null || frame >= available.size()) {
            return Optional.empty();
        }
        return Optional.of(available.get(frame));
    }

    @Override
    public int probeFrameCount(Path file) {
        String key = file.toString();
        return frameCounts.getOrDefault(key, frames.containsKey(key) ? frames.get(key).size() : 0);
    }

    @Override
    public Optional<CreationInterval> probeCreationInterval(Path file) {
        return Optional.ofNullable(intervals.get(file.toString()));
    }
}
