package github.sarthakdev143.hdr_merge.service;

import github.sarthakdev143.hdr_merge.model.CreationInterval;
import github.sarthakdev143.hdr_merge.model.DecodedExposure;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

public interface RawDecoder {

    /**
     * Decodes one frame of a raw file. An empty result means the file holds no usable mosaic.
     */
    Optional<DecodedExposure> decode(Path file, int frame) throws IOException;

    /**
     * Number of raw frames in the file, or 0 when it cannot be identified.
     */
    int probeFrameCount(Path file);

    Optional<CreationInterval> probeCreationInterval(Path file);
}
