package github.sarthakdev143.hdr_merge.service;

import java.io.IOException;
import java.nio.file.Path;

public interface MetadataContainerFactory {

    MetadataContainer open(byte[] containerBytes) throws IOException;

    /**
     * Opens a file for reading. Writing back to it is not supported.
     */
    MetadataContainer open(Path file) throws IOException;
}
