package github.sarthakdev143.hdr_merge.service;

import github.sarthakdev143.hdr_merge.model.metadata.MetadataRecordSet;

import java.io.IOException;

/**
 * Metadata of one image file or in-memory container.
 */
public interface MetadataContainer extends AutoCloseable {

    MetadataRecordSet xmp();

    MetadataRecordSet iptc();

    MetadataRecordSet exif();

    /**
     * Stores modified entries back into the container.
     */
    void writeMetadata() throws IOException;

    /**
     * Current container bytes, including any metadata written.
     */
    byte[] bytes() throws IOException;

    @Override
    void close() throws IOException;
}
