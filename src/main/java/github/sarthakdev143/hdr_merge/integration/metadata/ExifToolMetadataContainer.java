package github.sarthakdev143.hdr_merge.integration.metadata;

import github.sarthakdev143.hdr_merge.model.metadata.MetadataFamily;
import github.sarthakdev143.hdr_merge.model.metadata.MetadataKey;
import github.sarthakdev143.hdr_merge.model.metadata.MetadataRecordSet;
import github.sarthakdev143.hdr_merge.service.MetadataContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Metadata of one file as read by ExifTool. Containers opened from bytes own a temporary copy
 * that is deleted on close.
 */
class ExifToolMetadataContainer implements MetadataContainer {

    private static final Logger logger = LoggerFactory.getLogger(ExifToolMetadataContainer.class);

    private final ExifToolMetadataContainerFactory factory;
    private final Path file;
    private final boolean temporary;
    private final MetadataRecordSet xmp = new MetadataRecordSet(MetadataFamily.XMP);
    private final MetadataRecordSet iptc = new MetadataRecordSet(MetadataFamily.IPTC);
    private final MetadataRecordSet exif = new MetadataRecordSet(MetadataFamily.EXIF);

    ExifToolMetadataContainer(
            ExifToolMetadataContainerFactory factory,
            Path file,
            boolean temporary,
            Map<MetadataKey, Object> entries) {
        this.factory = factory;
        this.file = file;
        this.temporary = temporary;
        entries.forEach((key, value) -> recordSet(key.family()).load(key, value));
    }

    @Override
    public MetadataRecordSet xmp() {
        return xmp;
    }

    @Override
    public MetadataRecordSet iptc() {
        return iptc;
    }

    @Override
    public MetadataRecordSet exif() {
        return exif;
    }

    @Override
    public void writeMetadata() throws IOException {
        if (!temporary) {
            throw new IOException("Metadata of " + file + " is opened read-only.");
        }

        List<Path> valueFiles = new ArrayList<>();
        Path argumentFile = Files.createTempFile("hdr-merge-exiftool-", ".args");
        try {
            List<String> arguments = new ArrayList<>(List.of("-overwrite_original", "-m", "-n"));
            int assignments = 0;
            for (MetadataRecordSet recordSet : List.of(xmp, iptc, exif)) {
                for (MetadataKey key : recordSet.modifiedKeys()) {
                    Object value = recordSet.get(key).orElseThrow();
                    assignments += addAssignments(arguments, ExifToolNames.toWriteTarget(key), value, valueFiles);
                }
            }
            if (assignments == 0) {
                return;
            }
            arguments.add(file.toString());
            Files.write(argumentFile, arguments, StandardCharsets.UTF_8);
            factory.runExifTool(List.of("-@", argumentFile.toString()), "write metadata");
            logger.debug("Wrote {} metadata assignments to {}", assignments, file);
            xmp.clearModified();
            iptc.clearModified();
            exif.clearModified();
        } finally {
            Files.deleteIfExists(argumentFile);
            for (Path valueFile : valueFiles) {
                Files.deleteIfExists(valueFile);
            }
        }
    }

    @Override
    public byte[] bytes() throws IOException {
        return Files.readAllBytes(file);
    }

    @Override
    public void close() throws IOException {
        if (temporary) {
            Files.deleteIfExists(file);
        }
    }

    private static int addAssignments(List<String> arguments, String target, Object value, List<Path> valueFiles)
            throws IOException {
        if (value instanceof List<?> items) {
            int count = 0;
            for (Object item : items) {
                count += addAssignments(arguments, target, item, valueFiles);
            }
            return count;
        }
        if (value instanceof byte[] bytes) {
            arguments.add("-" + target + "<=" + writeValueFile(bytes, valueFiles));
            return 1;
        }
        String text = String.valueOf(value);
        if (text.contains("\n") || text.contains("\r")) {
            arguments.add("-" + target + "<=" + writeValueFile(text.getBytes(StandardCharsets.UTF_8), valueFiles));
        } else {
            arguments.add("-" + target + "=" + text);
        }
        return 1;
    }

    private static Path writeValueFile(byte[] bytes, List<Path> valueFiles) throws IOException {
        Path valueFile = Files.createTempFile("hdr-merge-value-", ".bin");
        valueFiles.add(valueFile);
        Files.write(valueFile, bytes);
        return valueFile;
    }

    private MetadataRecordSet recordSet(MetadataFamily family) {
        return switch (family) {
            case XMP -> xmp;
            case IPTC -> iptc;
            case EXIF -> exif;
        };
    }
}
