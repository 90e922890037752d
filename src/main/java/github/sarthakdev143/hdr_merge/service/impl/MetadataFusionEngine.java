package github.sarthakdev143.hdr_merge.service.impl;

import github.sarthakdev143.hdr_merge.model.metadata.FusionOutcome;
import github.sarthakdev143.hdr_merge.model.metadata.FusionReport;
import github.sarthakdev143.hdr_merge.model.metadata.MetadataKey;
import github.sarthakdev143.hdr_merge.model.metadata.MetadataRecordSet;
import github.sarthakdev143.hdr_merge.service.MetadataContainer;
import github.sarthakdev143.hdr_merge.service.MetadataContainerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Carries XMP, IPTC and EXIF metadata from a source raw file into a freshly written DNG and
 * stores the result at the destination path.
 */
@Component
public class MetadataFusionEngine {

    private static final Logger logger = LoggerFactory.getLogger(MetadataFusionEngine.class);
    private static final long PRIMARY_IMAGE = 0L;

    private final MetadataContainerFactory containerFactory;
    private final MetadataFusionRules rules;

    public MetadataFusionEngine(MetadataContainerFactory containerFactory, MetadataFusionRules rules) {
        this.containerFactory = containerFactory;
        this.rules = rules;
    }

    public FusionReport fuse(Path sourceFile, byte[] destinationBytes, Path destinationPath) {
        MetadataContainer destination;
        try {
            destination = containerFactory.open(destinationBytes);
        } catch (IOException e) {
            logger.warn("Cannot read metadata of the merged container for {}", destinationPath, e);
            return FusionReport.destinationUnreadable("Merged container unreadable: " + e.getMessage());
        }

        try (destination) {
            return fuseInto(sourceFile, destination, destinationPath);
        } catch (IOException e) {
            logger.warn("Failed to release metadata container for {}", destinationPath, e);
            return new FusionReport(FusionOutcome.WRITE_FAILURE, 0, 0, 0,
                    List.of("Metadata container cleanup failed: " + e.getMessage()));
        }
    }

    private FusionReport fuseInto(Path sourceFile, MetadataContainer destination, Path destinationPath) {
        List<String> failures = new ArrayList<>();
        FusionOutcome outcome = FusionOutcome.FUSED;
        int xmpCopied = 0;
        int iptcCopied = 0;
        int exifCopied = 0;

        try (MetadataContainer source = containerFactory.open(sourceFile)) {
            xmpCopied = copyMissing(source.xmp(), destination.xmp(), rules::isCopyableXmp);
            iptcCopied = copyMissing(source.iptc(), destination.iptc(), key -> true);
            exifCopied = copyExif(source.exif(), destination.exif());
        } catch (IOException e) {
            logger.warn("Cannot read metadata from {}; the output keeps only its own tags", sourceFile, e);
            failures.add("Source metadata unreadable for " + sourceFile + ": " + e.getMessage());
            outcome = FusionOutcome.SOURCE_UNREADABLE;
            destination.exif().put(rules.primaryImageFlag(), PRIMARY_IMAGE);
        }

        try {
            destination.writeMetadata();
            Files.write(destinationPath, destination.bytes());
        } catch (IOException e) {
            logger.warn("Failed to write {} with fused metadata", destinationPath, e);
            failures.add("Metadata write failed for " + destinationPath + ": " + e.getMessage());
            outcome = FusionOutcome.WRITE_FAILURE;
        }

        logger.debug("Fused metadata from {} into {}: xmp={} iptc={} exif={} outcome={}",
                sourceFile, destinationPath, xmpCopied, iptcCopied, exifCopied, outcome);
        return new FusionReport(outcome, xmpCopied, iptcCopied, exifCopied, failures);
    }

    private int copyExif(MetadataRecordSet source, MetadataRecordSet destination) {
        int copied = 0;
        for (MetadataKey key : rules.forcedExifKeys()) {
            Object value = source.get(key).orElse(null);
            if (value != null) {
                destination.put(key, value);
                copied++;
            }
        }
        destination.put(rules.primaryImageFlag(), PRIMARY_IMAGE);
        return copied + copyMissing(source, destination, rules::isCopyableExif);
    }

    private static int copyMissing(
            MetadataRecordSet source,
            MetadataRecordSet destination,
            Predicate<MetadataKey> copyable) {
        int copied = 0;
        for (Map.Entry<MetadataKey, Object> entry : source.entries().entrySet()) {
            MetadataKey key = entry.getKey();
            if (copyable.test(key) && !destination.contains(key)) {
                destination.put(key, entry.getValue());
                copied++;
            }
        }
        return copied;
    }
}
