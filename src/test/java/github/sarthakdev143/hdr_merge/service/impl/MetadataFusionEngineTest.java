package github.sarthakdev143.hdr_merge.service.impl;

import github.sarthakdev143.hdr_merge.model.metadata.FusionOutcome;
import github.sarthakdev143.hdr_merge.model.metadata.FusionReport;
import github.sarthakdev143.hdr_merge.model.metadata.MetadataKey;
import github.sarthakdev143.hdr_merge.model.metadata.MetadataRecordSet;
import github.sarthakdev143.hdr_merge.support.InMemoryMetadataContainerFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataFusionEngineTest {

    private static final byte[] CONTAINER = {'I', 'I', 42, 0};

    @TempDir
    Path tempDir;

    private final InMemoryMetadataContainerFactory factory = new InMemoryMetadataContainerFactory();
    private final MetadataFusionEngine engine = new MetadataFusionEngine(factory, MetadataFusionRules.defaults());

    @Test
    void copiesSceneMetadataAndMarksTheRawImagePrimary() throws Exception {
        Path source = tempDir.resolve("IMG_0001.CR2");
        Path output = tempDir.resolve("IMG_0001.dng");
        factory.source(source, Map.of(
                "Exif.Photo.ExposureTime", 0.01,
                "Exif.Photo.FNumber", 8.0,
                "Exif.Canon.LensModel", "EF24-70mm f/2.8L",
                "Xmp.dc.creator", "Jane",
                "Iptc.Application2.City", "Lisbon"));

        FusionReport report = engine.fuse(source, CONTAINER, output);

        assertThat(report.outcome()).isEqualTo(FusionOutcome.FUSED);
        assertThat(report.written()).isTrue();
        assertThat(report.xmpCopied()).isEqualTo(1);
        assertThat(report.iptcCopied()).isEqualTo(1);
        assertThat(report.exifCopied()).isEqualTo(3);
        MetadataRecordSet exif = factory.lastDestination().exif();
        assertThat(exif.get(MetadataKey.parse("Exif.Canon.LensModel"))).contains("EF24-70mm f/2.8L");
        assertThat(exif.get(MetadataKey.parse("Exif.SubImage1.NewSubfileType"))).contains(0L);
        assertThat(factory.lastDestination().written()).isTrue();
        assertThat(factory.lastDestination().closed()).isTrue();
        assertThat(Files.readAllBytes(output)).isEqualTo(CONTAINER);
    }

    @Test
    void forcedKeysOverwriteWhileOtherKeysKeepTheDestinationValue() {
        Path source = tempDir.resolve("IMG_0002.NEF");
        factory.destinationEntry("Exif.Image.Make", "hdr-merge")
                .destinationEntry("Exif.Photo.ISOSpeedRatings", 100L)
                .source(source, Map.of(
                        "Exif.Image.Make", "NIKON CORPORATION",
                        "Exif.Photo.ISOSpeedRatings", 400L));

        engine.fuse(source, CONTAINER, tempDir.resolve("out.dng"));

        MetadataRecordSet exif = factory.lastDestination().exif();
        assertThat(exif.get(MetadataKey.parse("Exif.Image.Make"))).contains("NIKON CORPORATION");
        assertThat(exif.get(MetadataKey.parse("Exif.Photo.ISOSpeedRatings"))).contains(100L);
    }

    @Test
    void skipsPreviewLocatorsStructureGroupsAndTiffXmp() {
        Path source = tempDir.resolve("IMG_0003.ORF");
        factory.source(source, Map.of(
                "Exif.OlympusCs.PreviewImageStart", 4096L,
                "Exif.Thumbnail.Compression", 6L,
                "Exif.SubImage2.ImageWidth", 160L,
                "Exif.SubThumb1.ImageWidth", 320L,
                "Exif.Image.Orientation", 1L,
                "Xmp.tiff.ImageWidth", 4000L,
                "Xmp.exif.DateTimeOriginal", "2024-05-01T10:00:00"));

        FusionReport report = engine.fuse(source, CONTAINER, tempDir.resolve("out.dng"));

        MetadataRecordSet exif = factory.lastDestination().exif();
        assertThat(exif.contains(MetadataKey.parse("Exif.OlympusCs.PreviewImageStart"))).isFalse();
        assertThat(exif.contains(MetadataKey.parse("Exif.Thumbnail.Compression"))).isFalse();
        assertThat(exif.contains(MetadataKey.parse("Exif.SubImage2.ImageWidth"))).isFalse();
        assertThat(exif.contains(MetadataKey.parse("Exif.SubThumb1.ImageWidth"))).isFalse();
        assertThat(exif.contains(MetadataKey.parse("Exif.Image.Orientation"))).isFalse();
        assertThat(factory.lastDestination().xmp().contains(MetadataKey.parse("Xmp.tiff.ImageWidth"))).isFalse();
        assertThat(report.xmpCopied()).isEqualTo(1);
        assertThat(report.exifCopied()).isZero();
    }

    @Test
    void everyExcludedGroupPrefixKeepsItsTagsOutOfTheDestination() {
        for (String prefix : MetadataFusionRules.defaults().excludedGroupPrefixes()) {
            Path source = tempDir.resolve(prefix + ".NEF");
            String key = "Exif." + prefix + "3.Software";
            factory.source(source, Map.of(key, "firmware 1.1", "Exif.Photo.FNumber", 4.0));

            engine.fuse(source, CONTAINER, tempDir.resolve(prefix + ".dng"));

            MetadataRecordSet exif = factory.lastDestination().exif();
            assertThat(exif.contains(MetadataKey.parse(key))).as(key).isFalse();
            assertThat(exif.contains(MetadataKey.parse("Exif.Photo.FNumber"))).isTrue();
        }
    }

    @Test
    void fusingTwiceCopiesNothingNewTheSecondTime() {
        Path source = tempDir.resolve("IMG_0004.ARW");
        factory.source(source, Map.of("Exif.Photo.FNumber", 5.6, "Xmp.dc.title", "Harbour"));
        engine.fuse(source, CONTAINER, tempDir.resolve("first.dng"));

        MetadataRecordSet firstExif = factory.lastDestination().exif();
        InMemoryMetadataContainerFactory refused = new InMemoryMetadataContainerFactory();
        firstExif.entries().forEach((key, value) -> refused.destinationEntry(key.toString(), value));
        factory.lastDestination().xmp().entries()
                .forEach((key, value) -> refused.destinationEntry(key.toString(), value));
        refused.source(source, Map.of("Exif.Photo.FNumber", 5.6, "Xmp.dc.title", "Harbour"));

        FusionReport second = new MetadataFusionEngine(refused, MetadataFusionRules.defaults())
                .fuse(source, CONTAINER, tempDir.resolve("second.dng"));

        assertThat(second.exifCopied()).isZero();
        assertThat(second.xmpCopied()).isZero();
        assertThat(refused.lastDestination().exif().entries()).isEqualTo(firstExif.entries());
    }

    @Test
    void unreadableSourceStillWritesTheOutput() throws Exception {
        Path output = tempDir.resolve("lonely.dng");

        FusionReport report = engine.fuse(tempDir.resolve("missing.CR2"), CONTAINER, output);

        assertThat(report.outcome()).isEqualTo(FusionOutcome.SOURCE_UNREADABLE);
        assertThat(report.written()).isTrue();
        assertThat(report.failures()).hasSize(1);
        assertThat(factory.lastDestination().exif().get(MetadataKey.parse("Exif.SubImage1.NewSubfileType")))
                .contains(0L);
        assertThat(Files.exists(output)).isTrue();
    }

    @Test
    void unreadableDestinationWritesNothing() {
        Path output = tempDir.resolve("never.dng");
        factory.destinationUnreadable();

        FusionReport report = engine.fuse(tempDir.resolve("IMG.CR2"), CONTAINER, output);

        assertThat(report.outcome()).isEqualTo(FusionOutcome.DESTINATION_UNREADABLE);
        assertThat(report.written()).isFalse();
        assertThat(Files.exists(output)).isFalse();
    }

    @Test
    void failedMetadataWriteIsReported() {
        Path source = tempDir.resolve("IMG_0005.CR2");
        Path output = tempDir.resolve("failed.dng");
        factory.writeFails().source(source, Map.of("Exif.Photo.FNumber", 4.0));

        FusionReport report = engine.fuse(source, CONTAINER, output);

        assertThat(report.outcome()).isEqualTo(FusionOutcome.WRITE_FAILURE);
        assertThat(report.written()).isFalse();
        assertThat(report.failures()).singleElement().asString().contains("failed.dng");
        assertThat(factory.lastDestination().closed()).isTrue();
        assertThat(Files.exists(output)).isFalse();
    }
}
