package github.sarthakdev143.hdr_merge.service.impl;

import github.sarthakdev143.hdr_merge.model.metadata.MetadataKey;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Which source entries may be carried into a merged DNG.
 *
 * @param forcedExifKeys        copied from the source even when the destination already has them
 * @param excludedExifKeys      never copied; they locate previews that do not exist in the output
 * @param excludedGroupPrefixes EXIF groups that describe image structure rather than the scene
 * @param primaryImageFlag      marks the raw sub-image as the primary image
 * @param skippedXmpGroups      XMP schemas that duplicate EXIF structure tags
 */
public record MetadataFusionRules(
        List<MetadataKey> forcedExifKeys,
        Set<MetadataKey> excludedExifKeys,
        List<String> excludedGroupPrefixes,
        MetadataKey primaryImageFlag,
        Set<String> skippedXmpGroups) {

    public MetadataFusionRules {
        forcedExifKeys = List.copyOf(forcedExifKeys);
        excludedExifKeys = Set.copyOf(excludedExifKeys);
        excludedGroupPrefixes = List.copyOf(excludedGroupPrefixes);
        skippedXmpGroups = Set.copyOf(skippedXmpGroups);
    }

    public static MetadataFusionRules defaults() {
        return new MetadataFusionRules(
                keys(
                        "Exif.Image.Make",
                        "Exif.Image.Model",
                        "Exif.Image.Artist",
                        "Exif.Image.Copyright",
                        "Exif.Image.DNGPrivateData",
                        "Exif.SubImage1.OpcodeList1",
                        "Exif.SubImage1.OpcodeList2",
                        "Exif.SubImage1.OpcodeList3"),
                Set.copyOf(keys(
                        "Exif.OlympusCs.PreviewImageStart",
                        "Exif.OlympusCs.PreviewImageLength",
                        "Exif.Thumbnail.JPEGInterchangeFormat",
                        "Exif.Thumbnail.JPEGInterchangeFormatLength",
                        "Exif.NikonPreview.JPEGInterchangeFormat",
                        "Exif.NikonPreview.JPEGInterchangeFormatLength",
                        "Exif.Pentax.PreviewOffset",
                        "Exif.Pentax.PreviewLength",
                        "Exif.PentaxDng.PreviewOffset",
                        "Exif.PentaxDng.PreviewLength",
                        "Exif.Minolta.ThumbnailOffset",
                        "Exif.Minolta.ThumbnailLength",
                        "Exif.SonyMinolta.ThumbnailOffset",
                        "Exif.SonyMinolta.ThumbnailLength",
                        "Exif.Olympus.ThumbnailImage",
                        "Exif.Olympus2.ThumbnailImage",
                        "Exif.Minolta.Thumbnail",
                        "Exif.PanasonicRaw.PreviewImage",
                        "Exif.SamsungPreview.JPEGInterchangeFormat",
                        "Exif.SamsungPreview.JPEGInterchangeFormatLength")),
                List.of("Thumb", "SubThumb", "Image", "SubImage"),
                MetadataKey.parse("Exif.SubImage1.NewSubfileType"),
                Set.of("tiff"));
    }

    public boolean isForced(MetadataKey key) {
        return forcedExifKeys.contains(key);
    }

    /**
     * True when an EXIF entry may be copied into a destination that lacks it.
     */
    public boolean isCopyableExif(MetadataKey key) {
        if (excludedExifKeys.contains(key)) {
            return false;
        }
        return excludedGroupPrefixes.stream().noneMatch(key.group()::startsWith);
    }

    public boolean isCopyableXmp(MetadataKey key) {
        return !skippedXmpGroups.contains(key.group());
    }

    private static List<MetadataKey> keys(String... keys) {
        return Stream.of(keys).map(MetadataKey::parse).collect(Collectors.toUnmodifiableList());
    }
}
