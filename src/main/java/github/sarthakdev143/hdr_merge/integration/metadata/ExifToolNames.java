package github.sarthakdev143.hdr_merge.integration.metadata;

import github.sarthakdev143.hdr_merge.model.metadata.MetadataFamily;
import github.sarthakdev143.hdr_merge.model.metadata.MetadataKey;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates between ExifTool {@code Family0:Family1:Tag} names and dotted metadata keys.
 */
final class ExifToolNames {

    private static final Map<String, String> EXIF_GROUPS = Map.of(
            "IFD0", "Image",
            "IFD1", "Thumbnail",
            "ExifIFD", "Photo",
            "GPS", "GPSInfo",
            "InteropIFD", "Iop",
            "SubIFD", "SubImage1");
    private static final Map<String, String> EXIF_TAGS = Map.of(
            "SubfileType", "NewSubfileType",
            "ThumbnailOffset", "JPEGInterchangeFormat",
            "ThumbnailLength", "JPEGInterchangeFormatLength");
    private static final Pattern NUMBERED_SUB_IFD = Pattern.compile("SubIFD(\\d+)");
    private static final Pattern NUMBERED_SUB_IMAGE = Pattern.compile("SubImage(\\d+)");
    private static final Pattern NUMBERED_IFD = Pattern.compile("IFD(\\d+)");
    private static final Pattern NUMBERED_IMAGE = Pattern.compile("Image(\\d+)");
    private static final String XMP_PREFIX = "XMP-";

    private ExifToolNames() {
    }

    /**
     * Key for an ExifTool JSON field name, or empty for groups outside the three namespaces.
     */
    static Optional<MetadataKey> toKey(String qualifiedName) {
        String[] parts = qualifiedName.split(":");
        if (parts.length != 3) {
            return Optional.empty();
        }
        String family0 = parts[0];
        String family1 = parts[1];
        String tag = parts[2];
        return switch (family0) {
            case "EXIF" -> Optional.of(new MetadataKey(
                    MetadataFamily.EXIF, exifGroup(family1), EXIF_TAGS.getOrDefault(tag, tag)));
            case "MakerNotes" -> Optional.of(new MetadataKey(MetadataFamily.EXIF, family1, tag));
            case "XMP" -> Optional.of(new MetadataKey(MetadataFamily.XMP, xmpGroup(family1), tag));
            case "IPTC" -> Optional.of(new MetadataKey(MetadataFamily.IPTC, "Application2", tag));
            default -> Optional.empty();
        };
    }

    /**
     * ExifTool write target such as {@code SubIFD:SubfileType}.
     */
    static String toWriteTarget(MetadataKey key) {
        return switch (key.family()) {
            case EXIF -> exifToolGroup(key.group()) + ":" + exifToolTag(key.tag());
            case XMP -> XMP_PREFIX + key.group() + ":" + key.tag();
            case IPTC -> "IPTC:" + key.tag();
        };
    }

    private static String exifGroup(String family1) {
        String mapped = EXIF_GROUPS.get(family1);
        if (mapped != null) {
            return mapped;
        }
        Matcher subIfd = NUMBERED_SUB_IFD.matcher(family1);
        if (subIfd.matches()) {
            return "SubImage" + (Integer.parseInt(subIfd.group(1)) + 1);
        }
        Matcher ifd = NUMBERED_IFD.matcher(family1);
        if (ifd.matches()) {
            return "Image" + ifd.group(1);
        }
        return family1;
    }

    private static String exifToolGroup(String group) {
        for (Map.Entry<String, String> entry : EXIF_GROUPS.entrySet()) {
            if (entry.getValue().equals(group)) {
                return entry.getKey();
            }
        }
        Matcher subImage = NUMBERED_SUB_IMAGE.matcher(group);
        if (subImage.matches()) {
            return "SubIFD" + (Integer.parseInt(subImage.group(1)) - 1);
        }
        Matcher image = NUMBERED_IMAGE.matcher(group);
        if (image.matches()) {
            return "IFD" + image.group(1);
        }
        return group;
    }

    private static String exifToolTag(String tag) {
        for (Map.Entry<String, String> entry : EXIF_TAGS.entrySet()) {
            if (entry.getValue().equals(tag)) {
                return entry.getKey();
            }
        }
        return tag;
    }

    private static String xmpGroup(String family1) {
        return family1.startsWith(XMP_PREFIX) ? family1.substring(XMP_PREFIX.length()) : family1;
    }
}
