package github.sarthakdev143.hdr_merge.model.metadata;

/**
 * Dotted metadata key such as {@code Exif.Image.Make} or {@code Xmp.dc.subject}.
 */
public record MetadataKey(MetadataFamily family, String group, String tag) {

    public MetadataKey {
        if (family == null) {
            throw new IllegalArgumentException("Metadata family is required.");
        }
        if (group == null || group.isBlank() || tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Metadata group and tag are required.");
        }
    }

    public static MetadataKey parse(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Metadata key is required.");
        }
        int firstDot = key.indexOf('.');
        int secondDot = firstDot < 0 ? -1 : key.indexOf('.', firstDot + 1);
        if (secondDot < 0) {
            throw new IllegalArgumentException("Metadata key must look like Family.Group.Tag: " + key);
        }
        return new MetadataKey(
                MetadataFamily.fromPrefix(key.substring(0, firstDot)),
                key.substring(firstDot + 1, secondDot),
                key.substring(secondDot + 1));
    }

    @Override
    public String toString() {
        return family.prefix() + "." + group + "." + tag;
    }
}
