package github.sarthakdev143.hdr_merge.model.metadata;

public enum MetadataFamily {
    XMP("Xmp"),
    IPTC("Iptc"),
    EXIF("Exif");

    private final String prefix;

    MetadataFamily(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }

    public static MetadataFamily fromPrefix(String prefix) {
        for (MetadataFamily family : values()) {
            if (family.prefix.equals(prefix)) {
                return family;
            }
        }
        throw new IllegalArgumentException("Unknown metadata family: " + prefix);
    }
}
