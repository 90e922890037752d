package github.sarthakdev143.hdr_merge.model.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One metadata namespace of an image. Values are strings, numbers, lists of those, or raw bytes.
 * Keys written after loading are tracked so a backend can persist only what changed.
 */
public class MetadataRecordSet {

    private final MetadataFamily family;
    private final Map<MetadataKey, Object> entries = new LinkedHashMap<>();
    private final Set<MetadataKey> modifiedKeys = new LinkedHashSet<>();

    public MetadataRecordSet(MetadataFamily family) {
        this.family = family;
    }

    public MetadataFamily family() {
        return family;
    }

    /**
     * Adds an entry as read from storage, without marking it modified.
     */
    public void load(MetadataKey key, Object value) {
        checkFamily(key);
        entries.put(key, value);
    }

    public void put(MetadataKey key, Object value) {
        checkFamily(key);
        if (value == null) {
            throw new IllegalArgumentException("Metadata value is required for " + key);
        }
        entries.put(key, value);
        modifiedKeys.add(key);
    }

    public boolean contains(MetadataKey key) {
        return entries.containsKey(key);
    }

    public Optional<Object> get(MetadataKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    public Map<MetadataKey, Object> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public Set<MetadataKey> modifiedKeys() {
        return Collections.unmodifiableSet(modifiedKeys);
    }

    public void clearModified() {
        modifiedKeys.clear();
    }

    public int size() {
        return entries.size();
    }

    private void checkFamily(MetadataKey key) {
        if (key.family() != family) {
            throw new IllegalArgumentException(key + " does not belong to the " + family.prefix() + " namespace.");
        }
    }
}
