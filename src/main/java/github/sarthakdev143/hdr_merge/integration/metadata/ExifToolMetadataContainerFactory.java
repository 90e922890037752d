package github.sarthakdev143.hdr_merge.integration.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.hdr_merge.config.HdrMergeProperties;
import github.sarthakdev143.hdr_merge.integration.process.ExternalCommandRunner;
import github.sarthakdev143.hdr_merge.model.metadata.MetadataKey;
import github.sarthakdev143.hdr_merge.service.MetadataContainer;
import github.sarthakdev143.hdr_merge.service.MetadataContainerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes XMP, IPTC and EXIF through ExifTool's JSON output.
 */
@Component
public class ExifToolMetadataContainerFactory implements MetadataContainerFactory {

    private static final String BASE64_PREFIX = "base64:";
    private static final List<String> READ_ARGUMENTS = List.of("-json", "-G0:1", "-a", "-u", "-n", "-b");

    private final ExternalCommandRunner commandRunner;
    private final HdrMergeProperties properties;
    private final ObjectMapper objectMapper;

    public ExifToolMetadataContainerFactory(
            ExternalCommandRunner commandRunner,
            HdrMergeProperties properties,
            ObjectMapper objectMapper) {
        this.commandRunner = commandRunner;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public MetadataContainer open(byte[] containerBytes) throws IOException {
        Path file = Files.createTempFile("hdr-merge-container-", ".dng");
        try {
            Files.write(file, containerBytes);
            return new ExifToolMetadataContainer(this, file, true, readEntries(file));
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(file);
            throw e;
        }
    }

    @Override
    public MetadataContainer open(Path file) throws IOException {
        if (!Files.isReadable(file)) {
            throw new IOException("Cannot read " + file);
        }
        return new ExifToolMetadataContainer(this, file, false, readEntries(file));
    }

    byte[] runExifTool(List<String> arguments, String stage) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(properties.resolveExiftoolBinary());
        command.addAll(arguments);
        return commandRunner.run(command, stage);
    }

    Map<MetadataKey, Object> readEntries(Path file) throws IOException {
        List<String> arguments = new ArrayList<>(READ_ARGUMENTS);
        arguments.add(file.toString());
        return parseEntries(runExifTool(arguments, "read metadata " + file.getFileName()));
    }

    Map<MetadataKey, Object> parseEntries(byte[] json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isArray() || root.isEmpty()) {
            throw new IOException("ExifTool returned no metadata.");
        }

        JsonNode fields = root.get(0);
        Map<MetadataKey, Object> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = fields.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> field = iterator.next();
            if (field.getKey().endsWith(":Error")) {
                throw new IOException("ExifTool cannot read the file: " + field.getValue().asText());
            }
            Object value = toValue(field.getValue());
            if (value != null) {
                ExifToolNames.toKey(field.getKey()).ifPresent(key -> entries.put(key, value));
            }
        }
        return entries;
    }

    private static Object toValue(JsonNode node) {
        if (node.isArray()) {
            List<Object> items = new ArrayList<>();
            for (JsonNode item : node) {
                Object value = toValue(item);
                if (value != null) {
                    items.add(value);
                }
            }
            return items;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            String text = node.asText();
            if (text.startsWith(BASE64_PREFIX)) {
                return Base64.getDecoder().decode(text.substring(BASE64_PREFIX.length()));
            }
            return text;
        }
        if (node.isBoolean()) {
            return String.valueOf(node.asBoolean());
        }
        return null;
    }
}
