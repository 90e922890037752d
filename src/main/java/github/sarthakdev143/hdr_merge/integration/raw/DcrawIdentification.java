package github.sarthakdev143.hdr_merge.integration.raw;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fields of {@code dcraw -i -v} output that describe a raw file.
 *
 * @param timestamp      capture time, or {@code null} when dcraw reports none
 * @param filterPattern  color filter letters, or an empty string for non-mosaic sensors
 * @param cameraMultipliers four white balance multipliers; the fourth repeats green when unused
 */
public record DcrawIdentification(
        String make,
        String model,
        Instant timestamp,
        double shutterSeconds,
        int rawCount,
        int width,
        int height,
        String filterPattern,
        float[] cameraMultipliers) {

    private static final DateTimeFormatter CTIME = DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.US);
    private static final Pattern SIZE = Pattern.compile("(\\d+)\\s*x\\s*(\\d+)");
    private static final Pattern SHUTTER = Pattern.compile("(?:(\\d+(?:\\.\\d+)?)/)?(\\d+(?:\\.\\d+)?)\\s*sec");

    public static DcrawIdentification parse(String output, ZoneId zone) {
        String make = "";
        String model = "";
        Instant timestamp = null;
        double shutter = 0.0;
        int rawCount = 1;
        int width = 0;
        int height = 0;
        String filterPattern = "";
        float[] multipliers = {1.0f, 1.0f, 1.0f, 1.0f};
        boolean identified = false;

        for (String line : output.split("\\R")) {
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String field = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            switch (field) {
                case "Camera" -> {
                    identified = true;
                    int space = value.indexOf(' ');
                    make = space < 0 ? value : value.substring(0, space);
                    model = space < 0 ? "" : value.substring(space + 1).trim();
                }
                case "Timestamp" -> timestamp = parseTimestamp(value, zone);
                case "Shutter" -> shutter = parseShutter(value);
                case "Number of raw images" -> rawCount = parseInt(value, rawCount);
                case "Image size" -> {
                    Matcher size = SIZE.matcher(value);
                    if (size.find()) {
                        width = Integer.parseInt(size.group(1));
                        height = Integer.parseInt(size.group(2));
                    }
                }
                case "Filter pattern" -> filterPattern = normalizeFilterPattern(value);
                case "Camera multipliers" -> multipliers = parseMultipliers(value, multipliers);
                default -> {
                    // Other fields are not needed.
                }
            }
        }

        if (!identified) {
            throw new IllegalArgumentException("dcraw did not identify a camera.");
        }
        return new DcrawIdentification(
                make, model, timestamp, shutter, rawCount, width, height, filterPattern, multipliers);
    }

    /**
     * Reduces the printed pattern to its 2x2 tile when it repeats as one.
     */
    static String normalizeFilterPattern(String printed) {
        String letters = printed.replaceAll("[^A-Za-z]", "").toUpperCase(Locale.ROOT);
        if (letters.length() < 4) {
            return letters;
        }
        for (int i = 4; i < letters.length(); i++) {
            if (letters.charAt(i) != letters.charAt(i % 4)) {
                return letters;
            }
        }
        return letters.substring(0, 4);
    }

    static double parseShutter(String value) {
        Matcher matcher = SHUTTER.matcher(value);
        if (!matcher.find()) {
            return 0.0;
        }
        double denominator = Double.parseDouble(matcher.group(2));
        if (matcher.group(1) == null) {
            return denominator;
        }
        return denominator == 0.0 ? 0.0 : Double.parseDouble(matcher.group(1)) / denominator;
    }

    private static Instant parseTimestamp(String value, ZoneId zone) {
        try {
            return LocalDateTime.parse(value.replaceAll("\\s+", " "), CTIME).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static float[] parseMultipliers(String value, float[] fallback) {
        String[] parts = value.trim().split("\\s+");
        if (parts.length < 3) {
            return fallback;
        }
        float[] multipliers = new float[4];
        try {
            for (int i = 0; i < 4; i++) {
                multipliers[i] = i < parts.length ? Float.parseFloat(parts[i]) : 0.0f;
            }
        } catch (NumberFormatException e) {
            return fallback;
        }
        if (multipliers[3] == 0.0f) {
            multipliers[3] = multipliers[1];
        }
        return multipliers;
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
