package github.sarthakdev143.hdr_merge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * External tool locations and tuning for merge jobs. The {@code DCRAW_PATH} and
 * {@code EXIFTOOL_PATH} environment variables take precedence over the configured paths.
 */
@ConfigurationProperties(prefix = "hdr-merge")
public record HdrMergeProperties(
        @DefaultValue("dcraw") String dcrawPath,
        @DefaultValue("exiftool") String exiftoolPath,
        @DefaultValue("10m") Duration processTimeout,
        @DefaultValue("16") int alignSearchRadius) {

    public static final String DCRAW_PATH_ENV = "DCRAW_PATH";
    public static final String EXIFTOOL_PATH_ENV = "EXIFTOOL_PATH";

    public HdrMergeProperties {
        if (processTimeout == null || processTimeout.isNegative() || processTimeout.isZero()) {
            throw new IllegalArgumentException("hdr-merge.process-timeout must be positive.");
        }
        if (alignSearchRadius < 0) {
            throw new IllegalArgumentException("hdr-merge.align-search-radius must not be negative.");
        }
    }

    public static HdrMergeProperties defaults() {
        return new HdrMergeProperties("dcraw", "exiftool", Duration.ofMinutes(10), 16);
    }

    public String resolveDcrawBinary() {
        return resolveBinary(DCRAW_PATH_ENV, dcrawPath);
    }

    public String resolveExiftoolBinary() {
        return resolveBinary(EXIFTOOL_PATH_ENV, exiftoolPath);
    }

    private static String resolveBinary(String environmentVariable, String configured) {
        String override = System.getenv(environmentVariable);
        if (override != null && !override.isBlank()) {
            return override;
        }
        return configured;
    }
}
