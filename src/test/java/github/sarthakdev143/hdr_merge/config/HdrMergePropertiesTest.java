package github.sarthakdev143.hdr_merge.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HdrMergePropertiesTest {

    @Test
    void defaultsPointAtToolsOnThePath() {
        HdrMergeProperties properties = HdrMergeProperties.defaults();

        assertThat(properties.dcrawPath()).isEqualTo("dcraw");
        assertThat(properties.exiftoolPath()).isEqualTo("exiftool");
        assertThat(properties.processTimeout()).isEqualTo(Duration.ofMinutes(10));
        assertThat(properties.alignSearchRadius()).isEqualTo(16);
    }

    @Test
    void configuredPathIsUsedWithoutEnvironmentOverride() {
        HdrMergeProperties properties = new HdrMergeProperties("/opt/dcraw", "/opt/exiftool", Duration.ofSeconds(30), 8);

        if (System.getenv(HdrMergeProperties.DCRAW_PATH_ENV) == null) {
            assertThat(properties.resolveDcrawBinary()).isEqualTo("/opt/dcraw");
        }
        if (System.getenv(HdrMergeProperties.EXIFTOOL_PATH_ENV) == null) {
            assertThat(properties.resolveExiftoolBinary()).isEqualTo("/opt/exiftool");
        }
    }

    @Test
    void rejectsNonPositiveTimeoutAndNegativeRadius() {
        assertThatThrownBy(() -> new HdrMergeProperties("dcraw", "exiftool", Duration.ZERO, 16))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("process-timeout");
        assertThatThrownBy(() -> new HdrMergeProperties("dcraw", "exiftool", Duration.ofMinutes(1), -2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("align-search-radius");
    }
}
