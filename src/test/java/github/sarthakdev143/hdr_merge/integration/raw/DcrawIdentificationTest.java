package github.sarthakdev143.hdr_merge.integration.raw;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DcrawIdentificationTest {

    static final String CANON_OUTPUT = """
            Filename: /s/IMG_0001.CR2
            Timestamp: Sat May  4 10:00:00 2024
            Camera: Canon EOS 5D Mark III
            Owner:\s
            ISO speed: 100
            Shutter: 1/250.0 sec
            Aperture: f/8.0
            Focal length: 24.0 mm
            Number of raw images: 1
            Thumb size:  5760 x 3840
            Full size:   5920 x 3950
            Image size:  5796 x 3870
            Output size: 5796 x 3870
            Raw colors: 3
            Filter pattern: RGGBRGGBRGGBRGGB
            Daylight multipliers: 2.102 0.928 1.289
            Camera multipliers: 2048.000000 1024.000000 1536.000000 0.000000
            """;

    @Test
    void parsesIdentificationFields() {
        DcrawIdentification identification = DcrawIdentification.parse(CANON_OUTPUT, ZoneOffset.UTC);

        assertThat(identification.make()).isEqualTo("Canon");
        assertThat(identification.model()).isEqualTo("EOS 5D Mark III");
        assertThat(identification.timestamp()).isEqualTo(Instant.parse("2024-05-04T10:00:00Z"));
        assertThat(identification.shutterSeconds()).isEqualTo(0.004);
        assertThat(identification.rawCount()).isEqualTo(1);
        assertThat(identification.width()).isEqualTo(5796);
        assertThat(identification.height()).isEqualTo(3870);
        assertThat(identification.filterPattern()).isEqualTo("RGGB");
        assertThat(identification.cameraMultipliers()).containsExactly(2048f, 1024f, 1536f, 1024f);
    }

    @Test
    void missingTimestampAndMultipliersFallBack() {
        DcrawIdentification identification = DcrawIdentification.parse("""
                Camera: Pentax K-1
                Timestamp: unknown
                Number of raw images: 4
                Filter pattern: GB/RG
                """, ZoneOffset.UTC);

        assertThat(identification.timestamp()).isNull();
        assertThat(identification.rawCount()).isEqualTo(4);
        assertThat(identification.filterPattern()).isEqualTo("GBRG");
        assertThat(identification.cameraMultipliers()).containsExactly(1f, 1f, 1f, 1f);
    }

    @Test
    void keepsNonRepeatingPatternsWhole() {
        assertThat(DcrawIdentification.normalizeFilterPattern("RGGBGBRGRGGBGBRG")).isEqualTo("RGGBGBRGRGGBGBRG");
        assertThat(DcrawIdentification.normalizeFilterPattern("")).isEmpty();
    }

    @Test
    void parsesWholeAndFractionalShutterSpeeds() {
        assertThat(DcrawIdentification.parseShutter("30.0 sec")).isEqualTo(30.0);
        assertThat(DcrawIdentification.parseShutter("1/8000.0 sec")).isEqualTo(1.0 / 8000.0);
        assertThat(DcrawIdentification.parseShutter("n/a")).isZero();
    }

    @Test
    void rejectsOutputWithoutCamera() {
        assertThatThrownBy(() -> DcrawIdentification.parse("Cannot decode file x.jpg", ZoneOffset.UTC))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
