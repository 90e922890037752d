package github.sarthakdev143.hdr_merge.integration.dng;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FloatSampleEncoderTest {

    @Test
    void encodesHalfPrecision() {
        assertThat(FloatSampleEncoder.toHalf(1.0f)).isEqualTo(0x3C00);
        assertThat(FloatSampleEncoder.toHalf(0.5f)).isEqualTo(0x3800);
        assertThat(FloatSampleEncoder.toHalf(-2.0f)).isEqualTo(0xC000);
        assertThat(FloatSampleEncoder.toHalf(65504f)).isEqualTo(0x7BFF);
        assertThat(FloatSampleEncoder.toHalf(0.0f)).isZero();
    }

    @Test
    void clampsHalfOverflowToTheLargestFiniteValue() {
        assertThat(FloatSampleEncoder.toHalf(1.0e6f)).isEqualTo(0x7BFF);
    }

    @Test
    void encodesTwentyFourBitFloatsWithBias63() {
        assertThat(FloatSampleEncoder.toFp24(1.0f)).isEqualTo(0x3F0000);
        assertThat(FloatSampleEncoder.toFp24(2.0f)).isEqualTo(0x400000);
        assertThat(FloatSampleEncoder.toFp24(1.5f)).isEqualTo(0x3F8000);
        assertThat(FloatSampleEncoder.toFp24(0.0f)).isZero();
    }

    @Test
    void writesLittleEndianSamples() {
        byte[] out = new byte[4];

        FloatSampleEncoder.encode(1.0f, 24, out, 1);

        assertThat(out).containsExactly(0, 0, 0, 0x3F);
    }

    @Test
    void rejectsUnsupportedDepths() {
        assertThat(FloatSampleEncoder.bytesPerSample(24)).isEqualTo(3);
        assertThatThrownBy(() -> FloatSampleEncoder.bytesPerSample(12))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("12");
    }
}
