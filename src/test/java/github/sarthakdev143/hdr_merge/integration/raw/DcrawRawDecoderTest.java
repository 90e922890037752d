package github.sarthakdev143.hdr_merge.integration.raw;

import github.sarthakdev143.hdr_merge.config.HdrMergeProperties;
import github.sarthakdev143.hdr_merge.integration.process.ExternalCommandRunner;
import github.sarthakdev143.hdr_merge.model.CreationInterval;
import github.sarthakdev143.hdr_merge.model.DecodedExposure;
import github.sarthakdev143.hdr_merge.model.ExposureParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DcrawRawDecoderTest {

    private static final Path FILE = Path.of("/s/IMG_0001.CR2");

    @Mock
    private ExternalCommandRunner commandRunner;

    private DcrawRawDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new DcrawRawDecoder(commandRunner, HdrMergeProperties.defaults(), ZoneOffset.UTC);
    }

    @Test
    void buildsIdentifyAndDecodeCommands() {
        List<String> identify = decoder.buildIdentifyCommand(FILE);
        List<String> decode = decoder.buildDecodeCommand(FILE, 2);

        assertThat(identify.subList(1, identify.size())).containsExactly("-i", "-v", "/s/IMG_0001.CR2");
        List<String> orientation = decoder.buildOrientationCommand(FILE);
        assertThat(orientation.subList(1, orientation.size()))
                .containsExactly("-s3", "-n", "-EXIF:IFD0:Orientation", "/s/IMG_0001.CR2");
        assertThat(decode.subList(1, decode.size())).containsExactly(
                "-d", "-4", "-j", "-t", "0", "-r", "1", "1", "1", "1", "-s", "2", "-c", "/s/IMG_0001.CR2");
        assertThat(valueAfter(decode, "-s")).isEqualTo("2");
    }

    @Test
    void decodesMosaicWithNormalizedLevels() throws IOException {
        when(commandRunner.runForText(eq(decoder.buildIdentifyCommand(FILE)), anyString()))
                .thenReturn(DcrawIdentificationTest.CANON_OUTPUT);
        when(commandRunner.run(eq(decoder.buildDecodeCommand(FILE, 0)), anyString()))
                .thenReturn(pgm(2, 2, new int[] {10, 20, 30, 40000}));
        when(commandRunner.runForText(eq(decoder.buildOrientationCommand(FILE)), anyString())).thenReturn("1\n");

        Optional<DecodedExposure> decoded = decoder.decode(FILE, 0);

        assertThat(decoded).isPresent();
        ExposureParameters params = decoded.get().parameters();
        assertThat(params.getFileName()).isEqualTo("/s/IMG_0001.CR2");
        assertThat(params.getRawWidth()).isEqualTo(2);
        assertThat(params.getCfaPattern()).isEqualTo("RGGB");
        assertThat(params.getBlack()).isZero();
        assertThat(params.getMax()).isEqualTo(DcrawRawDecoder.DECODED_WHITE_LEVEL);
        assertThat(params.getMake()).isEqualTo("Canon");
        assertThat(params.getTimestamp()).isEqualTo(Instant.parse("2024-05-04T10:00:00Z"));
        assertThat(decoded.get().image().get(1, 1)).isEqualTo(40000);
        assertThat(params.getFlip()).isZero();
    }

    @Test
    void portraitFramesCarryTheirFlipIntoTheParameters() throws IOException {
        when(commandRunner.runForText(eq(decoder.buildIdentifyCommand(FILE)), anyString()))
                .thenReturn(DcrawIdentificationTest.CANON_OUTPUT);
        when(commandRunner.run(eq(decoder.buildDecodeCommand(FILE, 0)), anyString()))
                .thenReturn(pgm(2, 2, new int[] {10, 20, 30, 40}));
        when(commandRunner.runForText(eq(decoder.buildOrientationCommand(FILE)), anyString())).thenReturn("8\n");

        ExposureParameters params = decoder.decode(FILE, 0).orElseThrow().parameters();

        assertThat(params.getFlip()).isEqualTo(5);
    }

    @Test
    void unreadableOrientationKeepsSensorOrientation() throws IOException {
        when(commandRunner.runForText(eq(decoder.buildIdentifyCommand(FILE)), anyString()))
                .thenReturn(DcrawIdentificationTest.CANON_OUTPUT);
        when(commandRunner.run(eq(decoder.buildDecodeCommand(FILE, 0)), anyString()))
                .thenReturn(pgm(2, 2, new int[] {10, 20, 30, 40}));
        when(commandRunner.runForText(eq(decoder.buildOrientationCommand(FILE)), anyString()))
                .thenThrow(new IOException("exiftool missing"));

        assertThat(decoder.decode(FILE, 0).orElseThrow().parameters().getFlip()).isZero();
    }

    @Test
    void mapsExifOrientationToFlipCodes() {
        assertThat(DcrawRawDecoder.flipForOrientation("1")).isZero();
        assertThat(DcrawRawDecoder.flipForOrientation("3")).isEqualTo(3);
        assertThat(DcrawRawDecoder.flipForOrientation("6")).isEqualTo(6);
        assertThat(DcrawRawDecoder.flipForOrientation("8")).isEqualTo(5);
        assertThat(DcrawRawDecoder.flipForOrientation("")).isZero();
        assertThat(DcrawRawDecoder.flipForOrientation("9")).isZero();
    }

    @Test
    void nonMosaicFilesAreNotDecoded() throws IOException {
        when(commandRunner.runForText(eq(decoder.buildIdentifyCommand(FILE)), anyString()))
                .thenReturn("Camera: Sigma SD14\nNumber of raw images: 1\n");

        assertThat(decoder.decode(FILE, 0)).isEmpty();
        verify(commandRunner, never()).run(eq(decoder.buildDecodeCommand(FILE, 0)), anyString());
    }

    @Test
    void probesFrameCountAndCaptureInterval() throws IOException {
        when(commandRunner.runForText(eq(decoder.buildIdentifyCommand(FILE)), anyString()))
                .thenReturn(DcrawIdentificationTest.CANON_OUTPUT);

        assertThat(decoder.probeFrameCount(FILE)).isEqualTo(1);
        assertThat(decoder.probeCreationInterval(FILE)).contains(new CreationInterval(
                Instant.parse("2024-05-04T09:59:59.996Z"), Instant.parse("2024-05-04T10:00:00Z")));
    }

    @Test
    void unreadableFilesHaveNoFramesAndNoCaptureTime() throws IOException {
        when(commandRunner.runForText(eq(decoder.buildIdentifyCommand(FILE)), anyString()))
                .thenThrow(new IOException("dcraw failed"));

        assertThat(decoder.probeFrameCount(FILE)).isZero();
        assertThat(decoder.probeCreationInterval(FILE)).isEmpty();
    }

    private static String valueAfter(List<String> command, String flag) {
        int index = command.indexOf(flag);
        return index >= 0 && index + 1 < command.size() ? command.get(index + 1) : null;
    }

    private static byte[] pgm(int width, int height, int[] samples) {
        byte[] header = ("P5\n" + width + " " + height + "\n65535\n").getBytes(StandardCharsets.US_ASCII);
        byte[] data = new byte[header.length + samples.length * 2];
        System.arraycopy(header, 0, data, 0, header.length);
        for (int i = 0; i < samples.length; i++) {
            data[header.length + i * 2] = (byte) (samples[i] >> 8);
            data[header.length + i * 2 + 1] = (byte) samples[i];
        }
        return data;
    }
}
