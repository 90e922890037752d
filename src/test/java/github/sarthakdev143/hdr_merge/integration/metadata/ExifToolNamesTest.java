package github.sarthakdev143.hdr_merge.integration.metadata;

import github.sarthakdev143.hdr_merge.model.metadata.MetadataKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExifToolNamesTest {

    @Test
    void mapsExifToolGroupsToDottedKeys() {
        assertThat(ExifToolNames.toKey("EXIF:IFD0:Make")).contains(MetadataKey.parse("Exif.Image.Make"));
        assertThat(ExifToolNames.toKey("EXIF:ExifIFD:FNumber")).contains(MetadataKey.parse("Exif.Photo.FNumber"));
        assertThat(ExifToolNames.toKey("EXIF:GPS:GPSLatitude")).contains(MetadataKey.parse("Exif.GPSInfo.GPSLatitude"));
        assertThat(ExifToolNames.toKey("EXIF:SubIFD:SubfileType"))
                .contains(MetadataKey.parse("Exif.SubImage1.NewSubfileType"));
        assertThat(ExifToolNames.toKey("EXIF:SubIFD2:ImageWidth"))
                .contains(MetadataKey.parse("Exif.SubImage3.ImageWidth"));
        assertThat(ExifToolNames.toKey("EXIF:IFD1:ThumbnailOffset"))
                .contains(MetadataKey.parse("Exif.Thumbnail.JPEGInterchangeFormat"));
        assertThat(ExifToolNames.toKey("EXIF:IFD2:Software")).contains(MetadataKey.parse("Exif.Image2.Software"));
    }

    @Test
    void mapsMakerNotesXmpAndIptc() {
        assertThat(ExifToolNames.toKey("MakerNotes:Canon:LensModel"))
                .contains(MetadataKey.parse("Exif.Canon.LensModel"));
        assertThat(ExifToolNames.toKey("XMP:XMP-dc:Subject")).contains(MetadataKey.parse("Xmp.dc.Subject"));
        assertThat(ExifToolNames.toKey("IPTC:IPTC:City")).contains(MetadataKey.parse("Iptc.Application2.City"));
    }

    @Test
    void ignoresOtherGroupsAndUnqualifiedNames() {
        assertThat(ExifToolNames.toKey("File:System:FileSize")).isEmpty();
        assertThat(ExifToolNames.toKey("Composite:Composite:LensID")).isEmpty();
        assertThat(ExifToolNames.toKey("SourceFile")).isEmpty();
    }

    @Test
    void writeTargetsUseExifToolNames() {
        assertThat(ExifToolNames.toWriteTarget(MetadataKey.parse("Exif.SubImage1.NewSubfileType")))
                .isEqualTo("SubIFD:SubfileType");
        assertThat(ExifToolNames.toWriteTarget(MetadataKey.parse("Exif.SubImage3.ImageWidth")))
                .isEqualTo("SubIFD2:ImageWidth");
        assertThat(ExifToolNames.toWriteTarget(MetadataKey.parse("Exif.Image.Make"))).isEqualTo("IFD0:Make");
        assertThat(ExifToolNames.toWriteTarget(MetadataKey.parse("Exif.Image2.Software"))).isEqualTo("IFD2:Software");
        assertThat(ExifToolNames.toWriteTarget(MetadataKey.parse("Exif.Thumbnail.JPEGInterchangeFormatLength")))
                .isEqualTo("IFD1:ThumbnailLength");
        assertThat(ExifToolNames.toWriteTarget(MetadataKey.parse("Exif.Canon.LensModel"))).isEqualTo("Canon:LensModel");
        assertThat(ExifToolNames.toWriteTarget(MetadataKey.parse("Xmp.dc.subject"))).isEqualTo("XMP-dc:subject");
        assertThat(ExifToolNames.toWriteTarget(MetadataKey.parse("Iptc.Application2.City"))).isEqualTo("IPTC:City");
    }
}
