package github.sarthakdev143.hdr_merge.model;

public record DecodedExposure(ExposureParameters parameters, RawImage image) {

    public DecodedExposure {
        if (parameters == null || image == null) {
            throw new IllegalArgumentException("Decoded exposure requires parameters and an image.");
        }
    }
}
