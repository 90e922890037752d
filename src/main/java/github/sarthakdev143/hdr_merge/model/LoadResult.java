package github.sarthakdev143.hdr_merge.model;

/**
 * Outcome of loading one bracketed set.
 * <p>
 * The integer form packs the failing index and a format bit: {@code (index << 1) + (format ? 1 : 0)}
 * for failures and {@code fileCount << 1} for success.
 */
public record LoadResult(Kind kind, int index, int imageCount) {

    public enum Kind {
        SUCCESS,
        DECODE_FAILED,
        FORMAT_MISMATCH
    }

    public static LoadResult success(int imageCount) {
        return new LoadResult(Kind.SUCCESS, -1, imageCount);
    }

    public static LoadResult decodeFailed(int index) {
        return new LoadResult(Kind.DECODE_FAILED, index, 0);
    }

    public static LoadResult formatMismatch(int index) {
        return new LoadResult(Kind.FORMAT_MISMATCH, index, 0);
    }

    public static LoadResult fromResultCode(int resultCode, int fileCount) {
        if (resultCode >= fileCount << 1) {
            return success(fileCount);
        }
        int index = resultCode >> 1;
        return (resultCode & 1) == 1 ? formatMismatch(index) : decodeFailed(index);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public boolean hasImages() {
        return isSuccess() && imageCount > 0;
    }

    public int toResultCode(int fileCount) {
        return switch (kind) {
            case SUCCESS -> fileCount << 1;
            case DECODE_FAILED -> index << 1;
            case FORMAT_MISMATCH -> (index << 1) + 1;
        };
    }
}
