package github.sarthakdev143.hdr_merge.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LoadResultTest {

    @Test
    void packsFailingIndexAndFormatBit() {
        assertThat(LoadResult.decodeFailed(0).toResultCode(3)).isZero();
        assertThat(LoadResult.formatMismatch(0).toResultCode(3)).isEqualTo(1);
        assertThat(LoadResult.decodeFailed(2).toResultCode(3)).isEqualTo(4);
        assertThat(LoadResult.formatMismatch(2).toResultCode(3)).isEqualTo(5);
        assertThat(LoadResult.success(3).toResultCode(3)).isEqualTo(6);
    }

    @Test
    void unpacksResultCodes() {
        assertThat(LoadResult.fromResultCode(5, 3)).isEqualTo(LoadResult.formatMismatch(2));
        assertThat(LoadResult.fromResultCode(2, 3)).isEqualTo(LoadResult.decodeFailed(1));
        assertThat(LoadResult.fromResultCode(6, 3).isSuccess()).isTrue();
    }

    @Test
    void successWithoutImagesHasNothingToSave() {
        assertThat(LoadResult.success(0).isSuccess()).isTrue();
        assertThat(LoadResult.success(0).hasImages()).isFalse();
        assertThat(LoadResult.decodeFailed(0).hasImages()).isFalse();
    }
}
