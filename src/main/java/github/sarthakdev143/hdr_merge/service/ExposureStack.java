package github.sarthakdev143.hdr_merge.service;

import github.sarthakdev143.hdr_merge.model.DecodedExposure;
import github.sarthakdev143.hdr_merge.model.ExposureMask;
import github.sarthakdev143.hdr_merge.model.ExposureParameters;
import github.sarthakdev143.hdr_merge.model.FloatImage;
import github.sarthakdev143.hdr_merge.model.RawImage;

import java.util.List;

/**
 * Ordered set of exposures of one scene, brightest first, and the operations that merge them.
 */
public interface ExposureStack {

    /**
     * Largest number of exposures one stack holds. Mask indexes are stored in one byte.
     */
    int MAX_EXPOSURES = 256;

    /**
     * Inserts an exposure and returns the position the ordering rule gave it.
     *
     * @throws IllegalStateException when the stack already holds {@link #MAX_EXPOSURES} exposures
     */
    int insert(long exposureId, DecodedExposure exposure);

    /**
     * Exposure ids in stack order.
     */
    List<Long> order();

    int size();

    void clear();

    void setFlip(int flip);

    void calculateSaturationLevel(ExposureParameters params, boolean useCustomWl);

    void align();

    void crop();

    void computeResponseFunctions();

    void generateMask();

    FloatImage compose(ExposureParameters params, int featherRadius);

    int width();

    int height();

    /**
     * Exposure ratio between the brightest and the darkest exposure.
     */
    double maxExposure();

    ExposureMask mask();

    RawImage exposure(int position);
}
