package github.sarthakdev143.hdr_merge.factory;

import github.sarthakdev143.hdr_merge.service.impl.ExposureLoader;

public interface ExposureLoaderFactory {

    ExposureLoader create();
}
