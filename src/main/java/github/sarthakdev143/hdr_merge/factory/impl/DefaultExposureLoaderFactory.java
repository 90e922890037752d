package github.sarthakdev143.hdr_merge.factory.impl;

import github.sarthakdev143.hdr_merge.factory.ExposureLoaderFactory;
import github.sarthakdev143.hdr_merge.service.ExposureStackFactory;
import github.sarthakdev143.hdr_merge.service.RawDecoder;
import github.sarthakdev143.hdr_merge.service.impl.ExposureLoader;
import org.springframework.stereotype.Component;

@Component
public class DefaultExposureLoaderFactory implements ExposureLoaderFactory {

    private final RawDecoder rawDecoder;
    private final ExposureStackFactory stackFactory;

    public DefaultExposureLoaderFactory(RawDecoder rawDecoder, ExposureStackFactory stackFactory) {
        this.rawDecoder = rawDecoder;
        this.stackFactory = stackFactory;
    }

    @Override
    public ExposureLoader create() {
        return new ExposureLoader(rawDecoder, stackFactory.create());
    }
}
