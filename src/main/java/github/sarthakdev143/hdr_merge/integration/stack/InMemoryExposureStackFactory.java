package github.sarthakdev143.hdr_merge.integration.stack;

import github.sarthakdev143.hdr_merge.config.HdrMergeProperties;
import github.sarthakdev143.hdr_merge.service.ExposureStack;
import github.sarthakdev143.hdr_merge.service.ExposureStackFactory;
import org.springframework.stereotype.Component;

@Component
public class InMemoryExposureStackFactory implements ExposureStackFactory {

    private final HdrMergeProperties properties;

    public InMemoryExposureStackFactory(HdrMergeProperties properties) {
        this.properties = properties;
    }

    @Override
    public ExposureStack create() {
        return new InMemoryExposureStack(properties.alignSearchRadius());
    }
}
