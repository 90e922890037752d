package github.sarthakdev143.hdr_merge.config;

import github.sarthakdev143.hdr_merge.service.impl.MetadataFusionRules;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(HdrMergeProperties.class)
public class HdrMergeConfiguration {

    @Bean
    public MetadataFusionRules metadataFusionRules() {
        return MetadataFusionRules.defaults();
    }
}
