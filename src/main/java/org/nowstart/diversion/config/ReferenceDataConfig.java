package org.nowstart.diversion.config;

import lombok.extern.slf4j.Slf4j;
import org.nowstart.diversion.data.dto.ReferenceData;
import org.nowstart.diversion.data.property.ReferenceDataProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class ReferenceDataConfig {

    @Bean
    public ReferenceData referenceData(ReferenceDataProperties properties) {
        ReferenceData referenceData = properties.toReferenceData();
        log.info("Reference data loaded. routes={}, vessels={}",
                referenceData.routes().size(), referenceData.vessels().size());
        return referenceData;
    }
}
