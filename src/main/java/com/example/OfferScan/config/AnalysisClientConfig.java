package com.example.OfferScan.config;

import com.example.OfferScan.model.ProductTypeKeywords;
import com.example.OfferScan.model.SectionKeywords;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({AnalysisProperties.class, AiExtractionProperties.class})
public class AnalysisClientConfig {

    @Bean
    @ConditionalOnMissingBean
    public SectionKeywords sectionKeywords() {
        return SectionKeywords.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProductTypeKeywords productTypeKeywords() {
        return ProductTypeKeywords.defaults();
    }
}
