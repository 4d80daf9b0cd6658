package com.logpipeline.processor.config;

import com.logpipeline.processor.parser.LogLineParser;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({ProcessorProperties.class, StoreProperties.class})
public class ProcessorConfig {

    @Bean
    public LogLineParser logLineParser() {
        return LogLineParser.withDefaultFormats();
    }
}
