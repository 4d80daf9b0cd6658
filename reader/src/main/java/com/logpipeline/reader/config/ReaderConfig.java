package com.logpipeline.reader.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ReaderProperties.class)
public class ReaderConfig {
}
