package com.logpipeline.reader.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the scheduled directory sweep.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {
}
