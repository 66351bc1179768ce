package com.storynest.reading.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LearningPathProperties.class)
public class ReadingPlatformConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
