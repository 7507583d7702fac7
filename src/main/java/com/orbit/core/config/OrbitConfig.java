package com.orbit.core.config;

import com.orbit.core.guardrail.HeapUsageProbe;
import com.orbit.core.time.Sleeper;
import com.orbit.core.time.ThreadSleeper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans shared by all agents.
 */
@Configuration
public class OrbitConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return new ThreadSleeper();
    }

    @Bean
    @ConditionalOnMissingBean
    public HeapUsageProbe heapUsageProbe() {
        return HeapUsageProbe.runtime();
    }
}
