package com.labassist.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LifecycleConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
