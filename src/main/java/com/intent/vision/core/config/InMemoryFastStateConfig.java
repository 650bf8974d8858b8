package com.intent.vision.core.config;

import com.intent.vision.core.core.FastStateStore;
import com.intent.vision.core.core.InMemoryFastStateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConditionalOnProperty(name = "intentvision.redis.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryFastStateConfig {

    @Bean
    public FastStateStore fastStateStore(Clock clock) {
        return new InMemoryFastStateStore("iv:", clock);
    }
}
