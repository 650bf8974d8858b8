package com.intent.vision.core.config;

import com.intent.vision.core.core.FastStateStore;
import com.intent.vision.core.core.RedisFastStateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Configuration
@ConditionalOnProperty(name = "intentvision.redis.enabled", havingValue = "true")
public class RedisConfig {

    // connection factory comes from spring.data.redis.* auto-configuration
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory cf) {
        return new StringRedisTemplate(cf);
    }

    @Bean
    public FastStateStore fastStateStore(StringRedisTemplate template) {
        return new RedisFastStateStore(template, "iv:");
    }
}
