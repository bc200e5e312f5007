package com.artinerary.domain.config;

import com.artinerary.common.cache.CacheProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({EngageProperties.class, CacheProperties.class})
public class DomainConfig {
}
