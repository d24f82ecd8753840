package dev.labelflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "labelflow.async")
public record AsyncProperties(int corePoolSize, int maxPoolSize, int queueCapacity) {
    public AsyncProperties {
        if (corePoolSize <= 0) corePoolSize = 2;
        if (maxPoolSize < corePoolSize) maxPoolSize = Math.max(4, corePoolSize);
        if (queueCapacity <= 0) queueCapacity = 500;
    }
}
