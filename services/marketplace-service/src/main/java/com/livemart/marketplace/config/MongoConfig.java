package com.livemart.marketplace.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Bounds every document-store call. A connect, read or server-selection timeout surfaces as a
 * {@code DataAccessResourceFailureException}, which the API reports as 503.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoClientSettingsBuilderCustomizer storeTimeouts(
            @Value("${marketplace.store.connect-timeout:2s}") Duration connectTimeout,
            @Value("${marketplace.store.read-timeout:5s}") Duration readTimeout,
            @Value("${marketplace.store.server-selection-timeout:3s}") Duration serverSelectionTimeout) {
        return builder -> builder
                .applyToSocketSettings(socket -> socket
                        .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                        .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS))
                .applyToClusterSettings(cluster -> cluster
                        .serverSelectionTimeout(serverSelectionTimeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Bean
    public MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(StoredValueConverters.all());
    }
}
