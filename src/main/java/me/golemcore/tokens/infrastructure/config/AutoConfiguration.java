package me.golemcore.tokens.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tokens.adapter.outbound.provider.ProviderRootResolver;
import me.golemcore.tokens.port.outbound.CacheStorePort;
import me.golemcore.tokens.port.outbound.UsageProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared beans and startup summary.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link ObjectMapper}, {@link Clock} and host
 * {@link ProviderRootResolver}</li>
 * <li>Creates the bounded parse worker pool sized by
 * {@code tokens.parse.threads}</li>
 * <li>Logs the registered providers and cache backend via
 * {@code @PostConstruct}</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final TokensProperties properties;
    private final List<UsageProvider> providers;
    private final CacheStorePort cacheStore;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public static ProviderRootResolver providerRootResolver() {
        return ProviderRootResolver.fromSystem();
    }

    @Bean(name = "usageParseExecutor", destroyMethod = "shutdownNow")
    public static ExecutorService usageParseExecutor(TokensProperties properties) {
        int configured = properties.getParse().getThreads();
        int threads = configured > 0 ? configured : Runtime.getRuntime().availableProcessors();
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "usage-parse-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Tokens starting...");
        log.info("Cache backend: {} ({})", cacheStore.getBackendName(), properties.getCache().getBackend());
        for (UsageProvider provider : providers) {
            log.debug("Provider {} roots: {}", provider.getName(), provider.getRootDirectories());
        }
        log.info("Providers: {}", providers.stream().map(UsageProvider::getName).toList());
    }
}
