package me.golemcore.tokens.adapter.outbound.cache;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tokens.adapter.outbound.provider.ProviderRootResolver;
import me.golemcore.tokens.adapter.outbound.provider.ProviderRootResolver.BaseDirectory;
import me.golemcore.tokens.infrastructure.config.TokensProperties;
import me.golemcore.tokens.port.outbound.CacheStorePort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Selects the cache backend from {@code tokens.cache.backend}.
 */
@Configuration
@Slf4j
public class CacheStoreConfiguration {

    static final String CACHE_DIRECTORY_NAME = "golemcore-tokens";

    @Bean(destroyMethod = "close")
    public CacheStorePort cacheStore(TokensProperties properties, ProviderRootResolver rootResolver) {
        Path directory = resolveCacheDirectory(properties, rootResolver);
        log.info("[Cache] Using {} cache in {}", properties.getCache().getBackend(), directory);
        return switch (properties.getCache().getBackend()) {
        case SQLITE -> new SqliteCacheStore(directory);
        case BLOB -> new BlobCacheStore(directory);
        };
    }

    /**
     * Configured directory with {@code ${user.home}} expanded, else
     * {@code $XDG_CACHE_HOME/golemcore-tokens} (or
     * {@code ~/.cache/golemcore-tokens}).
     */
    public static Path resolveCacheDirectory(TokensProperties properties, ProviderRootResolver rootResolver) {
        String configured = properties.getCache().getDirectory();
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured.replace("${user.home}", System.getProperty("user.home")));
        }
        Path cacheBase = rootResolver.baseDirectory(BaseDirectory.CACHE);
        if (cacheBase == null) {
            cacheBase = Paths.get(System.getProperty("java.io.tmpdir"));
        }
        return cacheBase.resolve(CACHE_DIRECTORY_NAME);
    }
}
