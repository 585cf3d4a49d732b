package me.golemcore.tokens.adapter.outbound.pricing;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tokens.adapter.outbound.cache.CacheStoreConfiguration;
import me.golemcore.tokens.adapter.outbound.provider.ProviderRootResolver;
import me.golemcore.tokens.domain.model.ModelPricing;
import me.golemcore.tokens.infrastructure.config.TokensProperties;
import me.golemcore.tokens.port.outbound.PricingLookup;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pricing table in the LiteLLM {@code model_prices_and_context_window.json}
 * format.
 *
 * <p>
 * Loaded once at startup from {@code tokens.pricing.file}, else from
 * {@code <cache-dir>/pricing.json}, else from the bundled
 * {@code classpath:pricing.json}. If none can be read the catalog is empty
 * and every cost is undefined.
 *
 * <p>
 * Besides its exact key, each entry is registered under variants without
 * region or vendor prefixes ({@code us.anthropic.}, {@code bedrock/},
 * {@code openai/}) and without version suffixes ({@code -v1:0}). A variant
 * never replaces an exact key.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class LiteLlmPricingCatalog implements PricingLookup {

    private static final String LOG_PREFIX = "[Pricing]";
    private static final String PRICING_FILE = "pricing.json";
    private static final List<String> PROVIDER_PREFIXES = List.of(
            "us.anthropic.",
            "eu.anthropic.",
            "au.anthropic.",
            "apac.anthropic.",
            "global.anthropic.",
            "anthropic.",
            "bedrock/",
            "openai/");

    private final TokensProperties properties;
    private final ObjectMapper objectMapper;
    private final ProviderRootResolver rootResolver;
    private Map<String, ModelPricing> pricing = Map.of();

    public LiteLlmPricingCatalog(TokensProperties properties, ObjectMapper objectMapper,
            ProviderRootResolver rootResolver) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.rootResolver = rootResolver;
    }

    @PostConstruct
    public void init() {
        String configured = properties.getPricing().getFile();
        if (configured != null && !configured.isBlank()) {
            if (loadFile(Paths.get(configured))) {
                return;
            }
        } else {
            Path cached = CacheStoreConfiguration.resolveCacheDirectory(properties, rootResolver)
                    .resolve(PRICING_FILE);
            if (Files.isRegularFile(cached) && loadFile(cached)) {
                return;
            }
        }
        loadFromClasspath();
    }

    @Override
    public Optional<ModelPricing> find(String model) {
        return Optional.ofNullable(pricing.get(model));
    }

    public Map<String, ModelPricing> getPricing() {
        return Collections.unmodifiableMap(pricing);
    }

    private boolean loadFile(Path file) {
        try {
            pricing = parse(objectMapper.readTree(file.toFile()));
            log.info("{} Loaded {} model prices from {}", LOG_PREFIX, pricing.size(), file);
            return true;
        } catch (IOException e) {
            log.warn("{} Failed to load {}: {}", LOG_PREFIX, file, e.getMessage());
            return false;
        }
    }

    private void loadFromClasspath() {
        ClassPathResource resource = new ClassPathResource(PRICING_FILE);
        if (resource.exists()) {
            try (InputStream is = resource.getInputStream()) {
                pricing = parse(objectMapper.readTree(is));
                log.info("{} Loaded {} model prices from classpath", LOG_PREFIX, pricing.size());
                return;
            } catch (IOException e) {
                log.warn("{} Failed to load from classpath: {}", LOG_PREFIX, e.getMessage());
            }
        }
        log.warn("{} No pricing table found, all costs will be undefined", LOG_PREFIX);
        pricing = Map.of();
    }

    /**
     * Parses a LiteLLM table. Entries without both input and output rates are
     * skipped.
     */
    static Map<String, ModelPricing> parse(JsonNode root) {
        Map<String, ModelPricing> exact = new LinkedHashMap<>();
        if (root == null || !root.isObject()) {
            return exact;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode entry = field.getValue();
            JsonNode input = entry.path("input_cost_per_token");
            JsonNode output = entry.path("output_cost_per_token");
            if (!input.isNumber() || !output.isNumber()) {
                continue;
            }
            exact.put(field.getKey(), ModelPricing.builder()
                    .inputCostPerToken(input.asDouble())
                    .outputCostPerToken(output.asDouble())
                    .cacheReadCostPerToken(optionalRate(entry.path("cache_read_input_token_cost")))
                    .cacheCreationCostPerToken(optionalRate(entry.path("cache_creation_input_token_cost")))
                    .build());
        }

        Map<String, ModelPricing> all = new LinkedHashMap<>(exact);
        for (Map.Entry<String, ModelPricing> entry : exact.entrySet()) {
            for (String variant : normalizedVariants(entry.getKey())) {
                all.putIfAbsent(variant, entry.getValue());
            }
        }
        return all;
    }

    static List<String> normalizedVariants(String key) {
        String withoutPrefix = stripProviderPrefix(key);
        String withoutSuffix = stripVersionSuffix(withoutPrefix);
        if (withoutPrefix.equals(key)) {
            return withoutSuffix.equals(key) ? List.of() : List.of(withoutSuffix);
        }
        return withoutSuffix.equals(withoutPrefix) ? List.of(withoutPrefix) : List.of(withoutPrefix, withoutSuffix);
    }

    private static String stripProviderPrefix(String key) {
        for (String prefix : PROVIDER_PREFIXES) {
            if (key.startsWith(prefix)) {
                return key.substring(prefix.length());
            }
        }
        return key;
    }

    private static String stripVersionSuffix(String key) {
        String stripped = key;
        if (stripped.endsWith(":0")) {
            stripped = stripped.substring(0, stripped.length() - 2);
        }
        if (stripped.endsWith("-v1")) {
            stripped = stripped.substring(0, stripped.length() - 3);
        }
        return stripped;
    }

    private static Double optionalRate(JsonNode node) {
        return node.isNumber() ? node.asDouble() : null;
    }
}
