package com.berrys.resilience.config;

import com.berrys.resilience.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Toolkit-wide configuration: the default retry policy, circuit breaker settings,
 * rate-limit tiers and cache defaults.
 *
 * <p>Recognized property keys:
 * <pre>
 * retry.max-retries, retry.base-delay-ms, retry.max-delay-ms, retry.jitter-factor, retry.retry-on
 * breaker.failure-threshold, breaker.recovery-timeout-seconds, breaker.reset-timeout-seconds
 * rate-limit.tiers.&lt;tier&gt;.requests, rate-limit.tiers.&lt;tier&gt;.window-seconds
 * cache.ttl-seconds, cache.strategy, cache.stale-retention-seconds
 * </pre>
 */
public class ResilienceConfig {

    private static final Logger logger = LoggerFactory.getLogger(ResilienceConfig.class);

    public static final String DEFAULT_RESOURCE = "resilience.properties";
    public static final String DEFAULT_TIER = "default";

    private static final String TIER_PREFIX = "rate-limit.tiers.";

    private final RetryPolicy retryPolicy;
    private final CircuitBreakerConfig circuitBreakerConfig;
    private final Map<String, RateLimitConfig> rateLimitTiers;
    private final CacheConfig cacheConfig;

    private ResilienceConfig(Builder builder) {
        this.retryPolicy = builder.retryPolicy;
        this.circuitBreakerConfig = builder.circuitBreakerConfig;
        this.rateLimitTiers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.rateLimitTiers));
        this.cacheConfig = builder.cacheConfig;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public CircuitBreakerConfig getCircuitBreakerConfig() {
        return circuitBreakerConfig;
    }

    public Map<String, RateLimitConfig> getRateLimitTiers() {
        return rateLimitTiers;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public static ResilienceConfig defaultConfig() {
        return builder().build();
    }

    /**
     * The built-in rate-limit tiers: low, default, high, critical and unlimited, all per 60 seconds.
     */
    public static Map<String, RateLimitConfig> defaultTiers() {
        Map<String, RateLimitConfig> tiers = new LinkedHashMap<>();
        tiers.put("low", RateLimitConfig.of("low", 50, 60));
        tiers.put(DEFAULT_TIER, RateLimitConfig.of(DEFAULT_TIER, 100, 60));
        tiers.put("high", RateLimitConfig.of("high", 200, 60));
        tiers.put("critical", RateLimitConfig.of("critical", 500, 60));
        tiers.put("unlimited", RateLimitConfig.of("unlimited", 100000, 60));
        return tiers;
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns the defaults when it is absent.
     */
    public static ResilienceConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static ResilienceConfig load(String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = ResilienceConfig.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                logger.info("No {} on the classpath, using default resilience configuration", resource);
                return defaultConfig();
            }
            Properties properties = new Properties();
            properties.load(in);
            logger.info("Loaded resilience configuration from {}", resource);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    /**
     * Builds a configuration from properties; keys that are absent keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static ResilienceConfig fromProperties(Properties properties) {
        RetryPolicy.Builder retry = RetryPolicy.builder();
        readInt(properties, "retry.max-retries").ifPresent(retry::maxRetries);
        readLong(properties, "retry.base-delay-ms").ifPresent(ms -> retry.baseDelay(Duration.ofMillis(ms)));
        readLong(properties, "retry.max-delay-ms").ifPresent(ms -> retry.maxDelay(Duration.ofMillis(ms)));
        readString(properties, "retry.jitter-factor").ifPresent(v -> retry.jitterFactor(parseDouble("retry.jitter-factor", v)));
        readString(properties, "retry.retry-on").ifPresent(v -> retry.retryOn(parseKinds(v)));

        CircuitBreakerConfig.Builder breaker = CircuitBreakerConfig.builder();
        readInt(properties, "breaker.failure-threshold").ifPresent(breaker::failureThreshold);
        readLong(properties, "breaker.recovery-timeout-seconds").ifPresent(s -> breaker.recoveryTimeout(Duration.ofSeconds(s)));
        readLong(properties, "breaker.reset-timeout-seconds").ifPresent(s -> breaker.resetTimeout(Duration.ofSeconds(s)));

        CacheConfig.Builder cache = CacheConfig.builder();
        readLong(properties, "cache.ttl-seconds").ifPresent(s -> cache.ttl(Duration.ofSeconds(s)));
        readString(properties, "cache.strategy").ifPresent(v -> cache.strategy(parseStrategy(v)));
        readLong(properties, "cache.stale-retention-seconds").ifPresent(s -> cache.staleRetention(Duration.ofSeconds(s)));

        Builder builder = builder()
            .retryPolicy(retry.build())
            .circuitBreaker(breaker.build())
            .cache(cache.build());

        for (String tier : tierNames(properties)) {
            RateLimitConfig current = builder.rateLimitTiers.get(tier);
            int requests = readInt(properties, TIER_PREFIX + tier + ".requests")
                .orElse(current != null ? current.getRequests() : 100);
            int window = readInt(properties, TIER_PREFIX + tier + ".window-seconds")
                .orElse(current != null ? current.getWindowSeconds() : 60);
            builder.rateLimitTier(RateLimitConfig.of(tier, requests, window));
        }

        return builder.build();
    }

    private static List<String> tierNames(Properties properties) {
        return properties.stringPropertyNames().stream()
            .filter(key -> key.startsWith(TIER_PREFIX))
            .map(key -> key.substring(TIER_PREFIX.length()))
            .filter(rest -> rest.indexOf('.') > 0)
            .map(rest -> rest.substring(0, rest.indexOf('.')))
            .distinct()
            .sorted()
            .collect(Collectors.toList());
    }

    private static Optional<String> readString(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    private static Optional<Integer> readInt(Properties properties, String key) {
        return readString(properties, key).map(value -> {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
            }
        });
    }

    private static Optional<Long> readLong(Properties properties, String key) {
        return readString(properties, key).map(value -> {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
            }
        });
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid decimal for " + key + ": " + value, e);
        }
    }

    private static List<ErrorKind> parseKinds(String value) {
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(kind -> !kind.isEmpty())
            .map(kind -> {
                try {
                    return ErrorKind.valueOf(kind.toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown error kind in retry.retry-on: " + kind, e);
                }
            })
            .collect(Collectors.toList());
    }

    private static CacheStrategy parseStrategy(String value) {
        try {
            return CacheStrategy.valueOf(value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown cache.strategy: " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("ResilienceConfig{retry=%s, breaker=%s, tiers=%s, cache=%s}",
            retryPolicy, circuitBreakerConfig, rateLimitTiers.keySet(), cacheConfig);
    }

    public static class Builder {
        private RetryPolicy retryPolicy = RetryPolicy.defaultPolicy();
        private CircuitBreakerConfig circuitBreakerConfig = CircuitBreakerConfig.defaultConfig();
        private final Map<String, RateLimitConfig> rateLimitTiers = defaultTiers();
        private CacheConfig cacheConfig = CacheConfig.defaultConfig();

        public Builder retryPolicy(RetryPolicy policy) {
            this.retryPolicy = policy;
            return this;
        }

        public Builder circuitBreaker(CircuitBreakerConfig config) {
            this.circuitBreakerConfig = config;
            return this;
        }

        /**
         * Adds a tier, replacing any tier with the same name.
         */
        public Builder rateLimitTier(RateLimitConfig config) {
            this.rateLimitTiers.put(config.getTier(), config);
            return this;
        }

        public Builder cache(CacheConfig config) {
            this.cacheConfig = config;
            return this;
        }

        public ResilienceConfig build() {
            if (retryPolicy == null || circuitBreakerConfig == null || cacheConfig == null) {
                throw new IllegalArgumentException("Retry, circuit breaker and cache configuration must be provided");
            }
            if (!rateLimitTiers.containsKey(DEFAULT_TIER)) {
                throw new IllegalArgumentException("A '" + DEFAULT_TIER + "' rate-limit tier is required");
            }
            return new ResilienceConfig(this);
        }
    }
}
