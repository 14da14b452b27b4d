package com.agentnet.common.config;

import com.agentnet.common.error.AgentNetworkException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads the agent network configuration from a JSON file.
 * <p>
 * The file text may reference environment variables as {@code ${NAME}} or
 * {@code ${NAME:-fallback}}. Keys set through {@link #setOverride} win over the
 * file. Loaded values are cached briefly; a file that stops parsing on reload
 * leaves the last good config in effect.
 */
@Slf4j
public class ConfigService {

    /** System property naming the config file. */
    public static final String CONFIG_PATH_PROPERTY = "agentnet.config.path";
    public static final String DEFAULT_CONFIG_PATH = "~/.agentnet/config.json";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");
    private static final String CACHE_KEY = "agent-network";

    private final ObjectMapper mapper = new ObjectMapper();
    private final Set<String> knownKeys;
    private final Path configPath;
    private final Map<String, String> environment;
    private final Cache<String, AgentNetworkConfig> cache;
    private final Map<String, Object> overrides = new LinkedHashMap<>();
    private volatile AgentNetworkConfig lastGood;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configPath, Duration cacheTtl) {
        this(configPath, cacheTtl, System.getenv());
    }

    ConfigService(Path configPath, Duration cacheTtl, Map<String, String> environment) {
        this.configPath = configPath;
        this.environment = Map.copyOf(environment);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
        Set<String> keys = new HashSet<>();
        mapper.valueToTree(AgentNetworkConfig.defaults()).fieldNames().forEachRemaining(keys::add);
        this.knownKeys = Set.copyOf(keys);
    }

    /**
     * Service for the file named by {@value #CONFIG_PATH_PROPERTY}, or
     * {@value #DEFAULT_CONFIG_PATH} when the property is unset.
     */
    public static ConfigService fromSystemProperty() {
        return new ConfigService(resolvePath(System.getProperty(CONFIG_PATH_PROPERTY, DEFAULT_CONFIG_PATH)));
    }

    /**
     * Turn a user-supplied location into a path; a leading {@code ~} means the
     * user's home directory.
     */
    public static Path resolvePath(String location) {
        if (location.equals("~") || location.startsWith("~/")) {
            Path home = Path.of(System.getProperty("user.home"));
            return location.length() <= 2 ? home : home.resolve(location.substring(2));
        }
        return Path.of(location);
    }

    public AgentNetworkConfig loadConfig() {
        return cache.get(CACHE_KEY, key -> read());
    }

    /**
     * Re-read the file now instead of waiting for the cache to expire.
     */
    public AgentNetworkConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Pin one key regardless of what the file says.
     *
     * @throws AgentNetworkException if the key is unknown or the value does not fit it
     */
    public void setOverride(String key, Object value) {
        if (!knownKeys.contains(key)) {
            throw AgentNetworkException.validation("Unknown config key: " + key);
        }
        ObjectNode single = mapper.createObjectNode();
        single.set(key, mapper.valueToTree(value));
        try {
            mapper.treeToValue(single, AgentNetworkConfig.class);
        } catch (JsonProcessingException e) {
            throw AgentNetworkException.validation("Invalid value for config key " + key + ": " + value);
        }
        synchronized (overrides) {
            overrides.put(key, value);
        }
        cache.invalidateAll();
    }

    public void clearOverrides() {
        synchronized (overrides) {
            overrides.clear();
        }
        cache.invalidateAll();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private AgentNetworkConfig read() {
        try {
            ObjectNode tree = readFileTree();
            warnUnknownKeys(tree);
            synchronized (overrides) {
                overrides.forEach((key, value) -> tree.set(key, mapper.valueToTree(value)));
            }
            AgentNetworkConfig config = mapper.treeToValue(tree, AgentNetworkConfig.class).normalized();
            lastGood = config;
            return config;
        } catch (IOException e) {
            AgentNetworkConfig previous = lastGood;
            if (previous != null) {
                log.error("Config {} is invalid, keeping the previous config", configPath, e);
                return previous;
            }
            log.error("Config {} is invalid, using defaults", configPath, e);
            return AgentNetworkConfig.defaults();
        }
    }

    private void warnUnknownKeys(ObjectNode tree) {
        List<String> unknown = new ArrayList<>();
        tree.fieldNames().forEachRemaining(name -> {
            if (!knownKeys.contains(name)) {
                unknown.add(name);
            }
        });
        if (!unknown.isEmpty()) {
            log.warn("Ignoring unknown config keys in {}: {}", configPath, unknown);
        }
    }

    private ObjectNode readFileTree() throws IOException {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return mapper.createObjectNode();
        }
        JsonNode parsed = mapper.readTree(substituteEnvVars(Files.readString(configPath)));
        if (!(parsed instanceof ObjectNode object)) {
            throw new IOException("expected a JSON object at the top level");
        }
        log.info("Config loaded from: {}", configPath);
        return object;
    }

    String substituteEnvVars(String raw) {
        return substituteEnvVars(raw, environment);
    }

    String substituteEnvVars(String raw, Map<String, String> env) {
        Matcher matcher = ENV_REFERENCE.matcher(raw);
        StringBuilder expanded = new StringBuilder();
        while (matcher.find()) {
            String fallback = matcher.group(2);
            String value = env.get(matcher.group(1));
            if (value == null) {
                value = fallback != null ? fallback : "";
            }
            matcher.appendReplacement(expanded, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(expanded);
        return expanded.toString();
    }
}
