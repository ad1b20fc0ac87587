package io.proofproxy.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import io.proofproxy.common.JacksonConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads {@link ProxyConfig} from a TOML file and applies {@code PROOF_PROXY_<KEY>} environment overrides.
 * List values (workers) are comma-separated in the environment.
 */
@Slf4j
public class ConfigLoader {
    public static final String ENV_PREFIX = "PROOF_PROXY_";

    private static final List<String> KEYS = List.of("workers", "queue_capacity", "max_retries",
            "health_check_interval_ms", "failure_threshold", "job_deadline_ms", "load_balancing",
            "connection_timeout_ms", "probe_timeout_ms", "max_requests_per_second", "remove_after_failed_probes");

    private final TomlMapper mapper;
    private final Map<String, String> environment;

    public ConfigLoader() {
        this(System.getenv());
    }

    public ConfigLoader(Map<String, String> environment) {
        this.mapper = JacksonConfig.createTomlMapper();
        this.environment = environment;
    }

    /**
     * Loads the file if it exists, otherwise starts from defaults.
     *
     * @throws IOException if the file cannot be read or parsed
     * @throws IllegalArgumentException if the resulting configuration is invalid
     */
    public ProxyConfig load(Path file) throws IOException {
        ObjectNode tree;
        if (Files.exists(file)) {
            JsonNode parsed = mapper.readTree(file.toFile());
            tree = parsed instanceof ObjectNode ? (ObjectNode) parsed : mapper.createObjectNode();
            log.info("Loaded configuration from {}", file.toAbsolutePath());
        } else {
            tree = mapper.createObjectNode();
            log.warn("Configuration file {} not found, using defaults", file.toAbsolutePath());
        }
        applyEnvironment(tree);
        return mapper.treeToValue(tree, ProxyConfig.class).validate();
    }

    /**
     * Writes the configuration as TOML.
     *
     * @param overwrite replace an existing file
     * @throws java.nio.file.FileAlreadyExistsException if the file exists and overwrite is false
     */
    public void write(ProxyConfig config, Path file, boolean overwrite) throws IOException {
        if (!overwrite && Files.exists(file)) {
            throw new java.nio.file.FileAlreadyExistsException(file.toString());
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, mapper.writeValueAsString(config));
    }

    private void applyEnvironment(ObjectNode tree) {
        for (String key : KEYS) {
            String value = environment.get(ENV_PREFIX + key.toUpperCase(Locale.ROOT));
            if (value == null || value.isBlank()) {
                continue;
            }
            if ("workers".equals(key)) {
                ArrayNode workers = tree.putArray(key);
                Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .forEach(workers::add);
            } else {
                tree.put(key, value.trim());
            }
            log.debug("Configuration key {} overridden from environment", key);
        }
    }
}
