package io.routecontract.javalin.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link ServiceConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code route-contract.yaml} from the current
 * directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Missing keys receive the defaults of {@link ServiceConfig.Builder}. Every
 * key can be overridden by an environment variable, which wins over YAML. A
 * variable counts as set only if it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "route-contract.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the config at {@code configPath}, overlaying {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ServiceConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the config at {@code configPath}, overlaying variables resolved by
     * {@code envLookup}. A {@code null} lookup result means undefined.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static ServiceConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root == null ? YAML_MAPPER.createObjectNode() : root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Resolves the config file path from command-line arguments.
     *
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static ServiceConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        ServiceConfig.Builder builder = ServiceConfig.builder();

        // --- YAML mapping ---

        JsonNode server = root.path("server");
        if (server.has("host")) builder.serverHost(server.get("host").asText());
        if (server.has("port")) builder.serverPort(server.get("port").asInt());

        JsonNode api = root.path("api");
        if (api.has("title")) builder.apiTitle(api.get("title").asText());
        if (api.has("version")) builder.apiVersion(api.get("version").asText());
        if (api.has("description")) builder.apiDescription(api.get("description").asText());

        JsonNode status = root.path("status");
        if (status.has("bad-request")) builder.badRequestStatus(status.get("bad-request").asInt());
        if (status.has("unprocessable")) builder.unprocessableStatus(status.get("unprocessable").asInt());
        if (status.has("internal-error")) builder.internalErrorStatus(status.get("internal-error").asInt());

        JsonNode health = root.path("health");
        if (health.has("enabled")) builder.healthEnabled(health.get("enabled").asBoolean());
        if (health.has("path")) builder.healthPath(health.get("path").asText());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "SERVER_HOST", builder::serverHost);
        envString(envLookup, "API_TITLE", builder::apiTitle);
        envString(envLookup, "API_VERSION", builder::apiVersion);
        envString(envLookup, "API_DESCRIPTION", builder::apiDescription);
        envString(envLookup, "HEALTH_PATH", builder::healthPath);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "SERVER_PORT", builder::serverPort);
        envInt(envLookup, "STATUS_BAD_REQUEST", builder::badRequestStatus);
        envInt(envLookup, "STATUS_UNPROCESSABLE", builder::unprocessableStatus);
        envInt(envLookup, "STATUS_INTERNAL_ERROR", builder::internalErrorStatus);

        envBool(envLookup, "HEALTH_ENABLED", builder::healthEnabled);

        return builder.build();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
