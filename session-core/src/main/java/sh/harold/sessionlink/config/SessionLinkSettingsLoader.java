package sh.harold.sessionlink.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Loads {@link SessionLinkSettings} from YAML, resolving {@code ${ENV:default}}
 * placeholders against the environment.
 */
public class SessionLinkSettingsLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionLinkSettingsLoader.class);

    public static final String DEFAULT_RESOURCE = "/sessionlink.yml";

    private final ObjectMapper objectMapper;
    private final UnaryOperator<String> environment;

    public SessionLinkSettingsLoader() {
        this(System::getenv);
    }

    public SessionLinkSettingsLoader(UnaryOperator<String> environment) {
        this.environment = environment;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Loads the default classpath resource, falling back to defaults when it
     * is missing or unreadable.
     */
    public SessionLinkSettings load() {
        return load(DEFAULT_RESOURCE);
    }

    public SessionLinkSettings load(String resource) {
        try (InputStream inputStream = getClass().getResourceAsStream(resource)) {
            if (inputStream == null) {
                LOGGER.warn("{} not found, using default configuration", resource);
                return SessionLinkSettings.defaults();
            }
            return load(inputStream);
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Failed to load {}, using default configuration", resource, e);
            return SessionLinkSettings.defaults();
        }
    }

    public SessionLinkSettings load(InputStream inputStream) {
        Map<String, Object> yamlConfig = new Yaml().load(inputStream);
        if (yamlConfig == null) {
            return SessionLinkSettings.defaults();
        }
        return fromMap(yamlConfig);
    }

    public SessionLinkSettings fromMap(Map<String, Object> config) {
        Map<String, Object> resolved = new LinkedHashMap<>(config);
        processEnvironmentVariables(resolved);
        return objectMapper.convertValue(resolved, SessionLinkSettings.class);
    }

    @SuppressWarnings("unchecked")
    private void processEnvironmentVariables(Map<String, Object> config) {
        for (Map.Entry<String, Object> entry : config.entrySet()) {
            if (entry.getValue() instanceof Map) {
                Map<String, Object> nested = new LinkedHashMap<>((Map<String, Object>) entry.getValue());
                processEnvironmentVariables(nested);
                entry.setValue(nested);
            } else if (entry.getValue() instanceof String value) {
                if (value.startsWith("${") && value.endsWith("}")) {
                    String envVarWithDefault = value.substring(2, value.length() - 1);
                    String[] parts = envVarWithDefault.split(":", 2);
                    String envValue = environment.apply(parts[0]);
                    String defaultValue = parts.length > 1 ? parts[1] : "";
                    entry.setValue(envValue != null ? envValue : defaultValue);
                }
            }
        }
    }
}
