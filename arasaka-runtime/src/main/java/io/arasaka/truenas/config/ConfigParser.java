/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads a {@link ClientConfig} from YAML.
 *
 * <p>String values may contain {@code ${NAME}} placeholders, resolved from the environment.
 * A placeholder with no value is left as written. Sections other than {@code server} and the
 * client settings are ignored, so the client can share a file with the tool that embeds it.</p>
 */
public class ConfigParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigParser.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Function<String, String> environment;

    public ConfigParser() {
        this(System::getenv);
    }

    /**
     * @param environment resolves placeholder names, returning null for unset names
     */
    public ConfigParser(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment);
    }

    public ClientConfig parseConfiguration(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return parseConfiguration(in);
        }
        catch (IOException e) {
            throw new ConfigException("Couldn't read configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    public ClientConfig parseConfiguration(InputStream yaml) {
        try {
            return bind(MAPPER.readTree(yaml));
        }
        catch (IOException e) {
            throw new ConfigException("Couldn't parse configuration: " + e.getMessage(), e);
        }
    }

    public ClientConfig parseConfiguration(String yaml) {
        try {
            return bind(MAPPER.readTree(yaml));
        }
        catch (JsonProcessingException e) {
            throw new ConfigException("Couldn't parse configuration: " + e.getOriginalMessage(), e);
        }
    }

    private ClientConfig bind(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigException("Configuration must be a YAML mapping");
        }
        substitute(root);
        JsonNode server = root.get("server");
        if (server == null || !server.isObject()) {
            throw new ConfigException("Missing required configuration section: server");
        }
        requireText(server, "host");
        requireText(server, "apiKey");

        ClientConfig config;
        try {
            config = MAPPER.treeToValue(root, ClientConfig.class);
        }
        catch (JsonProcessingException e) {
            throw new ConfigException("Invalid configuration: " + e.getOriginalMessage(), e);
        }
        if (config.callTimeout().isZero() || config.callTimeout().isNegative()) {
            throw new ConfigException("callTimeout must be positive");
        }
        if (config.jobPollInterval().isZero() || config.jobPollInterval().isNegative()) {
            throw new ConfigException("jobPollInterval must be positive");
        }
        LOGGER.debug("Loaded configuration for {}", config.server());
        return config;
    }

    private static void requireText(JsonNode section, String field) {
        JsonNode value = section.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new ConfigException("Missing required configuration field: server." + field);
        }
    }

    private void substitute(JsonNode node) {
        if (node instanceof ObjectNode object) {
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isTextual()) {
                    field.setValue(TextNode.valueOf(resolve(field.getValue().asText())));
                }
                else {
                    substitute(field.getValue());
                }
            }
        }
        else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                if (array.get(i).isTextual()) {
                    array.set(i, TextNode.valueOf(resolve(array.get(i).asText())));
                }
                else {
                    substitute(array.get(i));
                }
            }
        }
    }

    String resolve(String value) {
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = environment.apply(name);
            if (replacement == null) {
                LOGGER.warn("Environment variable {} is not set, leaving placeholder in place", name);
                replacement = matcher.group();
            }
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }
}
