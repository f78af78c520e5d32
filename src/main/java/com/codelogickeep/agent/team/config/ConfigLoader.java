package com.codelogickeep.agent.team.config;

import com.codelogickeep.agent.team.exception.ConfigurationException;
import com.codelogickeep.agent.team.exception.OrchestrationException.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the effective configuration by merging layers, lowest priority first:
 * classpath {@code agent.yml}, {@code ~/.agent-team/agent.yml}, {@code ./agent.yml}, explicit path.
 *
 * <p>{@code ${env:NAME}} placeholders resolve against the process environment, then against
 * a {@code .env} file in the working directory.
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Pattern ENV_PLACEHOLDER = Pattern.compile("\\$\\{env:([A-Za-z_][A-Za-z0-9_]*)}");
    private static final Pattern DOTENV_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final List<String> SECTIONS = List.of("llm", "team", "session");

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
    private final Function<String, String> env;
    private final File userHome;
    private final File workingDir;
    private Map<String, String> dotenv = Map.of();

    public ConfigLoader() {
        this(System::getenv, new File(System.getProperty("user.home")), new File("."));
    }

    ConfigLoader(Function<String, String> env, File userHome, File workingDir) {
        this.env = env;
        this.userHome = userHome;
        this.workingDir = workingDir;
    }

    /**
     * @param explicitPath value of {@code --config}, may be null
     * @throws ConfigurationException if the explicit file is missing or any layer cannot be parsed
     */
    public AppConfig load(String explicitPath) {
        AppConfig config = new AppConfig();

        try (InputStream in = getClass().getClassLoader().getResourceAsStream("agent.yml")) {
            if (in != null) {
                merge(config, mapper.readTree(in), "bundled agent.yml");
            }
        } catch (IOException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID,
                    "Failed to parse bundled agent.yml", e.getMessage(), e);
        }

        mergeConfigFromFile(config, Paths.get(userHome.getPath(), ".agent-team", "agent.yml").toFile());
        mergeConfigFromFile(config, new File(workingDir, "agent.yml"));

        if (explicitPath != null) {
            File file = new File(explicitPath);
            if (!file.isFile()) {
                throw new ConfigurationException(ErrorCode.CONFIG_NOT_FOUND,
                        "Configuration file not found: " + file.getAbsolutePath());
            }
            mergeConfigFromFile(config, file);
        }

        dotenv = loadDotenv(new File(workingDir, ".env"));
        resolveEnvironment(config);
        return config;
    }

    private void mergeConfigFromFile(AppConfig config, File file) {
        if (!file.isFile()) {
            return;
        }
        try {
            merge(config, mapper.readTree(file), file.getAbsolutePath());
            log.info("Merged configuration from {}", file.getAbsolutePath());
        } catch (IOException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID,
                    "Failed to parse " + file.getAbsolutePath(), e.getMessage(), e);
        }
    }

    /**
     * Checks the layer's shape before binding it, so a document that parses into the wrong
     * structure is rejected instead of partially merged.
     */
    private void merge(AppConfig config, JsonNode root, String origin) throws IOException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return;
        }
        if (!root.isObject()) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID,
                    "Failed to parse " + origin, "top level must be a mapping");
        }
        for (String section : SECTIONS) {
            JsonNode node = root.get(section);
            if (node != null && !node.isNull() && !node.isObject()) {
                throw new ConfigurationException(ErrorCode.CONFIG_INVALID,
                        "Failed to parse " + origin, "'" + section + "' must be a mapping");
            }
        }
        mapper.readerForUpdating(config).readValue(root);
    }

    /**
     * Reads {@code KEY=VALUE} lines. Blank lines, {@code #} comments and an {@code export }
     * prefix are ignored; one pair of surrounding quotes is stripped from the value.
     */
    Map<String, String> loadDotenv(File file) {
        if (!file.isFile()) {
            return Map.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID,
                    "Failed to read " + file.getAbsolutePath(), e.getMessage(), e);
        }

        Map<String, String> values = new HashMap<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).trim();
            }
            int eq = line.indexOf('=');
            if (eq <= 0) {
                log.warn("Ignoring malformed line in {}: {}", file.getName(), raw);
                continue;
            }
            String key = line.substring(0, eq).trim();
            if (!DOTENV_KEY.matcher(key).matches()) {
                log.warn("Ignoring invalid variable name in {}: {}", file.getName(), key);
                continue;
            }
            values.put(key, unquote(line.substring(eq + 1).trim()));
        }
        log.info("Loaded {} variables from {}", values.size(), file.getAbsolutePath());
        return values;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private void resolveEnvironment(AppConfig config) {
        AppConfig.LlmConfig llm = config.getLlm();
        if (llm == null) {
            return;
        }
        llm.setProtocol(replaceEnvVars(llm.getProtocol()));
        llm.setApiKey(replaceEnvVars(llm.getApiKey()));
        llm.setBaseUrl(replaceEnvVars(llm.getBaseUrl()));
        llm.setModelName(replaceEnvVars(llm.getModelName()));
    }

    private String lookup(String name) {
        String value = env.apply(name);
        return value != null ? value : dotenv.get(name);
    }

    /**
     * Replaces every {@code ${env:NAME}} with the variable's value. Unset variables are left
     * in place so validation can report them.
     */
    String replaceEnvVars(String value) {
        if (value == null || !value.contains("${env:")) {
            return value;
        }
        Matcher matcher = ENV_PLACEHOLDER.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String resolved = lookup(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved != null ? resolved : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Convenience for tests and tools: the environment as a map lookup.
     */
    public static ConfigLoader withEnvironment(Map<String, String> env, File userHome, File workingDir) {
        return new ConfigLoader(env::get, userHome, workingDir);
    }
}
