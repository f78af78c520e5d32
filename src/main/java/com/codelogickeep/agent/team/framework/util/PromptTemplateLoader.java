package com.codelogickeep.agent.team.framework.util;

import com.codelogickeep.agent.team.exception.ConfigurationException;
import com.codelogickeep.agent.team.exception.OrchestrationException.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads persona prompts, from the filesystem first and then from the classpath.
 */
public class PromptTemplateLoader {
    private static final Logger log = LoggerFactory.getLogger(PromptTemplateLoader.class);

    private PromptTemplateLoader() {
    }

    /**
     * @throws ConfigurationException if the template exists nowhere or cannot be read
     */
    public static String loadTemplate(String templatePath) {
        if (templatePath == null || templatePath.isBlank()) {
            throw new ConfigurationException(ErrorCode.CONFIG_MISSING_FIELD, "Prompt template path is empty");
        }

        Path file = Path.of(templatePath);
        if (Files.isRegularFile(file)) {
            try {
                log.debug("Loading prompt from file {}", file.toAbsolutePath());
                return Files.readString(file, StandardCharsets.UTF_8).strip();
            } catch (IOException e) {
                throw new ConfigurationException(ErrorCode.CONFIG_INVALID,
                        "Failed to read prompt file: " + templatePath, e.getMessage(), e);
            }
        }

        String resource = templatePath.startsWith("/") ? templatePath.substring(1) : templatePath;
        try (InputStream is = PromptTemplateLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new ConfigurationException(ErrorCode.CONFIG_NOT_FOUND,
                        "Prompt template not found: " + templatePath,
                        "Looked for a file and a classpath resource with that path");
            }
            log.debug("Loading prompt from classpath {}", resource);
            return new String(is.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID,
                    "Failed to read prompt resource: " + templatePath, e.getMessage(), e);
        }
    }
}
