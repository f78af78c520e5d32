package com.codelogickeep.agent.team.engine;

import com.codelogickeep.agent.team.config.AppConfig;
import com.codelogickeep.agent.team.config.ConfigValidator;
import com.codelogickeep.agent.team.exception.ConfigurationException;
import com.codelogickeep.agent.team.framework.adapter.LlmAdapter;
import com.codelogickeep.agent.team.framework.adapter.LlmAdapterFactory;
import com.codelogickeep.agent.team.framework.adapter.chat.UserMessage;
import com.codelogickeep.agent.team.framework.team.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.List;
import java.util.function.Function;

/**
 * Checks that the configuration is complete and the backend answers.
 */
public class EnvironmentChecker {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentChecker.class);

    private final PrintStream out;
    private final Function<AppConfig.LlmConfig, LlmAdapter> adapterFactory;

    public EnvironmentChecker() {
        this(System.out, LlmAdapterFactory::create);
    }

    EnvironmentChecker(PrintStream out, Function<AppConfig.LlmConfig, LlmAdapter> adapterFactory) {
        this.out = out;
        this.adapterFactory = adapterFactory;
    }

    /**
     * @return true if the configuration is valid and the backend answered a ping
     */
    public boolean check(AppConfig config) {
        out.println("\n>>> Starting Environment Check...\n");

        if (config.getLlm() != null) {
            out.println("LLM Protocol: " + config.getLlm().getProtocol());
            out.println("LLM Model:    " + config.getLlm().getModelName());
            out.println("Temperature:  " + config.getLlm().getTemperature());
        }
        if (config.getTeam() != null) {
            out.println("Team:         " + config.getTeam().getName());
        }
        out.println();

        boolean configOk = checkConfig(config);
        boolean llmOk = configOk && checkLlm(config);

        out.println("\n>>> Environment Check Summary:");
        out.println("Config: " + (configOk ? "OK" : "FAILED"));
        out.println("LLM:    " + (llmOk ? "OK" : (configOk ? "FAILED" : "SKIPPED")));

        if (!llmOk) {
            out.println("\n>>> CRITICAL: the team cannot start until the issues above are fixed.");
            out.println("    Check that:");
            out.println("    1. The API key is set (--api-key or OPENAI_API_KEY)");
            out.println("    2. The protocol matches your provider: openai, anthropic or gemini");
            out.println("    3. The model name is correct for your provider");
            out.println("    4. The base URL is correct (if using a custom endpoint)");
            return false;
        }

        out.println("\n>>> Environment is ready!");
        return true;
    }

    private boolean checkConfig(AppConfig config) {
        out.print("Checking Configuration... ");
        try {
            ConfigValidator.validateAndApplyDefaults(config);
            out.println("OK");
            return true;
        } catch (ConfigurationException e) {
            out.println("FAILED");
            out.println(e.getMessage());
            return false;
        }
    }

    private boolean checkLlm(AppConfig config) {
        out.print("Checking LLM Configuration... ");
        try {
            LlmAdapter adapter = adapterFactory.apply(config.getLlm());
            log.info("Using {} for LLM check", adapter.getName());

            String response = adapter.chat(List.of(new UserMessage("ping")), new CancellationToken());
            if (response != null) {
                out.println("OK (" + adapter.getName() + ")");
                return true;
            }
            out.println("FAILED (Empty response from LLM)");
            return false;
        } catch (RuntimeException e) {
            log.warn("LLM check failed", e);
            String msg = e.getMessage() != null ? e.getMessage() : e.toString();
            if (msg.length() > 100) {
                msg = msg.substring(0, 100) + "...";
            }
            out.println("FAILED (" + msg + ")");
            return false;
        }
    }
}
