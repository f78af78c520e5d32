package com.codelogickeep.agent.team;

import com.codelogickeep.agent.team.config.AppConfig;
import com.codelogickeep.agent.team.config.ConfigLoader;
import com.codelogickeep.agent.team.config.ConfigValidator;
import com.codelogickeep.agent.team.engine.ConsultationRunner;
import com.codelogickeep.agent.team.engine.EnvironmentChecker;
import com.codelogickeep.agent.team.engine.TeamFactory;
import com.codelogickeep.agent.team.exception.ConfigurationException;
import com.codelogickeep.agent.team.exception.ConversationAbortedException;
import com.codelogickeep.agent.team.framework.adapter.LlmAdapter;
import com.codelogickeep.agent.team.framework.adapter.LlmAdapterFactory;
import com.codelogickeep.agent.team.framework.backend.ChatCompletionBackend;
import com.codelogickeep.agent.team.framework.team.RoundRobinTeam;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

@Command(name = "agent-team", mixinStandardHelpOptions = true, version = "0.1.0",
        description = "Runs a round-robin team of LLM agents, with nested teams, over your questions.")
public class App implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_QUERY_FAILED = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Option(names = {"-c", "--config"}, description = "Path to an agent.yml merged over the bundled and local ones")
    private String configPath;

    @Option(names = {"-q", "--task"}, description = "Ask a single question and exit (defaults to env SINGLE_QUERY)")
    private String task;

    @Option(names = {"--protocol"}, description = "Override LLM Protocol for this run (openai, anthropic, gemini).")
    private String protocol;

    @Option(names = {"--api-key"}, description = "Override LLM API Key for this run.")
    private String apiKey;

    @Option(names = {"--base-url"}, description = "Override LLM Base URL for this run.")
    private String baseUrl;

    @Option(names = {"--model"}, description = "Override LLM Model Name for this run.")
    private String modelName;

    @Option(names = {"--temperature"}, description = "Override LLM Temperature for this run.")
    private Double temperature;

    @Option(names = {"--timeout"}, description = "Override LLM request timeout in seconds.")
    private Long timeout;

    @Option(names = {"--show-inner"}, description = "Print the conversations of nested teams as well.")
    private boolean showInner;

    @Option(names = {"--check-env"}, description = "Check configuration and LLM connectivity, then exit")
    private boolean checkEnv;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new App()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config;
        try {
            config = new ConfigLoader().load(configPath);
            applyOverrides(config);

            if (checkEnv) {
                return new EnvironmentChecker().check(config) ? 0 : EXIT_QUERY_FAILED;
            }

            ConfigValidator.validateAndApplyDefaults(config);
        } catch (ConfigurationException e) {
            System.err.println(e.toDisplayMessage());
            return EXIT_CONFIG_ERROR;
        }
        log.debug("{}", ConfigValidator.getConfigSummary(config));

        LlmAdapter adapter = LlmAdapterFactory.create(config.getLlm());
        RoundRobinTeam team;
        try {
            team = new TeamFactory(new ChatCompletionBackend(adapter), showInner, System.out)
                    .create(config.getTeam());
        } catch (ConfigurationException e) {
            System.err.println(e.toDisplayMessage());
            return EXIT_CONFIG_ERROR;
        }

        ConsultationRunner runner = new ConsultationRunner(team, config.getSession());
        runner.installShutdownHook();

        String query = task != null ? task : System.getenv("SINGLE_QUERY");
        if (query != null && !query.isBlank()) {
            try {
                runner.runSingle(query.trim());
                return 0;
            } catch (ConversationAbortedException e) {
                System.err.println(e.toDisplayMessage());
                return EXIT_QUERY_FAILED;
            }
        }

        runner.runInteractive(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        return 0;
    }

    void applyOverrides(AppConfig config) {
        if (config.getLlm() == null) {
            config.setLlm(new AppConfig.LlmConfig());
        }
        if (protocol != null) {
            config.getLlm().setProtocol(protocol);
        }
        if (apiKey != null) {
            config.getLlm().setApiKey(apiKey);
        }
        if (baseUrl != null) {
            config.getLlm().setBaseUrl(baseUrl);
        }
        if (modelName != null) {
            config.getLlm().setModelName(modelName);
        }
        if (temperature != null) {
            config.getLlm().setTemperature(temperature);
        }
        if (timeout != null) {
            config.getLlm().setTimeout(timeout);
        }
        if (showInner) {
            if (config.getSession() == null) {
                config.setSession(new AppConfig.SessionConfig());
            }
            config.getSession().setShowInnerMessages(true);
        }
        showInner = config.getSession() != null && config.getSession().isShowInnerMessages();
    }
}
