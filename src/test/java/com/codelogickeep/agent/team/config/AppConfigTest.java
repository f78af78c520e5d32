package com.codelogickeep.agent.team.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AppConfig Tests")
class AppConfigTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper(new YAMLFactory());
    }

    @Nested
    @DisplayName("Basic Parsing")
    class BasicParsing {

        @Test
        @DisplayName("should parse empty YAML to default config")
        void shouldParseEmptyYaml() throws Exception {
            AppConfig config = mapper.readValue("{}", AppConfig.class);

            assertNotNull(config);
            assertNull(config.getLlm());
            assertNull(config.getTeam());
        }

        @Test
        @DisplayName("should parse LLM config")
        void shouldParseLlmConfig() throws Exception {
            String yaml = """
                llm:
                  protocol: openai
                  api-key: test-key
                  model-name: gpt-5-mini-2025-08-07
                  base-url: https://api.openai.com
                  temperature: 0.7
                  timeout: 60
                  max-tokens: 2048
                """;

            AppConfig config = mapper.readValue(yaml, AppConfig.class);

            assertEquals("openai", config.getLlm().getProtocol());
            assertEquals("test-key", config.getLlm().getApiKey());
            assertEquals("gpt-5-mini-2025-08-07", config.getLlm().getModelName());
            assertEquals("https://api.openai.com", config.getLlm().getBaseUrl());
            assertEquals(0.7, config.getLlm().getTemperature());
            assertEquals(60L, config.getLlm().getTimeout());
            assertEquals(2048, config.getLlm().getMaxTokens());
        }

        @Test
        @DisplayName("should accept provider as an alias of protocol")
        void shouldAcceptProviderAlias() throws Exception {
            AppConfig config = mapper.readValue("llm:\n  provider: anthropic\n", AppConfig.class);

            assertEquals("anthropic", config.getLlm().getProtocol());
        }

        @Test
        @DisplayName("should ignore unknown keys")
        void shouldIgnoreUnknownKeys() throws Exception {
            String yaml = """
                llm:
                  model-name: m
                  streaming: true
                workflow:
                  max-retries: 3
                """;

            assertEquals("m", mapper.readValue(yaml, AppConfig.class).getLlm().getModelName());
        }
    }

    @Nested
    @DisplayName("Team Definitions")
    class TeamDefinitions {

        @Test
        @DisplayName("should parse a nested team tree")
        void shouldParseNestedTeam() throws Exception {
            String yaml = """
                team:
                  name: final_team
                  max-turns: 2
                  participants:
                    - name: SoM
                      type: composite
                      response-prompt: Answer briefly.
                      team:
                        name: inner
                        termination:
                          any:
                            - text-mention: APPROVE
                            - max-messages: 6
                        participants:
                          - name: Coach
                            instructions: Be helpful.
                          - name: Reviewer
                            persona: prompts/compliance-reviewer.md
                    - name: Formatter
                      instructions: Format it.
                """;

            AppConfig.TeamConfig team = mapper.readValue(yaml, AppConfig.class).getTeam();

            assertEquals("final_team", team.getName());
            assertEquals(2, team.getMaxTurns());
            assertNull(team.getTermination());
            AppConfig.ParticipantConfig som = team.getParticipants().get(0);
            assertTrue(som.isComposite());
            assertEquals("Answer briefly.", som.getResponsePrompt());
            AppConfig.TeamConfig inner = som.getTeam();
            assertEquals(2, inner.getTermination().getAny().size());
            assertEquals("APPROVE", inner.getTermination().getAny().get(0).getTextMention());
            assertEquals(6, inner.getTermination().getAny().get(1).getMaxMessages());
            assertFalse(team.getParticipants().get(1).isComposite());
            assertEquals("assistant", team.getParticipants().get(1).getType());
        }
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("session has sensible defaults")
        void sessionDefaults() {
            AppConfig.SessionConfig session = new AppConfig.SessionConfig();

            assertEquals(List.of("quit", "exit", "q", "bye"), session.getExitCommands());
            assertFalse(session.isShowInnerMessages());
            assertEquals("Goodbye!", session.getFarewell());
        }

        @Test
        @DisplayName("team starts with no participants")
        void teamDefaults() {
            AppConfig.TeamConfig team = new AppConfig.TeamConfig();

            assertNotNull(team.getParticipants());
            assertTrue(team.getParticipants().isEmpty());
        }
    }
}
