package com.codelogickeep.agent.team.framework.termination;

import com.codelogickeep.agent.team.framework.model.Message;
import com.codelogickeep.agent.team.framework.model.Transcript;

import java.util.List;
import java.util.Optional;

/**
 * Stops once any message in the transcript contains the keyword (case-sensitive substring).
 */
public final class TextMentionTermination implements TerminationCondition {

    private final String keyword;

    public TextMentionTermination(String keyword) {
        if (keyword == null || keyword.isEmpty()) {
            throw new IllegalArgumentException("keyword must not be empty");
        }
        this.keyword = keyword;
    }

    @Override
    public Optional<String> check(Transcript transcript) {
        List<Message> messages = transcript.messages();
        // newest first: the keyword almost always arrives in the message just appended
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (messages.get(i).content().contains(keyword)) {
                return Optional.of("Text '" + keyword + "' mentioned");
            }
        }
        return Optional.empty();
    }

    public String getKeyword() {
        return keyword;
    }

    @Override
    public String toString() {
        return "TextMention(" + keyword + ")";
    }
}
