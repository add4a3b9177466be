package io.github.drompincen.shopbench.runtime.exec;

import io.github.drompincen.shopbench.protocol.api.ConversationTurn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * Turns exchanged with one platform within one scenario. Not thread-safe; a
 * history belongs to the single platform task that created it.
 */
public final class ConversationHistory {

    private final List<ConversationTurn> turns = new ArrayList<>();

    /**
     * Plain-text transcript for stateless APIs. Prior turns with empty content
     * are skipped; the new prompt is always the last line.
     */
    public String buildPrompt(String userPrompt) {
        StringJoiner joiner = new StringJoiner("\n");
        for (ConversationTurn turn : turns) {
            if (turn.content() == null || turn.content().isEmpty()) continue;
            joiner.add(turn.role().label() + ": " + turn.content());
        }
        joiner.add(ConversationTurn.Role.USER.label() + ": " + (userPrompt != null ? userPrompt : ""));
        return joiner.toString();
    }

    public void append(String userPrompt, String assistantResponse) {
        turns.add(ConversationTurn.user(userPrompt));
        turns.add(ConversationTurn.assistant(assistantResponse));
    }

    public List<ConversationTurn> turns() {
        return Collections.unmodifiableList(turns);
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }
}
