package com.github.salilvnair.researchengine.engine.history.core;

import com.github.salilvnair.researchengine.engine.model.ConversationTurn;

import java.util.List;

/**
 * Ordered append log of turns keyed by conversation id.
 */
public interface ConversationStore {

    /**
     * Most recent turns of the conversation, oldest first.
     */
    List<ConversationTurn> lastTurns(String conversationId, int limit);

    void append(String conversationId, String userId, ConversationTurn turn);
}
