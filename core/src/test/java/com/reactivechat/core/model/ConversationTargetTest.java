package com.reactivechat.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConversationTargetTest {

    @Test
    void testDirectConversationIdIsSymmetric() {
        String fromAlice = ConversationTarget.direct("bob").conversationIdFor("alice");
        String fromBob = ConversationTarget.direct("alice").conversationIdFor("bob");

        assertEquals("direct:alice:bob", fromAlice);
        assertEquals(fromAlice, fromBob);
    }

    @Test
    void testGroupConversationIdIgnoresSender() {
        assertEquals("group:g1", ConversationTarget.group("g1").conversationIdFor("alice"));
        assertEquals("group:g1", ConversationTarget.group("g1").conversationIdFor("zed"));
    }

    @Test
    void testSelfConversation() {
        assertEquals("direct:alice:alice", ConversationTarget.direct("alice").conversationIdFor("alice"));
    }
}
