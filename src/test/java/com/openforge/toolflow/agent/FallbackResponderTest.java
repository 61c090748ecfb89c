package com.openforge.toolflow.agent;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FallbackResponderTest {

    private final FallbackResponder responder = new FallbackResponder();

    @Test
    void shouldPickTopicByKeyword() {
        assertEquals("pressure", FallbackResponder.topicOf("Pressure in line 3 is rising"));
        assertEquals("pressure", FallbackResponder.topicOf("보일러 압력 확인"));
        assertEquals("temperature", FallbackResponder.topicOf("TEMPERATURE drift on sensor 4"));
        assertEquals("temperature", FallbackResponder.topicOf("온도 센서 점검"));
        assertEquals("general", FallbackResponder.topicOf("How is the plant doing?"));
        assertEquals("general", FallbackResponder.topicOf(null));
    }

    @Test
    void shouldAnnotateFallbackModeAndModel() {
        String answer = responder.respond("temperature check", "qwen");

        assertTrue(answer.contains("(fallback mode)"));
        assertTrue(answer.contains("temperature sensor anomaly"));
        assertTrue(answer.contains("Model: qwen"));
    }

    @Test
    void shouldBeDeterministic() {
        assertEquals(responder.respond("status?", "m"), responder.respond("status?", "m"));
    }
}
