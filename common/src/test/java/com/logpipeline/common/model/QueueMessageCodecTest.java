package com.logpipeline.common.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class QueueMessageCodecTest {

    private final QueueMessageCodec codec = new QueueMessageCodec(new ObjectMapper());

    @Test
    void encodesWireFieldNames() {
        String payload = codec.encode(new QueueMessage("a|b=c|d=e", "firewall_001.log"));

        assertEquals("{\"line\":\"a|b=c|d=e\",\"source_file\":\"firewall_001.log\"}", payload);
    }

    @Test
    void decodingAnEncodedMessageYieldsTheSameLineAndSource() {
        String line = "2024-01-15T10:23:45.123Z auth-srv01 sshd[12345]: Failed password for \"root\" from 10.0.0.1 port 22 ssh2";
        QueueMessage decoded = codec.decode(codec.encode(new QueueMessage(line, "auth_ü.log")));

        assertEquals(line, decoded.getLine());
        assertEquals("auth_ü.log", decoded.getSourceFile());
    }

    @Test
    void ignoresUnknownFields() {
        QueueMessage decoded = codec.decode("{\"line\":\"x\",\"source_file\":\"a.log\",\"extra\":1}");

        assertEquals("x", decoded.getLine());
        assertEquals("a.log", decoded.getSourceFile());
    }

    @Test
    void rejectsPayloadsWithoutBothFields() {
        assertThrows(MalformedMessageException.class, () -> codec.decode("{\"line\":\"x\"}"));
        assertThrows(MalformedMessageException.class, () -> codec.decode("{\"source_file\":\"a.log\"}"));
        assertThrows(MalformedMessageException.class, () -> codec.decode("{\"line\":\"\",\"source_file\":\"a.log\"}"));
    }

    @Test
    void rejectsNonJsonPayloads() {
        MalformedMessageException e = assertThrows(MalformedMessageException.class,
            () -> codec.decode("2024-01-15T10:23:45.123Z|action=accept"));
        assertTrue(e.getMessage().startsWith("Payload is not a queue message"));

        assertThrows(MalformedMessageException.class, () -> codec.decode("[1,2]"));
        assertThrows(MalformedMessageException.class, () -> codec.decode(""));
        assertThrows(MalformedMessageException.class, () -> codec.decode(null));
    }
}
