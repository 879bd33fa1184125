package com.cairnsystems.persistence.serialization;

import org.junit.jupiter.api.Test;

import java.io.Serializable;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JavaPayloadSerializer.
 */
class JavaPayloadSerializerTest {

    private final JavaPayloadSerializer serializer = new JavaPayloadSerializer();

    @Test
    void testManifestIsClassName() {
        SerializedPayload serialized = serializer.serialize(new Transfer("a", "b", 10));

        assertEquals(Transfer.class.getName(), serialized.manifest());
        assertEquals(new Transfer("a", "b", 10), serializer.deserialize(serialized.bytes(), serialized.manifest()));
    }

    @Test
    void testNonSerializablePayloadRejected() {
        assertThrows(PayloadSerializationException.class, () -> serializer.serialize(new Object()));
        assertThrows(PayloadSerializationException.class, () -> serializer.serialize(null));
    }

    @Test
    void testManifestMismatchRejected() {
        SerializedPayload serialized = serializer.serialize("text");

        PayloadSerializationException error = assertThrows(PayloadSerializationException.class,
                () -> serializer.deserialize(serialized.bytes(), Transfer.class.getName()));
        assertTrue(error.getMessage().contains(String.class.getName()));
    }

    @Test
    void testCorruptBytesRejected() {
        assertThrows(PayloadSerializationException.class,
                () -> serializer.deserialize(new byte[]{1, 2, 3}, String.class.getName()));
    }

    record Transfer(String from, String to, long amount) implements Serializable {
    }
}
