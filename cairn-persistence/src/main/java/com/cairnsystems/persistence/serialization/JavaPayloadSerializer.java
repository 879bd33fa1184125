package com.cairnsystems.persistence.serialization;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;

/**
 * Serializer based on Java object streams. The manifest is the payload's class name and is
 * checked against the deserialized object.
 */
public class JavaPayloadSerializer implements PayloadSerializer {

    @Override
    public SerializedPayload serialize(Object payload) {
        if (payload == null) {
            throw new PayloadSerializationException("Cannot serialize a null payload");
        }
        if (!(payload instanceof Serializable)) {
            throw new PayloadSerializationException(
                    "Payload type " + payload.getClass().getName() + " is not Serializable");
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(payload);
        } catch (IOException e) {
            throw new PayloadSerializationException(
                    "Failed to serialize payload of type " + payload.getClass().getName(), e);
        }
        return new SerializedPayload(bytes.toByteArray(), payload.getClass().getName());
    }

    @Override
    public Object deserialize(byte[] bytes, String manifest) {
        Object payload;
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
            payload = in.readObject();
        } catch (IOException | ClassNotFoundException e) {
            throw new PayloadSerializationException("Failed to deserialize payload with manifest " + manifest, e);
        }
        if (manifest != null && !manifest.isEmpty() && !payload.getClass().getName().equals(manifest)) {
            throw new PayloadSerializationException(
                    "Manifest " + manifest + " does not match deserialized type " + payload.getClass().getName());
        }
        return payload;
    }
}
