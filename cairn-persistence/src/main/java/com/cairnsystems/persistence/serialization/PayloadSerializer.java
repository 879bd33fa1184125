package com.cairnsystems.persistence.serialization;

/**
 * Maps application events to bytes and back.
 */
public interface PayloadSerializer {

    /**
     * @param payload the event to store
     * @return its bytes and manifest
     * @throws PayloadSerializationException if the payload cannot be serialized
     */
    SerializedPayload serialize(Object payload);

    /**
     * @param bytes    bytes previously produced by {@link #serialize(Object)}
     * @param manifest the manifest stored alongside them
     * @return the event
     * @throws PayloadSerializationException if the bytes cannot be read
     */
    Object deserialize(byte[] bytes, String manifest);
}
