package com.cairnsystems.persistence.serialization;

import java.util.Arrays;
import java.util.Objects;

/**
 * Bytes of a serialized event plus the manifest needed to read them back.
 *
 * @param bytes    serialized form
 * @param manifest type hint handed back to {@link PayloadSerializer#deserialize(byte[], String)}
 */
public record SerializedPayload(byte[] bytes, String manifest) {

    public SerializedPayload {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(manifest, "manifest");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SerializedPayload)) return false;
        SerializedPayload that = (SerializedPayload) o;
        return Arrays.equals(bytes, that.bytes) && manifest.equals(that.manifest);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(bytes) + manifest.hashCode();
    }

    @Override
    public String toString() {
        return "SerializedPayload{" + bytes.length + " bytes, manifest='" + manifest + "'}";
    }
}
