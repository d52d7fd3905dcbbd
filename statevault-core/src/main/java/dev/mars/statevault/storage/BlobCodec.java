/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.statevault.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Optional;

/**
 * Encodes and decodes the signed blob layout.
 * <p>
 * <b>Format</b> (big-endian):
 * <pre>
 * SCHEMA_VERSION(4) + SAVED_AT_EPOCH_SECONDS(8) + PAYLOAD_LEN(4) + PAYLOAD(var) + SIGNATURE(32)
 * </pre>
 * The signature covers every byte before it, so the header is tamper-evident
 * along with the payload.
 */
public final class BlobCodec {

    private static final Logger LOG = LoggerFactory.getLogger(BlobCodec.class);

    /** Header size: SCHEMA_VERSION(4) + SAVED_AT(8) + PAYLOAD_LEN(4) */
    public static final int HEADER_SIZE = 4 + 8 + 4;

    /** Signature size */
    public static final int SIGNATURE_SIZE = IntegrityVerifier.SIGNATURE_LENGTH;

    private final IntegrityVerifier verifier;
    private final int maxPayloadSize;

    public BlobCodec(IntegrityVerifier verifier, int maxPayloadSize) {
        this.verifier = verifier;
        this.maxPayloadSize = maxPayloadSize;
    }

    /** Total encoded size of a blob carrying {@code payloadLength} bytes. */
    public static long encodedSize(long payloadLength) {
        return HEADER_SIZE + payloadLength + SIGNATURE_SIZE;
    }

    public int maxPayloadSize() {
        return maxPayloadSize;
    }

    public IntegrityVerifier verifier() {
        return verifier;
    }

    /**
     * Serializes and signs a blob.
     *
     * @throws IllegalArgumentException if the payload exceeds the configured maximum
     */
    public byte[] encode(StateBlob blob) {
        byte[] payload = blob.payload();
        if (payload.length > maxPayloadSize) {
            throw new IllegalArgumentException("Payload too large: " + payload.length +
                    " bytes (max: " + maxPayloadSize + ")");
        }

        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE + payload.length + SIGNATURE_SIZE);
        buf.putInt(blob.schemaVersion());
        buf.putLong(blob.savedAtEpochSeconds());
        buf.putInt(payload.length);
        buf.put(payload);

        byte[] signature = verifier.sign(buf.array(), 0, HEADER_SIZE + payload.length);
        buf.put(signature);
        return buf.array();
    }

    /**
     * Parses and verifies a blob.
     * <p>
     * Any structural problem (short file, bad length, trailing garbage) or signature
     * mismatch yields an empty result; nothing is thrown for bad data.
     */
    public Optional<StateBlob> decode(byte[] bytes) {
        if (bytes == null || bytes.length < HEADER_SIZE + SIGNATURE_SIZE) {
            LOG.debug("Blob too short: {} bytes", bytes == null ? 0 : bytes.length);
            return Optional.empty();
        }

        ByteBuffer buf = ByteBuffer.wrap(bytes);
        long schemaVersion = Integer.toUnsignedLong(buf.getInt());
        long savedAt = buf.getLong();
        long payloadLen = Integer.toUnsignedLong(buf.getInt());

        if (payloadLen > maxPayloadSize) {
            LOG.debug("Blob declares payload length {} above maximum {}", payloadLen, maxPayloadSize);
            return Optional.empty();
        }
        if (HEADER_SIZE + payloadLen + SIGNATURE_SIZE != bytes.length) {
            LOG.debug("Blob length mismatch: declared payload {} bytes, file {} bytes", payloadLen, bytes.length);
            return Optional.empty();
        }

        int signedLength = HEADER_SIZE + (int) payloadLen;
        byte[] signature = Arrays.copyOfRange(bytes, signedLength, bytes.length);
        if (!verifier.verify(bytes, 0, signedLength, signature)) {
            LOG.debug("Blob signature mismatch ({} bytes)", bytes.length);
            return Optional.empty();
        }
        if (schemaVersion > Integer.MAX_VALUE) {
            LOG.debug("Blob schema version out of range: {}", schemaVersion);
            return Optional.empty();
        }

        byte[] payload = Arrays.copyOfRange(bytes, HEADER_SIZE, signedLength);
        return Optional.of(new StateBlob((int) schemaVersion, savedAt, payload));
    }
}
