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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.zip.CRC32C;

/**
 * Lightweight per-tick snapshot of small hot fields.
 * <p>
 * No rotation and no keyed signature: a CRC32C trailer catches torn or flipped
 * bytes, and the temp + atomic rename sequence keeps the previous snapshot intact
 * until the new one is complete. Full signed saves remain the durable record.
 * <p>
 * <b>Format:</b>
 * <pre>
 * MAGIC(4) + SCHEMA_VERSION(4) + SAVED_AT(8) + PAYLOAD_LEN(4) + PAYLOAD(var) + CRC32C(4)
 * </pre>
 */
public final class SnapshotStore {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotStore.class);

    /** Magic number: 'SVSN' in ASCII */
    private static final int MAGIC = 0x5356534E;

    private static final int HEADER_SIZE = 4 + 4 + 8 + 4;
    private static final int CRC_SIZE = 4;

    private final AtomicWriter writer;
    private final int maxPayloadSize;

    public SnapshotStore(AtomicWriter writer, int maxPayloadSize) {
        this.writer = writer;
        this.maxPayloadSize = maxPayloadSize;
    }

    /**
     * Replaces the snapshot file with {@code blob}.
     *
     * @throws dev.mars.statevault.StateVaultException on I/O failure; the previous snapshot is intact
     */
    public void write(ComponentFiles files, StateBlob blob) {
        byte[] payload = blob.payload();
        if (payload.length > maxPayloadSize) {
            throw new IllegalArgumentException("Payload too large: " + payload.length +
                    " bytes (max: " + maxPayloadSize + ")");
        }
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE + payload.length + CRC_SIZE);
        buf.putInt(MAGIC);
        buf.putInt(blob.schemaVersion());
        buf.putLong(blob.savedAtEpochSeconds());
        buf.putInt(payload.length);
        buf.put(payload);

        CRC32C crc = new CRC32C();
        crc.update(buf.array(), 0, HEADER_SIZE + payload.length);
        buf.putInt((int) crc.getValue());

        writer.commit(writer.prepare(files.snapshot(), buf.array(), written -> parse(written).isPresent()));
        LOG.trace("Snapshot written for {}: {} bytes", files.id(), buf.capacity());
    }

    /**
     * Reads the snapshot, if present and intact.
     */
    public Optional<StateBlob> read(ComponentFiles files) {
        Path path = files.snapshot();
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            Optional<StateBlob> blob = parse(Files.readAllBytes(path));
            if (blob.isEmpty()) {
                LOG.warn("Snapshot for {} is corrupt, ignoring it", files.id());
            }
            return blob;
        } catch (IOException e) {
            LOG.warn("Could not read snapshot {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<StateBlob> parse(byte[] all) {
        if (all.length < HEADER_SIZE + CRC_SIZE) {
            return Optional.empty();
        }
        ByteBuffer buf = ByteBuffer.wrap(all);
        int magic = buf.getInt();
        int schemaVersion = buf.getInt();
        long savedAt = buf.getLong();
        int payloadLen = buf.getInt();

        if (magic != MAGIC || schemaVersion < 0) {
            return Optional.empty();
        }
        if (payloadLen < 0 || payloadLen > maxPayloadSize || HEADER_SIZE + payloadLen + CRC_SIZE != all.length) {
            return Optional.empty();
        }

        CRC32C crc = new CRC32C();
        crc.update(all, 0, HEADER_SIZE + payloadLen);
        int expectedCrc = ByteBuffer.wrap(all, HEADER_SIZE + payloadLen, CRC_SIZE).getInt();
        if ((int) crc.getValue() != expectedCrc) {
            LOG.debug("Snapshot CRC mismatch: expected={}, computed={}", expectedCrc, (int) crc.getValue());
            return Optional.empty();
        }
        return Optional.of(new StateBlob(schemaVersion, savedAt,
                Arrays.copyOfRange(all, HEADER_SIZE, HEADER_SIZE + payloadLen)));
    }
}
