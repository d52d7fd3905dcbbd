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

import dev.mars.statevault.ErrorCode;
import dev.mars.statevault.StateVaultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Keyed digest (HMAC-SHA256) over blob bytes.
 * <p>
 * The key is process-local and created once per installation, so a signature
 * detects both accidental corruption and substitution of a blob written under
 * another key. {@link #verify} never throws: a mismatch only means the candidate
 * is unusable.
 */
public final class IntegrityVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(IntegrityVerifier.class);

    private static final String ALGORITHM = "HmacSHA256";

    /** Length in bytes of every signature produced by {@link #sign}. */
    public static final int SIGNATURE_LENGTH = 32;

    /** Length in bytes of generated keys. */
    public static final int KEY_LENGTH = 32;

    private final SecretKeySpec key;

    public IntegrityVerifier(byte[] key) {
        if (key == null || key.length == 0) {
            throw new StateVaultException(ErrorCode.INVALID_ARGUMENT, "Signing key must not be empty");
        }
        this.key = new SecretKeySpec(key.clone(), ALGORITHM);
    }

    /**
     * Computes the signature of {@code length} bytes of {@code data} starting at {@code offset}.
     */
    public byte[] sign(byte[] data, int offset, int length) {
        Mac mac = newMac();
        mac.update(data, offset, length);
        return mac.doFinal();
    }

    public byte[] sign(byte[] data) {
        return sign(data, 0, data.length);
    }

    /**
     * Recomputes the signature over the given range and compares it in constant time.
     *
     * @return false on any mismatch or malformed signature; never throws for bad data
     */
    public boolean verify(byte[] data, int offset, int length, byte[] signature) {
        if (data == null || signature == null || signature.length != SIGNATURE_LENGTH) {
            return false;
        }
        if (offset < 0 || length < 0 || length > data.length - offset) {
            return false;
        }
        return MessageDigest.isEqual(sign(data, offset, length), signature);
    }

    public boolean verify(byte[] data, byte[] signature) {
        return data != null && verify(data, 0, data.length, signature);
    }

    private Mac newMac() {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac;
        } catch (GeneralSecurityException e) {
            // HmacSHA256 is mandatory on every JDK
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    /**
     * Loads the installation key from {@code keyFile}, generating and persisting a
     * random one on first use.
     * <p>
     * The key file holds the Base64-encoded key. A new key is written to a temp
     * file, forced to disk, renamed atomically and the directory synced, so a
     * crash never leaves a truncated key behind and a committed blob never
     * outlives its key. An existing key file is never replaced: if it is empty or
     * unreadable every blob signed with the lost key would be discarded, so the
     * call fails instead.
     *
     * @throws StateVaultException with {@link ErrorCode#IO_ERROR} if the file cannot be read
     *                             or created, or exists with no valid key in it
     */
    public static IntegrityVerifier loadOrCreate(Path keyFile) {
        if (Files.exists(keyFile)) {
            return load(keyFile);
        }
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            byte[] raw = new byte[KEY_LENGTH];
            new SecureRandom().nextBytes(raw);
            Path tmp = keyFile.resolveSibling(keyFile.getFileName() + ".tmp");
            byte[] encoded = Base64.getEncoder().encode(raw);
            try (FileChannel fc = FileChannel.open(tmp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(encoded);
                while (buffer.hasRemaining()) {
                    fc.write(buffer);
                }
                fc.force(true);
            }
            Files.move(tmp, keyFile, StandardCopyOption.ATOMIC_MOVE);
            AtomicWriter.syncDirectory(keyFile.toAbsolutePath().getParent());
            LOG.info("Generated new signing key: {}", keyFile);
            return new IntegrityVerifier(raw);
        } catch (IOException e) {
            LOG.error("Failed to create signing key {}: {}", keyFile, e.getMessage(), e);
            throw new StateVaultException(ErrorCode.IO_ERROR, "Failed to create signing key: " + keyFile, e);
        }
    }

    /**
     * Loads an existing installation key without ever creating one.
     *
     * @throws StateVaultException with {@link ErrorCode#IO_ERROR} if the file is missing,
     *                             unreadable, empty or not a Base64 key
     */
    public static IntegrityVerifier load(Path keyFile) {
        String existing;
        try {
            existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            LOG.error("Failed to read signing key {}: {}", keyFile, e.getMessage(), e);
            throw new StateVaultException(ErrorCode.IO_ERROR, "Failed to read signing key: " + keyFile, e);
        }
        if (existing.isEmpty()) {
            LOG.error("Signing key file {} is empty; refusing to replace it", keyFile);
            throw new StateVaultException(ErrorCode.IO_ERROR, "Signing key file is empty: " + keyFile);
        }
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(existing);
        } catch (IllegalArgumentException e) {
            LOG.error("Signing key file {} is not valid Base64; refusing to replace it", keyFile);
            throw new StateVaultException(ErrorCode.IO_ERROR, "Signing key file is invalid: " + keyFile, e);
        }
        if (raw.length == 0) {
            throw new StateVaultException(ErrorCode.IO_ERROR, "Signing key file is invalid: " + keyFile);
        }
        LOG.debug("Loaded signing key from {}", keyFile);
        return new IntegrityVerifier(raw);
    }
}
