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
package dev.mars.statevault.schema;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * JSON payloads via Jackson. Migrations operate on the {@link JsonNode} tree, so a
 * step can add a field with a default or recompute a derived value before the
 * tree is bound to {@code T}.
 *
 * @param <T> the component state type
 */
public final class JsonStateSerializer<T> extends MigratingSerializer<T, JsonNode> {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private final ObjectMapper mapper;
    private final Class<T> type;

    public JsonStateSerializer(Class<T> type, MigrationChain<JsonNode> chain) {
        this(DEFAULT_MAPPER, type, chain);
    }

    public JsonStateSerializer(ObjectMapper mapper, Class<T> type, MigrationChain<JsonNode> chain) {
        super(chain);
        this.mapper = mapper;
        this.type = type;
    }

    /** A serializer at {@code version} with no migration steps. */
    public static <T> JsonStateSerializer<T> of(Class<T> type, int version) {
        return new JsonStateSerializer<>(type, MigrationChain.none(version));
    }

    /** Shared mapper used when none is supplied. */
    public static ObjectMapper defaultMapper() {
        return DEFAULT_MAPPER;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    protected JsonNode read(byte[] payload) throws IOException {
        JsonNode node = mapper.readTree(payload);
        if (node == null || node.isMissingNode()) {
            throw new IOException("Empty JSON payload");
        }
        return node;
    }

    @Override
    protected byte[] write(JsonNode intermediate) throws IOException {
        return mapper.writeValueAsBytes(intermediate);
    }

    @Override
    protected JsonNode toIntermediate(T state) {
        return mapper.valueToTree(state);
    }

    @Override
    protected T fromIntermediate(JsonNode intermediate) throws IOException {
        return mapper.treeToValue(intermediate, type);
    }
}
