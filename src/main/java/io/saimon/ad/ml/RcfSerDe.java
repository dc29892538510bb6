/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.saimon.ad.ml;

import java.lang.reflect.Type;
import java.util.Base64;

import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.amazon.randomcutforest.state.RandomCutForestState;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

/**
 * Serializes/deserializes RandomCutForest.
 *
 * A forest is converted to its state object, written with protostuff and then encoded in Base64.
 */
public class RcfSerDe implements JsonSerializer<RandomCutForest>, JsonDeserializer<RandomCutForest> {
    private static final int BUFFER_SIZE = 512;

    private final RandomCutForestMapper mapper;
    private final Schema<RandomCutForestState> schema;

    public RcfSerDe() {
        this.mapper = new RandomCutForestMapper();
        this.mapper.setSaveExecutorContextEnabled(true);
        this.mapper.setSaveTreeStateEnabled(true);
        this.schema = RuntimeSchema.getSchema(RandomCutForestState.class);
    }

    @Override
    public JsonElement serialize(RandomCutForest src, Type typeOfSrc, JsonSerializationContext context) {
        LinkedBuffer buffer = LinkedBuffer.allocate(BUFFER_SIZE);
        try {
            byte[] bytes = ProtostuffIOUtil.toByteArray(mapper.toState(src), schema, buffer);
            return new JsonPrimitive(Base64.getEncoder().encodeToString(bytes));
        } finally {
            buffer.clear();
        }
    }

    @Override
    public RandomCutForest deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) {
        try {
            byte[] bytes = Base64.getDecoder().decode(json.getAsString());
            RandomCutForestState state = schema.newMessage();
            ProtostuffIOUtil.mergeFrom(bytes, state, schema);
            return mapper.toModel(state);
        } catch (RuntimeException e) {
            throw new JsonParseException("Failed to deserialize RCF model", e);
        }
    }
}
