package com.pivotcalc.common;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Codec 编解码器
 * 负责 {@link PivotDefinition} 与 JSON 之间的转换，shell 用它加载定义文件。
 */
public final class PivotDefinitionCodec {

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private PivotDefinitionCodec() {
    }

    public static byte[] encode(PivotDefinition definition) {
        return GSON.toJson(definition).getBytes(StandardCharsets.UTF_8);
    }

    public static PivotDefinition decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Pivot definition payload is empty");
        }
        PivotDefinition definition;
        try {
            definition = GSON.fromJson(new String(data, StandardCharsets.UTF_8), PivotDefinition.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Unable to decode pivot definition: " + e.getMessage(), e);
        }
        if (definition == null || definition.getFields() == null) {
            throw new IllegalArgumentException("Unable to decode pivot definition");
        }
        if (definition.getRecords() == null) {
            definition.setRecords(new ArrayList<>());
        }
        return definition;
    }
}
