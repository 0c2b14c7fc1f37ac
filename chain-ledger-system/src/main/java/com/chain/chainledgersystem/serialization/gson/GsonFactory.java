package com.chain.chainledgersystem.serialization.gson;

import com.chain.chainledgersystem.data.block.BlockPayload;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Map;
import java.util.TreeMap;

/**
 * 线上协议、持久化记录与区块哈希共用的Gson配置
 */
public final class GsonFactory {

    private static final Gson GSON = gsonBuilder().create();

    public static GsonBuilder gsonBuilder() {
        return new GsonBuilder()
                .serializeNulls()
                .disableHtmlEscaping()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .registerTypeAdapter(Transaction.class, new TransactionAdapter())
                .registerTypeAdapter(BlockPayload.class, new BlockPayloadAdapter());
    }

    public static Gson getGson() {
        return GSON;
    }

    /**
     * 对象键递归排序后的紧凑JSON，与字段声明顺序无关
     */
    public static String toCanonicalJson(JsonElement element) {
        return GSON.toJson(canonicalize(element));
    }

    static JsonElement canonicalize(JsonElement element) {
        if (element == null || element.isJsonNull() || element.isJsonPrimitive()) {
            return element;
        }
        if (element.isJsonArray()) {
            JsonArray sorted = new JsonArray();
            for (JsonElement e : element.getAsJsonArray()) {
                sorted.add(canonicalize(e));
            }
            return sorted;
        }
        Map<String, JsonElement> ordered = new TreeMap<>();
        for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
            ordered.put(entry.getKey(), canonicalize(entry.getValue()));
        }
        JsonObject sorted = new JsonObject();
        ordered.forEach(sorted::add);
        return sorted;
    }

    private GsonFactory() {
    }
}
