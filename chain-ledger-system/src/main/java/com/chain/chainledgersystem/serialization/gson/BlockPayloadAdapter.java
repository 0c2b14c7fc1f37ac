package com.chain.chainledgersystem.serialization.gson;

import com.chain.chainledgersystem.data.block.BlockPayload;
import com.chain.chainledgersystem.data.block.GenesisPayload;
import com.chain.chainledgersystem.data.block.TransactionBatch;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;

/**
 * 交易列表序列化为JSON数组，创世标记序列化为JSON对象
 */
public class BlockPayloadAdapter implements JsonSerializer<BlockPayload>, JsonDeserializer<BlockPayload> {

    @Override
    public JsonElement serialize(BlockPayload src, Type typeOfSrc, JsonSerializationContext context) {
        if (src.isGenesis()) {
            return context.serialize(src, GenesisPayload.class);
        }
        JsonArray array = new JsonArray();
        for (Transaction transaction : src.getTransactions()) {
            array.add(context.serialize(transaction, Transaction.class));
        }
        return array;
    }

    @Override
    public BlockPayload deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) throws JsonParseException {
        if (json.isJsonArray()) {
            List<Transaction> transactions = new ArrayList<>();
            for (JsonElement element : json.getAsJsonArray()) {
                transactions.add(context.deserialize(element, Transaction.class));
            }
            return new TransactionBatch(transactions);
        }
        if (json.isJsonObject()) {
            return context.deserialize(json, GenesisPayload.class);
        }
        throw new JsonParseException("无法识别的区块载荷: " + json);
    }
}
