package com.chain.chainledgersystem.serialization.gson;

import com.chain.chainledgersystem.constant.BlockChainConstants;
import com.chain.chainledgersystem.data.transaction.CreationTransaction;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.chain.chainledgersystem.data.transaction.TransferTransaction;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

import java.lang.reflect.Type;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按 type 字段分派交易子类
 */
public class TransactionAdapter implements JsonSerializer<Transaction>, JsonDeserializer<Transaction> {

    private final Map<String, Class<? extends Transaction>> transactionClassRegistry = new ConcurrentHashMap<>();

    public TransactionAdapter() {
        this.registerTransactionClass(BlockChainConstants.TX_TYPE_CREATION, CreationTransaction.class);
        this.registerTransactionClass(BlockChainConstants.TX_TYPE_TRANSFER, TransferTransaction.class);
    }

    @Override
    public JsonElement serialize(Transaction src, Type typeOfSrc, JsonSerializationContext context) {
        return context.serialize(src, src.getClass());
    }

    @Override
    public Transaction deserialize(JsonElement json, Type typeOfT, JsonDeserializationContext context) throws JsonParseException {
        if (!json.isJsonObject()) {
            throw new JsonParseException("交易必须是JSON对象");
        }
        JsonObject jsonObject = json.getAsJsonObject();
        JsonElement typeElement = jsonObject.get("type");
        if (typeElement == null || typeElement.isJsonNull()) {
            throw new JsonParseException("交易缺少 type 字段");
        }
        String type = typeElement.getAsString();
        Class<? extends Transaction> aClass = transactionClassRegistry.get(type);
        if (aClass == null) {
            throw new JsonParseException("未知的交易类型: " + type);
        }
        return context.deserialize(jsonObject, aClass);
    }

    public void registerTransactionClass(String type, Class<? extends Transaction> clazz) {
        this.transactionClassRegistry.put(type, clazz);
    }
}
