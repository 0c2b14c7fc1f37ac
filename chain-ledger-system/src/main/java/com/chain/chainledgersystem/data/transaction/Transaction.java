package com.chain.chainledgersystem.data.transaction;

import com.chain.chainledgersystem.exception.InvalidTransactionException;
import com.chain.chainledgersystem.serialization.gson.GsonFactory;
import com.google.common.base.Strings;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 保管事件，按 type 区分创建与转移两种交易。
 * 交易一旦封装进区块便不再修改。
 */
@Data
@NoArgsConstructor
public abstract class Transaction {

    //交易类型 item_creation / item_transfer
    private String type;
    //被追踪物品ID
    private String itemId;
    //固定动作 Created / Transferred
    private String action;
    //ISO-8601 本地时间
    private String timestamp;
    //发起交易的节点
    private String nodeId;

    protected Transaction(String type, String action) {
        this.type = type;
        this.action = action;
    }

    /**
     * 用于历史与日志展示的当前经手人
     */
    public abstract String getCustodian();

    /**
     * 子类追加自己的必填字段
     */
    protected abstract void collectMissingFields(List<String> missing);

    /**
     * 校验必填字段，缺失时抛出 InvalidTransactionException
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        if (Strings.isNullOrEmpty(type)) {
            missing.add("type");
        }
        if (isBlank(itemId)) {
            missing.add("item_id");
        }
        collectMissingFields(missing);
        if (!missing.isEmpty()) {
            throw new InvalidTransactionException("交易缺少必填字段: " + String.join(", ", missing));
        }
    }

    public Transaction copy() {
        return GsonFactory.getGson().fromJson(GsonFactory.getGson().toJson(this, Transaction.class), Transaction.class);
    }

    protected static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
