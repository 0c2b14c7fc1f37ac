package com.chain.chainledgersystem.data.transaction;

import com.chain.chainledgersystem.constant.BlockChainConstants;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CreationTransaction extends Transaction {

    private String description;
    //创建人 即初始经手人
    private String actor;
    private String location;
    private String itemType;
    //物品内容摘要 未提供时由账本生成
    private String contentHash;

    public CreationTransaction() {
        super(BlockChainConstants.TX_TYPE_CREATION, BlockChainConstants.ACTION_CREATED);
    }

    @Override
    public String getCustodian() {
        return actor;
    }

    @Override
    protected void collectMissingFields(List<String> missing) {
        if (isBlank(description)) {
            missing.add("description");
        }
        if (isBlank(actor)) {
            missing.add("actor");
        }
        if (isBlank(location)) {
            missing.add("location");
        }
        if (isBlank(itemType)) {
            missing.add("item_type");
        }
    }
}
