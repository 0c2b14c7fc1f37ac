package com.chain.chainledgersystem.data.item;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 物品投影行：当前经手人与创建信息，可由链完整重建
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemRecord {

    private String itemId;
    private String description;
    private String itemType;
    //当前经手人
    private String currentCustodian;
    private String location;
    private String createdBy;
    private String createdAt;
    private String lastAction;
    private String lastUpdated;
    //创建交易所在区块
    private long blockIndex;
    private String contentHash;
}
