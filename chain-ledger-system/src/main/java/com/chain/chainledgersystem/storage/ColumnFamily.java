package com.chain.chainledgersystem.storage;

import org.rocksdb.ColumnFamilyOptions;

public enum ColumnFamily {
    //大端序区块序号 -> 区块JSON
    BLOCK("CF_BLOCK", "block", new ColumnFamilyOptions()),

    //物品ID -> 物品投影行
    ITEM("CF_ITEM", "item", new ColumnFamilyOptions()),
    //物品ID + 0x00 + 区块序号 + 区块内位置 -> 历史记录
    ITEM_HISTORY("CF_ITEM_HISTORY", "itemHistory", new ColumnFamilyOptions()),

    //转移序号 -> 转移日志行
    TRANSFER("CF_TRANSFER", "transfer", new ColumnFamilyOptions()),
    //物品ID + 0x00 + 转移序号 -> 空
    TRANSFER_ITEM_INDEX("CF_TRANSFER_ITEM_INDEX", "transferItemIndex", new ColumnFamilyOptions()),
    //区块序号 + 转移序号 -> 空  重写同一区块时据此清理旧行
    TRANSFER_BLOCK_INDEX("CF_TRANSFER_BLOCK_INDEX", "transferBlockIndex", new ColumnFamilyOptions()),

    //区块链信息  链长度、最新hash、转移序号
    BLOCK_CHAIN("CF_BLOCK_CHAIN", "blockChain", new ColumnFamilyOptions()),

    NODE_INFO("CF_NODE_INFO", "nodeInfo", new ColumnFamilyOptions()),

    //节点URL -> 加入时间
    PEER("CF_PEER", "peer", new ColumnFamilyOptions()),
    ;
    final String logicalName;
    final String actualName;
    final ColumnFamilyOptions options;

    ColumnFamily(String logicalName, String actualName, ColumnFamilyOptions options) {
        this.logicalName = logicalName;
        this.actualName = actualName;
        this.options = options;
    }
}
