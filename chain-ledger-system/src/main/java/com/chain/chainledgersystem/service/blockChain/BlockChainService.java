package com.chain.chainledgersystem.service.blockChain;

import com.chain.chainledgersystem.data.block.Block;
import com.chain.chainledgersystem.data.dto.CreateItemRequest;
import com.chain.chainledgersystem.data.dto.TransferItemRequest;
import com.chain.chainledgersystem.data.item.HistoryEntry;
import com.chain.chainledgersystem.data.item.ItemRecord;
import com.chain.chainledgersystem.data.item.TransferRecord;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.chain.chainledgersystem.data.vo.SubmitResult;
import com.chain.chainledgersystem.storage.StorageStats;

import java.util.List;

public interface BlockChainService {

    /**
     * 存储中已有区块则加载，否则封装并持久化创世区块
     */
    void initBlockChain();

    /**
     * 校验交易并立即封装为新区块
     */
    SubmitResult submitTransaction(Transaction transaction);

    SubmitResult createItem(CreateItemRequest request);

    SubmitResult transferItem(TransferItemRequest request);

    /**
     * 其他节点广播的交易，保留来源节点ID，不再转发
     */
    SubmitResult receiveTransaction(Transaction transaction);

    boolean isChainValid();

    /**
     * 整体替换本地链，不做校验
     */
    void replaceChain(List<Block> blocks);

    /**
     * 候选链严格长于本地链时替换，判断与替换在同一把写锁内完成
     */
    boolean replaceChainIfLonger(List<Block> blocks);

    List<Block> getChain();

    int getChainLength();

    Block getLatestBlock();

    Block getBlock(long index);

    List<ItemRecord> getAllItems();

    ItemRecord getItem(String itemId);

    List<HistoryEntry> getItemHistory(String itemId);

    List<TransferRecord> getTransfers(String itemId);

    /**
     * 不经过存储，直接扫描内存中的链得到物品投影
     */
    List<ItemRecord> scanAllItems();

    StorageStats getStats();

    /**
     * 备份本节点数据库到存储目录下的 backups 目录，返回备份路径
     */
    String backup();

    String getNodeId();
}
