package com.chain.chainledgersystem.data.item;

import com.chain.chainledgersystem.data.block.Block;
import com.chain.chainledgersystem.data.transaction.CreationTransaction;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.chain.chainledgersystem.data.transaction.TransferTransaction;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 由区块推导物品投影、转移日志与历史记录。
 * 增量追加与整链重建使用同一套规则，保证存储中的投影与全链扫描一致。
 */
@Slf4j
public class ItemProjector {

    //读取已持久化的物品行 整链扫描时恒返回null
    private final Function<String, ItemRecord> itemLoader;
    //本次推导中被修改的物品行
    private final Map<String, ItemRecord> items = new LinkedHashMap<>();
    private final List<TransferRecord> transfers = new ArrayList<>();
    private final List<HistoryEntry> history = new ArrayList<>();
    private long nextTransferId;

    public ItemProjector(Function<String, ItemRecord> itemLoader, long nextTransferId) {
        this.itemLoader = itemLoader;
        this.nextTransferId = nextTransferId;
    }

    /**
     * 从空投影开始扫描整条链
     */
    public static ItemProjector scan(List<Block> chain) {
        ItemProjector projector = new ItemProjector(id -> null, 1);
        for (Block block : chain) {
            projector.apply(block);
        }
        return projector;
    }

    public void apply(@NotNull Block block) {
        if (block.isGenesis() || block.getPayload() == null) {
            return;
        }
        List<Transaction> transactions = block.getPayload().getTransactions();
        for (int position = 0; position < transactions.size(); position++) {
            Transaction tx = transactions.get(position);
            if (tx instanceof CreationTransaction) {
                applyCreation((CreationTransaction) tx, block.getIndex());
            } else if (tx instanceof TransferTransaction) {
                applyTransfer((TransferTransaction) tx, block.getIndex());
            } else {
                log.warn("区块{}中存在未知交易类型: {}", block.getIndex(), tx.getType());
                continue;
            }
            history.add(new HistoryEntry(tx.getItemId(), block.getIndex(), position,
                    tx.getTimestamp(), tx.getAction(), tx.getCustodian(), tx));
        }
    }

    private void applyCreation(CreationTransaction tx, long blockIndex) {
        //重复创建覆盖原有行
        ItemRecord record = new ItemRecord(
                tx.getItemId(),
                tx.getDescription(),
                tx.getItemType(),
                tx.getActor(),
                tx.getLocation(),
                tx.getActor(),
                tx.getTimestamp(),
                tx.getAction(),
                tx.getTimestamp(),
                blockIndex,
                tx.getContentHash());
        items.put(tx.getItemId(), record);
    }

    private void applyTransfer(TransferTransaction tx, long blockIndex) {
        ItemRecord record = lookup(tx.getItemId());
        if (record != null) {
            record.setCurrentCustodian(tx.getToActor());
            record.setLastAction(tx.getAction());
            record.setLastUpdated(tx.getTimestamp());
            items.put(record.getItemId(), record);
        } else {
            log.warn("转移的物品{}不存在于投影中，仅记录转移日志", tx.getItemId());
        }
        transfers.add(new TransferRecord(nextTransferId++, tx.getItemId(), tx.getFromActor(),
                tx.getToActor(), tx.getReason(), tx.getTimestamp(), blockIndex));
    }

    private ItemRecord lookup(String itemId) {
        ItemRecord record = items.get(itemId);
        if (record == null) {
            record = itemLoader.apply(itemId);
        }
        return record;
    }

    public Map<String, ItemRecord> getItems() {
        return Collections.unmodifiableMap(items);
    }

    public List<TransferRecord> getTransfers() {
        return Collections.unmodifiableList(transfers);
    }

    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public long getNextTransferId() {
        return nextTransferId;
    }
}
