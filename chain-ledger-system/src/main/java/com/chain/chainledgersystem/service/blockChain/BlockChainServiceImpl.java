package com.chain.chainledgersystem.service.blockChain;

import com.chain.chainledgersystem.config.SystemConfig;
import com.chain.chainledgersystem.constant.BlockChainConstants;
import com.chain.chainledgersystem.data.block.Block;
import com.chain.chainledgersystem.data.block.GenesisPayload;
import com.chain.chainledgersystem.data.block.TransactionBatch;
import com.chain.chainledgersystem.data.dto.CreateItemRequest;
import com.chain.chainledgersystem.data.dto.TransferItemRequest;
import com.chain.chainledgersystem.data.item.HistoryEntry;
import com.chain.chainledgersystem.data.item.ItemProjector;
import com.chain.chainledgersystem.data.item.ItemRecord;
import com.chain.chainledgersystem.data.item.TransferRecord;
import com.chain.chainledgersystem.data.transaction.CreationTransaction;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.chain.chainledgersystem.data.transaction.TransferTransaction;
import com.chain.chainledgersystem.data.vo.SubmitResult;
import com.chain.chainledgersystem.exception.InvalidTransactionException;
import com.chain.chainledgersystem.exception.ItemNotFoundException;
import com.chain.chainledgersystem.storage.StorageService;
import com.chain.chainledgersystem.storage.StorageStats;
import com.chain.chainledgersystem.util.CryptoUtil;
import com.google.common.base.Strings;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
@Service
public class BlockChainServiceImpl implements BlockChainService {

    private static final DateTimeFormatter BACKUP_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final StorageService storageService;
    private final String nodeId;
    private final String backupDir;

    //链、待封装交易与投影写入共用一把锁
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Block> chain = new ArrayList<>();
    private final List<Transaction> pendingTransactions = new ArrayList<>();

    @Autowired
    public BlockChainServiceImpl(StorageService storageService, SystemConfig systemConfig) {
        this.storageService = storageService;
        this.nodeId = systemConfig.getNodeId();
        this.backupDir = systemConfig.getStoragePath() + File.separator + BlockChainConstants.BACKUP_DIR;
    }

    @PostConstruct
    @Override
    public void initBlockChain() {
        lock.writeLock().lock();
        try {
            List<Block> stored = storageService.loadChain();
            chain.clear();
            if (!stored.isEmpty()) {
                chain.addAll(stored);
                log.info("从存储加载区块链，长度：{}，最新hash：{}", chain.size(), getLatestBlock().getHash());
                return;
            }
            Block genesisBlock = Block.seal(0, now(), GenesisPayload.of(nodeId), BlockChainConstants.GENESIS_PREVIOUS_HASH);
            storageService.appendBlock(genesisBlock, nodeId);
            chain.add(genesisBlock);
            log.info("创世区块初始化成功！hash={}", genesisBlock.getHash());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public SubmitResult submitTransaction(Transaction transaction) {
        if (transaction == null) {
            throw new InvalidTransactionException("交易不能为空");
        }
        transaction.validate();
        // 链上只保存副本，调用方之后修改原对象不影响已封装区块
        Transaction sealed = transaction.copy();
        lock.writeLock().lock();
        try {
            pendingTransactions.add(sealed);
            Block view = sealPendingTransactions().copy();
            List<Transaction> transactions = view.getPayload().getTransactions();
            return new SubmitResult(view, transactions.get(transactions.size() - 1));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 将待封装交易整体打包为一个区块，先落盘再追加到内存链。
     * 写入失败时内存链不变，待封装列表同样清空。
     */
    private Block sealPendingTransactions() {
        Block latest = chain.get(chain.size() - 1);
        Block block = Block.seal(latest.getIndex() + 1, now(),
                new TransactionBatch(pendingTransactions), latest.getHash());
        try {
            storageService.appendBlock(block, nodeId);
        } finally {
            pendingTransactions.clear();
        }
        chain.add(block);
        log.info("新区块已封装：index={}，交易数：{}，hash={}",
                block.getIndex(), block.getPayload().getTransactions().size(), block.getHash());
        return block;
    }

    @Override
    public SubmitResult createItem(CreateItemRequest request) {
        String timestamp = LocalDateTime.now().toString();
        CreationTransaction transaction = new CreationTransaction();
        transaction.setItemId(request.getItemId());
        transaction.setDescription(request.getDescription());
        transaction.setActor(request.getActor());
        transaction.setLocation(request.getLocation());
        transaction.setItemType(request.getItemType());
        transaction.setTimestamp(timestamp);
        transaction.setNodeId(nodeId);
        transaction.validate();
        if (Strings.isNullOrEmpty(request.getContentHash())) {
            transaction.setContentHash(CryptoUtil.sha256Hex(request.getItemId() + request.getDescription() + timestamp));
        } else {
            transaction.setContentHash(request.getContentHash());
        }
        return submitTransaction(transaction);
    }

    @Override
    public SubmitResult transferItem(TransferItemRequest request) {
        TransferTransaction transaction = new TransferTransaction();
        transaction.setItemId(request.getItemId());
        transaction.setFromActor(request.getFromActor());
        transaction.setToActor(request.getToActor());
        transaction.setReason(request.getReason());
        transaction.setTimestamp(LocalDateTime.now().toString());
        transaction.setNodeId(nodeId);
        return submitTransaction(transaction);
    }

    @Override
    public SubmitResult receiveTransaction(Transaction transaction) {
        if (transaction != null) {
            log.info("收到节点{}广播的交易：type={}，item_id={}",
                    transaction.getNodeId(), transaction.getType(), transaction.getItemId());
        }
        return submitTransaction(transaction);
    }

    @Override
    public boolean isChainValid() {
        lock.readLock().lock();
        try {
            return isValidChain(chain);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 从序号1开始逐块检查：重新计算的hash一致，且 previous_hash 指向前一个区块。只报告，不修复。
     */
    public static boolean isValidChain(List<Block> blocks) {
        for (int i = 1; i < blocks.size(); i++) {
            Block current = blocks.get(i);
            Block previous = blocks.get(i - 1);
            if (current == null || previous == null) {
                log.warn("链中第{}个位置存在空区块", current == null ? i : i - 1);
                return false;
            }
            if (current.getHash() == null || !current.getHash().equals(current.computeHash())) {
                log.warn("区块{}的hash与内容不一致", current.getIndex());
                return false;
            }
            if (current.getPreviousHash() == null || !current.getPreviousHash().equals(previous.getHash())) {
                log.warn("区块{}的previous_hash与前一区块不一致", current.getIndex());
                return false;
            }
        }
        return true;
    }

    @Override
    public void replaceChain(List<Block> blocks) {
        lock.writeLock().lock();
        try {
            List<Block> copies = new ArrayList<>(blocks.size());
            for (Block block : blocks) {
                copies.add(block.copy());
            }
            storageService.replaceAll(copies, nodeId);
            chain.clear();
            chain.addAll(copies);
            log.info("本地链已替换，新长度：{}", chain.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean replaceChainIfLonger(List<Block> blocks) {
        lock.writeLock().lock();
        try {
            if (blocks.size() <= chain.size()) {
                log.info("候选链长度{}不大于本地链长度{}，保留本地链", blocks.size(), chain.size());
                return false;
            }
            replaceChain(blocks);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Block> getChain() {
        lock.readLock().lock();
        try {
            List<Block> copies = new ArrayList<>(chain.size());
            for (Block block : chain) {
                copies.add(block.copy());
            }
            return Collections.unmodifiableList(copies);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int getChainLength() {
        lock.readLock().lock();
        try {
            return chain.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Block getLatestBlock() {
        lock.readLock().lock();
        try {
            return chain.isEmpty() ? null : chain.get(chain.size() - 1).copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Block getBlock(long index) {
        lock.readLock().lock();
        try {
            if (index < 0 || index >= chain.size()) {
                return null;
            }
            return chain.get((int) index).copy();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ItemRecord> getAllItems() {
        lock.readLock().lock();
        try {
            return storageService.queryAllItems();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public ItemRecord getItem(String itemId) {
        ItemRecord record;
        lock.readLock().lock();
        try {
            record = storageService.queryItem(itemId);
        } finally {
            lock.readLock().unlock();
        }
        if (record == null) {
            throw new ItemNotFoundException(itemId);
        }
        return record;
    }

    @Override
    public List<HistoryEntry> getItemHistory(String itemId) {
        lock.readLock().lock();
        try {
            return storageService.queryItemHistory(itemId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<TransferRecord> getTransfers(String itemId) {
        lock.readLock().lock();
        try {
            return storageService.queryTransfers(itemId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ItemRecord> scanAllItems() {
        lock.readLock().lock();
        try {
            List<ItemRecord> items = new ArrayList<>(ItemProjector.scan(chain).getItems().values());
            items.sort(StorageService.ITEM_ORDER);
            return items;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public StorageStats getStats() {
        lock.readLock().lock();
        try {
            return storageService.getStats();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String backup() {
        String name = BlockChainConstants.BACKUP_NAME_PREFIX + nodeId + "_"
                + LocalDateTime.now().format(BACKUP_TIME_FORMAT);
        lock.readLock().lock();
        try {
            //同一秒内多次备份时追加序号
            File target = new File(backupDir, name);
            for (int i = 1; target.exists(); i++) {
                target = new File(backupDir, name + "_" + i);
            }
            return storageService.backup(target.getPath());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String getNodeId() {
        return nodeId;
    }

    private static double now() {
        return System.currentTimeMillis() / 1000.0;
    }
}
