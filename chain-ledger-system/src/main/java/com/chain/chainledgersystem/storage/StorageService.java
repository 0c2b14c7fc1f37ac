package com.chain.chainledgersystem.storage;

import com.chain.chainledgersystem.data.block.Block;
import com.chain.chainledgersystem.data.item.HistoryEntry;
import com.chain.chainledgersystem.data.item.ItemProjector;
import com.chain.chainledgersystem.data.item.ItemRecord;
import com.chain.chainledgersystem.data.item.TransferRecord;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.chain.chainledgersystem.exception.StorageException;
import com.chain.chainledgersystem.network.common.NodeInfo;
import com.chain.chainledgersystem.serialization.gson.GsonFactory;
import com.chain.chainledgersystem.util.ByteUtils;
import com.chain.chainledgersystem.util.SerializeUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.rocksdb.Checkpoint;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * 账本的持久化存储。
 * 区块、物品投影、转移日志与链元数据放在同一个RocksDB实例的不同列族中，
 * 每次写入都通过一个 WriteBatch 原子提交。
 */
@Slf4j
public class StorageService implements AutoCloseable {

    private static final byte[] KEY_CHAIN_LENGTH = "key_chain_length".getBytes();
    private static final byte[] KEY_LATEST_HASH = "key_latest_hash".getBytes();
    private static final byte[] KEY_TRANSFER_SEQ = "key_transfer_seq".getBytes();
    private static final byte[] KEY_SELF_NODE_INFO = "key_self_node_info".getBytes();

    private static final byte[] SEPARATOR = new byte[]{0x00};

    //重建链时整体清空的列族
    private static final ColumnFamily[] CHAIN_DERIVED = {
            ColumnFamily.BLOCK,
            ColumnFamily.ITEM,
            ColumnFamily.ITEM_HISTORY,
            ColumnFamily.TRANSFER,
            ColumnFamily.TRANSFER_ITEM_INDEX,
            ColumnFamily.TRANSFER_BLOCK_INDEX
    };

    //物品按创建时间倒序
    public static final Comparator<ItemRecord> ITEM_ORDER = Comparator
            .comparing(ItemRecord::getCreatedAt, Comparator.nullsLast(Comparator.<String>reverseOrder()))
            .thenComparing(ItemRecord::getItemId);

    static {
        RocksDB.loadLibrary();
    }

    @Getter
    private final String dbPath;
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final Map<ColumnFamily, ColumnFamilyHandle> handles = new EnumMap<>(ColumnFamily.class);
    private final List<ColumnFamilyHandle> openedHandles = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final DBOptions dbOptions;
    private final RocksDB db;

    public StorageService(String dbPath) {
        this.dbPath = dbPath;
        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL)
                .setMaxLogFileSize(1024 * 1024)
                .setKeepLogFileNum(2);
        try {
            this.db = openRocksDBWithColumnFamilies();
            log.info("数据库已打开: {}", dbPath);
        } catch (RocksDBException e) {
            dbOptions.close();
            log.error("初始化数据库失败: {}", dbPath, e);
            throw new StorageException("数据库初始化失败: " + dbPath, e);
        }
    }

    private RocksDB openRocksDBWithColumnFamilies() throws RocksDBException {
        File dbDir = new File(dbPath);
        if (!dbDir.exists() && !dbDir.mkdirs()) {
            throw new StorageException("创建数据库目录失败: " + dbPath);
        }
        List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
        // 默认列族必须包含
        cfDescriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, new ColumnFamilyOptions()));
        for (ColumnFamily cf : ColumnFamily.values()) {
            cfDescriptors.add(new ColumnFamilyDescriptor(cf.actualName.getBytes(), cf.options));
        }

        String logDir = dbPath + File.separator + "rocksdb_logs";
        new File(logDir).mkdirs();
        dbOptions.setDbLogDir(logDir);

        RocksDB rocksDB = RocksDB.open(dbOptions, dbPath, cfDescriptors, openedHandles);
        // 跳过默认列族（索引0）
        for (int i = 0; i < ColumnFamily.values().length; i++) {
            handles.put(ColumnFamily.values()[i], openedHandles.get(i + 1));
        }
        return rocksDB;
    }

    private ColumnFamilyHandle handle(ColumnFamily cf) {
        return handles.get(cf);
    }

    //写入.........................................................................................................

    /**
     * 追加一个区块及其投影行。同一序号重复写入时先清理该区块之前写入的历史与转移行。
     */
    public void appendBlock(@NotNull Block block, String nodeId) {
        rwLock.writeLock().lock();
        try (WriteBatch batch = new WriteBatch(); WriteOptions writeOptions = new WriteOptions()) {
            byte[] blockKey = ByteUtils.toBytes(block.getIndex());
            byte[] previous = db.get(handle(ColumnFamily.BLOCK), blockKey);
            if (previous != null) {
                log.warn("区块{}已存在，覆盖写入", block.getIndex());
                removeBlockRows(batch, decodeBlock(previous));
            }

            ItemProjector projector = new ItemProjector(this::readItem, readLong(KEY_TRANSFER_SEQ, 1));
            projector.apply(block);
            writeProjection(batch, projector);
            batch.put(handle(ColumnFamily.BLOCK), blockKey, encodeBlock(block));

            long storedLength = readLong(KEY_CHAIN_LENGTH, 0);
            long chainLength = Math.max(storedLength, block.getIndex() + 1);
            writeChainMeta(batch, chainLength, block.getIndex() + 1 >= chainLength ? block.getHash() : null,
                    projector.getNextTransferId(), nodeId);

            db.write(writeOptions, batch);
            log.debug("区块{}写入成功 hash={}", block.getIndex(), block.getHash());
        } catch (RocksDBException e) {
            log.error("写入区块失败: index={}", block.getIndex(), e);
            throw new StorageException("写入区块失败: " + block.getIndex(), e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    /**
     * 用新链整体替换区块、物品投影与转移日志，投影由全链扫描重建
     */
    public void replaceAll(@NotNull List<Block> blocks, String nodeId) {
        rwLock.writeLock().lock();
        try (WriteBatch batch = new WriteBatch(); WriteOptions writeOptions = new WriteOptions()) {
            for (ColumnFamily cf : CHAIN_DERIVED) {
                forEachKey(cf, key -> deleteInBatch(batch, cf, key));
            }
            ItemProjector projector = ItemProjector.scan(blocks);
            writeProjection(batch, projector);
            for (Block block : blocks) {
                batch.put(handle(ColumnFamily.BLOCK), ByteUtils.toBytes(block.getIndex()), encodeBlock(block));
            }
            String latestHash = blocks.isEmpty() ? null : blocks.get(blocks.size() - 1).getHash();
            writeChainMeta(batch, blocks.size(), latestHash, projector.getNextTransferId(), nodeId);

            db.write(writeOptions, batch);
            log.info("链已整体替换，区块数：{}，物品数：{}，转移数：{}",
                    blocks.size(), projector.getItems().size(), projector.getTransfers().size());
        } catch (RocksDBException e) {
            log.error("替换链失败，区块数：{}", blocks.size(), e);
            throw new StorageException("替换链失败", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    private void writeProjection(WriteBatch batch, ItemProjector projector) throws RocksDBException {
        for (ItemRecord record : projector.getItems().values()) {
            batch.put(handle(ColumnFamily.ITEM), ByteUtils.utf8(record.getItemId()), SerializeUtils.serialize(record));
        }
        for (TransferRecord transfer : projector.getTransfers()) {
            byte[] id = ByteUtils.toBytes(transfer.getId());
            batch.put(handle(ColumnFamily.TRANSFER), id, SerializeUtils.serialize(transfer));
            batch.put(handle(ColumnFamily.TRANSFER_ITEM_INDEX), itemPrefix(transfer.getItemId(), id), new byte[0]);
            batch.put(handle(ColumnFamily.TRANSFER_BLOCK_INDEX),
                    ByteUtils.merge(ByteUtils.toBytes(transfer.getBlockIndex()), id), new byte[0]);
        }
        for (HistoryEntry entry : projector.getHistory()) {
            batch.put(handle(ColumnFamily.ITEM_HISTORY),
                    historyKey(entry.getItemId(), entry.getBlockIndex(), entry.getPosition()),
                    SerializeUtils.serialize(entry));
        }
    }

    private void removeBlockRows(WriteBatch batch, Block stale) throws RocksDBException {
        List<Transaction> transactions = stale.getPayload() == null
                ? List.of() : stale.getPayload().getTransactions();
        for (int position = 0; position < transactions.size(); position++) {
            batch.delete(handle(ColumnFamily.ITEM_HISTORY),
                    historyKey(transactions.get(position).getItemId(), stale.getIndex(), position));
        }
        byte[] prefix = ByteUtils.toBytes(stale.getIndex());
        try (RocksIterator iterator = db.newIterator(handle(ColumnFamily.TRANSFER_BLOCK_INDEX))) {
            for (iterator.seek(prefix); iterator.isValid() && ByteUtils.startsWith(iterator.key(), prefix); iterator.next()) {
                byte[] indexKey = iterator.key();
                byte[] id = ByteUtils.toBytes(ByteUtils.bytesToLong(indexKey, Long.BYTES));
                TransferRecord transfer = (TransferRecord) SerializeUtils.deSerialize(
                        db.get(handle(ColumnFamily.TRANSFER), id));
                if (transfer != null) {
                    batch.delete(handle(ColumnFamily.TRANSFER_ITEM_INDEX), itemPrefix(transfer.getItemId(), id));
                }
                batch.delete(handle(ColumnFamily.TRANSFER), id);
                batch.delete(handle(ColumnFamily.TRANSFER_BLOCK_INDEX), indexKey);
            }
        }
    }

    private void writeChainMeta(WriteBatch batch, long chainLength, String latestHash,
                                long nextTransferId, String nodeId) throws RocksDBException {
        ColumnFamilyHandle meta = handle(ColumnFamily.BLOCK_CHAIN);
        batch.put(meta, KEY_CHAIN_LENGTH, ByteUtils.toBytes(chainLength));
        if (latestHash != null) {
            batch.put(meta, KEY_LATEST_HASH, ByteUtils.utf8(latestHash));
        } else if (chainLength == 0) {
            batch.delete(meta, KEY_LATEST_HASH);
        }
        batch.put(meta, KEY_TRANSFER_SEQ, ByteUtils.toBytes(nextTransferId));
        NodeInfo nodeInfo = new NodeInfo(nodeId, System.currentTimeMillis(), chainLength);
        batch.put(handle(ColumnFamily.NODE_INFO), KEY_SELF_NODE_INFO, SerializeUtils.serialize(nodeInfo));
    }

    //读取.........................................................................................................

    /**
     * 按序号顺序读取全部区块，空列表表示新节点
     */
    public List<Block> loadChain() {
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(handle(ColumnFamily.BLOCK))) {
            List<Block> blocks = new ArrayList<>();
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                blocks.add(decodeBlock(iterator.value()));
            }
            return blocks;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public Block getBlock(long index) {
        rwLock.readLock().lock();
        try {
            byte[] value = db.get(handle(ColumnFamily.BLOCK), ByteUtils.toBytes(index));
            return value == null ? null : decodeBlock(value);
        } catch (RocksDBException e) {
            log.error("获取区块失败: index={}", index, e);
            throw new StorageException("获取区块失败: " + index, e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public long getChainLength() {
        rwLock.readLock().lock();
        try {
            return readLong(KEY_CHAIN_LENGTH, 0);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public String getLatestHash() {
        rwLock.readLock().lock();
        try {
            byte[] value = db.get(handle(ColumnFamily.BLOCK_CHAIN), KEY_LATEST_HASH);
            return value == null ? null : ByteUtils.fromUtf8(value);
        } catch (RocksDBException e) {
            log.error("获取最新区块hash失败", e);
            throw new StorageException("获取最新区块hash失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public ItemRecord queryItem(String itemId) {
        rwLock.readLock().lock();
        try {
            return readItem(itemId);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * 全部物品，按创建时间倒序
     */
    public List<ItemRecord> queryAllItems() {
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(handle(ColumnFamily.ITEM))) {
            List<ItemRecord> items = new ArrayList<>();
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                items.add((ItemRecord) SerializeUtils.deSerialize(iterator.value()));
            }
            items.sort(ITEM_ORDER);
            return items;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * 物品的全部保管记录，按区块序号、区块内位置排序
     */
    public List<HistoryEntry> queryItemHistory(String itemId) {
        byte[] prefix = ByteUtils.merge(ByteUtils.utf8(itemId), SEPARATOR);
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(handle(ColumnFamily.ITEM_HISTORY))) {
            List<HistoryEntry> history = new ArrayList<>();
            for (iterator.seek(prefix); iterator.isValid() && ByteUtils.startsWith(iterator.key(), prefix); iterator.next()) {
                history.add((HistoryEntry) SerializeUtils.deSerialize(iterator.value()));
            }
            return history;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * 物品的转移日志，最新的在前
     */
    public List<TransferRecord> queryTransfers(String itemId) {
        byte[] prefix = ByteUtils.merge(ByteUtils.utf8(itemId), SEPARATOR);
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(handle(ColumnFamily.TRANSFER_ITEM_INDEX))) {
            List<TransferRecord> transfers = new ArrayList<>();
            for (iterator.seek(prefix); iterator.isValid() && ByteUtils.startsWith(iterator.key(), prefix); iterator.next()) {
                byte[] id = ByteUtils.toBytes(ByteUtils.bytesToLong(iterator.key(), prefix.length));
                byte[] value = db.get(handle(ColumnFamily.TRANSFER), id);
                if (value != null) {
                    transfers.add((TransferRecord) SerializeUtils.deSerialize(value));
                }
            }
            transfers.sort(Comparator
                    .comparing(TransferRecord::getTimestamp, Comparator.nullsLast(Comparator.<String>reverseOrder()))
                    .thenComparing(TransferRecord::getId, Comparator.reverseOrder()));
            return transfers;
        } catch (RocksDBException e) {
            log.error("查询转移日志失败: itemId={}", itemId, e);
            throw new StorageException("查询转移日志失败: " + itemId, e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public List<TransferRecord> queryAllTransfers() {
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(handle(ColumnFamily.TRANSFER))) {
            List<TransferRecord> transfers = new ArrayList<>();
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                transfers.add((TransferRecord) SerializeUtils.deSerialize(iterator.value()));
            }
            return transfers;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public NodeInfo getNodeInfo() {
        rwLock.readLock().lock();
        try {
            return (NodeInfo) SerializeUtils.deSerialize(db.get(handle(ColumnFamily.NODE_INFO), KEY_SELF_NODE_INFO));
        } catch (RocksDBException e) {
            log.error("获取节点信息失败", e);
            throw new StorageException("获取节点信息失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public StorageStats getStats() {
        rwLock.readLock().lock();
        try {
            StorageStats stats = new StorageStats();
            stats.setBlocks(countKeys(ColumnFamily.BLOCK));
            stats.setItems(countKeys(ColumnFamily.ITEM));
            stats.setTransfers(countKeys(ColumnFamily.TRANSFER));
            stats.setStoragePath(dbPath);
            stats.setSizeMb(Math.round(directorySize() / (1024.0 * 1024.0) * 100) / 100.0);
            return stats;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * 在线备份：用 RocksDB Checkpoint 把当前数据库快照到目标目录，目标目录必须不存在。
     * 备份目录本身就是一个完整的数据库，可直接用 {@link #StorageService(String)} 打开。
     *
     * @param targetPath 备份目录
     * @return 备份目录的绝对路径
     */
    public String backup(@NotNull String targetPath) {
        Path target = Paths.get(targetPath).toAbsolutePath();
        if (Files.exists(target)) {
            throw new StorageException("备份目录已存在: " + target);
        }
        rwLock.readLock().lock();
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Checkpoint checkpoint = Checkpoint.create(db)) {
                checkpoint.createCheckpoint(target.toString());
            }
            log.info("数据库已备份到: {}", target);
            return target.toString();
        } catch (RocksDBException | IOException e) {
            log.error("备份数据库失败: target={}", target, e);
            throw new StorageException("备份数据库失败: " + target, e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    //节点列表.......................................................................................................

    public void savePeer(String url) {
        try {
            db.put(handle(ColumnFamily.PEER), ByteUtils.utf8(url), ByteUtils.toBytes(System.currentTimeMillis()));
        } catch (RocksDBException e) {
            log.error("保存节点失败: url={}", url, e);
            throw new StorageException("保存节点失败: " + url, e);
        }
    }

    public void deletePeer(String url) {
        try {
            db.delete(handle(ColumnFamily.PEER), ByteUtils.utf8(url));
        } catch (RocksDBException e) {
            log.error("删除节点失败: url={}", url, e);
            throw new StorageException("删除节点失败: " + url, e);
        }
    }

    /**
     * 已持久化的节点，按加入时间排序
     */
    public List<String> loadPeers() {
        Map<String, Long> peers = new LinkedHashMap<>();
        try (RocksIterator iterator = db.newIterator(handle(ColumnFamily.PEER))) {
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                peers.put(ByteUtils.fromUtf8(iterator.key()), ByteUtils.bytesToLong(iterator.value()));
            }
        }
        List<String> urls = new ArrayList<>(peers.keySet());
        urls.sort(Comparator.comparing(peers::get));
        return urls;
    }

    //..................................................................................................................

    private ItemRecord readItem(String itemId) {
        try {
            return (ItemRecord) SerializeUtils.deSerialize(db.get(handle(ColumnFamily.ITEM), ByteUtils.utf8(itemId)));
        } catch (RocksDBException e) {
            log.error("获取物品失败: itemId={}", itemId, e);
            throw new StorageException("获取物品失败: " + itemId, e);
        }
    }

    private long readLong(byte[] key, long defaultValue) {
        try {
            byte[] value = db.get(handle(ColumnFamily.BLOCK_CHAIN), key);
            return value == null ? defaultValue : ByteUtils.bytesToLong(value);
        } catch (RocksDBException e) {
            log.error("读取链元数据失败: key={}", ByteUtils.fromUtf8(key), e);
            throw new StorageException("读取链元数据失败", e);
        }
    }

    private long countKeys(ColumnFamily cf) {
        long[] count = {0};
        forEachKey(cf, key -> count[0]++);
        return count[0];
    }

    private void forEachKey(ColumnFamily cf, Consumer<byte[]> consumer) {
        try (RocksIterator iterator = db.newIterator(handle(cf))) {
            for (iterator.seekToFirst(); iterator.isValid(); iterator.next()) {
                consumer.accept(iterator.key());
            }
        }
    }

    private void deleteInBatch(WriteBatch batch, ColumnFamily cf, byte[] key) {
        try {
            batch.delete(handle(cf), key);
        } catch (RocksDBException e) {
            throw new StorageException("清理列族失败: " + cf.logicalName, e);
        }
    }

    private long directorySize() {
        Path root = Paths.get(dbPath);
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile).mapToLong(path -> path.toFile().length()).sum();
        } catch (IOException e) {
            log.warn("统计数据库目录大小失败: {}", dbPath, e);
            return 0;
        }
    }

    private static byte[] itemPrefix(String itemId, byte[] suffix) {
        return ByteUtils.merge(ByteUtils.utf8(itemId), SEPARATOR, suffix);
    }

    private static byte[] historyKey(String itemId, long blockIndex, int position) {
        return itemPrefix(itemId, ByteUtils.merge(ByteUtils.toBytes(blockIndex), ByteUtils.toBytes(position)));
    }

    private static byte[] encodeBlock(Block block) {
        return ByteUtils.utf8(GsonFactory.getGson().toJson(block));
    }

    private static Block decodeBlock(byte[] bytes) {
        return GsonFactory.getGson().fromJson(ByteUtils.fromUtf8(bytes), Block.class);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("关闭数据库资源: {}", dbPath);
        rwLock.writeLock().lock();
        try {
            for (ColumnFamilyHandle handle : openedHandles) {
                handle.close();
            }
            db.close();
            dbOptions.close();
        } finally {
            rwLock.writeLock().unlock();
        }
    }
}
