package com.chain.chainledgersystem.storage;

import com.chain.chainledgersystem.data.block.Block;
import com.chain.chainledgersystem.data.block.GenesisPayload;
import com.chain.chainledgersystem.data.block.TransactionBatch;
import com.chain.chainledgersystem.data.item.HistoryEntry;
import com.chain.chainledgersystem.data.item.ItemRecord;
import com.chain.chainledgersystem.data.item.TransferRecord;
import com.chain.chainledgersystem.data.transaction.CreationTransaction;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.chain.chainledgersystem.data.transaction.TransferTransaction;
import com.chain.chainledgersystem.exception.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class StorageServiceTest {

    @TempDir
    Path tempDir;

    private StorageService storage;

    @BeforeEach
    void open() {
        storage = new StorageService(tempDir.resolve("db").toString());
    }

    @AfterEach
    void close() {
        storage.close();
    }

    private static CreationTransaction creation(String itemId, String actor, String timestamp) {
        CreationTransaction tx = new CreationTransaction();
        tx.setItemId(itemId);
        tx.setDescription("knife");
        tx.setActor(actor);
        tx.setLocation("scene");
        tx.setItemType("Physical");
        tx.setTimestamp(timestamp);
        tx.setNodeId("node_a");
        return tx;
    }

    private static TransferTransaction transfer(String itemId, String from, String to, String timestamp) {
        TransferTransaction tx = new TransferTransaction();
        tx.setItemId(itemId);
        tx.setFromActor(from);
        tx.setToActor(to);
        tx.setReason("lab");
        tx.setTimestamp(timestamp);
        tx.setNodeId("node_a");
        return tx;
    }

    private static List<Block> chainOf(Transaction... txs) {
        List<Block> chain = new ArrayList<>();
        chain.add(Block.seal(0, 1.0, GenesisPayload.of("node_a"), "0"));
        for (Transaction tx : txs) {
            Block previous = chain.get(chain.size() - 1);
            chain.add(Block.seal(previous.getIndex() + 1, previous.getTimestamp() + 1,
                    new TransactionBatch(Collections.singletonList(tx)), previous.getHash()));
        }
        return chain;
    }

    @Test
    void appendedBlocksAreLoadedInOrder() {
        List<Block> chain = chainOf(creation("EV-1", "A", "2024-01-01T10:00"), transfer("EV-1", "A", "B", "2024-01-01T11:00"));
        for (Block block : chain) {
            storage.appendBlock(block, "node_a");
        }

        List<Block> loaded = storage.loadChain();
        Assertions.assertEquals(3, loaded.size());
        for (int i = 0; i < chain.size(); i++) {
            Assertions.assertEquals(chain.get(i).getHash(), loaded.get(i).getHash());
            Assertions.assertEquals(loaded.get(i).getHash(), loaded.get(i).computeHash());
        }
        Assertions.assertEquals(3, storage.getChainLength());
        Assertions.assertEquals(chain.get(2).getHash(), storage.getLatestHash());
        Assertions.assertEquals(3, storage.getNodeInfo().getChainLength());
        Assertions.assertEquals("node_a", storage.getNodeInfo().getNodeId());
        Assertions.assertEquals("B", storage.queryItem("EV-1").getCurrentCustodian());
    }

    @Test
    void reappendingABlockDoesNotDuplicateRows() {
        List<Block> chain = chainOf(creation("EV-1", "A", "2024-01-01T10:00"), transfer("EV-1", "A", "B", "2024-01-01T11:00"));
        for (Block block : chain) {
            storage.appendBlock(block, "node_a");
        }
        storage.appendBlock(chain.get(2), "node_a");

        Assertions.assertEquals(3, storage.loadChain().size());
        Assertions.assertEquals(1, storage.queryTransfers("EV-1").size());
        Assertions.assertEquals(1, storage.queryAllTransfers().size());
        Assertions.assertEquals(2, storage.queryItemHistory("EV-1").size());
    }

    @Test
    void historyIsOrderedByBlockAndScopedToTheItem() {
        List<Block> chain = chainOf(
                creation("EV-1", "A", "2024-01-01T10:00"),
                creation("EV-10", "X", "2024-01-01T10:30"),
                transfer("EV-1", "A", "B", "2024-01-01T11:00"));
        for (Block block : chain) {
            storage.appendBlock(block, "node_a");
        }

        List<HistoryEntry> history = storage.queryItemHistory("EV-1");
        Assertions.assertEquals(2, history.size());
        Assertions.assertEquals(1, history.get(0).getBlockIndex());
        Assertions.assertEquals("Created", history.get(0).getAction());
        Assertions.assertEquals("A", history.get(0).getCustodian());
        Assertions.assertEquals(3, history.get(1).getBlockIndex());
        Assertions.assertEquals("B", history.get(1).getCustodian());
        Assertions.assertTrue(history.get(1).getDetails() instanceof TransferTransaction);
    }

    @Test
    void itemsAreNewestFirstAndTransfersNewestFirst() {
        List<Block> chain = chainOf(
                creation("EV-1", "A", "2024-01-01T10:00"),
                creation("EV-2", "A", "2024-01-02T10:00"),
                transfer("EV-1", "A", "B", "2024-01-03T10:00"),
                transfer("EV-1", "B", "C", "2024-01-04T10:00"));
        for (Block block : chain) {
            storage.appendBlock(block, "node_a");
        }

        List<ItemRecord> items = storage.queryAllItems();
        Assertions.assertEquals(Arrays.asList("EV-2", "EV-1"), Arrays.asList(items.get(0).getItemId(), items.get(1).getItemId()));

        List<TransferRecord> transfers = storage.queryTransfers("EV-1");
        Assertions.assertEquals(2, transfers.size());
        Assertions.assertEquals("C", transfers.get(0).getToActor());
        Assertions.assertEquals("B", transfers.get(1).getToActor());
    }

    @Test
    void replaceAllRebuildsEverythingFromTheNewChain() {
        for (Block block : chainOf(creation("OLD-1", "A", "2024-01-01T10:00"), transfer("OLD-1", "A", "B", "2024-01-01T11:00"))) {
            storage.appendBlock(block, "node_a");
        }
        List<Block> replacement = chainOf(
                creation("NEW-1", "X", "2024-02-01T10:00"),
                creation("NEW-2", "Y", "2024-02-01T11:00"),
                transfer("NEW-1", "X", "Z", "2024-02-01T12:00"),
                transfer("MISSING", "Q", "R", "2024-02-01T13:00"));

        storage.replaceAll(replacement, "node_a");

        Assertions.assertEquals(5, storage.loadChain().size());
        Assertions.assertEquals(5, storage.getChainLength());
        Assertions.assertNull(storage.queryItem("OLD-1"));
        Assertions.assertTrue(storage.queryTransfers("OLD-1").isEmpty());
        Assertions.assertTrue(storage.queryItemHistory("OLD-1").isEmpty());
        Assertions.assertEquals("Z", storage.queryItem("NEW-1").getCurrentCustodian());
        Assertions.assertNull(storage.queryItem("MISSING"));
        Assertions.assertEquals(1, storage.queryTransfers("MISSING").size());
        Assertions.assertEquals(2, storage.queryAllTransfers().size());

        StorageStats stats = storage.getStats();
        Assertions.assertEquals(5, stats.getBlocks());
        Assertions.assertEquals(2, stats.getItems());
        Assertions.assertEquals(2, stats.getTransfers());
        Assertions.assertEquals(storage.getDbPath(), stats.getStoragePath());
    }

    @Test
    void transferIdsContinueAfterReplace() {
        storage.replaceAll(chainOf(creation("EV-1", "A", "t1"), transfer("EV-1", "A", "B", "t2")), "node_a");
        List<Block> chain = storage.loadChain();
        Block last = chain.get(chain.size() - 1);
        storage.appendBlock(Block.seal(last.getIndex() + 1, 9.0,
                new TransactionBatch(Collections.singletonList(transfer("EV-1", "B", "C", "t3"))), last.getHash()), "node_a");

        List<TransferRecord> transfers = storage.queryTransfers("EV-1");
        Assertions.assertEquals(2, transfers.size());
        Assertions.assertEquals(2, transfers.get(0).getId());
        Assertions.assertEquals(1, transfers.get(1).getId());
    }

    @Test
    void dataSurvivesReopen() {
        for (Block block : chainOf(creation("EV-1", "A", "2024-01-01T10:00"))) {
            storage.appendBlock(block, "node_a");
        }
        storage.savePeer("http://b:5001");
        storage.savePeer("http://c:5002");
        storage.deletePeer("http://c:5002");
        storage.close();

        storage = new StorageService(tempDir.resolve("db").toString());
        Assertions.assertEquals(2, storage.loadChain().size());
        Assertions.assertEquals("A", storage.queryItem("EV-1").getCurrentCustodian());
        Assertions.assertEquals(Collections.singletonList("http://b:5001"), storage.loadPeers());
    }

    @Test
    void backupIsAnOpenableCopy() {
        List<Block> chain = chainOf(creation("EV-1", "A", "2024-01-01T10:00"), transfer("EV-1", "A", "B", "2024-01-01T11:00"));
        for (Block block : chain) {
            storage.appendBlock(block, "node_a");
        }
        Path target = tempDir.resolve("backups").resolve("chainledger_backup_node_a");

        String backupPath = storage.backup(target.toString());
        storage.appendBlock(Block.seal(3, 4.0, new TransactionBatch(Collections.singletonList(
                creation("EV-2", "C", "2024-01-02T10:00"))), chain.get(2).getHash()), "node_a");

        Assertions.assertEquals(target.toAbsolutePath().toString(), backupPath);
        try (StorageService copy = new StorageService(backupPath)) {
            Assertions.assertEquals(3, copy.loadChain().size());
            Assertions.assertEquals(chain.get(2).getHash(), copy.getLatestHash());
            Assertions.assertEquals("B", copy.queryItem("EV-1").getCurrentCustodian());
            Assertions.assertNull(copy.queryItem("EV-2"));
        }
        Assertions.assertEquals(4, storage.loadChain().size());
    }

    @Test
    void backupRefusesExistingTarget() {
        String target = tempDir.resolve("backup_once").toString();
        storage.backup(target);

        Assertions.assertThrows(StorageException.class, () -> storage.backup(target));
    }
}
