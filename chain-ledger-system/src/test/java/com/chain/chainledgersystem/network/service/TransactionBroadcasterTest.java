package com.chain.chainledgersystem.network.service;

import com.chain.chainledgersystem.LedgerFixtures;
import com.chain.chainledgersystem.LoopbackPeerClient;
import com.chain.chainledgersystem.config.SystemConfig;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.chain.chainledgersystem.network.common.PeerTable;
import com.chain.chainledgersystem.service.blockChain.BlockChainServiceImpl;
import com.chain.chainledgersystem.storage.StorageService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static com.chain.chainledgersystem.LedgerFixtures.creation;

public class TransactionBroadcasterTest {

    @TempDir
    Path tempDir;

    private LedgerFixtures fixtures;
    private TransactionBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(tempDir);
    }

    @AfterEach
    void tearDown() {
        if (broadcaster != null) {
            broadcaster.shutdown();
        }
        fixtures.close();
    }

    @Test
    void reachablePeersReceiveTransactionDespiteFailingOne() throws Exception {
        LoopbackPeerClient network = new LoopbackPeerClient();
        SystemConfig config = fixtures.config("a");
        StorageService storage = fixtures.storage(config);
        BlockChainServiceImpl origin = fixtures.ledger(storage, config);
        PeerTable peers = fixtures.peerTable(storage, config);

        BlockChainServiceImpl b = fixtures.ledger("b");
        BlockChainServiceImpl c = fixtures.ledger("c");
        network.register("http://b.local", b);
        network.register("http://c.local", c);
        peers.add("http://down.local");
        peers.add("http://b.local");
        peers.add("http://c.local");
        broadcaster = new TransactionBroadcaster(peers, network, config);

        Transaction tx = origin.createItem(creation("EV-1", "A")).getTransaction();
        broadcaster.broadcast(tx).get(5, TimeUnit.SECONDS);

        for (BlockChainServiceImpl receiver : new BlockChainServiceImpl[]{b, c}) {
            Assertions.assertEquals(2, receiver.getChainLength());
            Assertions.assertEquals("A", receiver.getItem("EV-1").getCurrentCustodian());
            Assertions.assertEquals("a", receiver.getLatestBlock().getPayload().getTransactions().get(0).getNodeId());
        }
        // 接收方各自封装区块，hash与源节点不同
        Assertions.assertNotEquals(origin.getLatestBlock().getHash(), b.getLatestBlock().getHash());
    }

    @Test
    void noPeersCompletesImmediately() throws Exception {
        SystemConfig config = fixtures.config("a");
        StorageService storage = fixtures.storage(config);
        BlockChainServiceImpl origin = fixtures.ledger(storage, config);
        PeerTable peers = fixtures.peerTable(storage, config);
        broadcaster = new TransactionBroadcaster(peers, new LoopbackPeerClient(), config);

        Transaction tx = origin.createItem(creation("EV-1", "A")).getTransaction();

        Assertions.assertTrue(broadcaster.broadcast(tx).isDone());
    }
}
