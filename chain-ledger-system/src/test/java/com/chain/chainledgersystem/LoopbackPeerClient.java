package com.chain.chainledgersystem;

import com.chain.chainledgersystem.data.block.Block;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.chain.chainledgersystem.data.vo.ChainVO;
import com.chain.chainledgersystem.data.vo.PingVO;
import com.chain.chainledgersystem.exception.PeerUnreachableException;
import com.chain.chainledgersystem.network.client.PeerClient;
import com.chain.chainledgersystem.network.common.PeerTable;
import com.chain.chainledgersystem.serialization.gson.GsonFactory;
import com.chain.chainledgersystem.service.blockChain.BlockChainService;
import com.google.gson.Gson;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内的节点网络：地址映射到本地账本，数据经过一次JSON往返以模拟线上传输
 */
public class LoopbackPeerClient implements PeerClient {

    private final Gson gson = GsonFactory.getGson();
    private final Map<String, BlockChainService> ledgers = new ConcurrentHashMap<>();
    private final Map<String, PeerTable> peerTables = new ConcurrentHashMap<>();
    private final Map<String, List<Block>> fixedChains = new ConcurrentHashMap<>();

    public void register(String url, BlockChainService ledger) {
        ledgers.put(url, ledger);
    }

    public void register(String url, BlockChainService ledger, PeerTable peerTable) {
        ledgers.put(url, ledger);
        peerTables.put(url, peerTable);
    }

    /**
     * 该地址只应答 /chain，原样返回给定的区块（可含空元素）
     */
    public void serve(String url, List<Block> chain) {
        fixedChains.put(url, chain);
    }

    public void unplug(String url) {
        ledgers.remove(url);
    }

    @Override
    public PingVO ping(String peerUrl) throws PeerUnreachableException {
        return new PingVO("online", target(peerUrl).getNodeId());
    }

    @Override
    public ChainVO fetchChain(String peerUrl) throws PeerUnreachableException {
        List<Block> chain = fixedChains.containsKey(peerUrl) ? fixedChains.get(peerUrl) : target(peerUrl).getChain();
        String json = gson.toJson(new ChainVO(chain.size(), chain));
        return gson.fromJson(json, ChainVO.class);
    }

    @Override
    public void sendTransaction(String peerUrl, Transaction transaction) throws PeerUnreachableException {
        BlockChainService ledger = target(peerUrl);
        ledger.receiveTransaction(gson.fromJson(gson.toJson(transaction, Transaction.class), Transaction.class));
    }

    @Override
    public void registerPeer(String peerUrl, String selfUrl) throws PeerUnreachableException {
        target(peerUrl);
        PeerTable peerTable = peerTables.get(peerUrl);
        if (peerTable != null) {
            peerTable.add(selfUrl);
        }
    }

    private BlockChainService target(String peerUrl) throws PeerUnreachableException {
        BlockChainService ledger = ledgers.get(peerUrl);
        if (ledger == null) {
            throw new PeerUnreachableException(peerUrl, "Connection refused");
        }
        return ledger;
    }
}
