package com.chain.chainledgersystem.service.sync;

import com.chain.chainledgersystem.config.SystemConfig;
import com.chain.chainledgersystem.data.block.Block;
import com.chain.chainledgersystem.data.vo.ChainVO;
import com.chain.chainledgersystem.data.vo.SyncResult;
import com.chain.chainledgersystem.exception.PeerUnreachableException;
import com.chain.chainledgersystem.network.client.PeerClient;
import com.chain.chainledgersystem.network.common.PeerTable;
import com.chain.chainledgersystem.service.blockChain.BlockChainService;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Service
public class SyncBlockChainServiceImpl implements SyncBlockChainService {

    private final BlockChainService blockChainService;
    private final PeerTable peerTable;
    private final PeerClient peerClient;
    private final ChainAdoptionPolicy adoptionPolicy;
    private final ExecutorService fetchExecutor;

    @Autowired
    public SyncBlockChainServiceImpl(BlockChainService blockChainService, PeerTable peerTable,
                                     PeerClient peerClient, SystemConfig systemConfig) {
        this.blockChainService = blockChainService;
        this.peerTable = peerTable;
        this.peerClient = peerClient;
        this.adoptionPolicy = systemConfig.getSync().getAdoptionPolicy();
        this.fetchExecutor = Executors.newFixedThreadPool(
                Math.max(1, systemConfig.getPeer().getBroadcastThreads()),
                new ThreadFactoryBuilder().setNameFormat("chain-fetch-%d").setDaemon(true).build());
    }

    @Override
    public SyncResult reconcile() {
        List<String> peers = peerTable.list();
        if (peers.isEmpty()) {
            log.debug("没有已知节点，跳过同步");
            return SyncResult.upToDate();
        }

        // 并发拉取各节点的链
        Map<String, CompletableFuture<List<Block>>> fetches = new LinkedHashMap<>();
        for (String peer : peers) {
            fetches.put(peer, CompletableFuture.supplyAsync(() -> fetchChain(peer), fetchExecutor));
        }

        int localLength = blockChainService.getChainLength();
        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<List<Block>>> entry : fetches.entrySet()) {
            List<Block> chain = entry.getValue().join();
            if (chain != null && chain.size() > localLength) {
                candidates.add(new Candidate(entry.getKey(), chain));
            }
        }
        // 最长的优先，等长时保持节点顺序
        candidates.sort(Comparator.comparingInt((Candidate c) -> c.chain.size()).reversed());

        for (Candidate candidate : candidates) {
            if (!adoptionPolicy.accept(candidate.chain)) {
                log.warn("节点{}的链（长度{}）未通过{}策略，跳过", candidate.peer, candidate.chain.size(), adoptionPolicy);
                continue;
            }
            boolean replaced;
            try {
                replaced = blockChainService.replaceChainIfLonger(candidate.chain);
            } catch (RuntimeException e) {
                // 写入批次已丢弃，本地链不变
                log.warn("节点{}的链无法写入，跳过：{}", candidate.peer, e.toString());
                continue;
            }
            if (replaced) {
                log.info("已从节点{}同步链，新长度：{}", candidate.peer, candidate.chain.size());
                return SyncResult.synced(candidate.chain.size(), candidate.peer);
            }
            // 本地链在此期间已增长，更短的候选不必再试
            break;
        }
        return SyncResult.upToDate();
    }

    private List<Block> fetchChain(String peer) {
        try {
            ChainVO chainVO = peerClient.fetchChain(peer);
            if (chainVO.getLength() != chainVO.getChain().size()) {
                log.debug("节点{}声明长度{}与实际区块数{}不一致", peer, chainVO.getLength(), chainVO.getChain().size());
            }
            if (chainVO.getChain().contains(null)) {
                log.warn("节点{}返回的链包含空区块，丢弃", peer);
                return null;
            }
            return chainVO.getChain();
        } catch (PeerUnreachableException e) {
            log.warn("从节点{}拉取链失败：{}", e.getPeerUrl(), e.getMessage());
            return null;
        }
    }

    @PreDestroy
    public void shutdown() {
        fetchExecutor.shutdownNow();
    }

    private static class Candidate {
        private final String peer;
        private final List<Block> chain;

        Candidate(String peer, List<Block> chain) {
            this.peer = peer;
            this.chain = chain;
        }
    }
}
