package com.chain.chainledgersystem.network.service;

import com.chain.chainledgersystem.config.SystemConfig;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.chain.chainledgersystem.exception.PeerUnreachableException;
import com.chain.chainledgersystem.network.client.PeerClient;
import com.chain.chainledgersystem.network.common.PeerTable;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 把本节点产生的交易异步推送给所有已知节点。失败只记录日志，不重试。
 */
@Slf4j
@Component
public class TransactionBroadcaster {

    private final PeerTable peerTable;
    private final PeerClient peerClient;
    private final ExecutorService broadcastExecutor;

    @Autowired
    public TransactionBroadcaster(PeerTable peerTable, PeerClient peerClient, SystemConfig systemConfig) {
        this.peerTable = peerTable;
        this.peerClient = peerClient;
        int threads = Math.max(1, systemConfig.getPeer().getBroadcastThreads());
        this.broadcastExecutor = new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(1000), // 限制任务队列大小
                new ThreadFactoryBuilder().setNameFormat("tx-broadcast-%d").setDaemon(true).build()
        );
    }

    /**
     * 提交广播任务后立即返回。返回值在所有推送结束（成功或失败）后完成，调用方通常忽略它。
     */
    public CompletableFuture<Void> broadcast(@NotNull Transaction transaction) {
        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        for (String peer : peerTable.list()) {
            try {
                tasks.add(CompletableFuture.runAsync(() -> send(peer, transaction), broadcastExecutor));
            } catch (RejectedExecutionException e) {
                log.warn("广播队列已满，放弃向节点{}推送交易 item_id={}", peer, transaction.getItemId());
            }
        }
        return CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]));
    }

    private void send(String peer, Transaction transaction) {
        try {
            peerClient.sendTransaction(peer, transaction);
            log.info("交易已广播到节点{}：item_id={}", peer, transaction.getItemId());
        } catch (PeerUnreachableException e) {
            log.warn("向节点{}广播交易失败：{}", e.getPeerUrl(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        broadcastExecutor.shutdownNow();
    }
}
