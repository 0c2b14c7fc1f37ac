package com.chain.chainledgersystem.service.sync;

import com.chain.chainledgersystem.config.SystemConfig;
import com.chain.chainledgersystem.constant.BlockChainConstants;
import com.chain.chainledgersystem.data.vo.SyncResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 定时与已知节点对账，采用更长的链
 */
@Slf4j
@Component
public class AutoSyncTrigger {

    private final SyncBlockChainService syncBlockChainService;
    private final boolean enabled;
    private final long intervalSeconds;

    private ScheduledExecutorService scheduler;
    private final AtomicBoolean isSyncing = new AtomicBoolean(false); // 同步任务状态标记，防止并发执行

    @Autowired
    public AutoSyncTrigger(SyncBlockChainService syncBlockChainService, SystemConfig systemConfig) {
        this.syncBlockChainService = syncBlockChainService;
        SystemConfig.Sync sync = systemConfig.getSync();
        this.enabled = sync.isEnabled();
        if (sync.getIntervalSeconds() <= 0) {
            log.warn("同步间隔{}秒无效，改用默认值{}秒", sync.getIntervalSeconds(), BlockChainConstants.SYNC_INTERVAL_SECONDS);
            this.intervalSeconds = BlockChainConstants.SYNC_INTERVAL_SECONDS;
        } else {
            this.intervalSeconds = sync.getIntervalSeconds();
        }
    }

    @PostConstruct
    public void init() {
        if (!enabled) {
            log.info("自动同步已关闭");
            return;
        }
        log.info("自动同步触发器初始化，间隔{}秒", intervalSeconds);
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "chain-sync-scheduler");
            thread.setDaemon(true); // 守护线程，随应用退出
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::autoSync, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    /**
     * 上一轮未结束时跳过本轮，返回本轮是否执行了对账
     */
    boolean autoSync() {
        if (!isSyncing.compareAndSet(false, true)) {
            log.debug("上一轮同步尚未结束，跳过");
            return false;
        }
        try {
            SyncResult result = syncBlockChainService.reconcile();
            if (result.isSynced()) {
                log.info("自动同步完成：从{}同步，新长度{}", result.getSyncedFrom(), result.getNewLength());
            }
        } catch (RuntimeException e) {
            // 异常会终止后续调度
            log.error("自动同步失败", e);
        } finally {
            isSyncing.set(false);
        }
        return true;
    }

    long getIntervalSeconds() {
        return intervalSeconds;
    }

    boolean isScheduled() {
        return scheduler != null && !scheduler.isShutdown();
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }
}
