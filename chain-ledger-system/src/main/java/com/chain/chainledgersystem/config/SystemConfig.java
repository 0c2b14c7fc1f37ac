package com.chain.chainledgersystem.config;

import com.chain.chainledgersystem.constant.BlockChainConstants;
import com.chain.chainledgersystem.service.sync.ChainAdoptionPolicy;
import com.google.common.base.Strings;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "system")
public class SystemConfig {

    //本节点ID
    private String nodeId = "node_a";

    private String storagePath = "./data";

    //对外地址主机名，用于向其他节点注册自己
    private String host = "127.0.0.1";

    //对外地址，为空时由 host 与端口拼接
    private String advertisedUrl;

    //启动时注册的节点列表（从配置文件读取）
    private List<String> peers = new ArrayList<>();

    private Peer peer = new Peer();

    private Sync sync = new Sync();

    @Value("${server.port:5000}")
    private int serverPort;

    @Data
    public static class Peer {
        //单次远程调用超时 毫秒
        private int timeoutMs = BlockChainConstants.RPC_TIMEOUT;
        //广播线程数
        private int broadcastThreads = 4;
    }

    @Data
    public static class Sync {
        private boolean enabled = true;
        private long intervalSeconds = BlockChainConstants.SYNC_INTERVAL_SECONDS;
        private ChainAdoptionPolicy adoptionPolicy = ChainAdoptionPolicy.TRUST_LONGEST;
    }

    /**
     * 本节点数据库目录
     */
    public String getDbPath() {
        return storagePath + File.separator + BlockChainConstants.DB_NAME_PREFIX + nodeId;
    }

    public String getSelfUrl() {
        if (!Strings.isNullOrEmpty(advertisedUrl)) {
            return advertisedUrl;
        }
        return "http://" + host + ":" + serverPort;
    }

    @PostConstruct
    public void init() {
        log.info("节点ID:{}", nodeId);
        log.info("存储路径:{}", getDbPath());
        log.info("对外地址:{}", getSelfUrl());
        log.info("初始节点:{}", peers);
        log.info("自动同步:{} 间隔{}秒 策略{}", sync.isEnabled(), sync.getIntervalSeconds(), sync.getAdoptionPolicy());
    }
}
