package com.chain.chainledgersystem.network.common;

import com.chain.chainledgersystem.config.SystemConfig;
import com.chain.chainledgersystem.storage.StorageService;
import com.google.common.base.Strings;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 已知节点列表，读多写少。新增与删除同步写入存储，重启后恢复。
 */
@Slf4j
@Component
public class PeerTable {

    private final CopyOnWriteArrayList<String> peers = new CopyOnWriteArrayList<>();
    private final StorageService storageService;
    private final SystemConfig systemConfig;

    @Autowired
    public PeerTable(StorageService storageService, SystemConfig systemConfig) {
        this.storageService = storageService;
        this.systemConfig = systemConfig;
    }

    @PostConstruct
    public void init() {
        for (String url : storageService.loadPeers()) {
            if (!isSelf(url)) {
                peers.addIfAbsent(url);
            }
        }
        log.info("从存储恢复节点：{}", peers);
        for (String url : systemConfig.getPeers()) {
            add(url);
        }
    }

    /**
     * 去除首尾空白与末尾的 /
     */
    public static String normalize(String url) {
        if (url == null) {
            return null;
        }
        String normalized = url.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    /**
     * 加入节点，返回是否为新节点。本节点自身地址不会加入。
     */
    public synchronized boolean add(String url) {
        String normalized = normalize(url);
        if (Strings.isNullOrEmpty(normalized)) {
            throw new IllegalArgumentException("节点地址不能为空");
        }
        if (isSelf(normalized)) {
            log.debug("忽略本节点地址：{}", normalized);
            return false;
        }
        if (!peers.addIfAbsent(normalized)) {
            return false;
        }
        storageService.savePeer(normalized);
        log.info("新增节点：{}", normalized);
        return true;
    }

    public synchronized boolean remove(String url) {
        String normalized = normalize(url);
        if (!peers.remove(normalized)) {
            return false;
        }
        storageService.deletePeer(normalized);
        log.info("移除节点：{}", normalized);
        return true;
    }

    public boolean contains(String url) {
        return peers.contains(normalize(url));
    }

    public List<String> list() {
        return new ArrayList<>(peers);
    }

    public int size() {
        return peers.size();
    }

    /**
     * 是否为本节点自身的对外地址
     */
    public boolean isSelf(String url) {
        return normalize(systemConfig.getSelfUrl()).equals(normalize(url));
    }
}
