package com.chain.chainledgersystem.network.service;

import com.chain.chainledgersystem.config.SystemConfig;
import com.chain.chainledgersystem.data.vo.ConnectResult;
import com.chain.chainledgersystem.data.vo.NodeInfoVO;
import com.chain.chainledgersystem.data.vo.PeersVO;
import com.chain.chainledgersystem.data.vo.PingVO;
import com.chain.chainledgersystem.exception.PeerUnreachableException;
import com.chain.chainledgersystem.network.client.PeerClient;
import com.chain.chainledgersystem.network.common.PeerTable;
import com.chain.chainledgersystem.service.blockChain.BlockChainService;
import com.google.common.base.Strings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class NodeService {

    private final PeerTable peerTable;
    private final PeerClient peerClient;
    private final BlockChainService blockChainService;
    private final SystemConfig systemConfig;

    @Autowired
    public NodeService(PeerTable peerTable, PeerClient peerClient,
                       BlockChainService blockChainService, SystemConfig systemConfig) {
        this.peerTable = peerTable;
        this.peerClient = peerClient;
        this.blockChainService = blockChainService;
        this.systemConfig = systemConfig;
    }

    public PingVO ping() {
        return new PingVO("online", blockChainService.getNodeId());
    }

    public NodeInfoVO info() {
        return new NodeInfoVO(blockChainService.getNodeId(), blockChainService.getChainLength(), peerTable.list());
    }

    /**
     * 获取节点列表
     */
    public PeersVO list() {
        List<String> peers = peerTable.list();
        return new PeersVO(peers, peers.size());
    }

    public List<String> addPeer(String url) {
        peerTable.add(url);
        return peerTable.list();
    }

    public List<String> removePeer(String url) {
        peerTable.remove(url);
        return peerTable.list();
    }

    /**
     * 探测对方存活后加入节点列表，并请求对方登记本节点。登记失败不影响连接结果。
     */
    public ConnectResult connect(String url) {
        String peerUrl = PeerTable.normalize(url);
        if (Strings.isNullOrEmpty(peerUrl)) {
            throw new IllegalArgumentException("节点地址不能为空");
        }
        if (peerTable.isSelf(peerUrl)) {
            log.warn("拒绝连接本节点自身地址：{}", peerUrl);
            return new ConnectResult(false, "Cannot connect to self: " + peerUrl, peerTable.list());
        }
        if (peerTable.contains(peerUrl)) {
            log.info("已连接节点：{}", peerUrl);
            return new ConnectResult(true, "Already connected to " + peerUrl, peerTable.list());
        }
        try {
            peerClient.ping(peerUrl);
        } catch (PeerUnreachableException e) {
            log.error("连接节点{}失败：{}", peerUrl, e.getMessage());
            return new ConnectResult(false, "Failed to connect to " + peerUrl, peerTable.list());
        }
        if (!peerTable.add(peerUrl)) {
            // 探测期间已被其他请求加入
            return new ConnectResult(true, "Already connected to " + peerUrl, peerTable.list());
        }
        try {
            peerClient.registerPeer(peerUrl, systemConfig.getSelfUrl());
        } catch (PeerUnreachableException e) {
            log.warn("节点{}未能登记本节点：{}", peerUrl, e.getMessage());
        }
        log.info("已连接节点：{}", peerUrl);
        return new ConnectResult(true, "Connected to " + peerUrl, peerTable.list());
    }
}
