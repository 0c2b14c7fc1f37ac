package com.chain.chainledgersystem.application.controller;

import com.chain.chainledgersystem.data.dto.PeerRequest;
import com.chain.chainledgersystem.data.vo.ConnectResult;
import com.chain.chainledgersystem.data.vo.NodeInfoVO;
import com.chain.chainledgersystem.data.vo.PeersVO;
import com.chain.chainledgersystem.data.vo.PingVO;
import com.chain.chainledgersystem.network.service.NodeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
public class NodeController {

    @Lazy
    @Autowired
    private NodeService nodeService;

    @GetMapping("/ping")
    public PingVO ping() {
        return nodeService.ping();
    }

    @GetMapping("/node/info")
    public NodeInfoVO info() {
        return nodeService.info();
    }

    /**
     * 获取节点列表
     */
    @GetMapping("/peers")
    public PeersVO getPeers() {
        return nodeService.list();
    }

    /**
     * 其他节点登记自己
     */
    @PostMapping("/peers/add")
    public Map<String, List<String>> addPeer(@RequestBody PeerRequest request) {
        return Collections.singletonMap("peers", nodeService.addPeer(peerUrl(request)));
    }

    @PostMapping("/peers/connect")
    public ConnectResult connect(@RequestBody PeerRequest request) {
        return nodeService.connect(peerUrl(request));
    }

    @PostMapping("/peers/remove")
    public Map<String, List<String>> removePeer(@RequestBody PeerRequest request) {
        return Collections.singletonMap("peers", nodeService.removePeer(peerUrl(request)));
    }

    private static String peerUrl(PeerRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("缺少 peer_url 字段");
        }
        return request.getPeerUrl();
    }
}
