package com.chain.chainledgersystem.application.controller;

import com.chain.chainledgersystem.application.service.CustodyService;
import com.chain.chainledgersystem.data.block.Block;
import com.chain.chainledgersystem.data.dto.ReceiveTransactionRequest;
import com.chain.chainledgersystem.data.vo.BackupVO;
import com.chain.chainledgersystem.data.vo.BlocksVO;
import com.chain.chainledgersystem.data.vo.ChainVO;
import com.chain.chainledgersystem.data.vo.SyncResult;
import com.chain.chainledgersystem.data.vo.ValidateVO;
import com.chain.chainledgersystem.exception.InvalidTransactionException;
import com.chain.chainledgersystem.service.blockChain.BlockChainService;
import com.chain.chainledgersystem.service.sync.SyncBlockChainService;
import com.chain.chainledgersystem.storage.StorageStats;
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
public class BlockChainController {

    @Lazy
    @Autowired
    private BlockChainService blockChainService;
    @Lazy
    @Autowired
    private SyncBlockChainService syncBlockChainService;
    @Lazy
    @Autowired
    private CustodyService custodyService;

    /**
     * 整条链，供其他节点同步
     */
    @GetMapping("/chain")
    public ChainVO getChain() {
        List<Block> chain = blockChainService.getChain();
        return new ChainVO(chain.size(), chain);
    }

    @GetMapping("/blocks")
    public BlocksVO getBlocks() {
        List<Block> blocks = blockChainService.getChain();
        return new BlocksVO(blocks, blocks.size());
    }

    @GetMapping("/validate")
    public ValidateVO validate() {
        return new ValidateVO(blockChainService.isChainValid(), blockChainService.getChainLength());
    }

    @GetMapping("/stats")
    public StorageStats stats() {
        return blockChainService.getStats();
    }

    /**
     * 在线备份本节点数据库
     */
    @PostMapping("/backup")
    public BackupVO backup() {
        return new BackupVO("Backup created", blockChainService.backup());
    }

    /**
     * 接收其他节点广播的交易
     */
    @PostMapping("/transaction/receive")
    public Map<String, String> receiveTransaction(@RequestBody ReceiveTransactionRequest request) {
        if (request == null || request.getTransaction() == null) {
            throw new InvalidTransactionException("缺少 transaction 字段");
        }
        custodyService.receive(request.getTransaction());
        return Collections.singletonMap("status", "Transaction received");
    }

    /**
     * 手动触发同步
     */
    @PostMapping("/sync")
    public SyncResult sync() {
        return syncBlockChainService.reconcile();
    }
}
