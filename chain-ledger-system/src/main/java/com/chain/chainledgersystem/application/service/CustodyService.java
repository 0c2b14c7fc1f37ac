package com.chain.chainledgersystem.application.service;

import com.chain.chainledgersystem.data.dto.CreateItemRequest;
import com.chain.chainledgersystem.data.dto.TransferItemRequest;
import com.chain.chainledgersystem.data.transaction.Transaction;
import com.chain.chainledgersystem.data.vo.SubmitResult;
import com.chain.chainledgersystem.network.service.TransactionBroadcaster;
import com.chain.chainledgersystem.service.blockChain.BlockChainService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * 本地提交的保管事件：先写入本地链，再异步广播给其他节点
 */
@Slf4j
@Service
public class CustodyService {

    private final BlockChainService blockChainService;
    private final TransactionBroadcaster transactionBroadcaster;

    @Autowired
    public CustodyService(BlockChainService blockChainService, TransactionBroadcaster transactionBroadcaster) {
        this.blockChainService = blockChainService;
        this.transactionBroadcaster = transactionBroadcaster;
    }

    public SubmitResult createItem(CreateItemRequest request) {
        SubmitResult result = blockChainService.createItem(request);
        transactionBroadcaster.broadcast(result.getTransaction());
        return result;
    }

    public SubmitResult transferItem(TransferItemRequest request) {
        SubmitResult result = blockChainService.transferItem(request);
        transactionBroadcaster.broadcast(result.getTransaction());
        return result;
    }

    /**
     * 广播来的交易只在本地封装，不再转发
     */
    public SubmitResult receive(Transaction transaction) {
        return blockChainService.receiveTransaction(transaction);
    }
}
