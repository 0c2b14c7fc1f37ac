package com.chain.chainledgersystem.application.controller;

import com.chain.chainledgersystem.application.service.CustodyService;
import com.chain.chainledgersystem.data.dto.CreateItemRequest;
import com.chain.chainledgersystem.data.dto.TransferItemRequest;
import com.chain.chainledgersystem.data.item.ItemRecord;
import com.chain.chainledgersystem.data.item.TransferRecord;
import com.chain.chainledgersystem.data.vo.ItemHistoryVO;
import com.chain.chainledgersystem.data.vo.ItemsVO;
import com.chain.chainledgersystem.data.vo.SubmitResult;
import com.chain.chainledgersystem.exception.InvalidTransactionException;
import com.chain.chainledgersystem.service.blockChain.BlockChainService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
public class ItemController {

    @Lazy
    @Autowired
    private BlockChainService blockChainService;
    @Lazy
    @Autowired
    private CustodyService custodyService;

    /**
     * 登记新物品
     */
    @PostMapping("/items")
    public SubmitResult createItem(@RequestBody CreateItemRequest request) {
        if (request == null) {
            throw new InvalidTransactionException("请求体不能为空");
        }
        return custodyService.createItem(request);
    }

    /**
     * 转移物品保管权
     */
    @PostMapping("/transfers")
    public SubmitResult transferItem(@RequestBody TransferItemRequest request) {
        if (request == null) {
            throw new InvalidTransactionException("请求体不能为空");
        }
        return custodyService.transferItem(request);
    }

    @GetMapping("/items")
    public ItemsVO getAllItems() {
        List<ItemRecord> items = blockChainService.getAllItems();
        return new ItemsVO(items, items.size());
    }

    @GetMapping("/items/{itemId}")
    public ItemRecord getItem(@PathVariable("itemId") String itemId) {
        return blockChainService.getItem(itemId);
    }

    @GetMapping("/items/{itemId}/history")
    public ItemHistoryVO getItemHistory(@PathVariable("itemId") String itemId) {
        return new ItemHistoryVO(itemId, blockChainService.getItemHistory(itemId));
    }

    @GetMapping("/items/{itemId}/transfers")
    public List<TransferRecord> getTransfers(@PathVariable("itemId") String itemId) {
        return blockChainService.getTransfers(itemId);
    }
}
