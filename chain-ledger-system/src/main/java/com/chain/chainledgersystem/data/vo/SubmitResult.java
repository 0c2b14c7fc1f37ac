package com.chain.chainledgersystem.data.vo;

import com.chain.chainledgersystem.data.block.Block;
import com.chain.chainledgersystem.data.transaction.Transaction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 新封装的区块以及触发它的交易
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitResult {
    private Block block;
    private Transaction transaction;
}
