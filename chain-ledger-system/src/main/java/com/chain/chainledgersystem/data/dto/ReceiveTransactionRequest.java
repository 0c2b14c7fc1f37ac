package com.chain.chainledgersystem.data.dto;

import com.chain.chainledgersystem.data.transaction.Transaction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 其他节点广播过来的交易
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReceiveTransactionRequest {
    private Transaction transaction;
}
