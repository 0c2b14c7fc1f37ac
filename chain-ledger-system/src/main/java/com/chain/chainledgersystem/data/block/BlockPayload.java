package com.chain.chainledgersystem.data.block;

import com.chain.chainledgersystem.data.transaction.Transaction;

import java.util.List;

/**
 * 区块载荷：创世区块是固定标记对象，其余区块是交易列表
 */
public interface BlockPayload {

    boolean isGenesis();

    /**
     * 载荷中的交易，创世区块返回空列表
     */
    List<Transaction> getTransactions();
}
