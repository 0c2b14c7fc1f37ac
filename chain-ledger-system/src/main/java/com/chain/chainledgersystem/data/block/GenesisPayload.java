package com.chain.chainledgersystem.data.block;

import com.chain.chainledgersystem.constant.BlockChainConstants;
import com.chain.chainledgersystem.data.transaction.Transaction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenesisPayload implements BlockPayload {

    private String type;
    private String message;
    //创建创世区块的节点
    private String node;

    public static GenesisPayload of(String nodeId) {
        return new GenesisPayload(BlockChainConstants.GENESIS_TYPE, BlockChainConstants.GENESIS_MESSAGE, nodeId);
    }

    @Override
    public boolean isGenesis() {
        return true;
    }

    @Override
    public List<Transaction> getTransactions() {
        return Collections.emptyList();
    }
}
