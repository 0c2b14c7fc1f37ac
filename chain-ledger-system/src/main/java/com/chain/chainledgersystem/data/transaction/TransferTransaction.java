package com.chain.chainledgersystem.data.transaction;

import com.chain.chainledgersystem.constant.BlockChainConstants;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TransferTransaction extends Transaction {

    private String fromActor;
    private String toActor;
    private String reason;

    public TransferTransaction() {
        super(BlockChainConstants.TX_TYPE_TRANSFER, BlockChainConstants.ACTION_TRANSFERRED);
    }

    @Override
    public String getCustodian() {
        return toActor;
    }

    @Override
    protected void collectMissingFields(List<String> missing) {
        if (isBlank(fromActor)) {
            missing.add("from_actor");
        }
        if (isBlank(toActor)) {
            missing.add("to_actor");
        }
        if (isBlank(reason)) {
            missing.add("reason");
        }
    }
}
