package com.chain.chainledgersystem.data.block;

import com.chain.chainledgersystem.data.transaction.Transaction;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Data
@NoArgsConstructor
public class TransactionBatch implements BlockPayload {

    private List<Transaction> transactions = new ArrayList<>();

    public TransactionBatch(List<Transaction> transactions) {
        this.transactions = Collections.unmodifiableList(new ArrayList<>(transactions));
    }

    @Override
    public boolean isGenesis() {
        return false;
    }
}
