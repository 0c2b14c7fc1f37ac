package com.chain.chainledgersystem.data.item;

import com.chain.chainledgersystem.data.transaction.Transaction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 物品的一条保管记录，按区块序号、区块内位置排序
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HistoryEntry {

    private String itemId;
    private long blockIndex;
    //交易在区块载荷中的位置
    private int position;
    private String timestamp;
    private String action;
    //该事件之后的经手人
    private String custodian;
    //原始交易
    private Transaction details;
}
