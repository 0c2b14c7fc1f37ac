package com.chain.chainledgersystem.data.item;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 转移日志行
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferRecord {

    //自增序号
    private long id;
    private String itemId;
    private String fromActor;
    private String toActor;
    private String reason;
    private String timestamp;
    private long blockIndex;
}
