package com.chain.chainledgersystem.data.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 存活检查应答
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PingVO {
    private String status;
    private String nodeId;
}
