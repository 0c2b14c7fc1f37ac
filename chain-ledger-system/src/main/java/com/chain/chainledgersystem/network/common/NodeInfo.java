package com.chain.chainledgersystem.network.common;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 本节点状态，每次写入区块时刷新
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class NodeInfo {
    private String nodeId;//节点ID
    private long lastActive;//最后活跃时间 毫秒
    private long chainLength;//链长度
}
