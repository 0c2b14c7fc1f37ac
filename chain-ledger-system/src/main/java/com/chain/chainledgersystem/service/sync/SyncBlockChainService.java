package com.chain.chainledgersystem.service.sync;

import com.chain.chainledgersystem.data.vo.SyncResult;

public interface SyncBlockChainService {

    /**
     * 向所有已知节点拉取整链，采用严格最长且被策略接受的一条。
     * 单个节点失败只记录日志。
     */
    SyncResult reconcile();
}
