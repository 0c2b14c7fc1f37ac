package com.chain.chainledgersystem.network.client;

import com.chain.chainledgersystem.data.transaction.Transaction;
import com.chain.chainledgersystem.data.vo.ChainVO;
import com.chain.chainledgersystem.data.vo.PingVO;
import com.chain.chainledgersystem.exception.PeerUnreachableException;

/**
 * 访问其他节点的HTTP+JSON接口，每次调用都有超时上限
 */
public interface PeerClient {

    /**
     * GET {peer}/ping
     */
    PingVO ping(String peerUrl) throws PeerUnreachableException;

    /**
     * GET {peer}/chain
     */
    ChainVO fetchChain(String peerUrl) throws PeerUnreachableException;

    /**
     * POST {peer}/transaction/receive {transaction}
     */
    void sendTransaction(String peerUrl, Transaction transaction) throws PeerUnreachableException;

    /**
     * POST {peer}/peers/add {peer_url}，让对方登记本节点
     */
    void registerPeer(String peerUrl, String selfUrl) throws PeerUnreachableException;
}
