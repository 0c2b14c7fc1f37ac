package com.chain.chainledgersystem.exception;

/**
 * 对等节点超时、连接失败或返回非2xx状态
 */
public class PeerUnreachableException extends Exception {

    private final String peerUrl;

    public PeerUnreachableException(String peerUrl, String message) {
        super(message);
        this.peerUrl = peerUrl;
    }

    public PeerUnreachableException(String peerUrl, String message, Throwable cause) {
        super(message, cause);
        this.peerUrl = peerUrl;
    }

    public String getPeerUrl() {
        return peerUrl;
    }
}
