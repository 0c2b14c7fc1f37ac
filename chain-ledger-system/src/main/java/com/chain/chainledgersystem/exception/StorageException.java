package com.chain.chainledgersystem.exception;

/**
 * 持久化写入失败，整个写批次已放弃
 */
public class StorageException extends RuntimeException {

    /**
     * 构造一个带有详细消息的StorageException
     * @param message 详细错误消息
     */
    public StorageException(String message) {
        super(message);
    }

    /**
     * 构造一个带有详细消息和原因的StorageException
     * @param message 详细错误消息
     * @param cause 导致此异常的原因
     */
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
