package com.chain.chainledgersystem.exception;

/**
 * 交易缺少必填字段或类型未知时抛出，此时不会产生任何区块
 */
public class InvalidTransactionException extends RuntimeException {

    public InvalidTransactionException(String message) {
        super(message);
    }

    public InvalidTransactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
