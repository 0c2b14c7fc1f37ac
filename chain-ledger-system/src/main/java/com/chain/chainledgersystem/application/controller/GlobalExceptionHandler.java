package com.chain.chainledgersystem.application.controller;

import com.chain.chainledgersystem.data.vo.result.Result;
import com.chain.chainledgersystem.exception.InvalidTransactionException;
import com.chain.chainledgersystem.exception.ItemNotFoundException;
import com.chain.chainledgersystem.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({InvalidTransactionException.class, IllegalArgumentException.class})
    public ResponseEntity<Result<Void>> handleBadRequest(RuntimeException e) {
        log.warn("请求参数错误：{}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Result<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("无法解析请求体：{}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "请求体格式错误");
    }

    @ExceptionHandler(ItemNotFoundException.class)
    public ResponseEntity<Result<Void>> handleNotFound(ItemNotFoundException e) {
        return build(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Result<Void>> handleStorage(StorageException e) {
        log.error("存储写入失败", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<Result<Void>> build(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Result.error(status.value(), message));
    }
}
