package com.minicall.common.web;

import com.minicall.calling.command.CallingException;
import com.minicall.common.api.ApiCodes;
import com.minicall.common.api.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.concurrent.CompletionException;

/**
 * 全局异常处理：把常见异常翻译为统一的 Result JSON，HTTP 状态码照常设置。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleValidation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getAllErrors().isEmpty()
                ? "invalid_request"
                : e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Result<Void>> handleBadRequest(IllegalArgumentException e) {
        String msg = (e.getMessage() == null || e.getMessage().isBlank()) ? "bad_request" : e.getMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Result.fail(ApiCodes.BAD_REQUEST, msg));
    }

    /**
     * 命令与当前通话状态冲突。
     */
    @ExceptionHandler(CallingException.class)
    public ResponseEntity<Result<Void>> handleCalling(CallingException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Result.fail(ApiCodes.CONFLICT, e.getReason()));
    }

    /**
     * 异步命令的失败会包在 CompletionException 里，拆开后按原异常处理。
     */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Result<Void>> handleCompletion(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof CallingException ce) {
            return handleCalling(ce);
        }
        if (cause instanceof IllegalArgumentException iae) {
            return handleBadRequest(iae);
        }
        log.error("calling command failed: cause={}", cause == null ? e.toString() : cause.toString());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Result<Void>> handleNoResourceFound(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Result.fail(ApiCodes.NOT_FOUND, "not_found"));
    }

    /**
     * 兜底：避免默认 HTML 错误页。
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleAny(Exception e) {
        log.error("unhandled exception: cause={}", e.toString());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Result.fail(ApiCodes.INTERNAL_ERROR, "internal_error"));
    }
}
