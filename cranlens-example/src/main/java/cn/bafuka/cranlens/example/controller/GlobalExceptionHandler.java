package cn.bafuka.cranlens.example.controller;

import cn.bafuka.cranlens.example.exception.RegistryLookupException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * 统一异常处理
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 上游注册中心失败
     */
    @ExceptionHandler(RegistryLookupException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, Object> handleRegistryFailure(RegistryLookupException e) {
        log.error("注册中心查询失败: target={}, reason={}", e.getTarget(), e.getReason(), e);

        Map<String, Object> result = new HashMap<>();
        result.put("success", false);
        result.put("reason", e.getReason());
        result.put("message", e.getReason().getDescription() + ": " + e.getMessage());
        return result;
    }

    /**
     * 参数不合法
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        log.warn("请求参数不合法: {}", e.getMessage());

        Map<String, Object> result = new HashMap<>();
        result.put("success", false);
        result.put("message", e.getMessage());
        return result;
    }
}
