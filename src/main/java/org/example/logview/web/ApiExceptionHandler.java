package org.example.logview.web;

import org.example.logview.filesystem.LogViewException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 把核心层异常映射为 HTTP 响应：{@code {"error": 分类, "detail": 描述}}。
 * <p>
 * 显式设置 Content-Type 为 JSON：SSE 请求（Accept: text/event-stream）在流开始前失败时也能正常返回错误体。
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(LogViewException.class)
    public ResponseEntity<Map<String, String>> handleLogView(LogViewException e) {
        HttpStatus status = HttpStatus.valueOf(e.getKind().httpStatus());
        if (status.is5xxServerError()) {
            log.warn("请求失败：{}", e.getMessage(), e);
        } else {
            log.debug("请求被拒绝：{} {}", e.getKind(), e.getMessage());
        }
        return body(status, e.getKind().name(), e.getMessage(), null);
    }

    @ExceptionHandler(MissingUserException.class)
    public ResponseEntity<Map<String, String>> handleMissingUser(MissingUserException e) {
        return body(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", e.getMessage(), "UserHeader");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "参数格式错误：" + e.getName(), null);
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String error, String detail, String authenticate) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("detail", detail);
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON);
        if (authenticate != null) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, authenticate);
        }
        return builder.body(body);
    }
}
