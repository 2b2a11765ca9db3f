package org.example.logview.filesystem;

import java.util.Objects;

/**
 * 核心文件服务抛出的唯一业务异常，通过 {@link ErrorKind} 区分失败原因。
 * <p>
 * 所有失败都是“整个请求失败”：列目录、分页读取不会返回部分结果。
 */
public class LogViewException extends RuntimeException {

    private final ErrorKind kind;

    public LogViewException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public LogViewException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
