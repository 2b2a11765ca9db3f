package org.example.logview.filesystem;

/**
 * 日志文件服务的错误分类。
 * <p>
 * 每个分类自带对应的 HTTP 状态码，传输层据此直接映射响应；核心层本身不依赖任何 Web 类型。
 */
public enum ErrorKind {

    /**
     * 解析后的路径逃逸出根目录（安全边界），永不重试。
     */
    OUT_OF_BOUNDS_PATH(400),

    /**
     * 用户没有任何组同时“包含该用户”且“模式匹配该路径”。
     */
    ACCESS_DENIED(403),

    NOT_FOUND(404),

    NOT_A_DIRECTORY(400),

    NOT_A_FILE(400),

    /**
     * 文件超过 {@code app.logview.max-file-size}。
     */
    TOO_LARGE(413),

    /**
     * 操作系统拒绝枚举目录。
     */
    PERMISSION_DENIED(403),

    IO_ERROR(500);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
