package org.example.logview.filesystem;

import org.example.logview.access.GroupAuthorizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 读文件类操作（分页读取 / tail / 下载）共用的前置校验链。
 */
final class FileChecks {

    private static final Logger log = LoggerFactory.getLogger(FileChecks.class);

    private FileChecks() {
    }

    /**
     * 依次校验：路径不越界 -> 授权 -> 存在 -> 普通文件 -> 打开前再确认真实路径未变。
     * <p>
     * 授权基于规范化后的相对路径，因此 {@code a/../b.log} 与 {@code b.log} 得到相同的判定。
     *
     * @return 规范化后的绝对路径
     */
    static Path requireReadableFile(SecurePathResolver pathResolver, GroupAuthorizer authorizer,
                                    String username, String filePath) {
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolve(filePath);
        if (!authorizer.canAccess(username, resolved.relativePath())) {
            log.debug("拒绝访问：user={}, path={}", username, resolved.relativePath());
            throw new LogViewException(ErrorKind.ACCESS_DENIED, "无权访问文件：" + filePath);
        }
        Path file = resolved.absolutePath();
        if (!Files.exists(file)) {
            throw new LogViewException(ErrorKind.NOT_FOUND, "文件不存在：" + filePath);
        }
        if (!Files.isRegularFile(file)) {
            throw new LogViewException(ErrorKind.NOT_A_FILE, "不是普通文件：" + filePath);
        }
        return pathResolver.requireContained(resolved, filePath);
    }
}
