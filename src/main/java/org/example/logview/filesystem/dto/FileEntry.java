package org.example.logview.filesystem.dto;

import java.time.Instant;

/**
 * 目录列表项（非递归），是列目录那一刻的文件元信息快照，不做缓存。
 *
 * @param name         名称（文件名/目录名）
 * @param path         相对根目录的路径（统一使用 / 分隔）
 * @param sizeBytes    大小（字节）
 * @param modifiedAt   最后修改时间
 * @param file         是否为普通文件
 * @param readable     当前进程是否可读
 */
public record FileEntry(
        String name,
        String path,
        long sizeBytes,
        Instant modifiedAt,
        boolean file,
        boolean readable
) {
}
