package org.example.logview.filesystem.dto;

import java.util.List;
import java.util.Set;

/**
 * {@code GET /files} 的返回结果。
 *
 * @param directory  请求的目录（相对根目录）
 * @param files      当前用户可见的条目（按名称升序）
 * @param userGroups 当前用户所属的组
 */
public record DirectoryListResult(
        String directory,
        List<FileEntry> files,
        Set<String> userGroups
) {
}
