package org.example.logview.filesystem.dto;

import java.util.List;

/**
 * 分页读取的结果（按行）。
 * <p>
 * {@code totalLines} 来自本次调用的完整扫描，不跨调用缓存；文件正在被写入时，
 * 两次调用看到的总行数可能不同，窗口与总行数之间也可能不一致。
 *
 * @param path       相对根目录的路径（统一使用 / 分隔）
 * @param startLine  本次读取的起始行号（1-based）
 * @param pageSize   本次实际使用的每页行数（已应用默认值与上限）
 * @param totalLines 文件总行数
 * @param hasMore    起始行之后是否还有未返回的行
 * @param lines      行内容列表（不含行尾换行符）
 */
public record FilePage(
        String path,
        int startLine,
        int pageSize,
        int totalLines,
        boolean hasMore,
        List<String> lines
) {
}
