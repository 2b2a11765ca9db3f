package org.example.logview.filesystem;

import org.example.logview.access.GroupAuthorizer;
import org.example.logview.filesystem.dto.FilePage;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 按行分页读取文本文件（UTF-8，非法字节替换为 U+FFFD）。
 * <p>
 * 算法为两遍扫描：第一遍统计总行数，第二遍跳过 {@code startLine - 1} 行后收集一页。
 * 两遍各自打开文件，文件被并发追加时总行数与窗口可能不一致；这是有意接受的弱一致性，
 * 不为此把整个文件读入内存。
 */
public class PaginatedReader {

    private final SecurePathResolver pathResolver;
    private final GroupAuthorizer authorizer;
    private final LogViewSettings settings;

    public PaginatedReader(SecurePathResolver pathResolver, GroupAuthorizer authorizer, LogViewSettings settings) {
        this.pathResolver = pathResolver;
        this.authorizer = authorizer;
        this.settings = settings;
    }

    /**
     * 读取一页。
     * <p>
     * 前置校验顺序：授权 -> 存在 -> 普通文件 -> 大小上限 -> 读取。
     *
     * @param startLine 起始行号（1-based）
     * @param pageSize  每页行数；null 使用默认值，超过上限时截到上限
     */
    public FilePage readPage(String username, String filePath, int startLine, Integer pageSize) {
        if (startLine < 1) {
            throw new IllegalArgumentException("参数错误：startLine 必须 >= 1（" + startLine + "）");
        }
        int effectivePageSize = effectivePageSize(pageSize);

        Path file = FileChecks.requireReadableFile(pathResolver, authorizer, username, filePath);
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new LogViewException(ErrorKind.IO_ERROR, "读取文件属性失败：" + filePath, e);
        }
        if (size > settings.maxFileBytes()) {
            throw new LogViewException(ErrorKind.TOO_LARGE,
                    "文件过大（" + size + " 字节，上限 " + settings.maxFileBytes() + " 字节）：" + filePath);
        }

        int totalLines;
        List<String> lines = new ArrayList<>(Math.min(effectivePageSize, 1024));
        try {
            totalLines = countLines(file);
            try (BufferedReader reader = open(file)) {
                int skipped = 0;
                while (skipped < startLine - 1 && reader.readLine() != null) {
                    skipped++;
                }
                String line;
                while (lines.size() < effectivePageSize && (line = reader.readLine()) != null) {
                    lines.add(line);
                }
            }
        } catch (IOException e) {
            throw new LogViewException(ErrorKind.IO_ERROR, "读取文件失败：" + filePath, e);
        }

        boolean hasMore = ((long) startLine + lines.size() - 1) < totalLines;
        return new FilePage(
                normalizeDisplayPath(filePath),
                startLine,
                effectivePageSize,
                totalLines,
                hasMore,
                lines
        );
    }

    int effectivePageSize(Integer pageSize) {
        if (pageSize == null) {
            return settings.defaultPageSize();
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("参数错误：pageSize 必须 >= 1（" + pageSize + "）");
        }
        return Math.min(pageSize, settings.maxPageSize());
    }

    private static int countLines(Path file) throws IOException {
        int count = 0;
        try (BufferedReader reader = open(file)) {
            while (reader.readLine() != null) {
                count++;
            }
        }
        return count;
    }

    private static BufferedReader open(Path file) throws IOException {
        // InputStreamReader(Charset) 对非法字节做替换而不是抛 MalformedInputException
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8));
    }

    private static String normalizeDisplayPath(String path) {
        if (path == null) {
            return "";
        }
        return path.startsWith("/") ? path.substring(1) : path;
    }
}
