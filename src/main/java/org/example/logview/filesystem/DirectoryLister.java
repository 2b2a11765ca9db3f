package org.example.logview.filesystem;

import org.example.logview.access.GroupAuthorizer;
import org.example.logview.filesystem.dto.FileEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 列目录（非递归），并按条目逐个做授权过滤。
 * <p>
 * 过滤粒度是“条目”而不是“目录”：同一目录下可以同时存在对某用户可见与不可见的文件。
 */
public class DirectoryLister {

    private static final Logger log = LoggerFactory.getLogger(DirectoryLister.class);

    private final SecurePathResolver pathResolver;
    private final GroupAuthorizer authorizer;

    public DirectoryLister(SecurePathResolver pathResolver, GroupAuthorizer authorizer) {
        this.pathResolver = pathResolver;
        this.authorizer = authorizer;
    }

    /**
     * @param directory 相对根目录的目录路径；为空表示根目录
     * @return 当前用户可见的条目，按名称升序
     */
    public List<FileEntry> list(String username, String directory) {
        // 没有任何组的用户看不到任何东西，直接返回，不触碰文件系统
        if (authorizer.userGroups(username).isEmpty()) {
            return List.of();
        }

        SecurePathResolver.ResolvedPath resolved = pathResolver.resolve(directory);
        Path dir = resolved.absolutePath();
        if (!Files.exists(dir)) {
            throw new LogViewException(ErrorKind.NOT_FOUND, "目录不存在：" + displayPath(directory));
        }
        if (!Files.isDirectory(dir)) {
            throw new LogViewException(ErrorKind.NOT_A_DIRECTORY, "不是目录：" + displayPath(directory));
        }
        dir = pathResolver.requireContained(resolved, displayPath(directory));

        List<FileEntry> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                String childRelative = childPath(resolved.relativePath(), child.getFileName().toString());
                if (!authorizer.canAccess(username, childRelative)) {
                    continue;
                }
                FileEntry entry = toEntry(pathResolver.root(), child, childRelative);
                if (entry != null) {
                    entries.add(entry);
                }
            }
        } catch (AccessDeniedException e) {
            throw new LogViewException(ErrorKind.PERMISSION_DENIED, "没有权限列出目录：" + displayPath(directory), e);
        } catch (IOException e) {
            throw new LogViewException(ErrorKind.IO_ERROR, "列出目录失败：" + displayPath(directory), e);
        }

        entries.sort(Comparator.comparing(FileEntry::name));
        return entries;
    }

    /**
     * 读取条目元信息；读取失败（例如悬空链接）时按不可访问处理，返回 null。
     * <p>
     * 符号链接按目标读取元信息，但目标在根目录之外的条目直接跳过，不暴露根目录之外的任何属性。
     */
    private static FileEntry toEntry(Path root, Path child, String relativePath) {
        try {
            Path real = child.toRealPath();
            if (!real.startsWith(root)) {
                log.debug("跳过指向根目录之外的条目：{}", relativePath);
                return null;
            }
            BasicFileAttributes attrs = Files.readAttributes(real, BasicFileAttributes.class);
            return new FileEntry(
                    child.getFileName().toString(),
                    relativePath,
                    attrs.size(),
                    attrs.lastModifiedTime().toInstant(),
                    attrs.isRegularFile(),
                    Files.isReadable(real)
            );
        } catch (IOException e) {
            log.debug("跳过无法读取属性的条目：{}（{}）", relativePath, e.toString());
            return null;
        }
    }

    private static String childPath(String parentRelative, String name) {
        return parentRelative.isEmpty() ? name : parentRelative + "/" + name;
    }

    private static String displayPath(String directory) {
        return (directory == null || directory.isEmpty()) ? "/" : directory;
    }
}
