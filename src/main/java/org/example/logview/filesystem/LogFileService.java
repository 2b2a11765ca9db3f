package org.example.logview.filesystem;

import org.example.logview.access.GroupAuthorizer;
import org.example.logview.access.GroupDefinition;
import org.example.logview.filesystem.dto.DirectoryListResult;
import org.example.logview.filesystem.dto.FileEntry;
import org.example.logview.filesystem.dto.FilePage;
import org.example.logview.filesystem.dto.GroupInfo;
import org.example.logview.filesystem.dto.GroupsOverviewResult;
import org.example.logview.filesystem.dto.UserInfoResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 日志文件服务门面：传输层（HTTP / MCP）只通过这里访问核心能力。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列目录（按条目授权过滤）。</li>
 *   <li>分页读取。</li>
 *   <li>实时 tail。</li>
 *   <li>整文件下载前的校验。</li>
 *   <li>组/用户信息查询。</li>
 * </ul>
 * <p>
 * 用户名由传输层的认证步骤提供，这里不读取任何请求头或参数。
 */
public class LogFileService {

    private final LogViewSettings settings;
    private final SecurePathResolver pathResolver;
    private final GroupAuthorizer authorizer;
    private final DirectoryLister directoryLister;
    private final PaginatedReader paginatedReader;
    private final TailStreamer tailStreamer;

    public LogFileService(LogViewSettings settings, SecurePathResolver pathResolver, GroupAuthorizer authorizer,
                          DirectoryLister directoryLister, PaginatedReader paginatedReader, TailStreamer tailStreamer) {
        this.settings = settings;
        this.pathResolver = pathResolver;
        this.authorizer = authorizer;
        this.directoryLister = directoryLister;
        this.paginatedReader = paginatedReader;
        this.tailStreamer = tailStreamer;
    }

    public DirectoryListResult listDirectory(String username, String directory) {
        String dir = (directory == null) ? "" : directory;
        List<FileEntry> files = directoryLister.list(username, dir);
        return new DirectoryListResult(dir, files, authorizer.userGroups(username));
    }

    public FilePage readFilePage(String username, String filePath, int startLine, Integer pageSize) {
        return paginatedReader.readPage(username, filePath, startLine, pageSize);
    }

    public TailSession tailFile(String username, String filePath, TailListener listener) {
        return tailStreamer.tail(username, filePath, listener);
    }

    /**
     * 下载前校验（越界、授权、存在、普通文件），返回待下载的文件。
     * <p>
     * 下载是从磁盘流式输出，因此不受 {@code max-file-size} 限制。
     */
    public DownloadTarget resolveDownload(String username, String filePath) {
        Path file = FileChecks.requireReadableFile(pathResolver, authorizer, username, filePath);
        try {
            return new DownloadTarget(file, file.getFileName().toString(), Files.size(file));
        } catch (IOException e) {
            throw new LogViewException(ErrorKind.IO_ERROR, "读取文件属性失败：" + filePath, e);
        }
    }

    /**
     * 对某个路径，用户可通过哪些组访问；路径先经规范化，越界时抛出 {@link ErrorKind#OUT_OF_BOUNDS_PATH}。
     */
    public List<String> resolveAccessibleGroups(String username, String filePath) {
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolve(filePath);
        return List.copyOf(authorizer.accessibleGroups(username, resolved.relativePath()));
    }

    public Set<String> userGroups(String username) {
        return authorizer.userGroups(username);
    }

    public UserInfoResult userInfo(String username) {
        return new UserInfoResult(username, authorizer.userGroups(username));
    }

    /**
     * 所有组的概览；组成员名单只对该组成员可见。
     */
    public GroupsOverviewResult groupsOverview(String username) {
        Set<String> userGroups = authorizer.userGroups(username);
        List<GroupInfo> groups = new ArrayList<>();
        for (GroupDefinition group : authorizer.groups()) {
            boolean member = userGroups.contains(group.name());
            groups.add(new GroupInfo(
                    group.name(),
                    group.pattern().pattern(),
                    group.description(),
                    member,
                    member ? List.copyOf(group.members()) : null
            ));
        }
        return new GroupsOverviewResult(groups, userGroups, settings.root().toString());
    }

    /**
     * @param file      规范化后的绝对路径
     * @param fileName  下载文件名
     * @param sizeBytes 校验时刻的文件大小
     */
    public record DownloadTarget(Path file, String fileName, long sizeBytes) {
    }
}
