package org.example.logview.mcp;

import org.example.logview.filesystem.LogFileService;
import org.example.logview.filesystem.dto.DirectoryListResult;
import org.example.logview.filesystem.dto.FilePage;
import org.example.logview.filesystem.dto.UserInfoResult;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

/**
 * 日志查看 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列目录（{@code logs_list_directory}）。</li>
 *   <li>分页读取（{@code logs_read_page}）。</li>
 *   <li>查询用户所属组（{@code logs_user_groups}）。</li>
 * </ul>
 * <p>
 * 安全策略与 HTTP 接口完全一致：同一个 {@link LogFileService}，同一套组授权与路径越界校验。
 * tail 与下载是长连接/大文件场景，只通过 HTTP 提供。
 */
@Component
public class LogMcpTools {

    private final LogFileService logFileService;

    public LogMcpTools(LogFileService logFileService) {
        this.logFileService = logFileService;
    }

    @Tool(
            name = "logs_list_directory",
            description = "列出日志目录下当前用户可见的文件/子目录（非递归，按名称升序）。"
    )
    public DirectoryListResult listDirectory(
            @ToolParam(description = "用户名（由调用方的认证环节提供）") String username,
            @ToolParam(required = false, description = "目录路径（相对日志根目录；为空则为根目录）") String directory
    ) {
        return logFileService.listDirectory(username, directory);
    }

    /**
     * 分页读取。
     * <p>
     * 使用建议：第一次调用不传 startLine；之后用 {@code startLine + lines.size()} 作为下一页起点，直到 hasMore=false。
     */
    @Tool(
            name = "logs_read_page",
            description = "按行分页读取日志文件；根据返回的 hasMore 继续用下一页的 startLine 读取。"
    )
    public FilePage readPage(
            @ToolParam(description = "用户名（由调用方的认证环节提供）") String username,
            @ToolParam(description = "文件路径（相对日志根目录）") String path,
            @ToolParam(required = false, description = "起始行号（1-based；默认 1）") Integer startLine,
            @ToolParam(required = false, description = "每页行数（默认 app.logview.default-page-size，上限 app.logview.max-page-size）") Integer pageSize
    ) {
        int resolvedStartLine = (startLine == null) ? 1 : startLine;
        return logFileService.readFilePage(username, path, resolvedStartLine, pageSize);
    }

    @Tool(
            name = "logs_user_groups",
            description = "查询用户所属的授权组。"
    )
    public UserInfoResult userGroups(
            @ToolParam(description = "用户名") String username
    ) {
        return logFileService.userInfo(username);
    }
}
