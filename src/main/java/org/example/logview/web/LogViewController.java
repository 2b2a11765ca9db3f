package org.example.logview.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import org.example.logview.filesystem.LogFileService;
import org.example.logview.filesystem.TailSession;
import org.example.logview.filesystem.dto.DirectoryListResult;
import org.example.logview.filesystem.dto.FilePage;
import org.example.logview.filesystem.dto.GroupsOverviewResult;
import org.example.logview.filesystem.dto.UserInfoResult;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 日志查看 HTTP 接口。
 * <p>
 * 路径参数使用 {@code {*path}} 捕获剩余路径（带前导 /），由 {@code SecurePathResolver} 去掉前导分隔符后解析。
 */
@RestController
public class LogViewController {

    static final String APPLICATION = "LogView";
    static final String VERSION = "0.1.0";

    private final LogFileService logFileService;
    private final UserResolver userResolver;
    private final ObjectMapper objectMapper;

    public LogViewController(LogFileService logFileService, UserResolver userResolver, ObjectMapper objectMapper) {
        this.logFileService = logFileService;
        this.userResolver = userResolver;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("application", APPLICATION);
        info.put("version", VERSION);
        info.put("description", "按用户组授权的只读日志文件服务");
        return info;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }

    @GetMapping("/user")
    public UserInfoResult user(HttpServletRequest request) {
        return logFileService.userInfo(userResolver.resolve(request));
    }

    @GetMapping("/files")
    public DirectoryListResult listFiles(
            @RequestParam(name = "directory", required = false, defaultValue = "") String directory,
            HttpServletRequest request
    ) {
        return logFileService.listDirectory(userResolver.resolve(request), directory);
    }

    @GetMapping("/files/{*filePath}")
    public FilePage readFile(
            @PathVariable("filePath") String filePath,
            @RequestParam(name = "startLine", defaultValue = "1") int startLine,
            @RequestParam(name = "pageSize", required = false) Integer pageSize,
            HttpServletRequest request
    ) {
        return logFileService.readFilePage(userResolver.resolve(request), filePath, startLine, pageSize);
    }

    /**
     * 实时 tail（SSE）。前置校验失败时返回普通的 HTTP 错误；流开始之后的失败以 {@code event: error} 发送。
     */
    @GetMapping("/tail/{*filePath}")
    public SseEmitter tailFile(@PathVariable("filePath") String filePath, HttpServletRequest request) {
        String username = userResolver.resolveForStream(request);
        // 0 表示不超时：流只在客户端断开或读取失败时结束
        SseEmitter emitter = new SseEmitter(0L);
        TailSession session = logFileService.tailFile(username, filePath, new SseTailListener(emitter, objectMapper));
        emitter.onCompletion(session::close);
        emitter.onTimeout(session::close);
        emitter.onError(error -> session.close());
        return emitter;
    }

    @GetMapping("/download/{*filePath}")
    public ResponseEntity<Resource> downloadFile(@PathVariable("filePath") String filePath, HttpServletRequest request) {
        LogFileService.DownloadTarget target = logFileService.resolveDownload(userResolver.resolve(request), filePath);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(target.fileName(), StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .contentLength(target.sizeBytes())
                .body(new FileSystemResource(target.file()));
    }

    @GetMapping("/config/groups")
    public GroupsOverviewResult groups(HttpServletRequest request) {
        return logFileService.groupsOverview(userResolver.resolve(request));
    }
}
