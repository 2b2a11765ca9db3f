package org.example.logview.filesystem;

import org.example.logview.access.GroupDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 运行期使用的不可变配置。
 * <p>
 * 在启动时由 {@link LogViewProperties} 构造一次，然后通过构造函数注入各组件。
 * 所有“配置错误”（根目录不存在、正则非法、组名重复等）都在这里失败，避免拖到第一次请求时才暴露。
 *
 * @param root             根目录的真实路径（已解析符号链接）
 * @param authHeader       携带用户名的请求头
 * @param groups           已编译的授权组
 * @param maxFileBytes     分页读取允许的最大文件字节数
 * @param defaultPageSize  默认每页行数
 * @param maxPageSize      每页行数上限
 * @param tailPollInterval tail 轮询间隔
 * @param tailBufferBytes  tail 单次读取字节数
 * @param tailHeartbeatInterval tail 连续无新行多久后发送一次心跳
 */
public record LogViewSettings(
        Path root,
        String authHeader,
        List<GroupDefinition> groups,
        long maxFileBytes,
        int defaultPageSize,
        int maxPageSize,
        Duration tailPollInterval,
        int tailBufferBytes,
        Duration tailHeartbeatInterval
) {

    public LogViewSettings {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(tailPollInterval, "tailPollInterval");
        Objects.requireNonNull(tailHeartbeatInterval, "tailHeartbeatInterval");
        groups = List.copyOf(groups);
        if (defaultPageSize < 1 || maxPageSize < 1) {
            throw new IllegalStateException("分页大小必须为正数");
        }
        if (defaultPageSize > maxPageSize) {
            throw new IllegalStateException("default-page-size（" + defaultPageSize + "）不能大于 max-page-size（" + maxPageSize + "）");
        }
        if (tailPollInterval.isNegative() || tailPollInterval.isZero()) {
            throw new IllegalStateException("tail-poll-interval 必须大于 0");
        }
        if (tailHeartbeatInterval.isNegative() || tailHeartbeatInterval.isZero()) {
            throw new IllegalStateException("tail-heartbeat-interval 必须大于 0");
        }
        if (tailBufferBytes < 1) {
            throw new IllegalStateException("tail-buffer-size 必须大于 0");
        }
        Set<String> names = new HashSet<>();
        for (GroupDefinition group : groups) {
            if (!names.add(group.name())) {
                throw new IllegalStateException("组名重复：" + group.name());
            }
        }
    }

    public static LogViewSettings from(LogViewProperties properties) {
        return new LogViewSettings(
                resolveRoot(properties.getRoot()),
                properties.getAuthHeader(),
                compileGroups(properties.getGroups()),
                properties.getMaxFileSize().toBytes(),
                properties.getDefaultPageSize(),
                properties.getMaxPageSize(),
                properties.getTailPollInterval(),
                Math.toIntExact(properties.getTailBufferSize().toBytes()),
                properties.getTailHeartbeatInterval()
        );
    }

    static Path resolveRoot(String configured) {
        if (configured == null || configured.isBlank()) {
            throw new IllegalStateException("未配置日志根目录（app.logview.root）");
        }
        Path path = Path.of(configured).toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            throw new IllegalStateException("日志根目录不存在：" + path);
        }
        if (!Files.isDirectory(path)) {
            throw new IllegalStateException("日志根目录不是目录：" + path);
        }
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("日志根目录无法解析：" + path, e);
        }
    }

    static List<GroupDefinition> compileGroups(List<LogViewProperties.Group> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<GroupDefinition> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            LogViewProperties.Group group = Objects.requireNonNull(configured.get(i), "配置项 app.logview.groups[" + i + "] 不能为空");
            if (group.getName() == null || group.getName().isBlank()) {
                throw new IllegalStateException("配置项 app.logview.groups[" + i + "].name 不能为空");
            }
            if (group.getPattern() == null) {
                throw new IllegalStateException("组 " + group.getName() + " 未配置 pattern");
            }
            Pattern pattern;
            try {
                pattern = Pattern.compile(group.getPattern());
            } catch (PatternSyntaxException e) {
                throw new IllegalStateException("组 " + group.getName() + " 的正则不合法：" + e.getDescription(), e);
            }
            Set<String> users = new LinkedHashSet<>();
            if (group.getUsers() != null) {
                for (String user : group.getUsers()) {
                    if (user != null && !user.isBlank()) {
                        users.add(user.strip());
                    }
                }
            }
            result.add(new GroupDefinition(group.getName(), pattern, users, group.getDescription()));
        }
        return result;
    }
}
