package org.example.logview.filesystem;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 日志查看服务的业务配置（{@code app.logview.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #root} 是唯一的根目录，所有对外路径都相对它解析，也是安全边界。</li>
 *   <li>{@link #groups} 定义“路径正则 + 用户”的授权组，用户能看到的文件完全由组决定。</li>
 *   <li>分页与文件大小上限用于控制单次响应体积。</li>
 * </ul>
 * <p>
 * 注意：该类只负责绑定与基础校验，运行期使用的是由它构造出来的不可变 {@link LogViewSettings}。
 */
@Validated
@ConfigurationProperties(prefix = "app.logview")
public class LogViewProperties {

    /**
     * 日志根目录（启动时必须存在且为目录）。
     */
    @NotBlank
    private String root = "/var/log";

    /**
     * 携带已认证用户名的 HTTP 请求头。
     * <p>
     * 说明：认证由前置网关完成，本服务只读取该请求头，不做校验。
     */
    @NotBlank
    private String authHeader = "X-User";

    /**
     * 分页读取允许的最大文件大小，超过则拒绝（413）。
     */
    @NotNull
    private DataSize maxFileSize = DataSize.ofMegabytes(100);

    /**
     * 分页读取默认每页行数。
     */
    @Min(1)
    @Max(1_000_000)
    private int defaultPageSize = 1000;

    /**
     * 分页读取每页行数上限（上限保护）。
     */
    @Min(1)
    @Max(1_000_000)
    private int maxPageSize = 10_000;

    /**
     * tail 在没有新数据时的轮询间隔。
     */
    @NotNull
    private Duration tailPollInterval = Duration.ofSeconds(1);

    /**
     * tail 每次从文件读取的字节块大小。
     */
    @NotNull
    private DataSize tailBufferSize = DataSize.ofKilobytes(1);

    /**
     * tail 连续无新行多久后向消费端发送一次心跳；消费端已断开时靠这次写入失败结束会话。
     */
    @NotNull
    private Duration tailHeartbeatInterval = Duration.ofSeconds(15);

    /**
     * 授权组列表（组名在列表内必须唯一）。
     */
    @Valid
    @NotNull
    private List<Group> groups = new ArrayList<>();

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }

    public String getAuthHeader() {
        return authHeader;
    }

    public void setAuthHeader(String authHeader) {
        this.authHeader = authHeader;
    }

    public DataSize getMaxFileSize() {
        return maxFileSize;
    }

    public void setMaxFileSize(DataSize maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public Duration getTailPollInterval() {
        return tailPollInterval;
    }

    public void setTailPollInterval(Duration tailPollInterval) {
        this.tailPollInterval = tailPollInterval;
    }

    public DataSize getTailBufferSize() {
        return tailBufferSize;
    }

    public void setTailBufferSize(DataSize tailBufferSize) {
        this.tailBufferSize = tailBufferSize;
    }

    public Duration getTailHeartbeatInterval() {
        return tailHeartbeatInterval;
    }

    public void setTailHeartbeatInterval(Duration tailHeartbeatInterval) {
        this.tailHeartbeatInterval = tailHeartbeatInterval;
    }

    public List<Group> getGroups() {
        return groups;
    }

    public void setGroups(List<Group> groups) {
        this.groups = groups;
    }

    /**
     * 单个授权组的配置项（{@code app.logview.groups[n].*}）。
     */
    public static class Group {

        @NotBlank
        private String name;

        /**
         * 相对根目录路径的正则（从路径开头匹配）。
         */
        @NotBlank
        private String pattern;

        private List<String> users = new ArrayList<>();

        private String description;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public List<String> getUsers() {
            return users;
        }

        public void setUsers(List<String> users) {
            this.users = users;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }
    }
}
