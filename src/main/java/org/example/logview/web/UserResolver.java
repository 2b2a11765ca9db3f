package org.example.logview.web;

import jakarta.servlet.http.HttpServletRequest;
import org.example.logview.filesystem.LogViewSettings;
import org.springframework.stereotype.Component;

/**
 * 从请求中取出已认证的用户名。
 * <p>
 * 认证由前置网关完成并写入 {@code app.logview.auth-header} 指定的请求头，这里只读取，不校验。
 */
@Component
public class UserResolver {

    static final String STREAM_USER_PARAM = "user";

    private final String authHeader;

    public UserResolver(LogViewSettings settings) {
        this.authHeader = settings.authHeader();
    }

    public String authHeader() {
        return authHeader;
    }

    public String resolve(HttpServletRequest request) {
        String user = trimToNull(request.getHeader(authHeader));
        if (user == null) {
            throw new MissingUserException("缺少请求头：" + authHeader);
        }
        return user;
    }

    /**
     * tail 流专用：浏览器的 EventSource 无法设置自定义请求头，因此先取查询参数 {@code user}，再回退到请求头。
     */
    public String resolveForStream(HttpServletRequest request) {
        String user = trimToNull(request.getParameter(STREAM_USER_PARAM));
        if (user == null) {
            user = trimToNull(request.getHeader(authHeader));
        }
        if (user == null) {
            throw new MissingUserException("缺少请求头 " + authHeader + " 或查询参数 " + STREAM_USER_PARAM);
        }
        return user;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
