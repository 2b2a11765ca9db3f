package org.example.logview.filesystem.dto;

import java.util.Set;

/**
 * {@code GET /user} 的返回结果。
 *
 * @param username 当前用户名
 * @param groups   用户所属的组
 */
public record UserInfoResult(String username, Set<String> groups) {
}
