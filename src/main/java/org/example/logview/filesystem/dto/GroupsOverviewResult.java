package org.example.logview.filesystem.dto;

import java.util.List;
import java.util.Set;

/**
 * {@code GET /config/groups} 的返回结果。
 *
 * @param groups     所有已配置的组
 * @param userGroups 当前用户所属的组
 * @param basePath   日志根目录
 */
public record GroupsOverviewResult(
        List<GroupInfo> groups,
        Set<String> userGroups,
        String basePath
) {
}
