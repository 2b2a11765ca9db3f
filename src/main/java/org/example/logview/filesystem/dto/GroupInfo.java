package org.example.logview.filesystem.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 单个组的概览。
 *
 * @param name          组名
 * @param pattern       路径正则（原文）
 * @param description   描述
 * @param userHasAccess 当前用户是否属于该组
 * @param users         组成员；仅当当前用户属于该组时返回，否则为 null（不序列化）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupInfo(
        String name,
        String pattern,
        String description,
        boolean userHasAccess,
        List<String> users
) {
}
