package org.example.logview.access;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 一个授权组：文件路径正则 + 成员用户名集合。
 * <p>
 * 正则在构造时已编译（配置加载阶段），请求期间不会再出现“模式非法”的情况。
 *
 * @param name        组名（在同一份配置中唯一）
 * @param pattern     相对根目录路径的匹配模式（从路径开头匹配，不要求匹配到结尾）
 * @param members     成员用户名
 * @param description 可选描述
 */
public record GroupDefinition(
        String name,
        Pattern pattern,
        Set<String> members,
        String description
) {

    public GroupDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        members = (members == null) ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(members));
    }

    /**
     * 按“锚定开头、不锚定结尾”的语义匹配路径。
     * <p>
     * 例如模式 {@code app} 会匹配 {@code app/x.log}，也会匹配 {@code application.log}；
     * 需要整串匹配时请在模式末尾显式加 {@code $}。
     */
    public boolean matches(String relativePath) {
        return pattern.matcher(relativePath).lookingAt();
    }

    public boolean hasMember(String username) {
        return members.contains(username);
    }
}
