package org.example.logview.access;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 基于组的授权引擎。
 * <p>
 * 规则：用户可以访问某个路径，当且仅当存在至少一个组同时满足
 * <ul>
 *   <li>用户是该组成员；</li>
 *   <li>该组的模式从路径开头匹配该路径。</li>
 * </ul>
 * 授权是所有组的并集，没有任何“管理员全放行”的概念。
 * <p>
 * 该类无状态、线程安全：组定义在构造后不可变。
 */
public class GroupAuthorizer {

    private final List<GroupDefinition> groups;

    public GroupAuthorizer(List<GroupDefinition> groups) {
        this.groups = List.copyOf(groups);
    }

    public List<GroupDefinition> groups() {
        return groups;
    }

    /**
     * 用户所属的组名（与路径无关），按配置顺序返回。
     */
    public Set<String> userGroups(String username) {
        if (username == null || username.isEmpty()) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (GroupDefinition group : groups) {
            if (group.hasMember(username)) {
                result.add(group.name());
            }
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * 同时“包含该用户”且“匹配该路径”的组名；没有匹配时返回空集合而不是抛异常，
     * 由调用方在边界处把空集合转换为拒绝访问。
     *
     * @param relativePath 已经过 {@code SecurePathResolver} 规范化的相对路径（使用 / 分隔）
     */
    public Set<String> accessibleGroups(String username, String relativePath) {
        List<GroupDefinition> memberOf = memberGroups(username);
        if (memberOf.isEmpty() || relativePath == null) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (GroupDefinition group : memberOf) {
            if (group.matches(relativePath)) {
                result.add(group.name());
            }
        }
        return Collections.unmodifiableSet(result);
    }

    public boolean canAccess(String username, String relativePath) {
        return !accessibleGroups(username, relativePath).isEmpty();
    }

    private List<GroupDefinition> memberGroups(String username) {
        if (username == null || username.isEmpty()) {
            return List.of();
        }
        List<GroupDefinition> result = new ArrayList<>();
        for (GroupDefinition group : groups) {
            if (group.hasMember(username)) {
                result.add(group);
            }
        }
        return result;
    }
}
