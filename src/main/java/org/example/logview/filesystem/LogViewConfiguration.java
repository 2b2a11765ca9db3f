package org.example.logview.filesystem;

import org.example.logview.access.GroupAuthorizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 日志查看服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>把可变的 {@link LogViewProperties} 转换成一次性构造的不可变 {@link LogViewSettings}，
 *   配置错误在这里直接让启动失败。</li>
 *   <li>各组件只通过构造函数拿到配置，不依赖任何全局可变状态。</li>
 *   <li>这里不引入任何数据库/外部依赖，全部基于本地文件系统。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class LogViewConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LogViewConfiguration.class);

    @Bean
    public LogViewSettings logViewSettings(LogViewProperties properties) {
        LogViewSettings settings = LogViewSettings.from(properties);
        log.info("日志根目录：{}，授权组 {} 个", settings.root(), settings.groups().size());
        return settings;
    }

    @Bean
    public SecurePathResolver securePathResolver(LogViewSettings settings) {
        return new SecurePathResolver(settings.root());
    }

    @Bean
    public GroupAuthorizer groupAuthorizer(LogViewSettings settings) {
        return new GroupAuthorizer(settings.groups());
    }

    @Bean
    public DirectoryLister directoryLister(SecurePathResolver pathResolver, GroupAuthorizer authorizer) {
        return new DirectoryLister(pathResolver, authorizer);
    }

    @Bean
    public PaginatedReader paginatedReader(SecurePathResolver pathResolver, GroupAuthorizer authorizer, LogViewSettings settings) {
        return new PaginatedReader(pathResolver, authorizer, settings);
    }

    @Bean
    public TailStreamer tailStreamer(SecurePathResolver pathResolver, GroupAuthorizer authorizer, LogViewSettings settings) {
        return new TailStreamer(pathResolver, authorizer, settings);
    }

    @Bean
    public LogFileService logFileService(LogViewSettings settings, SecurePathResolver pathResolver, GroupAuthorizer authorizer,
                                         DirectoryLister directoryLister, PaginatedReader paginatedReader, TailStreamer tailStreamer) {
        return new LogFileService(settings, pathResolver, authorizer, directoryLister, paginatedReader, tailStreamer);
    }
}
