package org.example.logview.filesystem;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogViewSettingsTest {

    @TempDir
    Path tempDir;

    private LogViewProperties properties(Path root, LogViewProperties.Group... groups) {
        LogViewProperties properties = new LogViewProperties();
        properties.setRoot(root.toString());
        properties.setGroups(List.of(groups));
        return properties;
    }

    private static LogViewProperties.Group group(String name, String pattern, String... users) {
        LogViewProperties.Group group = new LogViewProperties.Group();
        group.setName(name);
        group.setPattern(pattern);
        group.setUsers(List.of(users));
        return group;
    }

    @Test
    void from_compilesGroupsAndResolvesRoot() {
        LogViewProperties properties = properties(tempDir, group("app", "^app/", " dev ", "", "ops"));
        properties.setMaxFileSize(DataSize.ofKilobytes(8));
        properties.setTailPollInterval(Duration.ofMillis(250));

        LogViewSettings settings = LogViewSettings.from(properties);

        assertThat(settings.root()).isEqualTo(LogViewFixtures.realPath(tempDir));
        assertThat(settings.groups()).hasSize(1);
        assertThat(settings.groups().get(0).members()).containsExactly("dev", "ops");
        assertThat(settings.groups().get(0).matches("app/x.log")).isTrue();
        assertThat(settings.maxFileBytes()).isEqualTo(8192);
        assertThat(settings.tailPollInterval()).isEqualTo(Duration.ofMillis(250));
        assertThat(settings.authHeader()).isEqualTo("X-User");
    }

    @Test
    void from_rejectsInvalidPatternAtLoadTime() {
        LogViewProperties properties = properties(tempDir, group("broken", "app/(unclosed", "dev"));

        assertThatThrownBy(() -> LogViewSettings.from(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("broken");
    }

    @Test
    void from_rejectsDuplicateGroupNames() {
        LogViewProperties properties = properties(tempDir, group("app", "^a/", "u"), group("app", "^b/", "v"));

        assertThatThrownBy(() -> LogViewSettings.from(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("组名重复");
    }

    @Test
    void from_rejectsMissingOrNonDirectoryRoot() throws Exception {
        Path file = Files.writeString(tempDir.resolve("plain.log"), "x");

        assertThatThrownBy(() -> LogViewSettings.from(properties(tempDir.resolve("missing"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("不存在");
        assertThatThrownBy(() -> LogViewSettings.from(properties(file)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("不是目录");
    }

    @Test
    void from_rejectsDefaultPageSizeAboveMaximum() {
        LogViewProperties properties = properties(tempDir);
        properties.setDefaultPageSize(500);
        properties.setMaxPageSize(100);

        assertThatThrownBy(() -> LogViewSettings.from(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("default-page-size");
    }
}
