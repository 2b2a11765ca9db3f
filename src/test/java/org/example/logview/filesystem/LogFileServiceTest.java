package org.example.logview.filesystem;

import org.example.logview.filesystem.dto.DirectoryListResult;
import org.example.logview.filesystem.dto.FileEntry;
import org.example.logview.filesystem.dto.GroupInfo;
import org.example.logview.filesystem.dto.GroupsOverviewResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.example.logview.filesystem.LogViewFixtures.group;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class LogFileServiceTest {

    @TempDir
    Path tempDir;

    private Path root;
    private LogViewSettings settings;
    private LogFileService service;

    @BeforeEach
    void setUp() throws IOException {
        root = LogViewFixtures.realPath(tempDir);
        Files.createDirectories(root.resolve("app"));
        Files.writeString(root.resolve("app/x.log"), "one\ntwo\n");
        Files.writeString(root.resolve("auth.log"), "auth\n");
        settings = LogViewFixtures.settings(root,
                group("all", ".*", "admin"),
                group("app", "^app/.*\\.log$", "admin", "dev"));
        service = LogViewFixtures.service(settings);
    }


    @Test
    void listDirectory_reportsFilesAndUserGroups() {
        DirectoryListResult result = service.listDirectory("dev", "app");

        assertThat(result.directory()).isEqualTo("app");
        assertThat(result.files()).extracting(FileEntry::name).containsExactly("x.log");
        assertThat(result.userGroups()).containsExactly("app");
    }

    @Test
    void listDirectory_nullDirectoryMeansRoot() {
        DirectoryListResult result = service.listDirectory("admin", null);

        assertThat(result.directory()).isEmpty();
        assertThat(result.files()).extracting(FileEntry::name).containsExactly("app", "auth.log");
    }

    @Test
    void resolveAccessibleGroups_usesCanonicalPath() {
        assertThat(service.resolveAccessibleGroups("admin", "app/x.log")).containsExactly("all", "app");
        assertThat(service.resolveAccessibleGroups("dev", "/app/./x.log")).containsExactly("app");
        assertThat(service.resolveAccessibleGroups("dev", "auth.log")).isEmpty();
        assertThat(service.resolveAccessibleGroups("nobody", "app/x.log")).isEmpty();
        assertThatThrownBy(() -> service.resolveAccessibleGroups("admin", "../x.log"))
                .isInstanceOf(LogViewException.class)
                .extracting(e -> ((LogViewException) e).getKind())
                .isEqualTo(ErrorKind.OUT_OF_BOUNDS_PATH);
    }

    @Test
    void fileOperations_rejectSymlinkOutOfRootReachedThroughMissingDirectory() throws IOException {
        Path outside = Files.createTempDirectory("logview-outside");
        Path secret = Files.writeString(outside.resolve("secret.log"), "TOP SECRET\n");
        try {
            Files.createSymbolicLink(root.resolve("escape.log"), secret);
        } catch (IOException | UnsupportedOperationException e) {
            assumeTrue(false, "symlinks not supported");
        }

        for (String path : new String[]{"escape.log", "nope/../escape.log", "/nope/../escape.log"}) {
            assertOutOfBounds(() -> service.readFilePage("admin", path, 1, 10));
            assertOutOfBounds(() -> service.resolveDownload("admin", path));
            assertOutOfBounds(() -> service.resolveAccessibleGroups("admin", path));
        }
    }

    @Test
    void groupsOverview_showsMembersOnlyForOwnGroups() {
        GroupsOverviewResult overview = service.groupsOverview("dev");

        assertThat(overview.userGroups()).containsExactly("app");
        assertThat(overview.basePath()).isEqualTo(root.toString());
        assertThat(overview.groups()).extracting(GroupInfo::name).containsExactly("all", "app");

        GroupInfo all = overview.groups().get(0);
        assertThat(all.userHasAccess()).isFalse();
        assertThat(all.users()).isNull();
        assertThat(all.pattern()).isEqualTo(".*");

        GroupInfo app = overview.groups().get(1);
        assertThat(app.userHasAccess()).isTrue();
        assertThat(app.users()).containsExactlyInAnyOrder("admin", "dev");
    }

    @Test
    void userInfo_listsMemberships() {
        assertThat(service.userInfo("admin").groups()).containsExactly("all", "app");
        assertThat(service.userInfo("guest").groups()).isEmpty();
        assertThat(service.userGroups("dev")).containsExactly("app");
    }

    @Test
    void resolveDownload_appliesSameChecksAsTail() throws IOException {
        LogFileService.DownloadTarget target = service.resolveDownload("dev", "app/x.log");

        assertThat(target.file()).isEqualTo(root.resolve("app/x.log"));
        assertThat(target.fileName()).isEqualTo("x.log");
        assertThat(target.sizeBytes()).isEqualTo(8);

        assertThatThrownBy(() -> service.resolveDownload("dev", "auth.log"))
                .isInstanceOf(LogViewException.class)
                .extracting(e -> ((LogViewException) e).getKind())
                .isEqualTo(ErrorKind.ACCESS_DENIED);
        assertThatThrownBy(() -> service.resolveDownload("admin", "app"))
                .isInstanceOf(LogViewException.class)
                .extracting(e -> ((LogViewException) e).getKind())
                .isEqualTo(ErrorKind.NOT_A_FILE);
    }

    @Test
    void resolveDownload_isNotBoundByPageReadSizeLimit() throws IOException {
        Files.write(root.resolve("app/big.log"), new byte[(int) settings.maxFileBytes() + 1]);

        assertThat(service.resolveDownload("dev", "app/big.log").sizeBytes()).isGreaterThan(settings.maxFileBytes());
        assertThatThrownBy(() -> service.readFilePage("dev", "app/big.log", 1, null))
                .isInstanceOf(LogViewException.class)
                .extracting(e -> ((LogViewException) e).getKind())
                .isEqualTo(ErrorKind.TOO_LARGE);
    }

    private static void assertOutOfBounds(Runnable action) {
        assertThatThrownBy(action::run)
                .isInstanceOf(LogViewException.class)
                .extracting(e -> ((LogViewException) e).getKind())
                .isEqualTo(ErrorKind.OUT_OF_BOUNDS_PATH);
    }
}
