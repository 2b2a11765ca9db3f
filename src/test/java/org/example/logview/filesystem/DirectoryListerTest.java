package org.example.logview.filesystem;

import org.example.logview.access.GroupAuthorizer;
import org.example.logview.filesystem.dto.FileEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.example.logview.filesystem.LogViewFixtures.group;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class DirectoryListerTest {

    @TempDir
    Path tempDir;

    private Path root;
    private DirectoryLister lister;

    @BeforeEach
    void setUp() throws IOException {
        root = LogViewFixtures.realPath(tempDir);
        Files.createDirectories(root.resolve("app"));
        Files.writeString(root.resolve("app/b.log"), "bb\n");
        Files.writeString(root.resolve("app/a.log"), "a\n");
        Files.writeString(root.resolve("app/notes.txt"), "n\n");
        Files.writeString(root.resolve("auth.log"), "auth\n");
        Files.writeString(root.resolve("syslog"), "sys\n");

        LogViewSettings settings = LogViewFixtures.settings(root,
                group("app", "^app/.*\\.log$", "dev", "ops"),
                group("root-logs", "^(app|auth\\.log$)", "ops"));
        GroupAuthorizer authorizer = new GroupAuthorizer(settings.groups());
        lister = new DirectoryLister(new SecurePathResolver(settings.root()), authorizer);
    }

    @Test
    void list_filtersEachEntryAndSortsByName() {
        List<FileEntry> entries = lister.list("dev", "app");

        assertThat(entries).extracting(FileEntry::name).containsExactly("a.log", "b.log");
        assertThat(entries).extracting(FileEntry::path).containsExactly("app/a.log", "app/b.log");
        FileEntry b = entries.get(1);
        assertThat(b.sizeBytes()).isEqualTo(3);
        assertThat(b.file()).isTrue();
        assertThat(b.readable()).isTrue();
        assertThat(b.modifiedAt()).isNotNull();
    }

    @Test
    void list_rootShowsOnlyEntriesWhosePathMatches() {
        assertThat(lister.list("ops", "")).extracting(FileEntry::name).containsExactly("app", "auth.log");
        assertThat(lister.list("ops", "/")).extracting(FileEntry::name).containsExactly("app", "auth.log");
        // "app" 目录本身不匹配 ^app/.*\.log$
        assertThat(lister.list("dev", "")).isEmpty();
    }

    @Test
    void list_directoryEntryIsNotAFile() {
        FileEntry app = lister.list("ops", "").get(0);

        assertThat(app.name()).isEqualTo("app");
        assertThat(app.file()).isFalse();
    }

    @Test
    void list_skipsSymlinksLeavingRootAndKeepsThoseInside() throws IOException {
        Path outside = Files.createTempDirectory("logview-outside");
        Path secret = Files.writeString(outside.resolve("secret.log"), "0123456789");
        try {
            Files.createSymbolicLink(root.resolve("app/escape.log"), secret);
            Files.createSymbolicLink(root.resolve("app/current.log"), root.resolve("app/b.log"));
        } catch (IOException | UnsupportedOperationException e) {
            assumeTrue(false, "symlinks not supported");
        }

        List<FileEntry> entries = lister.list("dev", "app");

        assertThat(entries).extracting(FileEntry::name).containsExactly("a.log", "b.log", "current.log");
        FileEntry current = entries.get(2);
        assertThat(current.path()).isEqualTo("app/current.log");
        assertThat(current.sizeBytes()).isEqualTo(3);
        assertThat(current.file()).isTrue();
    }

    @Test
    void list_userWithoutGroupsGetsEmptyListWithoutTouchingFilesystem() {
        assertThat(lister.list("guest", "app")).isEmpty();
        assertThat(lister.list("guest", "does/not/exist")).isEmpty();
        assertThat(lister.list("guest", "../../etc")).isEmpty();
    }

    @Test
    void list_failsForMissingDirectory() {
        assertKind(() -> lister.list("dev", "missing"), ErrorKind.NOT_FOUND);
    }

    @Test
    void list_failsForFile() {
        assertKind(() -> lister.list("dev", "auth.log"), ErrorKind.NOT_A_DIRECTORY);
    }

    @Test
    void list_failsForPathOutsideRoot() {
        assertKind(() -> lister.list("dev", "../.."), ErrorKind.OUT_OF_BOUNDS_PATH);
    }

    private static void assertKind(Runnable action, ErrorKind kind) {
        assertThatThrownBy(action::run)
                .isInstanceOf(LogViewException.class)
                .extracting(e -> ((LogViewException) e).getKind())
                .isEqualTo(kind);
    }
}
