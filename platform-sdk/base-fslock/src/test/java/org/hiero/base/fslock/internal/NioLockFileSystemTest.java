// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock.internal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import org.hiero.base.fslock.LockFileSystem;
import org.hiero.base.fslock.LockFileSystem.EntryAttributes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NioLockFileSystemTest {

    private final LockFileSystem fileSystem = LockFileSystem.nio();

    @TempDir
    Path tempDir;

    @Test
    void statReportsMissingEntriesAsNull() throws IOException {
        assertThat(fileSystem.stat(tempDir.resolve("missing"))).isNull();
    }

    @Test
    void statDistinguishesDirectoriesFromFiles() throws IOException {
        final Path file = Files.writeString(tempDir.resolve("file"), "x");

        final EntryAttributes directory = fileSystem.stat(tempDir);
        final EntryAttributes regular = fileSystem.stat(file);

        assertThat(directory).isNotNull();
        assertThat(directory.directory()).isTrue();
        assertThat(regular).isNotNull();
        assertThat(regular.directory()).isFalse();
    }

    @Test
    void createDirectoryIsExclusive() throws IOException {
        final Path lock = tempDir.resolve("lock");

        fileSystem.createDirectory(lock);

        assertThat(lock).isDirectory();
        assertThatThrownBy(() -> fileSystem.createDirectory(lock)).isInstanceOf(FileAlreadyExistsException.class);
    }

    @Test
    void createParentDirectoriesLeavesTheLeafAlone() throws IOException {
        final Path lock = tempDir.resolve("a").resolve("b").resolve("lock");

        fileSystem.createParentDirectories(lock);
        fileSystem.createParentDirectories(lock);

        assertThat(lock.getParent()).isDirectory();
        assertThat(lock).doesNotExist();
    }

    @Test
    void deleteDirectoryReportsWhetherItRemovedSomething() throws IOException {
        final Path lock = Files.createDirectory(tempDir.resolve("lock"));

        assertThat(fileSystem.deleteDirectory(lock)).isTrue();
        assertThat(fileSystem.deleteDirectory(lock)).isFalse();
    }

    @Test
    void deleteDirectoryRefusesNonEmptyDirectories() throws IOException {
        final Path lock = Files.createDirectory(tempDir.resolve("lock"));
        Files.writeString(lock.resolve("content"), "x");

        assertThatThrownBy(() -> fileSystem.deleteDirectory(lock)).isInstanceOf(DirectoryNotEmptyException.class);
    }

    @Test
    void setLastModifiedTimeIsVisibleThroughStat() throws IOException {
        final Path lock = Files.createDirectory(tempDir.resolve("lock"));
        final Instant time = Instant.parse("2020-06-01T12:00:00Z");

        fileSystem.setLastModifiedTime(lock, time);

        final EntryAttributes attributes = fileSystem.stat(lock);
        assertThat(attributes).isNotNull();
        assertThat(attributes.lastModifiedTime()).isEqualTo(time);
    }

    @Test
    void setLastModifiedTimeFailsForMissingEntries() {
        assertThatThrownBy(() -> fileSystem.setLastModifiedTime(tempDir.resolve("gone"), Instant.now()))
                .isInstanceOf(NoSuchFileException.class);
    }
}
