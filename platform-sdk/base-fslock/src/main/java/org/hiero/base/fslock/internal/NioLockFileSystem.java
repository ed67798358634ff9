// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.fslock.internal;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import org.hiero.base.fslock.LockFileSystem;

/**
 * {@link LockFileSystem} on top of {@link Files}. {@link Files#createDirectory} is atomic with respect to other
 * processes on local filesystems.
 */
public final class NioLockFileSystem implements LockFileSystem {

    public static final NioLockFileSystem INSTANCE = new NioLockFileSystem();

    private NioLockFileSystem() {}

    @Override
    @Nullable
    public EntryAttributes stat(@NonNull final Path path) throws IOException {
        try {
            final BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new EntryAttributes(
                    attributes.isDirectory(), attributes.lastModifiedTime().toInstant());
        } catch (final NoSuchFileException e) {
            return null;
        }
    }

    @Override
    public void createParentDirectories(@NonNull final Path path) throws IOException {
        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    @Override
    public void createDirectory(@NonNull final Path path) throws IOException {
        Files.createDirectory(path);
    }

    @Override
    public boolean deleteDirectory(@NonNull final Path path) throws IOException {
        return Files.deleteIfExists(path);
    }

    @Override
    public void setLastModifiedTime(@NonNull final Path path, @NonNull final Instant time) throws IOException {
        Files.setLastModifiedTime(path, FileTime.from(time));
    }
}
