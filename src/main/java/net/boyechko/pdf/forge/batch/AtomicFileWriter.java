/*
 * PDF-Forge - Batch PDF Document Operations
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.forge.batch;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one job's outputs as a unit. Every output is first staged to a temporary sibling; only
 * when all of them are staged are they renamed into place. A file being replaced is moved aside
 * and restored if any later rename fails, so a failed job never destroys an existing file.
 */
final class AtomicFileWriter {
    private static final Logger logger = LoggerFactory.getLogger(AtomicFileWriter.class);

    private record Staged(Path temp, Path target) {}

    private record Backup(Path target, Path saved) {}

    private final boolean replace;
    private final List<Staged> staged = new ArrayList<>();
    private final List<Path> committed = new ArrayList<>();
    private final List<Backup> backups = new ArrayList<>();

    AtomicFileWriter(boolean replace) {
        this.replace = replace;
    }

    /** Writes {@code bytes} to a temporary file next to {@code target}. */
    void stage(Path target, byte[] bytes) throws IOException {
        if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new IOException(target + " is a directory");
        }
        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, ".pdf-forge-", ".tmp");
        staged.add(new Staged(temp, target));
        Files.write(temp, bytes);
    }

    /**
     * Renames every staged file onto its target. On failure the targets already renamed are
     * removed, replaced files are restored, and the exception is rethrown.
     *
     * @return the final paths, in staging order
     */
    List<Path> commit() throws IOException {
        try {
            for (Staged item : staged) {
                if (replace && Files.exists(item.target(), LinkOption.NOFOLLOW_LINKS)) {
                    Path saved = sidePath(item.target());
                    move(item.target(), saved, false);
                    backups.add(new Backup(item.target(), saved));
                }
                move(item.temp(), item.target(), false);
                committed.add(item.target());
            }
        } catch (IOException e) {
            abort();
            throw e;
        }
        for (Backup backup : backups) {
            deleteQuietly(backup.saved());
        }
        backups.clear();
        staged.clear();
        return List.copyOf(committed);
    }

    /** Undoes everything this writer did: temp files, renamed targets and replaced files. */
    void abort() {
        for (Staged item : staged) {
            deleteQuietly(item.temp());
        }
        for (Path path : committed) {
            deleteQuietly(path);
        }
        for (Backup backup : backups) {
            try {
                move(backup.saved(), backup.target(), true);
            } catch (IOException e) {
                logger.error(
                        "Could not restore {} from {}: {}",
                        backup.target(),
                        backup.saved(),
                        e.getMessage());
            }
        }
        staged.clear();
        committed.clear();
        backups.clear();
    }

    private static Path sidePath(Path target) {
        return target.toAbsolutePath()
                .getParent()
                .resolve(".pdf-forge-" + UUID.randomUUID() + ".bak");
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not remove {}: {}", path, e.getMessage());
        }
    }

    private static void move(Path source, Path target, boolean replace) throws IOException {
        try {
            if (replace) {
                Files.move(
                        source,
                        target,
                        StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
            }
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}; using a plain move", target);
            if (replace) {
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            } else {
                Files.move(source, target);
            }
        }
    }
}
