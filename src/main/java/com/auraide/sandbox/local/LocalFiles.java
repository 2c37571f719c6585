package com.auraide.sandbox.local;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Directory helpers for the local provider.
 */
final class LocalFiles {

    private static final Logger log = LoggerFactory.getLogger(LocalFiles.class);

    private LocalFiles() {}

    /**
     * Resolves a sandbox-relative path, rejecting anything outside {@code root}.
     */
    static Path resolveWithin(Path root, String relative) {
        String cleaned = relative == null ? "" : relative.replace('\\', '/');
        while (cleaned.startsWith("/")) {
            cleaned = cleaned.substring(1);
        }
        Path resolved = root.resolve(cleaned).normalize();
        if (!resolved.startsWith(root.normalize())) {
            throw new IllegalArgumentException("Path escapes the sandbox root: " + relative);
        }
        return resolved;
    }

    static String relativize(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    static void deleteRecursively(Path path) throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Removes everything inside {@code dir}, keeping the directory itself.
     */
    static void clearDirectory(Path dir) throws IOException {
        try (var children = Files.list(dir)) {
            for (Path child : children.toList()) {
                deleteRecursively(child);
            }
        }
    }

    /**
     * Copies a tree into {@code target}, skipping source paths rejected by {@code include}.
     */
    static void copyTree(Path source, Path target, Predicate<Path> include) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(source) && !include.test(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (include.test(file)) {
                    Files.copy(file, target.resolve(source.relativize(file).toString()),
                            StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    static long sizeOf(Path dir) {
        AtomicLong total = new AtomicLong();
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    total.addAndGet(attrs.size());
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (NoSuchFileException e) {
            return 0;
        } catch (IOException e) {
            log.debug("Could not size {}: {}", dir, e.getMessage());
        }
        return total.get();
    }

    /**
     * Octal mode string such as {@code 644}; {@code 644}/{@code 755} on filesystems without POSIX attributes.
     */
    static String permissions(Path path, boolean directory) {
        try {
            Set<PosixFilePermission> perms = Files.getPosixFilePermissions(path);
            int mode = 0;
            for (PosixFilePermission perm : perms) {
                mode |= switch (perm) {
                    case OWNER_READ -> 0400;
                    case OWNER_WRITE -> 0200;
                    case OWNER_EXECUTE -> 0100;
                    case GROUP_READ -> 040;
                    case GROUP_WRITE -> 020;
                    case GROUP_EXECUTE -> 010;
                    case OTHERS_READ -> 04;
                    case OTHERS_WRITE -> 02;
                    case OTHERS_EXECUTE -> 01;
                };
            }
            String octal = Integer.toOctalString(mode);
            return "0".repeat(Math.max(0, 3 - octal.length())) + octal;
        } catch (UnsupportedOperationException | IOException e) {
            return directory ? "755" : "644";
        }
    }

    /**
     * Applies an octal mode such as {@code 750}. No-op on filesystems without POSIX attributes.
     */
    static void applyPermissions(Path path, String octal) throws IOException {
        int mode;
        try {
            mode = Integer.parseInt(octal, 8);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid permissions: " + octal, e);
        }
        StringBuilder symbolic = new StringBuilder();
        String flags = "rwxrwxrwx";
        for (int i = 0; i < 9; i++) {
            symbolic.append((mode & (1 << (8 - i))) != 0 ? flags.charAt(i) : '-');
        }
        try {
            Files.setPosixFilePermissions(path, PosixFilePermissions.fromString(symbolic.toString()));
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions not supported for {}", path);
        }
    }
}
