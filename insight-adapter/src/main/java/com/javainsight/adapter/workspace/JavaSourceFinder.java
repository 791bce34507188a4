package com.javainsight.adapter.workspace;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Finds files under a workspace root, skipping excluded directory names at any depth.
 * Results are sorted by path.
 */
public class JavaSourceFinder {

    private final Set<String> excludedDirs;

    public JavaSourceFinder(Collection<String> excludedDirs) {
        this.excludedDirs = Set.copyOf(excludedDirs);
    }

    public List<Path> findByFileName(Path root, String fileName) {
        return find(root, file -> file.getFileName().toString().equals(fileName));
    }

    public List<Path> findByExtension(Path root, String extension) {
        return find(root, file -> file.getFileName().toString().endsWith(extension));
    }

    /**
     * Files ending in {@code extension} with a directory named {@code segment} somewhere
     * between {@code root} and the file, e.g. {@code jni/**}{@code /*.cpp}.
     */
    public List<Path> findByExtensionUnder(Path root, String segment, String extension) {
        return find(root, file -> {
            if (!file.getFileName().toString().endsWith(extension)) {
                return false;
            }
            Path parent = root.relativize(file).getParent();
            if (parent == null) {
                return false;
            }
            for (Path part : parent) {
                if (part.toString().equals(segment)) {
                    return true;
                }
            }
            return false;
        });
    }

    private List<Path> find(Path root, Predicate<Path> accept) {
        if (!Files.isDirectory(root)) {
            return Collections.emptyList();
        }
        List<Path> found = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && excludedDirs.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && accept.test(file)) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    System.err.println("[java-insight] Warning: cannot access " + file + ": " + e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            System.err.println("[java-insight] Warning: could not walk " + root + ": " + e.getMessage());
        }
        Collections.sort(found);
        return found;
    }
}
