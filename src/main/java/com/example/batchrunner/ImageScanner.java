package com.example.batchrunner;

import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds the images under a set of roots. A file counts as an image when Tika detects an
 * {@code image/*} media type for it.
 */
public class ImageScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageScanner.class);

    private final Tika tika;
    private final boolean followLinks;
    private final List<PathMatcher> fileExcludes;
    private final List<PathMatcher> directoryExcludes;

    public ImageScanner(Tika tika, boolean followLinks, List<String> excludeFilePatterns, List<String> excludeDirectoryPatterns) {
        this.tika = tika;
        this.followLinks = followLinks;
        this.fileExcludes = matchers(excludeFilePatterns);
        this.directoryExcludes = matchers(excludeDirectoryPatterns);
    }

    public static ImageScanner from(RunnerConfig config, Tika tika) {
        return new ImageScanner(tika, config.followLinks(), config.excludeFilePatterns(), config.excludeDirectoryPatterns());
    }

    /**
     * Returns the absolute, normalized paths of all images found, sorted and without duplicates.
     */
    public List<Path> scan(List<Path> roots) throws IOException {
        Set<Path> images = new TreeSet<>();
        Set<FileVisitOption> options = followLinks ? EnumSet.of(FileVisitOption.FOLLOW_LINKS) : EnumSet.noneOf(FileVisitOption.class);
        for (Path root : roots) {
            Path normalizedRoot = root.toAbsolutePath().normalize();
            if (!Files.exists(normalizedRoot)) {
                LOGGER.warn("Root {} does not exist; skipping.", normalizedRoot);
                continue;
            }
            Files.walkFileTree(normalizedRoot, options, Integer.MAX_VALUE, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(normalizedRoot) && matches(directoryExcludes, dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && !matches(fileExcludes, file) && isImage(file)) {
                        images.add(file.toAbsolutePath().normalize());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException ex) {
                    LOGGER.warn("Failed to read {}", file, ex);
                    return FileVisitResult.CONTINUE;
                }
            });
        }
        LOGGER.info("Found {} images under {} roots.", images.size(), roots.size());
        return new ArrayList<>(images);
    }

    private boolean isImage(Path file) {
        try {
            return tika.detect(file).startsWith("image/");
        } catch (IOException ex) {
            LOGGER.warn("Failed to detect media type for {}", file, ex);
            return false;
        }
    }

    private static boolean matches(List<PathMatcher> matchers, Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    private static List<PathMatcher> matchers(List<String> patterns) {
        List<PathMatcher> matchers = new ArrayList<>();
        if (patterns != null) {
            for (String pattern : patterns) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            }
        }
        return List.copyOf(matchers);
    }
}
