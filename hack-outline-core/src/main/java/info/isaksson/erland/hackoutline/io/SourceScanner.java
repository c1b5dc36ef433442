package info.isaksson.erland.hackoutline.io;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Deterministic discovery of Hack/PHP sources ({@code .php}, {@code .hh}, {@code .hack},
 * {@code .hck}) under a root folder.
 *
 * The scanner returns a stable list sorted by relative path.
 */
public final class SourceScanner {

    public static final Set<String> EXTENSIONS = Set.of(".php", ".hh", ".hack", ".hck");

    private SourceScanner() {}

    /**
     * Scan for Hack sources under {@code root}.
     *
     * @param root root folder to scan
     * @param excludeGlobs glob patterns matched against the path relative to root, using '/' separators
     */
    public static List<Path> scan(Path root, List<String> excludeGlobs) throws IOException {
        Objects.requireNonNull(root, "root");

        final List<Predicate<Path>> excludeMatchers = compileExcludeMatchers(excludeGlobs);

        try (Stream<Path> stream = Files.walk(root)) {
            List<Path> out = new ArrayList<>();
            stream
                .filter(Files::isRegularFile)
                .filter(SourceScanner::isHackSource)
                .filter(p -> !isInCommonBuildDir(root, p))
                .filter(p -> !matchesAny(root, p, excludeMatchers))
                .forEach(out::add);

            out.sort(Comparator.comparing(p -> relativeName(root, p)));
            return out;
        }
    }

    public static boolean isHackSource(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot > 0 && EXTENSIONS.contains(name.substring(dot));
    }

    /** Path of {@code file} relative to {@code root}, with '/' separators. */
    public static String relativeName(Path root, Path file) {
        return normalizePathString(root.relativize(file));
    }

    private static boolean matchesAny(Path root, Path absolutePath, List<Predicate<Path>> matchers) {
        if (matchers.isEmpty()) return false;
        final Path rel = root.relativize(absolutePath);
        for (Predicate<Path> m : matchers) {
            if (m.test(rel)) return true;
        }
        return false;
    }

    private static List<Predicate<Path>> compileExcludeMatchers(List<String> excludeGlobs) {
        if (excludeGlobs == null || excludeGlobs.isEmpty()) return Collections.emptyList();

        FileSystem fs = FileSystems.getDefault();
        List<Predicate<Path>> out = new ArrayList<>();
        for (String raw : excludeGlobs) {
            if (raw == null) continue;
            String pattern = raw.trim();
            if (pattern.isEmpty()) continue;

            pattern = pattern.replace("\\", "/");

            // A plain name excludes that file or everything under that directory.
            if (!pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[") && !pattern.endsWith("/")) {
                final var exact = fs.getPathMatcher("glob:" + pattern);
                out.add(p -> exact.matches(Path.of(normalizePathString(p))));
                pattern = pattern + "/**";
            }

            final var matcher = fs.getPathMatcher("glob:" + pattern);
            out.add(p -> matcher.matches(Path.of(normalizePathString(p))));
        }
        return out;
    }

    private static boolean isInCommonBuildDir(Path root, Path absolutePath) {
        String rel = relativeName(root, absolutePath);
        return rel.startsWith("target/")
                || rel.startsWith("build/")
                || rel.startsWith(".git/")
                || rel.startsWith(".hg/")
                || rel.startsWith(".idea/")
                || rel.startsWith("node_modules/");
    }

    private static String normalizePathString(Path p) {
        return p.toString().replace("\\", "/");
    }
}
