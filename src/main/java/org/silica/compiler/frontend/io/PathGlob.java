package org.silica.compiler.frontend.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands file path patterns the way library maps and command lines write them.
 * <p>
 * {@code *} and {@code ?} match within one path segment, a {@code ...} segment matches
 * any number of directory levels, and a trailing {@code /} stands for every file in
 * the named directory. Relative patterns are resolved against a base directory.
 */
public final class PathGlob {

    private static final Pattern ENV_VAR = Pattern.compile("\\$(?:\\{([^}]*)\\}|\\(([^)]*)\\)|([A-Za-z_][A-Za-z0-9_]*))");
    private static final String RECURSIVE = "...";

    private PathGlob() {}

    /**
     * Expands a pattern, reading environment variables from the process environment.
     *
     * @param basePath      The directory relative patterns resolve against, or {@code null} for the working directory.
     * @param pattern       The pattern to expand.
     * @param mode          Whether files or directories are wanted.
     * @param expandEnvVars Whether {@code $VAR}, {@code ${VAR}} and {@code $(VAR)} are substituted first.
     * @return The ranked matches.
     * @throws IOException If the pattern is malformed, or names a literal path that does not exist.
     */
    public static GlobResult expand(Path basePath, String pattern, GlobMode mode, boolean expandEnvVars) throws IOException {
        return expand(basePath, pattern, mode, expandEnvVars, System::getenv);
    }

    /**
     * Expands a pattern using the given environment lookup.
     *
     * @param basePath      The directory relative patterns resolve against, or {@code null} for the working directory.
     * @param pattern       The pattern to expand.
     * @param mode          Whether files or directories are wanted.
     * @param expandEnvVars Whether environment variables are substituted first.
     * @param environment   Resolves variable names; may return {@code null} for unset variables.
     * @return The ranked matches.
     * @throws IOException If the pattern is malformed, or names a literal path that does not exist.
     */
    public static GlobResult expand(Path basePath, String pattern, GlobMode mode, boolean expandEnvVars,
                                    Function<String, String> environment) throws IOException {
        String text = expandEnvVars ? expandEnvVars(pattern, environment) : pattern;
        if (text == null || text.isBlank()) {
            throw new IOException("Empty path pattern");
        }
        text = text.trim().replace('\\', '/');

        try {
            return expandNormalized(basePath, text, mode);
        } catch (InvalidPathException e) {
            throw new IOException("Invalid path pattern '" + pattern + "': " + e.getMessage(), e);
        }
    }

    /**
     * Substitutes {@code $VAR}, {@code ${VAR}} and {@code $(VAR)} references. Unset variables expand to nothing.
     *
     * @param text        The text to expand.
     * @param environment Resolves variable names.
     * @return The expanded text.
     */
    public static String expandEnvVars(String text, Function<String, String> environment) {
        var matcher = ENV_VAR.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1) != null ? matcher.group(1)
                    : matcher.group(2) != null ? matcher.group(2) : matcher.group(3);
            String value = environment.apply(name);
            matcher.appendReplacement(sb, java.util.regex.Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static GlobResult expandNormalized(Path basePath, String text, GlobMode mode) throws IOException {
        boolean directoryPattern = text.endsWith("/") && text.length() > 1;

        Path root;
        String rest;
        if (text.startsWith("/")) {
            root = Path.of("/");
            rest = text.substring(1);
        } else if (text.length() >= 3 && Character.isLetter(text.charAt(0)) && text.charAt(1) == ':' && text.charAt(2) == '/') {
            root = Path.of(text.substring(0, 3));
            rest = text.substring(3);
        } else {
            root = basePath != null ? basePath : Path.of("");
            rest = text;
        }
        root = root.toAbsolutePath().normalize();

        List<String> segments = new ArrayList<>();
        for (String segment : rest.split("/")) {
            if (!segment.isEmpty() && !segment.equals(".")) {
                segments.add(segment);
            }
        }

        if (!hasWildcards(rest)) {
            return expandLiteral(root.resolve(String.join("/", segments)).normalize(), directoryPattern, mode);
        }

        GlobRank rank = directoryPattern ? GlobRank.DIRECTORY : rankOf(segments.get(segments.size() - 1));
        Predicate<Path> wanted = mode == GlobMode.FILES ? Files::isRegularFile : Files::isDirectory;

        List<Path> current = List.of(root);
        for (int i = 0; i < segments.size(); i++) {
            String segment = segments.get(i);
            boolean last = i == segments.size() - 1 && !directoryPattern;
            Set<Path> next = new LinkedHashSet<>();

            for (Path dir : current) {
                if (!Files.isDirectory(dir)) {
                    continue;
                }
                if (segment.equals(RECURSIVE)) {
                    try (Stream<Path> walk = Files.walk(dir)) {
                        walk.filter(last ? wanted : Files::isDirectory).forEach(next::add);
                    }
                } else if (hasWildcards(segment)) {
                    Pattern regex = toRegex(segment);
                    try (Stream<Path> children = Files.list(dir)) {
                        children.filter(p -> regex.matcher(p.getFileName().toString()).matches())
                                .filter(last ? wanted : Files::isDirectory)
                                .forEach(next::add);
                    }
                } else {
                    Path child = dir.resolve(segment).normalize();
                    if (last ? wanted.test(child) : Files.isDirectory(child)) {
                        next.add(child);
                    }
                }
            }
            current = new ArrayList<>(next);
        }

        if (directoryPattern) {
            current = listDirectories(current, mode);
        }
        return new GlobResult(rank, sorted(current));
    }

    private static GlobResult expandLiteral(Path path, boolean directoryPattern, GlobMode mode) throws IOException {
        if (directoryPattern) {
            if (!Files.isDirectory(path)) {
                throw new NoSuchFileException(path.toString());
            }
            return new GlobResult(GlobRank.DIRECTORY, sorted(listDirectories(List.of(path), mode)));
        }

        if (mode == GlobMode.FILES) {
            if (Files.isRegularFile(path)) {
                return new GlobResult(GlobRank.EXACT_PATH, List.of(path));
            }
            if (Files.isDirectory(path)) {
                throw new IOException(path + " is a directory");
            }
        } else if (Files.isDirectory(path)) {
            return new GlobResult(GlobRank.EXACT_PATH, List.of(path));
        }
        throw new NoSuchFileException(path.toString());
    }

    private static List<Path> listDirectories(List<Path> directories, GlobMode mode) throws IOException {
        if (mode == GlobMode.DIRECTORIES) {
            return directories;
        }
        List<Path> files = new ArrayList<>();
        for (Path dir : directories) {
            try (Stream<Path> children = Files.list(dir)) {
                children.filter(Files::isRegularFile).forEach(files::add);
            }
        }
        return files;
    }

    private static GlobRank rankOf(String fileNameSegment) {
        if (fileNameSegment.equals(RECURSIVE)) {
            return GlobRank.DIRECTORY;
        }
        return hasWildcards(fileNameSegment) ? GlobRank.WILDCARD_NAME : GlobRank.SIMPLE_NAME;
    }

    private static boolean hasWildcards(String text) {
        return text.indexOf('*') >= 0 || text.indexOf('?') >= 0 || text.contains(RECURSIVE);
    }

    private static Pattern toRegex(String segment) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : segment.toCharArray()) {
            if (c == '*' || c == '?') {
                if (!literal.isEmpty()) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? "[^/]*" : "[^/]");
            } else {
                literal.append(c);
            }
        }
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString());
    }

    private static List<Path> sorted(List<Path> paths) {
        return paths.stream()
                .map(p -> p.toAbsolutePath().normalize())
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }
}
