package com.docmend.core.corpus;

import com.docmend.core.model.DocumentFile;
import com.docmend.core.model.DocumentSection;
import com.docmend.core.model.RelevantSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of the documentation corpus under {@code docmend.corpus.root}.
 * <p>
 * Files are re-read from disk on every call, so the index always reflects the
 * result of the latest apply. Common build-tool and IDE directories are skipped.
 */
@Service
public class CorpusIndex {

    private static final Logger log = LoggerFactory.getLogger(CorpusIndex.class);

    /** Directories to skip during the walk. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "__pycache__", ".gradle", "dist", "out", ".mvn", ".next"
    );

    private final Path root;
    private final List<PathMatcher> includes;

    public CorpusIndex(CorpusProperties properties) {
        Path configured = Path.of(properties.getRoot()).toAbsolutePath().normalize();
        if (!Files.isDirectory(configured)) {
            throw new IllegalStateException("Corpus root does not exist or is not a directory: " + configured);
        }
        try {
            this.root = configured.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot resolve corpus root " + configured, e);
        }
        this.includes = matchersFor(properties.getInclude());
        log.info("Corpus index rooted at {} (include {})", root, properties.getInclude());
    }

    public Path root() {
        return root;
    }

    /**
     * Lists every readable document under the root, sorted by relative path.
     * Unreadable files are logged and skipped.
     */
    public List<DocumentFile> listFiles() {
        var files = new ArrayList<DocumentFile>();
        for (Path path : walk()) {
            try {
                files.add(read(path));
            } catch (IOException | UncheckedIOException e) {
                log.warn("Skipping unreadable document {}: {}", path, e.getMessage());
            }
        }
        return files;
    }

    /**
     * Loads a single document by corpus-relative path.
     */
    public Optional<DocumentFile> load(String relativePath) {
        return resolve(relativePath).flatMap(path -> {
            try {
                return Optional.of(read(path));
            } catch (IOException | UncheckedIOException e) {
                log.warn("Cannot read document {}: {}", relativePath, e.getMessage());
                return Optional.empty();
            }
        });
    }

    /**
     * Resolves a corpus-relative path to an existing regular file inside the root.
     * Absolute paths, {@code ..} escapes and symlinks leading outside the root resolve
     * to empty.
     */
    public Optional<Path> resolve(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return Optional.empty();
        }
        try {
            Path candidate = Path.of(relativePath);
            if (candidate.isAbsolute()) {
                return Optional.empty();
            }
            Path resolved = root.resolve(candidate).normalize();
            if (!resolved.startsWith(root) || !Files.isRegularFile(resolved)) {
                return Optional.empty();
            }
            Path real = resolved.toRealPath();
            return real.startsWith(root) ? Optional.of(real) : Optional.empty();
        } catch (InvalidPathException | IOException e) {
            log.debug("Cannot resolve {} inside corpus: {}", relativePath, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Returns the corpus-relative form of an absolute path inside the root.
     */
    public String relativize(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    /**
     * Scores sections by how many query keywords appear in their title or body and
     * returns the best ones, highest score first.
     */
    public List<RelevantSection> findRelevantSections(String query, int limit) {
        List<String> keywords = QueryKeywords.of(query);
        if (keywords.isEmpty() || limit <= 0) {
            return List.of();
        }
        var relevant = new ArrayList<RelevantSection>();
        for (DocumentFile file : listFiles()) {
            for (DocumentSection section : file.sections()) {
                String text = (section.title() + " " + section.content()).toLowerCase(Locale.ROOT);
                int score = (int) keywords.stream().filter(text::contains).count();
                if (score > 0) {
                    relevant.add(new RelevantSection(file.path(), section, score));
                }
            }
        }
        relevant.sort(Comparator.comparingInt(RelevantSection::score).reversed()
                .thenComparing(RelevantSection::filePath)
                .thenComparingInt(r -> r.section().startLine()));
        return relevant.size() > limit ? List.copyOf(relevant.subList(0, limit)) : relevant;
    }

    /**
     * Builds a compact listing of file paths and their headings, truncated to
     * {@code maxChars}, for use in prompts.
     */
    public String outline(int maxChars) {
        var sb = new StringBuilder();
        for (DocumentFile file : listFiles()) {
            var entry = new StringBuilder(file.path()).append('\n');
            for (DocumentSection section : file.sections()) {
                entry.append("  ".repeat(section.level() - 1))
                        .append("- ").append(section.title())
                        .append(" (line ").append(section.startLine()).append(")\n");
            }
            if (sb.length() + entry.length() > maxChars) {
                sb.append("...\n");
                break;
            }
            sb.append(entry);
        }
        return sb.toString();
    }

    private List<Path> walk() {
        try (var stream = Files.walk(root)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> !shouldIgnore(p))
                    .filter(this::isIncluded)
                    .sorted(Comparator.comparing(this::relativize))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk corpus root " + root, e);
        }
    }

    private DocumentFile read(Path path) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        List<String> lines = TextLines.split(content);
        return new DocumentFile(
                relativize(path),
                path.getFileName().toString(),
                content,
                lines.size(),
                SectionExtractor.extract(lines)
        );
    }

    private boolean isIncluded(Path path) {
        Path relative = root.relativize(path);
        return includes.stream().anyMatch(m -> m.matches(relative));
    }

    /**
     * Returns {@code true} if any component of the path matches {@link #IGNORE_DIRS}.
     */
    private boolean shouldIgnore(Path path) {
        for (Path component : root.relativize(path)) {
            if (IGNORE_DIRS.contains(component.toString())) return true;
        }
        return false;
    }

    private static List<PathMatcher> matchersFor(String glob) {
        var matchers = new ArrayList<PathMatcher>();
        matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
        // "**/" requires at least one directory; also accept files directly under the root
        if (glob.startsWith("**/")) {
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
        }
        return matchers;
    }
}
