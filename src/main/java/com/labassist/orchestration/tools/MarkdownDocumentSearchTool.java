package com.labassist.orchestration.tools;

import com.labassist.config.LabAssistantProperties;
import com.labassist.orchestration.model.DocHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * {@code search_docs} over a directory of Markdown files.
 */
@Component
@Slf4j
public class MarkdownDocumentSearchTool implements DocumentSearchTool {

    static final int MAX_SNIPPET = 300;

    private final Path docsRoot;
    private final int maxResults;

    public MarkdownDocumentSearchTool(LabAssistantProperties properties) {
        this.docsRoot = Paths.get(properties.getDocs().getPath()).toAbsolutePath().normalize();
        this.maxResults = Math.max(1, properties.getDocs().getMaxResults());
    }

    @Override
    public List<DocHit> search(String query) {
        List<String> keywords = QueryKeywords.of(query);
        if (keywords.isEmpty()) {
            return List.of();
        }
        if (!Files.isDirectory(docsRoot)) {
            log.warn("Documentation directory {} does not exist.", docsRoot);
            return List.of();
        }
        List<Path> files;
        try {
            files = listMarkdownFiles();
        } catch (IOException | UncheckedIOException ex) {
            throw new ToolUnavailableException(ToolName.SEARCH_DOCS,
                    "Documentation corpus could not be read: " + ex.getMessage(), ex);
        }
        List<ScoredDoc> scored = new ArrayList<>();
        for (Path file : files) {
            ParsedDoc doc = parse(file);
            if (doc == null) {
                continue;
            }
            int score = score(doc, keywords);
            if (score > 0) {
                scored.add(new ScoredDoc(doc, score));
            }
        }
        return scored.stream()
                .sorted(Comparator.comparingInt(ScoredDoc::score).reversed()
                        .thenComparing(s -> s.doc().filename()))
                .limit(maxResults)
                .map(s -> new DocHit(s.doc().filename(), s.doc().title(), s.doc().snippet(), s.doc().keyPoints()))
                .toList();
    }

    List<Path> listMarkdownFiles() throws IOException {
        try (Stream<Path> stream = Files.walk(docsRoot)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".md"))
                    .toList();
        }
    }

    /**
     * @return the parsed document, or {@code null} when the file cannot be read as UTF-8
     */
    private ParsedDoc parse(Path file) {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException ex) {
            log.warn("Skipping unreadable document {}: {}", file, ex.toString());
            return null;
        }
        String filename = docsRoot.relativize(file).toString().replace("\\", "/");
        String title = null;
        StringBuilder snippet = new StringBuilder();
        boolean snippetDone = false;
        List<String> keyPoints = new ArrayList<>();

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (title == null && line.startsWith("# ")) {
                title = line.substring(2).trim();
                continue;
            }
            if (line.startsWith("- ") || line.startsWith("* ")) {
                keyPoints.add(line.substring(2).trim());
                if (snippet.length() > 0) {
                    snippetDone = true;
                }
                continue;
            }
            if (line.isEmpty() || line.startsWith("#")) {
                if (snippet.length() > 0) {
                    snippetDone = true;
                }
                continue;
            }
            if (!snippetDone) {
                if (snippet.length() > 0) {
                    snippet.append(' ');
                }
                snippet.append(line);
            }
        }
        if (!StringUtils.hasText(title)) {
            title = file.getFileName().toString();
        }
        String snippetText = snippet.length() <= MAX_SNIPPET ? snippet.toString() : snippet.substring(0, MAX_SNIPPET);
        return new ParsedDoc(filename, title, snippetText, keyPoints, content.toLowerCase(Locale.ROOT));
    }

    private static int score(ParsedDoc doc, List<String> keywords) {
        String title = doc.title().toLowerCase(Locale.ROOT);
        int score = 0;
        for (String keyword : keywords) {
            if (doc.lowerContent().contains(keyword)) {
                score += 1;
            }
            if (title.contains(keyword)) {
                score += 2;
            }
        }
        return score;
    }

    private record ParsedDoc(String filename, String title, String snippet, List<String> keyPoints,
                             String lowerContent) {
    }

    private record ScoredDoc(ParsedDoc doc, int score) {
    }
}
