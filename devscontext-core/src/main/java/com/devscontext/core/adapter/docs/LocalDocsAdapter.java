package com.devscontext.core.adapter.docs;

import com.devscontext.common.constants.DocFileTypes;
import com.devscontext.common.exception.AdapterException;
import com.devscontext.common.util.FileUtils;
import com.devscontext.common.util.TextUtils;
import com.devscontext.core.adapter.SourceAdapter;
import com.devscontext.core.config.DevsContextProperties;
import com.devscontext.core.model.FetchDepth;
import com.devscontext.core.model.SearchResult;
import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.SourceType;
import com.devscontext.core.model.TicketFields;
import com.devscontext.core.model.docs.DocSection;
import com.devscontext.core.model.docs.DocType;
import com.devscontext.core.model.docs.DocsContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Markdown, text and reStructuredText files under the configured directories.
 *
 * <p>Matching runs in three passes: ticket components and labels against file
 * names and headings, title keywords against section bodies, and finally all
 * standards documents, which are included regardless of the ticket.
 */
@Component
@Order(4)
@ConditionalOnProperty(prefix = "devscontext.sources.docs", name = "enabled", havingValue = "true")
@Slf4j
public class LocalDocsAdapter implements SourceAdapter {

    public static final String NAME = "local_docs";

    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+?)\\s*#*\\s*$");
    private static final int MAX_SECTION_CHARS = 4000;
    private static final int MAX_WALK_DEPTH = 10;

    private final DevsContextProperties.Docs config;
    private final Clock clock;

    public LocalDocsAdapter(DevsContextProperties properties, Clock clock) {
        this.config = properties.getSources().getDocs();
        this.clock = clock;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SourceType getSourceType() {
        return SourceType.DOCUMENTATION;
    }

    @Override
    public boolean needsPrimaryContext() {
        return true;
    }

    @Override
    public SourceContext fetchTaskContext(String taskId, SourceContext primaryHint, FetchDepth depth) {
        long startTime = System.currentTimeMillis();
        List<DocSection> all = loadSections();
        TicketFields ticket = TicketFields.from(primaryHint);

        List<DocSection> matched = match(all, ticket, depth.getMaxDocSections());
        List<DocSection> standards = all.stream()
            .filter(s -> s.getDocType() == DocType.STANDARDS)
            .filter(s -> !matched.contains(s))
            .limit(depth.getMaxDocSections())
            .collect(Collectors.toList());

        List<DocSection> sections = new ArrayList<>(matched);
        sections.addAll(standards);

        long duration = System.currentTimeMillis() - startTime;
        log.info("[LOCAL_DOCS] Docs matched | taskId={} | sectionsScanned={} | matched={} | standards={} | durationMs={}",
            taskId, all.size(), matched.size(), standards.size(), duration);

        return SourceContext.builder()
            .sourceName(NAME)
            .sourceType(SourceType.DOCUMENTATION)
            .data(new DocsContext(sections))
            .rawText(format(sections))
            .metadata(Map.of("matchedCount", matched.size(), "standardsCount", standards.size()))
            .fetchedAt(clock.instant())
            .build();
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) {
        List<String> terms = searchTerms(query);
        return rank(terms, true, maxResults).stream()
            .map(scored -> SearchResult.builder()
                .sourceName(NAME)
                .sourceType(SourceType.DOCUMENTATION)
                .title(scored.section().getSectionTitle() + " (" + scored.section().getFilePath() + ")")
                .excerpt(excerptAround(scored.section().getContent(), terms))
                .relevanceScore(Math.min(1.0, (double) scored.hits() / terms.size()))
                .metadata(Map.of("path", scored.section().getFilePath(),
                    "docType", scored.section().getDocType().name()))
                .build())
            .collect(Collectors.toList());
    }

    /**
     * Task-specific sections whose body mentions the query terms, best first.
     * Standards are left out: every fetch attaches them already.
     */
    public List<DocSection> searchSections(String query, int maxResults) {
        return rank(searchTerms(query), false, maxResults).stream()
            .map(ScoredSection::section)
            .collect(Collectors.toList());
    }

    private static List<String> searchTerms(String query) {
        List<String> terms = TextUtils.extractKeywords(query);
        if (terms.isEmpty() && query != null && !query.isBlank()) {
            return List.of(query.toLowerCase(Locale.ROOT).strip());
        }
        return terms;
    }

    private List<ScoredSection> rank(List<String> terms, boolean includeStandards, int maxResults) {
        if (terms.isEmpty()) {
            return List.of();
        }
        return loadSections().stream()
            .filter(section -> includeStandards || section.getDocType() != DocType.STANDARDS)
            .map(section -> new ScoredSection(section, bodyHits(section, terms)))
            .filter(scored -> scored.hits() > 0)
            .sorted(Comparator.comparingInt(ScoredSection::hits).reversed())
            .limit(maxResults)
            .collect(Collectors.toList());
    }

    /**
     * Standards sections, optionally narrowed to an area such as "testing"
     * or "typescript" by path or heading.
     */
    public List<DocSection> findStandards(String area) {
        return loadSections().stream()
            .filter(s -> s.getDocType() == DocType.STANDARDS)
            .filter(s -> area == null || area.isBlank()
                || TextUtils.containsIgnoreCase(s.getFilePath(), area)
                || TextUtils.containsIgnoreCase(s.getSectionTitle(), area))
            .collect(Collectors.toList());
    }

    @Override
    public boolean healthCheck() {
        boolean healthy = !roots().isEmpty() && roots().stream().anyMatch(Files::isDirectory);
        if (!healthy) {
            log.warn("[LOCAL_DOCS] No readable docs directory | paths={}", config.getPaths());
        }
        return healthy;
    }

    List<DocSection> match(List<DocSection> sections, TicketFields ticket, int limit) {
        Set<String> fieldTerms = new LinkedHashSet<>();
        ticket.getComponents().forEach(c -> fieldTerms.add(c.toLowerCase(Locale.ROOT)));
        ticket.getLabels().forEach(l -> fieldTerms.add(l.toLowerCase(Locale.ROOT)));
        List<String> keywords = TextUtils.extractKeywords(ticket.getTitle());
        int keywordThreshold = Math.min(2, keywords.size());

        List<ScoredSection> scored = new ArrayList<>();
        for (DocSection section : sections) {
            if (section.getDocType() == DocType.STANDARDS) {
                continue;
            }
            int score = 0;
            String fileName = FileUtils.baseName(section.getFilePath()).toLowerCase(Locale.ROOT);
            for (String term : fieldTerms) {
                if (fileName.contains(term)) {
                    score += 3;
                }
                if (TextUtils.containsIgnoreCase(section.getSectionTitle(), term)) {
                    score += 2;
                }
            }
            int hits = bodyHits(section, keywords);
            if (keywordThreshold > 0 && hits >= keywordThreshold) {
                score += hits;
            }
            if (score > 0) {
                scored.add(new ScoredSection(section, score));
            }
        }

        return scored.stream()
            .sorted(Comparator.comparingInt(ScoredSection::hits).reversed())
            .limit(limit)
            .map(ScoredSection::section)
            .collect(Collectors.toList());
    }

    List<DocSection> loadSections() {
        List<DocSection> sections = new ArrayList<>();
        int files = 0;
        for (Path root : roots()) {
            if (!Files.isDirectory(root)) {
                continue;
            }
            List<Path> docs;
            try (Stream<Path> walk = Files.walk(root, MAX_WALK_DEPTH)) {
                docs = walk.filter(Files::isRegularFile)
                    .filter(this::isSearchable)
                    .sorted()
                    .collect(Collectors.toList());
            } catch (IOException | UncheckedIOException e) {
                throw new AdapterException(NAME, "Failed to scan docs directory " + root + ": " + e.getMessage(), e);
            }
            for (Path doc : docs) {
                if (files >= DocFileTypes.MAX_DOCS_TO_SEARCH) {
                    log.warn("[LOCAL_DOCS] File limit reached | limit={}", DocFileTypes.MAX_DOCS_TO_SEARCH);
                    return sections;
                }
                files++;
                sections.addAll(readSections(root, doc));
            }
        }
        return sections;
    }

    private List<DocSection> readSections(Path root, Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("[LOCAL_DOCS] Unreadable file skipped | path={} | error={}", file, e.getMessage());
            return List.of();
        }
        String relative = displayPath(root, file);
        DocType type = classify(root, file, relative);
        return splitSections(relative, content, type);
    }

    static List<DocSection> splitSections(String relativePath, String content, DocType type) {
        List<DocSection> sections = new ArrayList<>();
        String title = FileUtils.baseName(relativePath);
        StringBuilder body = new StringBuilder();
        boolean inFence = false;
        for (String line : content.split("\\R", -1)) {
            if (line.stripLeading().startsWith("```")) {
                inFence = !inFence;
            }
            Matcher heading = inFence ? null : HEADING.matcher(line);
            if (heading != null && heading.matches()) {
                addSection(sections, relativePath, title, body, type);
                title = heading.group(2);
                body.setLength(0);
            } else {
                body.append(line).append('\n');
            }
        }
        addSection(sections, relativePath, title, body, type);
        return sections;
    }

    private static void addSection(List<DocSection> sections, String path, String title, StringBuilder body, DocType type) {
        String text = body.toString().strip();
        if (text.isEmpty()) {
            return;
        }
        sections.add(DocSection.builder()
            .filePath(path)
            .sectionTitle(title)
            .content(TextUtils.truncateText(text, MAX_SECTION_CHARS))
            .docType(type)
            .build());
    }

    public static String format(List<DocSection> sections) {
        return sections.stream()
            .map(s -> "## " + s.getSectionTitle() + "\n*Source: " + s.getFilePath() + "* ["
                + s.getDocType().name().toLowerCase(Locale.ROOT) + "]\n\n" + s.getContent())
            .collect(Collectors.joining("\n\n"));
    }

    private DocType classify(Path root, Path file, String relative) {
        if (StringUtils.hasText(config.getStandardsPath()) && file.toAbsolutePath().normalize()
                .startsWith(Paths.get(config.getStandardsPath()).toAbsolutePath().normalize())) {
            return DocType.STANDARDS;
        }
        if (StringUtils.hasText(config.getArchitecturePath()) && file.toAbsolutePath().normalize()
                .startsWith(Paths.get(config.getArchitecturePath()).toAbsolutePath().normalize())) {
            return DocType.ARCHITECTURE;
        }
        return DocType.fromCategory(DocFileTypes.getCategory(relative));
    }

    private boolean isSearchable(Path file) {
        try {
            return FileUtils.isSearchableDoc(file.getFileName().toString(), Files.size(file));
        } catch (IOException e) {
            log.debug("[LOCAL_DOCS] Cannot stat file | path={} | error={}", file, e.getMessage());
            return false;
        }
    }

    private List<Path> roots() {
        Set<Path> roots = new LinkedHashSet<>();
        config.getPaths().stream().filter(StringUtils::hasText)
            .forEach(p -> roots.add(Paths.get(p.strip()).toAbsolutePath().normalize()));
        if (StringUtils.hasText(config.getStandardsPath())) {
            Path standards = Paths.get(config.getStandardsPath()).toAbsolutePath().normalize();
            if (roots.stream().noneMatch(standards::startsWith)) {
                roots.add(standards);
            }
        }
        if (StringUtils.hasText(config.getArchitecturePath())) {
            Path architecture = Paths.get(config.getArchitecturePath()).toAbsolutePath().normalize();
            if (roots.stream().noneMatch(architecture::startsWith)) {
                roots.add(architecture);
            }
        }
        return new ArrayList<>(roots);
    }

    private static String displayPath(Path root, Path file) {
        Path base = root.getFileName() != null ? root.getParent() : root;
        Path relative = base != null ? base.relativize(file) : root.relativize(file);
        return relative.toString().replace('\\', '/');
    }

    private static int bodyHits(DocSection section, List<String> terms) {
        int hits = 0;
        for (String term : terms) {
            if (TextUtils.containsIgnoreCase(section.getContent(), term)
                || TextUtils.containsIgnoreCase(section.getSectionTitle(), term)) {
                hits++;
            }
        }
        return hits;
    }

    private static String excerptAround(String content, List<String> terms) {
        String lower = content.toLowerCase(Locale.ROOT);
        int index = terms.stream().mapToInt(lower::indexOf).filter(i -> i >= 0).min().orElse(0);
        int start = Math.max(0, index - 100);
        String excerpt = content.substring(start);
        return (start > 0 ? "..." : "") + TextUtils.truncateText(excerpt, 300);
    }

    private record ScoredSection(DocSection section, int hits) {
    }
}
