package com.docrag.ingest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docrag.ingest.Paragraphs.Paragraph;

/**
 * Splits Markdown by ATX headings. Each section is chunked on its own with the heading line
 * repeated at the top of every sub-chunk. Overlap is only carried between consecutive chunks under
 * the same top-level heading.
 */
class MarkdownSplitter {
    private static final Logger log = LoggerFactory.getLogger(MarkdownSplitter.class);
    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+)$");

    private final int maxWords;
    private final int overlapWords;
    private final TokenEstimator tokenEstimator;

    MarkdownSplitter(int maxWords, int overlapWords, TokenEstimator tokenEstimator) {
        this.maxWords = maxWords;
        this.overlapWords = overlapWords;
        this.tokenEstimator = tokenEstimator;
    }

    List<TextChunk> split(String content) {
        List<Section> sections = parseSections(content);
        List<Draft> drafts = new ArrayList<>();
        for (Section section : sections) {
            drafts.addAll(splitSection(section));
        }

        List<TextChunk> chunks = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            Draft draft = drafts.get(i);
            List<Paragraph> overlap = List.of();
            if (i > 0 && sameTopLevel(drafts.get(i - 1), draft)) {
                overlap = Paragraphs.trailing(drafts.get(i - 1).body(), overlapWords);
            }
            String text = draft.render(overlap);
            chunks.add(new TextChunk(text, tokenEstimator.estimate(text), draft.metadata()));
        }
        log.debug("Created {} chunks from {} markdown sections", chunks.size(), sections.size());
        return chunks;
    }

    private List<Section> parseSections(String content) {
        String[] lines = content.split("\\R", -1);
        List<Section> sections = new ArrayList<>();
        Deque<HeadingEntry> stack = new ArrayDeque<>();
        Section current = null;
        boolean inFence = false;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            String stripped = line.strip();
            if (stripped.startsWith("```") || stripped.startsWith("~~~")) {
                inFence = !inFence;
            }
            Matcher matcher = HEADING.matcher(line.stripTrailing());
            if (!inFence && matcher.matches()) {
                if (current != null) {
                    sections.add(current);
                }
                int level = matcher.group(1).length();
                String title = matcher.group(2).strip();
                while (!stack.isEmpty() && stack.peekLast().level() >= level) {
                    stack.removeLast();
                }
                stack.addLast(new HeadingEntry(level, title));
                List<String> path = stack.stream().map(HeadingEntry::title).toList();
                current = new Section(line.strip(), level, path, i);
            } else {
                if (current == null) {
                    current = new Section("", 0, List.of(), i);
                }
                current.addLine(line, i);
            }
        }
        if (current != null) {
            sections.add(current);
        }
        return sections;
    }

    private List<Draft> splitSection(Section section) {
        ChunkMetadata metadata = new ChunkMetadata(section.headingPath(), section.level(), section.startLine());
        List<Paragraph> paragraphs = section.paragraphs();
        if (paragraphs.isEmpty()) {
            if (section.heading().isEmpty()) {
                return List.of();
            }
            return List.of(new Draft(section.heading(), List.of(), metadata));
        }

        int headingWords = TokenEstimator.wordCount(section.heading());
        if (headingWords + Paragraphs.words(paragraphs) <= maxWords) {
            return List.of(new Draft(section.heading(), paragraphs, metadata));
        }

        List<Draft> drafts = new ArrayList<>();
        List<Paragraph> current = new ArrayList<>();
        int currentWords = headingWords;
        for (Paragraph paragraph : paragraphs) {
            if (!current.isEmpty() && currentWords + paragraph.words() > maxWords) {
                drafts.add(new Draft(section.heading(), current, metadata));
                current = new ArrayList<>();
                currentWords = headingWords;
            }
            current.add(paragraph);
            currentWords += paragraph.words();
        }
        if (!current.isEmpty()) {
            drafts.add(new Draft(section.heading(), current, metadata));
        }
        return drafts;
    }

    private static boolean sameTopLevel(Draft previous, Draft current) {
        String previousTop = previous.metadata().topLevelHeading();
        return previousTop != null && Objects.equals(previousTop, current.metadata().topLevelHeading());
    }

    private record HeadingEntry(int level, String title) {
    }

    private record Draft(String heading, List<Paragraph> body, ChunkMetadata metadata) {
        String render(List<Paragraph> overlap) {
            List<String> blocks = new ArrayList<>();
            if (!heading.isEmpty()) {
                blocks.add(heading);
            }
            if (!overlap.isEmpty()) {
                blocks.add(Paragraphs.join(overlap, "\n\n"));
            }
            if (!body.isEmpty()) {
                blocks.add(Paragraphs.join(body, "\n\n"));
            }
            return String.join("\n\n", blocks);
        }
    }

    private static final class Section {
        private final String heading;
        private final int level;
        private final List<String> headingPath;
        private final int startLine;
        private final List<Paragraph> paragraphs = new ArrayList<>();
        private final List<String> pending = new ArrayList<>();
        private int pendingStart = -1;

        Section(String heading, int level, List<String> headingPath, int startLine) {
            this.heading = heading;
            this.level = level;
            this.headingPath = headingPath;
            this.startLine = startLine;
        }

        void addLine(String line, int lineIndex) {
            if (line.isBlank()) {
                flush();
                return;
            }
            if (pending.isEmpty()) {
                pendingStart = lineIndex;
            }
            pending.add(line.stripTrailing());
        }

        List<Paragraph> paragraphs() {
            flush();
            return paragraphs;
        }

        private void flush() {
            if (pending.isEmpty()) {
                return;
            }
            String text = String.join("\n", pending);
            paragraphs.add(new Paragraph(text, TokenEstimator.wordCount(text), pendingStart));
            pending.clear();
        }

        String heading() {
            return heading;
        }

        int level() {
            return level;
        }

        List<String> headingPath() {
            return headingPath;
        }

        int startLine() {
            return startLine;
        }
    }
}
