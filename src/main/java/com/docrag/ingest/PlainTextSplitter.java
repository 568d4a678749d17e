package com.docrag.ingest;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docrag.ingest.Paragraphs.Paragraph;

/**
 * Every non-blank line is a paragraph. Paragraphs accumulate until the next one would exceed the
 * word limit; the following chunk is re-seeded with the trailing paragraphs that fit the overlap.
 */
class PlainTextSplitter {
    private static final Logger log = LoggerFactory.getLogger(PlainTextSplitter.class);

    private final int maxWords;
    private final int overlapWords;
    private final TokenEstimator tokenEstimator;

    PlainTextSplitter(int maxWords, int overlapWords, TokenEstimator tokenEstimator) {
        this.maxWords = maxWords;
        this.overlapWords = overlapWords;
        this.tokenEstimator = tokenEstimator;
    }

    List<TextChunk> split(String content) {
        List<Paragraph> paragraphs = paragraphs(content);
        if (paragraphs.isEmpty()) {
            log.warn("No paragraphs found in plain text content");
            return List.of();
        }

        List<TextChunk> chunks = new ArrayList<>();
        List<Paragraph> current = new ArrayList<>();
        int currentWords = 0;
        for (Paragraph paragraph : paragraphs) {
            if (currentWords > 0 && currentWords + paragraph.words() > maxWords) {
                chunks.add(toChunk(current));
                current = new ArrayList<>(Paragraphs.trailing(current, overlapWords));
                currentWords = Paragraphs.words(current);
            }
            current.add(paragraph);
            currentWords += paragraph.words();
        }
        if (!current.isEmpty()) {
            chunks.add(toChunk(current));
        }
        log.debug("Created {} chunks from {} paragraphs", chunks.size(), paragraphs.size());
        return chunks;
    }

    private TextChunk toChunk(List<Paragraph> paragraphs) {
        String text = Paragraphs.join(paragraphs, "\n");
        return new TextChunk(text, tokenEstimator.estimate(text), ChunkMetadata.body(paragraphs.get(0).startLine()));
    }

    private static List<Paragraph> paragraphs(String content) {
        String[] lines = content.split("\\R", -1);
        List<Paragraph> out = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (!line.isEmpty()) {
                out.add(new Paragraph(line, TokenEstimator.wordCount(line), i));
            }
        }
        return out;
    }
}
