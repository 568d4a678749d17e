package com.docrag.ingest;

import java.util.ArrayList;
import java.util.List;

final class Paragraphs {
    private Paragraphs() {
    }

    record Paragraph(String text, int words, int startLine) {
    }

    /**
     * Takes paragraphs from the end of {@code source} while their combined word count stays within
     * {@code budgetWords}.
     */
    static List<Paragraph> trailing(List<Paragraph> source, int budgetWords) {
        List<Paragraph> out = new ArrayList<>();
        int words = 0;
        for (int i = source.size() - 1; i >= 0; i--) {
            Paragraph paragraph = source.get(i);
            if (words + paragraph.words() > budgetWords) {
                break;
            }
            out.add(0, paragraph);
            words += paragraph.words();
        }
        return out;
    }

    static int words(List<Paragraph> paragraphs) {
        int sum = 0;
        for (Paragraph paragraph : paragraphs) {
            sum += paragraph.words();
        }
        return sum;
    }

    static String join(List<Paragraph> paragraphs, String separator) {
        List<String> texts = new ArrayList<>(paragraphs.size());
        for (Paragraph paragraph : paragraphs) {
            texts.add(paragraph.text());
        }
        return String.join(separator, texts);
    }
}
