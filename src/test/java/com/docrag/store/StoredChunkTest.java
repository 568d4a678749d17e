package com.docrag.store;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StoredChunkTest {

    @Test
    void shouldCompareEmbeddingsByContent() {
        StoredChunk first = chunk(new float[] { 0.25f, -1f });
        StoredChunk second = chunk(new float[] { 0.25f, -1f });

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, chunk(new float[] { 0.25f, 1f }));
    }

    @Test
    void shouldNotExposeInternalEmbeddingArray() {
        float[] source = { 1f, 2f };
        StoredChunk chunk = chunk(source);

        source[0] = 9f;
        chunk.embedding()[1] = 9f;

        assertArrayEquals(new float[] { 1f, 2f }, chunk.embedding());
        assertEquals(2, chunk.dimension());
    }

    @Test
    void shouldPrintDimensionInsteadOfVector() {
        String text = chunk(new float[] { 1f, 2f, 3f }).toString();

        assertTrue(text.contains("embedding=float[3]"), text);
        assertTrue(text.contains("sourceName=Guide"), text);
    }

    private static StoredChunk chunk(float[] embedding) {
        return new StoredChunk(7, 3, 0, "text", embedding, 4, 1000L, "Guide");
    }
}
