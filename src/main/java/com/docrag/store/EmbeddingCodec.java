package com.docrag.store;

import java.nio.ByteBuffer;

/**
 * Fixed-width binary form of an embedding: 4 bytes per component, big-endian IEEE-754.
 */
public final class EmbeddingCodec {
    private EmbeddingCodec() {
    }

    public static byte[] encode(float[] embedding) {
        ByteBuffer buffer = ByteBuffer.allocate(embedding.length * Float.BYTES);
        for (float value : embedding) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    public static float[] decode(byte[] bytes) {
        if (bytes.length % Float.BYTES != 0) {
            throw new VectorStoreException("Embedding blob length " + bytes.length + " is not a multiple of " + Float.BYTES);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        float[] out = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < out.length; i++) {
            out[i] = buffer.getFloat();
        }
        return out;
    }
}
