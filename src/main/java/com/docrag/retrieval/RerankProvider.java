package com.docrag.retrieval;

import java.util.List;

/**
 * External cross-encoder. Returns one score per text, aligned by position.
 */
public interface RerankProvider {
    double[] score(String query, List<String> texts) throws RerankProviderException;
}
