package com.arqsz.skillsense.service;

import java.util.LinkedHashMap;
import java.util.Map;

import com.arqsz.skillsense.model.AnalysisReport;

/**
 * Bounded LRU cache of analysis results keyed by content hash and validation flag
 */
public class AnalysisCache {

    private final Map<String, AnalysisReport> entries;

    public AnalysisCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive");
        }
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, AnalysisReport> eldest) {
                return size() > capacity;
            }
        };
    }

    public synchronized AnalysisReport get(String contentHash, boolean validate) {
        return entries.get(key(contentHash, validate));
    }

    public synchronized void put(String contentHash, boolean validate, AnalysisReport report) {
        entries.put(key(contentHash, validate), report);
    }

    public synchronized int size() {
        return entries.size();
    }

    private static String key(String contentHash, boolean validate) {
        return contentHash + (validate ? ":validated" : ":deterministic");
    }
}
