package com.raditha.mvscan.model;

import java.util.List;
import java.util.TreeSet;

/**
 * Unordered set of owning entries of a writer and a reader, kept sorted.
 */
public record TransactionSet(List<String> entries) implements Comparable<TransactionSet> {

    public TransactionSet {
        entries = List.copyOf(new TreeSet<>(entries));
    }

    public static TransactionSet of(String writerEntry, String readerEntry) {
        return new TransactionSet(List.of(writerEntry, readerEntry));
    }

    public boolean isSingleEntry() {
        return entries.size() == 1;
    }

    @Override
    public int compareTo(TransactionSet other) {
        return String.join(",", entries).compareTo(String.join(",", other.entries));
    }

    @Override
    public String toString() {
        return String.join(", ", entries);
    }
}
