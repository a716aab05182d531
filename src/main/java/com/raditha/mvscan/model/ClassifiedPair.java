package com.raditha.mvscan.model;

/**
 * A pair that survived filtering, with its final pattern and shape tags.
 *
 * @param pair         The raw pair
 * @param writerEntry  Normalized entry owning the writer block
 * @param readerEntry  Normalized entry owning the reader block
 * @param pattern      Final pattern, after reentrancy escalation
 * @param reentrant    Writer and reader functions reach each other through calls
 * @param sharedCallee Writer and reader functions call a common function
 */
public record ClassifiedPair(
        StalePair pair,
        String writerEntry,
        String readerEntry,
        PairPattern pattern,
        boolean reentrant,
        boolean sharedCallee) {

    public TransactionSet txSet() {
        return TransactionSet.of(writerEntry, readerEntry);
    }

    public StateVar variable() {
        return pair.variable();
    }

    public BlockId writer() {
        return pair.writer();
    }

    public BlockId reader() {
        return pair.reader();
    }
}
