package com.raditha.mvscan.model;

/**
 * A raw write/read pair on one variable.
 *
 * @param writer   Writing block
 * @param reader   Reading block
 * @param variable Variable written and read
 * @param pattern  Pattern before reentrancy escalation
 */
public record StalePair(BlockId writer, BlockId reader, StateVar variable, PairPattern pattern) {
}
