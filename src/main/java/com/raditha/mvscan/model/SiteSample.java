package com.raditha.mvscan.model;

/**
 * A writer or reader site sampled into a finding.
 *
 * @param sig      Contract-qualified signature
 * @param selector Four-byte selector as hex
 * @param file     Source file
 * @param line     First line of the node
 */
public record SiteSample(String sig, String selector, String file, int line) {

    public String location() {
        return file + ":" + line;
    }
}
