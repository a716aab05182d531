package com.raditha.mvscan.frontend;

/**
 * A declared function parameter.
 */
public record ParameterModel(String name, String type) {
}
