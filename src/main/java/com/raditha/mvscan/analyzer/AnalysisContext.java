package com.raditha.mvscan.analyzer;

import com.raditha.mvscan.alias.AliasRegistry;
import com.raditha.mvscan.alias.VariableCanonicalizer;
import com.raditha.mvscan.frontend.CompilationUnitModel;
import com.raditha.mvscan.layout.StorageLayoutResolver;
import com.raditha.mvscan.normalization.ExpressionNormalizer;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Per-run state shared by the analysis stages: the alias registry, the
 * expression normalizer, the storage layout cache and the admin-only
 * function set. One context is created per analyzed compilation unit.
 */
public class AnalysisContext {

    private final CompilationUnitModel unit;
    private final ExpressionNormalizer normalizer;
    private final AliasRegistry aliasRegistry;
    private final VariableCanonicalizer canonicalizer;
    private final StorageLayoutResolver layout;
    private final Set<String> adminOnly = new HashSet<>();

    public AnalysisContext(CompilationUnitModel unit, Path projectRoot) {
        this.unit = unit;
        this.normalizer = new ExpressionNormalizer();
        this.aliasRegistry = new AliasRegistry();
        this.canonicalizer = new VariableCanonicalizer(unit, normalizer, aliasRegistry);
        this.layout = new StorageLayoutResolver(projectRoot, unit);
    }

    public CompilationUnitModel unit() {
        return unit;
    }

    public ExpressionNormalizer normalizer() {
        return normalizer;
    }

    public AliasRegistry aliasRegistry() {
        return aliasRegistry;
    }

    public VariableCanonicalizer canonicalizer() {
        return canonicalizer;
    }

    public StorageLayoutResolver layout() {
        return layout;
    }

    public void markAdminOnly(Set<String> functionIds) {
        adminOnly.addAll(functionIds);
    }

    public boolean isAdminOnly(String functionId) {
        return adminOnly.contains(functionId);
    }

    public Set<String> adminOnly() {
        return Collections.unmodifiableSet(adminOnly);
    }
}
