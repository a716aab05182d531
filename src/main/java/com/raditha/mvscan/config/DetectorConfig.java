package com.raditha.mvscan.config;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Configuration for inconsistent-state detection.
 * Defines the sink test, its budget, entry selection and the pair filters.
 *
 * @param divergenceBudget    Maximum blocks visited by the sink search; {@link #UNBOUNDED} for no limit
 * @param sinkMode            Sink policy
 * @param includeRoleGated    Keep owner/role-gated functions as entries
 * @param userCallableAlways  Functions that are always entries (id, signature or name)
 * @param userCallableDeny    Functions that are never entries (id, signature or name)
 * @param initOnlyFilter      Drop pairs on initialization-only variables and latched initializers
 * @param adminWritesBenign   Drop pairs whose writer is admin-only and reader is not
 * @param coarseDedup         Deduplicate findings by shape instead of by site
 * @param promoteMappingBase  Add a slot's collection to the branch groups the slot is in
 * @param noopWriteFilter     Drop self-copy and identity-update writes
 * @param requireSameSlotKey  Require a shared key when both sides touch slots of one collection
 * @param aliasHops           Local alias resolutions followed by self-copy detection
 * @param atomicGroup         Entry names folded into one atomic entry
 * @param mergeOverloads      Fold {@code Contract.fn(args)} entries into {@code Contract.fn}
 * @param crossTxOnly         Drop pairs whose writer and reader have the same owning entry
 * @param maxSitesPerVariable Writer/reader pairs sampled per variable into a finding
 * @param jsonOut             JSON output file, null for none
 * @param projectRoot         Root searched for compiler build artifacts
 */
public record DetectorConfig(
        int divergenceBudget,
        SinkMode sinkMode,
        boolean includeRoleGated,
        List<String> userCallableAlways,
        List<String> userCallableDeny,
        boolean initOnlyFilter,
        boolean adminWritesBenign,
        boolean coarseDedup,
        boolean promoteMappingBase,
        boolean noopWriteFilter,
        boolean requireSameSlotKey,
        int aliasHops,
        List<String> atomicGroup,
        boolean mergeOverloads,
        boolean crossTxOnly,
        int maxSitesPerVariable,
        @Nullable Path jsonOut,
        Path projectRoot) {

    /**
     * Budget value meaning "no limit".
     */
    public static final int UNBOUNDED = -1;

    public static final int DEFAULT_BUDGET = 1000;

    /**
     * Validate configuration.
     */
    public DetectorConfig {
        if (divergenceBudget < UNBOUNDED) {
            throw new IllegalArgumentException("divergenceBudget must be >= 0 or UNBOUNDED");
        }
        if (sinkMode == null) {
            throw new IllegalArgumentException("sinkMode cannot be null");
        }
        if (aliasHops < 0) {
            throw new IllegalArgumentException("aliasHops must be >= 0");
        }
        if (maxSitesPerVariable < 1) {
            throw new IllegalArgumentException("maxSitesPerVariable must be >= 1");
        }
        userCallableAlways = userCallableAlways == null ? List.of() : List.copyOf(userCallableAlways);
        userCallableDeny = userCallableDeny == null ? List.of() : List.copyOf(userCallableDeny);
        atomicGroup = atomicGroup == null ? List.of() : List.copyOf(atomicGroup);
        if (projectRoot == null) {
            projectRoot = Path.of(".");
        }
    }

    public boolean isUnbounded() {
        return divergenceBudget == UNBOUNDED;
    }

    /**
     * Default preset: no sink test, every heuristic filter on.
     */
    public static DetectorConfig defaults() {
        return builder().build();
    }

    /**
     * Precise preset: value-influence sink with the default budget.
     * Fewer findings, each backed by a consequential use.
     */
    public static DetectorConfig precise() {
        return builder()
                .sinkMode(SinkMode.VALUE_INFLUENCE)
                .divergenceBudget(DEFAULT_BUDGET)
                .build();
    }

    /**
     * Exhaustive preset: all filters off, sink disabled, role-gated entries kept.
     * Useful for ablation runs.
     */
    public static DetectorConfig exhaustive() {
        return builder()
                .sinkMode(SinkMode.NONE)
                .includeRoleGated(true)
                .initOnlyFilter(false)
                .adminWritesBenign(false)
                .noopWriteFilter(false)
                .requireSameSlotKey(false)
                .crossTxOnly(false)
                .coarseDedup(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .divergenceBudget(divergenceBudget)
                .sinkMode(sinkMode)
                .includeRoleGated(includeRoleGated)
                .userCallableAlways(userCallableAlways)
                .userCallableDeny(userCallableDeny)
                .initOnlyFilter(initOnlyFilter)
                .adminWritesBenign(adminWritesBenign)
                .coarseDedup(coarseDedup)
                .promoteMappingBase(promoteMappingBase)
                .noopWriteFilter(noopWriteFilter)
                .requireSameSlotKey(requireSameSlotKey)
                .aliasHops(aliasHops)
                .atomicGroup(atomicGroup)
                .mergeOverloads(mergeOverloads)
                .crossTxOnly(crossTxOnly)
                .maxSitesPerVariable(maxSitesPerVariable)
                .jsonOut(jsonOut)
                .projectRoot(projectRoot);
    }

    /**
     * Builder starting from the default values.
     */
    public static final class Builder {
        private int divergenceBudget = DEFAULT_BUDGET;
        private SinkMode sinkMode = SinkMode.NONE;
        private boolean includeRoleGated = false;
        private List<String> userCallableAlways = List.of();
        private List<String> userCallableDeny = List.of();
        private boolean initOnlyFilter = true;
        private boolean adminWritesBenign = true;
        private boolean coarseDedup = true;
        private boolean promoteMappingBase = false;
        private boolean noopWriteFilter = true;
        private boolean requireSameSlotKey = true;
        private int aliasHops = 3;
        private List<String> atomicGroup = List.of();
        private boolean mergeOverloads = false;
        private boolean crossTxOnly = true;
        private int maxSitesPerVariable = 3;
        private Path jsonOut;
        private Path projectRoot = Path.of(".");

        private Builder() {
        }

        public Builder divergenceBudget(int divergenceBudget) {
            this.divergenceBudget = divergenceBudget;
            return this;
        }

        public Builder sinkMode(SinkMode sinkMode) {
            this.sinkMode = sinkMode;
            return this;
        }

        public Builder includeRoleGated(boolean includeRoleGated) {
            this.includeRoleGated = includeRoleGated;
            return this;
        }

        public Builder userCallableAlways(List<String> userCallableAlways) {
            this.userCallableAlways = userCallableAlways;
            return this;
        }

        public Builder userCallableDeny(List<String> userCallableDeny) {
            this.userCallableDeny = userCallableDeny;
            return this;
        }

        public Builder initOnlyFilter(boolean initOnlyFilter) {
            this.initOnlyFilter = initOnlyFilter;
            return this;
        }

        public Builder adminWritesBenign(boolean adminWritesBenign) {
            this.adminWritesBenign = adminWritesBenign;
            return this;
        }

        public Builder coarseDedup(boolean coarseDedup) {
            this.coarseDedup = coarseDedup;
            return this;
        }

        public Builder promoteMappingBase(boolean promoteMappingBase) {
            this.promoteMappingBase = promoteMappingBase;
            return this;
        }

        public Builder noopWriteFilter(boolean noopWriteFilter) {
            this.noopWriteFilter = noopWriteFilter;
            return this;
        }

        public Builder requireSameSlotKey(boolean requireSameSlotKey) {
            this.requireSameSlotKey = requireSameSlotKey;
            return this;
        }

        public Builder aliasHops(int aliasHops) {
            this.aliasHops = aliasHops;
            return this;
        }

        public Builder atomicGroup(List<String> atomicGroup) {
            this.atomicGroup = atomicGroup;
            return this;
        }

        public Builder mergeOverloads(boolean mergeOverloads) {
            this.mergeOverloads = mergeOverloads;
            return this;
        }

        public Builder crossTxOnly(boolean crossTxOnly) {
            this.crossTxOnly = crossTxOnly;
            return this;
        }

        public Builder maxSitesPerVariable(int maxSitesPerVariable) {
            this.maxSitesPerVariable = maxSitesPerVariable;
            return this;
        }

        public Builder jsonOut(Path jsonOut) {
            this.jsonOut = jsonOut;
            return this;
        }

        public Builder projectRoot(Path projectRoot) {
            this.projectRoot = projectRoot;
            return this;
        }

        public DetectorConfig build() {
            return new DetectorConfig(
                    divergenceBudget,
                    sinkMode,
                    includeRoleGated,
                    userCallableAlways,
                    userCallableDeny,
                    initOnlyFilter,
                    adminWritesBenign,
                    coarseDedup,
                    promoteMappingBase,
                    noopWriteFilter,
                    requireSameSlotKey,
                    aliasHops,
                    atomicGroup,
                    mergeOverloads,
                    crossTxOnly,
                    maxSitesPerVariable,
                    jsonOut,
                    projectRoot);
        }
    }
}
