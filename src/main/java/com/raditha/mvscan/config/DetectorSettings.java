package com.raditha.mvscan.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads detector configuration from Settings (mvscan.yml) with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments &gt; mvscan.yml &gt; defaults
 */
public class DetectorSettings {

    private static final Logger logger = LoggerFactory.getLogger(DetectorSettings.class);

    public static final String CONFIG_KEY = "inconsistent_state";

    private static final Set<String> UNBOUNDED_WORDS = Set.of("inf", "infinite", "unlimited", "unbounded");

    private DetectorSettings() {
    }

    /**
     * Load configuration from Settings. CLI parameters should already be
     * applied to Settings via setProperty() before calling this.
     *
     * @param settings loaded settings
     * @return complete detector configuration
     * @throws IllegalArgumentException if a value is out of range or unknown
     */
    public static DetectorConfig loadConfig(Settings settings) {
        Object yamlConfigRaw = settings.getProperty(CONFIG_KEY);

        if (!(yamlConfigRaw instanceof Map)) {
            return DetectorConfig.defaults();
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) yamlConfigRaw;

        DetectorConfig base = preset(getString(config, "preset", "default"));

        DetectorConfig.Builder builder = base.toBuilder();
        if (config.containsKey("divergence_budget")) {
            builder.divergenceBudget(parseBudget(config.get("divergence_budget")));
        }
        if (config.containsKey("sink_test")) {
            builder.sinkMode(SinkMode.fromString(getString(config, "sink_test", "none")));
        }
        builder.includeRoleGated(getBoolean(config, "include_role_gated", base.includeRoleGated()))
                .userCallableAlways(getListString(config, "user_callable_always", base.userCallableAlways()))
                .userCallableDeny(getListString(config, "user_callable_deny", base.userCallableDeny()))
                .initOnlyFilter(getBoolean(config, "init_only_filter", base.initOnlyFilter()))
                .adminWritesBenign(getBoolean(config, "admin_writes_benign", base.adminWritesBenign()))
                .coarseDedup(getBoolean(config, "coarse_dedup", base.coarseDedup()))
                .promoteMappingBase(getBoolean(config, "promote_mapping_base", base.promoteMappingBase()))
                .noopWriteFilter(getBoolean(config, "noop_write_filter", base.noopWriteFilter()))
                .requireSameSlotKey(getBoolean(config, "require_same_slot_key", base.requireSameSlotKey()))
                .aliasHops(getInt(config, "alias_hops", base.aliasHops()))
                .atomicGroup(getListString(config, "atomic_group", base.atomicGroup()))
                .mergeOverloads(getBoolean(config, "merge_overloads", base.mergeOverloads()))
                .crossTxOnly(getBoolean(config, "cross_tx_only", base.crossTxOnly()))
                .maxSitesPerVariable(getInt(config, "max_sites_per_variable", base.maxSitesPerVariable()));

        String jsonOut = getString(config, "json_out", null);
        if (jsonOut != null && !jsonOut.isBlank()) {
            builder.jsonOut(Path.of(jsonOut));
        }
        String projectRoot = getString(config, "project_root", null);
        if (projectRoot != null && !projectRoot.isBlank()) {
            builder.projectRoot(Path.of(projectRoot));
        }
        return builder.build();
    }

    /**
     * Resolve a preset by name.
     *
     * @throws IllegalArgumentException for unknown presets
     */
    public static DetectorConfig preset(String name) {
        return switch (name == null ? "default" : name.toLowerCase()) {
            case "default" -> DetectorConfig.defaults();
            case "precise" -> DetectorConfig.precise();
            case "exhaustive" -> DetectorConfig.exhaustive();
            default -> throw new IllegalArgumentException(
                    "Unknown preset: " + name + ". Must be: default, precise, or exhaustive");
        };
    }

    /**
     * Parse a divergence budget. {@code inf}, {@code unbounded} and negative
     * numbers mean unbounded; anything unparseable logs an error and falls back
     * to {@link DetectorConfig#DEFAULT_BUDGET}.
     */
    public static int parseBudget(Object raw) {
        if (raw == null) {
            return DetectorConfig.DEFAULT_BUDGET;
        }
        if (raw instanceof Number number) {
            return number.intValue() < 0 ? DetectorConfig.UNBOUNDED : number.intValue();
        }
        String text = raw.toString().trim().toLowerCase();
        if (UNBOUNDED_WORDS.contains(text)) {
            return DetectorConfig.UNBOUNDED;
        }
        try {
            int n = Integer.parseInt(text);
            return n < 0 ? DetectorConfig.UNBOUNDED : n;
        } catch (NumberFormatException e) {
            logger.error("Invalid divergence budget '{}', using default {}", raw, DetectorConfig.DEFAULT_BUDGET);
            return DetectorConfig.DEFAULT_BUDGET;
        }
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be an integer, got: " + s, e);
            }
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String s) {
            return switch (s.trim().toLowerCase()) {
                case "true", "1", "yes", "on" -> true;
                case "false", "0", "no", "off" -> false;
                default -> throw new IllegalArgumentException(key + " must be a boolean, got: " + s);
            };
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(Object::toString).map(String::trim).filter(s -> !s.isEmpty()).toList();
        }
        if (value instanceof String s) {
            return Arrays.stream(s.split(",")).map(String::trim).filter(t -> !t.isEmpty()).toList();
        }
        return defaultValue;
    }
}
