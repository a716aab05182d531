package com.raditha.mvscan.config;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DetectorSettingsTest {

    private static Settings testSettings() throws IOException {
        try (InputStream in = DetectorSettingsTest.class.getResourceAsStream("/mvscan-test.yml")) {
            assertNotNull(in, "mvscan-test.yml must be on the test classpath");
            return Settings.read(in);
        }
    }

    @Test
    void testLoadConfig_Defaults() {
        DetectorConfig config = DetectorSettings.loadConfig(Settings.empty());

        assertEquals(DetectorConfig.DEFAULT_BUDGET, config.divergenceBudget());
        assertEquals(SinkMode.NONE, config.sinkMode());
        assertFalse(config.includeRoleGated());
        assertTrue(config.initOnlyFilter());
        assertTrue(config.adminWritesBenign());
        assertTrue(config.coarseDedup());
        assertTrue(config.crossTxOnly());
        assertEquals(3, config.aliasHops());
        assertNull(config.jsonOut());
    }

    @Test
    void testLoadConfig_YamlFile() throws IOException {
        DetectorConfig config = DetectorSettings.loadConfig(testSettings());

        assertTrue(config.isUnbounded());
        // sink_test overrides the precise preset's value-influence sink
        assertEquals(SinkMode.SAME_VARIABLE, config.sinkMode());
        assertTrue(config.includeRoleGated());
        assertEquals(List.of("Vault.sweep()"), config.userCallableAlways());
        assertEquals(List.of("Vault.rescue", "Vault.kill"), config.userCallableDeny());
        assertFalse(config.coarseDedup());
        assertFalse(config.crossTxOnly());
        assertEquals(5, config.aliasHops());
        assertEquals(Path.of("build/findings.json"), config.jsonOut());
        assertTrue(config.initOnlyFilter());
    }

    @Test
    void testLoadConfig_CliOverridesYaml() throws IOException {
        Settings settings = testSettings();
        settings.setProperty(DetectorSettings.CONFIG_KEY, "divergence_budget", "7");
        settings.setProperty(DetectorSettings.CONFIG_KEY, "sink_test", "none");
        settings.setProperty(DetectorSettings.CONFIG_KEY, "alias_hops", 0);

        DetectorConfig config = DetectorSettings.loadConfig(settings);

        assertEquals(7, config.divergenceBudget());
        assertEquals(SinkMode.NONE, config.sinkMode());
        assertEquals(0, config.aliasHops());
        // untouched keys keep their YAML values
        assertFalse(config.coarseDedup());
    }

    @Test
    void testPresets() {
        assertEquals(SinkMode.VALUE_INFLUENCE, DetectorSettings.preset("precise").sinkMode());
        DetectorConfig exhaustive = DetectorSettings.preset("EXHAUSTIVE");
        assertFalse(exhaustive.initOnlyFilter());
        assertFalse(exhaustive.crossTxOnly());
        assertTrue(exhaustive.includeRoleGated());
        assertEquals(DetectorConfig.defaults(), DetectorSettings.preset(null));
    }

    @Test
    void testUnknownPreset_Throws() {
        Settings settings = Settings.empty();
        settings.setProperty(DetectorSettings.CONFIG_KEY, "preset", "reckless");

        assertThrows(IllegalArgumentException.class, () -> DetectorSettings.loadConfig(settings));
    }

    @Test
    void testParseBudget() {
        assertEquals(DetectorConfig.UNBOUNDED, DetectorSettings.parseBudget("inf"));
        assertEquals(DetectorConfig.UNBOUNDED, DetectorSettings.parseBudget("Unbounded"));
        assertEquals(DetectorConfig.UNBOUNDED, DetectorSettings.parseBudget(-5));
        assertEquals(0, DetectorSettings.parseBudget(0));
        assertEquals(250, DetectorSettings.parseBudget(" 250 "));
        assertEquals(DetectorConfig.DEFAULT_BUDGET, DetectorSettings.parseBudget("lots"));
        assertEquals(DetectorConfig.DEFAULT_BUDGET, DetectorSettings.parseBudget(null));
    }

    @Test
    void testInvalidBoolean_Throws() {
        Settings settings = Settings.empty();
        settings.setProperty(DetectorSettings.CONFIG_KEY, "coarse_dedup", "maybe");

        assertThrows(IllegalArgumentException.class, () -> DetectorSettings.loadConfig(settings));
    }

    @Test
    void testConfigValidation() {
        DetectorConfig.Builder negativeHops = DetectorConfig.builder().aliasHops(-1);
        assertThrows(IllegalArgumentException.class, negativeHops::build);

        DetectorConfig.Builder noSites = DetectorConfig.builder().maxSitesPerVariable(0);
        assertThrows(IllegalArgumentException.class, noSites::build);

        DetectorConfig.Builder badBudget = DetectorConfig.builder().divergenceBudget(-2);
        assertThrows(IllegalArgumentException.class, badBudget::build);
    }
}
