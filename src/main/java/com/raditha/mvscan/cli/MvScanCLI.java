package com.raditha.mvscan.cli;

import com.raditha.mvscan.analyzer.AnalysisReport;
import com.raditha.mvscan.analyzer.InconsistentStateAnalyzer;
import com.raditha.mvscan.config.DetectorConfig;
import com.raditha.mvscan.config.DetectorSettings;
import com.raditha.mvscan.config.Settings;
import com.raditha.mvscan.config.SinkMode;
import com.raditha.mvscan.frontend.CompilationUnitModel;
import com.raditha.mvscan.frontend.FrontEndLoader;
import com.raditha.mvscan.metrics.FindingExporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the inconsistent-state detector.
 * <p>
 * Usage:
 * java -jar mvscan.jar [options] &lt;front-end-model.json&gt;
 * <p>
 * Configuration priority: CLI arguments &gt; mvscan.yml &gt; defaults
 */
@Command(name = "mvscan", mixinStandardHelpOptions = true, version = "MV-Scan v1.0.0",
        description = "Multi-variable inconsistent state detector for smart contracts")
@SuppressWarnings("java:S106")
public class MvScanCLI implements Callable<Integer> {

    @Parameters(index = "0", description = "Front-end model JSON of the compilation unit", paramLabel = "<model>")
    private Path modelFile;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--preset", description = "Preset: default, precise or exhaustive", paramLabel = "<name>")
    private String preset;

    @Option(names = "--budget", description = "Divergence budget (number, or inf for unbounded)", paramLabel = "<n>")
    private String budget;

    @Option(names = "--sink", description = "Sink test: value, samevar or none", paramLabel = "<mode>",
            converter = SinkModeConverter.class)
    private SinkMode sinkMode;

    @Option(names = "--include-role-gated", description = "Treat owner/role-gated functions as entries")
    private Boolean includeRoleGated;

    @Option(names = "--allow", split = ",", description = "Functions that are always entries", paramLabel = "<fn>")
    private List<String> allow;

    @Option(names = "--deny", split = ",", description = "Functions that are never entries", paramLabel = "<fn>")
    private List<String> deny;

    @Option(names = "--no-init-filter", description = "Keep pairs on initialization-only variables")
    private boolean noInitFilter;

    @Option(names = "--no-admin-filter", description = "Keep pairs whose writer is admin-only")
    private boolean noAdminFilter;

    @Option(names = "--strict-dedup", description = "Deduplicate by sites instead of by shape")
    private boolean strictDedup;

    @Option(names = "--promote-mapping-base", description = "Add collections of branch-read slots to branch groups")
    private Boolean promoteMappingBase;

    @Option(names = "--no-noop-filter", description = "Keep self-copy writes")
    private boolean noNoopFilter;

    @Option(names = "--no-key-overlap", description = "Pair slot writes with reads of other keys")
    private boolean noKeyOverlap;

    @Option(names = "--alias-hops", description = "Alias resolutions for self-copy detection (default: 3)",
            paramLabel = "<n>")
    private Integer aliasHops;

    @Option(names = "--atomic-group", split = ",", description = "Entries folded into one atomic entry",
            paramLabel = "<fn>")
    private List<String> atomicGroup;

    @Option(names = "--merge-overloads", description = "Fold overloaded entries by name")
    private Boolean mergeOverloads;

    @Option(names = "--all-pairs", description = "Keep pairs within one transaction")
    private boolean allPairs;

    @Option(names = "--json-out", description = "Write findings as JSON to this file", paramLabel = "<path>")
    private Path jsonOut;

    @Option(names = "--project-root", description = "Root searched for compiler build artifacts",
            paramLabel = "<path>")
    private Path projectRoot;

    @Option(names = "--json", description = "Print findings as JSON instead of text")
    private boolean jsonOutput;

    @Option(names = "--export", description = "Export run metrics as CSV to this file", paramLabel = "<path>")
    private Path exportPath;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        Settings settings = configFile != null ? Settings.load(configFile) : Settings.loadDefault();
        applyOverrides(settings);
        DetectorConfig config = DetectorSettings.loadConfig(settings);

        CompilationUnitModel unit = new FrontEndLoader().load(modelFile);
        AnalysisReport report = new InconsistentStateAnalyzer(config).analyze(unit);

        FindingExporter exporter = new FindingExporter();
        if (jsonOutput) {
            System.out.println(exporter.toJson(report.findings()));
        } else {
            System.out.println(report.getDetailedReport());
        }
        if (config.jsonOut() != null) {
            exporter.exportFindings(report.findings(), config.jsonOut());
            System.out.println("✓ Findings written to: " + config.jsonOut().toAbsolutePath());
        }
        if (exportPath != null) {
            exporter.exportToCsv(exporter.buildMetrics(report, modelFile.getFileName().toString()), exportPath);
            System.out.println("✓ Metrics exported to: " + exportPath.toAbsolutePath());
        }
        return 0;
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    /**
     * Run the command with the standard error handlers and return its exit code.
     */
    static int execute(String[] args) {
        return execute(args, new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    static int execute(String[] args, PrintWriter out, PrintWriter err) {
        CommandLine cmd = new CommandLine(new MvScanCLI());
        cmd.setOut(out);
        cmd.setErr(err);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });

        return cmd.execute(args);
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (configFile != null && !Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (projectRoot != null && !Files.isDirectory(projectRoot)) {
            throw new IllegalArgumentException("Project root not found: " + projectRoot);
        }
        if (aliasHops != null && aliasHops < 0) {
            throw new IllegalArgumentException("Alias hops must not be negative, got: " + aliasHops);
        }
        if (preset != null) {
            DetectorSettings.preset(preset);
        }
    }

    /**
     * Apply CLI arguments on top of the YAML section.
     */
    private void applyOverrides(Settings settings) {
        String section = DetectorSettings.CONFIG_KEY;
        if (preset != null) {
            settings.setProperty(section, "preset", preset);
        }
        if (budget != null) {
            settings.setProperty(section, "divergence_budget", budget);
        }
        if (sinkMode != null) {
            settings.setProperty(section, "sink_test", sinkMode.toCliString());
        }
        if (includeRoleGated != null) {
            settings.setProperty(section, "include_role_gated", includeRoleGated);
        }
        if (allow != null) {
            settings.setProperty(section, "user_callable_always", allow);
        }
        if (deny != null) {
            settings.setProperty(section, "user_callable_deny", deny);
        }
        if (noInitFilter) {
            settings.setProperty(section, "init_only_filter", false);
        }
        if (noAdminFilter) {
            settings.setProperty(section, "admin_writes_benign", false);
        }
        if (strictDedup) {
            settings.setProperty(section, "coarse_dedup", false);
        }
        if (promoteMappingBase != null) {
            settings.setProperty(section, "promote_mapping_base", promoteMappingBase);
        }
        if (noNoopFilter) {
            settings.setProperty(section, "noop_write_filter", false);
        }
        if (noKeyOverlap) {
            settings.setProperty(section, "require_same_slot_key", false);
        }
        if (aliasHops != null) {
            settings.setProperty(section, "alias_hops", aliasHops);
        }
        if (atomicGroup != null) {
            settings.setProperty(section, "atomic_group", atomicGroup);
        }
        if (mergeOverloads != null) {
            settings.setProperty(section, "merge_overloads", mergeOverloads);
        }
        if (allPairs) {
            settings.setProperty(section, "cross_tx_only", false);
        }
        if (jsonOut != null) {
            settings.setProperty(section, "json_out", jsonOut.toString());
        }
        if (projectRoot != null) {
            settings.setProperty(section, "project_root", projectRoot.toString());
        }
    }

    /**
     * Custom converter for SinkMode enum to handle CLI string values.
     */
    public static class SinkModeConverter implements ITypeConverter<SinkMode> {
        @Override
        public SinkMode convert(String value) throws Exception {
            return SinkMode.fromString(value);
        }
    }
}
