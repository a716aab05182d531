package com.raditha.mvscan.layout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.mvscan.frontend.CompilationUnitModel;
import com.raditha.mvscan.frontend.ContractModel;
import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.frontend.StateVariableModel;
import com.raditha.mvscan.model.SlotInstance;
import com.raditha.mvscan.model.StorageVariable;
import com.raditha.mvscan.util.Keccak256;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Resolves storage slots of state variables.
 * <p>
 * Lookup order: the slot supplied by the front-end, the {@code storageLayout}
 * of compiler build artifacts under the project root, then a legacy fallback
 * that replays the linearized inheritance over non-constant, non-immutable
 * variables. Layout tables are cached per contract for the run.
 */
public class StorageLayoutResolver {

    private static final Logger logger = LoggerFactory.getLogger(StorageLayoutResolver.class);

    private final Path projectRoot;
    private final CompilationUnitModel unit;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, Map<String, Integer>> layoutCache = new HashMap<>();

    public StorageLayoutResolver(Path projectRoot, CompilationUnitModel unit) {
        this.projectRoot = projectRoot;
        this.unit = unit;
    }

    /**
     * Slot of a storage variable, or null when no source can place it.
     */
    public @Nullable Integer slotOf(StorageVariable variable) {
        if (variable.slot() != null) {
            return variable.slot();
        }
        Map<String, Integer> table = slotMap(variable.contract());
        Integer slot = table.get(variable.name());
        if (slot == null) {
            slot = table.get(stripUnderscores(variable.name()));
        }
        if (slot != null) {
            return slot;
        }
        return legacySlot(variable);
    }

    /**
     * Storage slot of a mapping element when its key is a numeric literal and
     * the collection slot is known.
     */
    public Optional<BigInteger> elementSlot(SlotInstance slot) {
        Integer base = slotOf(slot.collection());
        Optional<BigInteger> key = parseUint(slot.key());
        if (base == null || key.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Keccak256.mappingSlot(key.get(), BigInteger.valueOf(base)));
    }

    /**
     * Four-byte selector of a function as zero-padded hex.
     */
    public String selectorOf(FunctionModel function) {
        String declared = function.selector();
        if (declared != null && !declared.isBlank()) {
            Optional<BigInteger> value = parseUint(declared.trim());
            if (value.isPresent()) {
                return String.format("0x%08x", value.get().longValue() & 0xFFFFFFFFL);
            }
        }
        return Keccak256.selector(function.signature());
    }

    /**
     * Name to slot table for a contract, merged from build artifacts.
     * First value wins; labels lose their leading underscores.
     */
    public Map<String, Integer> slotMap(String contractName) {
        String canon = contractName.substring(contractName.lastIndexOf(':') + 1);
        return layoutCache.computeIfAbsent(canon, this::loadLayout);
    }

    private Map<String, Integer> loadLayout(String contract) {
        Map<String, Integer> merged = new LinkedHashMap<>();
        for (Path file : jsonFiles(projectRoot.resolve("artifacts").resolve("build-info"))) {
            mergeFromBuildInfo(file, contract, merged);
        }
        for (Path file : jsonFiles(projectRoot.resolve("out").resolve("build-info"))) {
            mergeFromBuildInfo(file, contract, merged);
        }
        if (merged.isEmpty()) {
            mergeFromContractArtifacts(projectRoot.resolve("out"), contract, merged);
        }
        if (!merged.isEmpty()) {
            logger.debug("Resolved {} storage labels for {}", merged.size(), contract);
        }
        return merged;
    }

    private void mergeFromBuildInfo(Path file, String contract, Map<String, Integer> merged) {
        Optional<JsonNode> root = readJson(file);
        if (root.isEmpty()) {
            return;
        }
        JsonNode contracts = root.get().path("output").path("contracts");
        if (!contracts.isObject()) {
            return;
        }
        contracts.elements().forEachRemaining(source -> {
            JsonNode ctr = source.get(contract);
            if (ctr != null && ctr.isObject()) {
                mergeStorage(ctr.path("storageLayout"), merged);
            }
        });
    }

    private void mergeFromContractArtifacts(Path outDir, String contract, Map<String, Integer> merged) {
        if (!Files.isDirectory(outDir)) {
            return;
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(outDir)) {
            files = walk.filter(p -> p.toString().endsWith(".json")).sorted().toList();
        } catch (IOException e) {
            logger.warn("Could not scan {}: {}", outDir, e.getMessage());
            return;
        }
        for (Path file : files) {
            Optional<JsonNode> root = readJson(file);
            if (root.isEmpty()) {
                continue;
            }
            JsonNode layout = root.get().path("storageLayout");
            if (!layout.isObject()) {
                continue;
            }
            String name = root.get().path("contractName").asText(null);
            if (name != null && !name.equals(contract)) {
                continue;
            }
            mergeStorage(layout, merged);
        }
    }

    private static void mergeStorage(JsonNode layout, Map<String, Integer> merged) {
        for (JsonNode entry : layout.path("storage")) {
            String label = stripUnderscores(entry.path("label").asText(""));
            JsonNode slot = entry.get("slot");
            if (label.isEmpty() || slot == null || slot.isNull()) {
                continue;
            }
            parseUint(slot.asText()).ifPresent(s -> merged.putIfAbsent(label, s.intValue()));
        }
    }

    private Optional<JsonNode> readJson(Path file) {
        try {
            return Optional.of(mapper.readTree(file.toFile()));
        } catch (IOException e) {
            logger.warn("Skipping unreadable artifact {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static List<Path> jsonFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            logger.warn("Could not list {}: {}", dir, e.getMessage());
        }
        files.sort(null);
        return files;
    }

    /**
     * Index of the variable when the linearized inheritance, base-most first,
     * is replayed over non-constant, non-immutable state variables.
     */
    @Nullable
    Integer legacySlot(StorageVariable variable) {
        Optional<ContractModel> declaring = unit.contract(variable.contract());
        if (declaring.isEmpty()) {
            return null;
        }
        List<String> bases = new ArrayList<>(declaring.get().linearizedBases());
        if (bases.isEmpty()) {
            bases.add(variable.contract());
        }
        int index = 0;
        for (int i = bases.size() - 1; i >= 0; i--) {
            Optional<ContractModel> base = unit.contract(bases.get(i));
            if (base.isEmpty()) {
                continue;
            }
            for (StateVariableModel sv : base.get().stateVariables()) {
                if (sv.constant() || sv.immutable()) {
                    continue;
                }
                if (base.get().name().equals(variable.contract()) && sv.name().equals(variable.name())) {
                    return index;
                }
                index++;
            }
        }
        return null;
    }

    static Optional<BigInteger> parseUint(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String t = text.trim().toLowerCase();
        try {
            BigInteger value = t.startsWith("0x") ? new BigInteger(t.substring(2), 16) : new BigInteger(t);
            return value.signum() < 0 ? Optional.empty() : Optional.of(value);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String stripUnderscores(String text) {
        int i = 0;
        while (i < text.length() && text.charAt(i) == '_') {
            i++;
        }
        return text.substring(i);
    }
}
