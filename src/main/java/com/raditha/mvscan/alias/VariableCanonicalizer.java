package com.raditha.mvscan.alias;

import com.raditha.mvscan.frontend.CallKind;
import com.raditha.mvscan.frontend.CallModel;
import com.raditha.mvscan.frontend.CompilationUnitModel;
import com.raditha.mvscan.frontend.ContractModel;
import com.raditha.mvscan.frontend.StateVariableModel;
import com.raditha.mvscan.frontend.VariableRef;
import com.raditha.mvscan.model.ExternalStateProxy;
import com.raditha.mvscan.model.SlotInstance;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.model.StorageVariable;
import com.raditha.mvscan.normalization.ExpressionNormalizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps raw front-end references into the canonical {@link StateVar} key space.
 * <p>
 * Plain references become {@link StorageVariable}s, indexed references become
 * {@link SlotInstance}s with a normalized key, and calls to well-known token
 * methods become {@link ExternalStateProxy}s obtained from the
 * {@link AliasRegistry}.
 */
public class VariableCanonicalizer {

    /** Selectors that observe external state. */
    public static final Set<String> EXT_READS = Set.of("balanceof", "totalsupply", "lastbalance");

    /** Selectors that mutate external state. */
    public static final Set<String> EXT_WRITES = Set.of("transfer", "transferfrom", "mint", "burn", "sync");

    /** Storage variables and the public getter selector they back. */
    public static final Map<String, String> STORAGE_TO_SELECTOR = Map.of(
            "_lastBalance", "lastbalance",
            "balances", "balanceof",
            "_balances", "balanceof",
            "balanceOf", "balanceof");

    private static final Pattern INDEXED_LVALUE = Pattern.compile("^\\s*([A-Za-z_$][A-Za-z0-9_$]*)\\s*\\[(.*)]\\s*$");

    /**
     * An external state access at a call site.
     *
     * @param proxy Proxy standing for the accessed state
     * @param write True for state-mutating selectors
     */
    public record ExternalAccess(ExternalStateProxy proxy, boolean write) {
    }

    private final CompilationUnitModel unit;
    private final ExpressionNormalizer normalizer;
    private final AliasRegistry registry;
    private final Map<String, StorageVariable> variables = new HashMap<>();

    public VariableCanonicalizer(CompilationUnitModel unit, ExpressionNormalizer normalizer, AliasRegistry registry) {
        this.unit = unit;
        this.normalizer = normalizer;
        this.registry = registry;
    }

    /**
     * Canonicalize a storage reference. Idempotent within a run.
     */
    public StateVar canonicalize(VariableRef ref) {
        StorageVariable base = storageVariable(ref.contract(), ref.name());
        if (ref.isIndexed()) {
            return slot(base, ref.key());
        }
        return base;
    }

    public SlotInstance slot(StorageVariable base, String key) {
        return new SlotInstance(base, normalizer.normalize(key));
    }

    /**
     * Resolve a storage variable by declaring contract and name. Falls back to
     * the contract's linearized bases, then to a bare variable when nothing
     * declares it.
     */
    public StorageVariable storageVariable(String contract, String name) {
        return variables.computeIfAbsent(contract + "." + name, k -> resolve(contract, name));
    }

    private StorageVariable resolve(String contract, String name) {
        Optional<ContractModel> declaring = unit.contract(contract);
        if (declaring.isPresent()) {
            Optional<StateVariableModel> model = declaring.get().stateVariable(name);
            if (model.isPresent()) {
                return StorageVariable.from(contract, model.get());
            }
            for (String baseName : declaring.get().linearizedBases()) {
                if (baseName.equals(contract)) {
                    continue;
                }
                Optional<StateVariableModel> inherited = unit.contract(baseName)
                        .flatMap(c -> c.stateVariable(name));
                if (inherited.isPresent()) {
                    return StorageVariable.from(baseName, inherited.get());
                }
            }
        }
        return StorageVariable.of(contract, name);
    }

    /**
     * A slot written through an IR lvalue such as {@code balances[to]}, when
     * the indexed name is a state variable visible from the contract.
     */
    public Optional<SlotInstance> indexedLvalue(String contract, String lvalue) {
        if (lvalue == null) {
            return Optional.empty();
        }
        Matcher m = INDEXED_LVALUE.matcher(lvalue.replace("this.", ""));
        if (!m.matches()) {
            return Optional.empty();
        }
        String name = m.group(1);
        if (!isStateVariable(contract, name)) {
            return Optional.empty();
        }
        return Optional.of(slot(storageVariable(contract, name), m.group(2)));
    }

    private boolean isStateVariable(String contract, String name) {
        Optional<ContractModel> c = unit.contract(contract);
        if (c.isEmpty()) {
            return false;
        }
        if (c.get().stateVariable(name).isPresent()) {
            return true;
        }
        return c.get().linearizedBases().stream()
                .map(unit::contract)
                .flatMap(Optional::stream)
                .anyMatch(b -> b.stateVariable(name).isPresent());
    }

    /**
     * External state touched by a call, if its selector is a known observer or
     * mutator.
     */
    public Optional<ExternalAccess> externalAccess(CallModel call, String callerFunctionId) {
        if (call.kind() == CallKind.INTERNAL) {
            return Optional.empty();
        }
        String selector = call.selector();
        boolean read = EXT_READS.contains(selector);
        boolean write = EXT_WRITES.contains(selector);
        if (!read && !write) {
            return Optional.empty();
        }
        String address = call.destination() == null ? null : normalizer.normalize(call.destination());
        ExternalStateProxy proxy = registry.getOrCreate(address, selector, callerFunctionId);
        return Optional.of(new ExternalAccess(proxy, write));
    }

    /**
     * Getter proxies aliased by a storage write, e.g. a write to
     * {@code balances[to]} also writes {@code Token.balanceof}.
     */
    public List<ExternalStateProxy> getterAliases(StateVar written, String callerFunctionId) {
        List<ExternalStateProxy> aliases = new ArrayList<>();
        if (written.base() instanceof StorageVariable sv) {
            String selector = STORAGE_TO_SELECTOR.get(sv.name());
            if (selector != null) {
                aliases.add(registry.getOrCreate(sv.contract(), selector, callerFunctionId));
            }
        }
        return aliases;
    }

    /**
     * Normalized text of a variable as it appears in IR assignments:
     * {@code name} or {@code name[key]}. Empty for proxies and groups.
     */
    public String variableText(StateVar variable) {
        if (variable instanceof StorageVariable sv) {
            return normalizer.normalize(sv.name());
        }
        if (variable instanceof SlotInstance slot) {
            return normalizer.normalize(slot.collection().name()) + "[" + slot.key() + "]";
        }
        return "";
    }
}
