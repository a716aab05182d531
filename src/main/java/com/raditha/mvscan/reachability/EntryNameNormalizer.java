package com.raditha.mvscan.reachability;

import java.util.List;
import java.util.Set;

/**
 * Normalizes entry names above the transaction level: names of the atomic
 * group fold into {@link #ATOMIC_GROUP}, and with overload merging
 * {@code Contract.fn(args)} folds into {@code Contract.fn}.
 */
public class EntryNameNormalizer {

    public static final String ATOMIC_GROUP = "ATOMIC_GROUP";

    private final Set<String> atomicGroup;
    private final boolean mergeOverloads;

    public EntryNameNormalizer(List<String> atomicGroup, boolean mergeOverloads) {
        this.atomicGroup = Set.copyOf(atomicGroup.stream().map(String::trim).filter(s -> !s.isEmpty()).toList());
        this.mergeOverloads = mergeOverloads;
    }

    public String normalize(String functionId) {
        if (atomicGroup.contains(functionId)) {
            return ATOMIC_GROUP;
        }
        if (mergeOverloads) {
            int dot = functionId.indexOf('.');
            if (dot < 0) {
                return functionId;
            }
            String contract = functionId.substring(0, dot);
            String rest = functionId.substring(dot + 1);
            int paren = rest.indexOf('(');
            String fn = (paren < 0 ? rest : rest.substring(0, paren)).strip();
            return contract + "." + fn;
        }
        return functionId;
    }
}
