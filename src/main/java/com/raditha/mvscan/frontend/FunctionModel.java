package com.raditha.mvscan.frontend;

import org.jspecify.annotations.Nullable;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A function (or modifier-expanded function body) of a contract.
 *
 * @param contract        Declaring contract name
 * @param name            Function name
 * @param parameters      Declared parameters
 * @param visibility      {@code public}, {@code external}, {@code internal} or {@code private}
 * @param stateMutability {@code view}, {@code pure}, {@code nonpayable} or {@code payable}
 * @param constructor     True for the contract constructor
 * @param modifiers       Names of applied modifiers
 * @param selector        Four-byte selector as hex text when known, otherwise null
 * @param entryNodeId     Id of the entry node, null to infer it
 * @param nodes           Control-flow nodes
 */
public record FunctionModel(
        String contract,
        String name,
        List<ParameterModel> parameters,
        String visibility,
        String stateMutability,
        boolean constructor,
        List<String> modifiers,
        @Nullable String selector,
        @Nullable Integer entryNodeId,
        List<NodeModel> nodes) {

    public FunctionModel {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        if (visibility == null) {
            visibility = "internal";
        }
        if (stateMutability == null) {
            stateMutability = "nonpayable";
        }
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    /**
     * Solidity signature, e.g. {@code withdraw(uint256)}.
     */
    public String signature() {
        return name + "(" + parameters.stream()
                .map(ParameterModel::type)
                .collect(Collectors.joining(",")) + ")";
    }

    /**
     * Contract-qualified signature used as the function identifier throughout
     * the analysis, e.g. {@code Vault.withdraw(uint256)}.
     */
    public String id() {
        return contract + "." + signature();
    }

    public boolean isExternallyVisible() {
        return "public".equals(visibility) || "external".equals(visibility);
    }

    /**
     * View and pure functions cannot write storage.
     */
    public boolean isViewOnly() {
        return "view".equals(stateMutability) || "pure".equals(stateMutability);
    }

    public Optional<NodeModel> node(int nodeId) {
        for (NodeModel node : nodes) {
            if (node.id() == nodeId) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /**
     * Entry node: the declared one, else the first node without predecessors,
     * else the first node.
     */
    public Optional<NodeModel> entryNode() {
        if (entryNodeId != null) {
            Optional<NodeModel> declared = node(entryNodeId);
            if (declared.isPresent()) {
                return declared;
            }
        }
        if (nodes.isEmpty()) {
            return Optional.empty();
        }
        Set<Integer> targets = new HashSet<>();
        for (NodeModel node : nodes) {
            targets.addAll(node.successors());
        }
        for (NodeModel node : nodes) {
            if (!targets.contains(node.id())) {
                return Optional.of(node);
            }
        }
        return Optional.of(nodes.get(0));
    }

    /**
     * Exit nodes: return statements, or every node without successors when the
     * function has no explicit return.
     */
    public List<NodeModel> exitNodes() {
        List<NodeModel> returns = nodes.stream().filter(NodeModel::isReturn).toList();
        if (!returns.isEmpty()) {
            return returns;
        }
        return nodes.stream().filter(n -> n.successors().isEmpty()).toList();
    }

    public boolean hasModifierContaining(String fragment) {
        String needle = fragment.toLowerCase();
        return modifiers.stream().anyMatch(m -> m.toLowerCase().contains(needle));
    }

    public boolean writesStorage() {
        return nodes.stream().anyMatch(NodeModel::writesStorage);
    }
}
