package com.raditha.mvscan.frontend;

import java.util.List;
import java.util.Optional;

/**
 * A contract with its declared state and functions.
 *
 * @param name            Contract name
 * @param linearizedBases C3-linearized inheritance, most derived first (includes the contract itself)
 * @param stateVariables  State variables declared by this contract, in declaration order
 * @param functions       Functions declared by this contract
 */
public record ContractModel(
        String name,
        List<String> linearizedBases,
        List<StateVariableModel> stateVariables,
        List<FunctionModel> functions) {

    public ContractModel {
        linearizedBases = linearizedBases == null ? List.of() : List.copyOf(linearizedBases);
        stateVariables = stateVariables == null ? List.of() : List.copyOf(stateVariables);
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public Optional<StateVariableModel> stateVariable(String variableName) {
        return stateVariables.stream()
                .filter(v -> v.name().equals(variableName))
                .findFirst();
    }

    /**
     * True if the contract exposes a public or external function with this name.
     */
    public boolean exposesFunction(String functionName) {
        return functions.stream()
                .anyMatch(f -> f.name().equals(functionName) && f.isExternallyVisible());
    }
}
