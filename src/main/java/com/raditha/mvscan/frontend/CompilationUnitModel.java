package com.raditha.mvscan.frontend;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The compilation unit handed over by the front-end: every contract to analyze.
 */
public record CompilationUnitModel(List<ContractModel> contracts) {

    public CompilationUnitModel {
        contracts = contracts == null ? List.of() : List.copyOf(contracts);
    }

    public Optional<ContractModel> contract(String name) {
        return contracts.stream()
                .filter(c -> c.name().equals(name))
                .findFirst();
    }

    public Stream<FunctionModel> functions() {
        return contracts.stream().flatMap(c -> c.functions().stream());
    }
}
