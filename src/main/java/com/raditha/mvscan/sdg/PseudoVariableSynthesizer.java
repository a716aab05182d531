package com.raditha.mvscan.sdg;

import com.raditha.mvscan.model.SlotInstance;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.model.VariableGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns branch groups and multi-return summaries into {@link VariableGroup}
 * pseudo-variables registered in the graph.
 */
public class PseudoVariableSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(PseudoVariableSynthesizer.class);

    private static final Comparator<StateVar> BY_NAME = Comparator.comparing(StateVar::name)
            .thenComparing(StateVar::identity);

    /**
     * Synthesized groups and, per concrete variable, the groups it belongs to.
     */
    public record PseudoVariables(List<VariableGroup> groups, Map<StateVar, Set<VariableGroup>> memberIndex) {

        public Set<VariableGroup> groupsContaining(StateVar variable) {
            Set<VariableGroup> found = memberIndex.getOrDefault(variable.base(), Set.of());
            return Collections.unmodifiableSet(found);
        }
    }

    public PseudoVariables synthesize(StateDependencyGraph sdg) {
        List<VariableGroup> groups = new ArrayList<>();
        Map<StateVar, Set<VariableGroup>> index = new LinkedHashMap<>();

        for (Map.Entry<Integer, Set<StateVar>> entry : sdg.branchGroups().entrySet()) {
            List<StateVar> concrete = entry.getValue().stream()
                    .filter(v -> !(v instanceof SlotInstance))
                    .distinct()
                    .sorted(BY_NAME)
                    .toList();
            if (concrete.size() < 2) {
                continue;
            }
            VariableGroup group = new VariableGroup(entry.getKey(), concrete);
            sdg.registerPseudo(group, concrete);
            groups.add(group);
            for (StateVar member : concrete) {
                index.computeIfAbsent(member, k -> new LinkedHashSet<>()).add(group);
            }
        }

        for (Map.Entry<String, Set<StateVar>> entry : sdg.functionReturns().entrySet()) {
            Set<StateVar> slotsAndBases = new LinkedHashSet<>();
            for (StateVar v : entry.getValue()) {
                slotsAndBases.add(v);
                slotsAndBases.add(v.base());
            }
            if (slotsAndBases.size() < 2) {
                continue;
            }
            List<StateVar> members = slotsAndBases.stream()
                    .map(StateVar::base)
                    .distinct()
                    .sorted(BY_NAME)
                    .toList();
            if (members.size() < 2) {
                continue;
            }
            VariableGroup group = new VariableGroup(sdg.nextGroupId(), members);
            sdg.registerPseudo(group, slotsAndBases);
            groups.add(group);
            for (StateVar v : slotsAndBases) {
                index.computeIfAbsent(v.base(), k -> new LinkedHashSet<>()).add(group);
            }
            logger.debug("Multi-return group {} from {}", group.name(), entry.getKey());
        }

        logger.info("Synthesized {} multi-variable groups", groups.size());
        return new PseudoVariables(List.copyOf(groups), index);
    }
}
