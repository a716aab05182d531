package com.raditha.mvscan.clustering;

import com.raditha.mvscan.layout.StorageLayoutResolver;
import com.raditha.mvscan.model.ExternalStateProxy;
import com.raditha.mvscan.model.SlotInstance;
import com.raditha.mvscan.model.StateVar;
import com.raditha.mvscan.model.StorageVariable;
import com.raditha.mvscan.model.VariableGroup;
import com.raditha.mvscan.model.VariableKind;
import com.raditha.mvscan.model.VariableMetadata;
import com.raditha.mvscan.sdg.StateDependencyGraph;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Builds the serializable description of a variable: kind, storage slot,
 * key and the branch groups it takes part in.
 */
public class VariableDescriber {

    private final StateDependencyGraph sdg;
    private final StorageLayoutResolver layout;

    public VariableDescriber(StateDependencyGraph sdg, StorageLayoutResolver layout) {
        this.sdg = sdg;
        this.layout = layout;
    }

    public VariableMetadata describe(StateVar variable) {
        if (variable instanceof VariableGroup group) {
            return VariableMetadata.group(group.name(), group.memberNames());
        }
        List<Integer> groups = List.copyOf(sdg.branchGroupsOf(variable));
        List<Integer> branchGroups = groups.isEmpty() ? null : groups;

        if (variable instanceof ExternalStateProxy proxy) {
            return new VariableMetadata(proxy.name(), VariableKind.EXTERNAL,
                    null, null, null, null, null, branchGroups);
        }
        if (variable instanceof SlotInstance slot) {
            Integer baseSlot = layout.slotOf(slot.collection());
            Optional<BigInteger> element = layout.elementSlot(slot);
            return new VariableMetadata(slot.collection().name(), VariableKind.MAPPING_SLOT,
                    element.orElse(null), baseSlot, slot.key(),
                    element.isPresent() ? null : slot.key(), null, branchGroups);
        }
        StorageVariable storage = (StorageVariable) variable;
        Integer slot = layout.slotOf(storage);
        return new VariableMetadata(storage.name(), VariableKind.STATE,
                slot == null ? null : BigInteger.valueOf(slot), null, null, null, null, branchGroups);
    }
}
