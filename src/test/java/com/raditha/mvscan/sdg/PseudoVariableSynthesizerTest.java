package com.raditha.mvscan.sdg;

import com.raditha.mvscan.ModelFixtures;
import com.raditha.mvscan.model.BlockId;
import com.raditha.mvscan.model.StorageVariable;
import com.raditha.mvscan.model.VariableGroup;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PseudoVariableSynthesizerTest {

    private final PseudoVariableSynthesizer synthesizer = new PseudoVariableSynthesizer();

    @Test
    void testBranchGroupBecomesPseudoVariable() {
        StateDependencyGraph sdg = ModelFixtures.sdgOf(ModelFixtures.context(ModelFixtures.pool()));
        StorageVariable a = StorageVariable.of("Pool", "a");
        StorageVariable b = StorageVariable.of("Pool", "b");

        PseudoVariableSynthesizer.PseudoVariables pseudo = synthesizer.synthesize(sdg);

        assertEquals(1, pseudo.groups().size());
        VariableGroup group = pseudo.groups().get(0);
        assertEquals(List.of("a", "b"), group.memberNames());
        assertEquals(Set.of(group), pseudo.groupsContaining(a));
        assertTrue(pseudo.groupsContaining(StorageVariable.of("Pool", "hits")).isEmpty());

        // the group is read and written wherever a member is
        assertEquals(Set.of(new BlockId("Pool.set(uint256)", 1), new BlockId("Pool.set(uint256)", 2)),
                sdg.writers(group));
        assertEquals(sdg.readers(a), sdg.readers(group));
        assertTrue(sdg.writtenVariables().contains(group));
        assertEquals(sdg.readers(b), sdg.readers(group));
    }

    @Test
    void testMultiReturnSummaryBecomesPseudoVariable() {
        StateDependencyGraph sdg = ModelFixtures.sdgOf(ModelFixtures.context(ModelFixtures.ledger()));
        StorageVariable balances = StorageVariable.of("Ledger", "balances");
        StorageVariable total = StorageVariable.of("Ledger", "total");

        PseudoVariableSynthesizer.PseudoVariables pseudo = synthesizer.synthesize(sdg);

        assertEquals(1, pseudo.groups().size());
        VariableGroup group = pseudo.groups().get(0);
        assertEquals(List.of(balances, total), group.members());
        assertEquals(Set.of(group), pseudo.groupsContaining(balances));
        assertEquals(Set.of(new BlockId("Ledger.mint(uint256)", 1)), sdg.writers(group));
        assertTrue(sdg.readers(group).contains(new BlockId("Ledger.check()", 1)));
    }

    @Test
    void testNoGroupsWithoutMultiVariableFacts() {
        StateDependencyGraph sdg = ModelFixtures.sdgOf(ModelFixtures.context(ModelFixtures.vault()));

        PseudoVariableSynthesizer.PseudoVariables pseudo = synthesizer.synthesize(sdg);

        assertTrue(pseudo.groups().isEmpty());
        assertTrue(pseudo.memberIndex().isEmpty());
    }
}
