package com.raditha.mvscan.clustering;

import com.raditha.mvscan.ModelFixtures;
import com.raditha.mvscan.analyzer.AnalysisContext;
import com.raditha.mvscan.frontend.CompilationUnitModel;
import com.raditha.mvscan.layout.StorageLayoutResolver;
import com.raditha.mvscan.model.ExternalStateProxy;
import com.raditha.mvscan.model.SlotInstance;
import com.raditha.mvscan.model.StorageVariable;
import com.raditha.mvscan.model.VariableGroup;
import com.raditha.mvscan.model.VariableKind;
import com.raditha.mvscan.model.VariableMetadata;
import com.raditha.mvscan.util.Keccak256;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VariableDescriberTest {

    @TempDir
    Path root;

    private VariableDescriber describer(CompilationUnitModel unit) {
        AnalysisContext context = ModelFixtures.context(unit);
        return new VariableDescriber(ModelFixtures.sdgOf(context), new StorageLayoutResolver(root, unit));
    }

    @Test
    void testStateVariable() {
        VariableDescriber describer = describer(ModelFixtures.pool());

        VariableMetadata a = describer.describe(StorageVariable.of("Pool", "a"));
        VariableMetadata hits = describer.describe(StorageVariable.of("Pool", "hits"));

        assertEquals("a", a.name());
        assertEquals(VariableKind.STATE, a.kind());
        assertEquals(BigInteger.ZERO, a.slot());
        assertEquals(1, a.branchGroups().size());
        assertEquals(BigInteger.TWO, hits.slot());
        assertNull(hits.branchGroups());
    }

    @Test
    void testNumericKeySlot() {
        VariableDescriber describer = describer(ModelFixtures.vault());
        SlotInstance slot = new SlotInstance(StorageVariable.of("Vault", "balances"), "7");

        VariableMetadata meta = describer.describe(slot);

        assertEquals("balances", meta.name());
        assertEquals(VariableKind.MAPPING_SLOT, meta.kind());
        assertEquals(Keccak256.mappingSlot(BigInteger.valueOf(7), BigInteger.ZERO), meta.slot());
        assertEquals(0, meta.baseSlot());
        assertEquals("7", meta.key());
        assertNull(meta.slotExpr());
    }

    @Test
    void testSymbolicKeySlot() {
        VariableDescriber describer = describer(ModelFixtures.vault());
        SlotInstance slot = new SlotInstance(StorageVariable.of("Vault", "balances"), "msg.sender");

        VariableMetadata meta = describer.describe(slot);

        assertNull(meta.slot());
        assertEquals(0, meta.baseSlot());
        assertEquals("msg.sender", meta.slotExpr());
    }

    @Test
    void testGroupAndProxy() {
        VariableDescriber describer = describer(ModelFixtures.pool());
        VariableGroup group = new VariableGroup(3,
                List.of(StorageVariable.of("Pool", "a"), StorageVariable.of("Pool", "b")));

        VariableMetadata g = describer.describe(group);
        VariableMetadata proxy = describer.describe(new ExternalStateProxy("Token", "0x70a08231"));

        assertEquals(VariableKind.MULTI_VAR_GROUP, g.kind());
        assertEquals(List.of("a", "b"), g.members());
        assertEquals("token.0x70a08231", proxy.name());
        assertEquals(VariableKind.EXTERNAL, proxy.kind());
        assertNull(proxy.slot());
    }
}
