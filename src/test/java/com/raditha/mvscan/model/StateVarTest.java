package com.raditha.mvscan.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateVarTest {

    @Test
    void testStorageVariableEquality() {
        StorageVariable a = new StorageVariable("Vault", "total", "uint256", false, false, 3);
        StorageVariable b = StorageVariable.of("Vault", "total");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, StorageVariable.of("Pool", "total"));
        assertEquals("SV:Vault.total", a.identity());
    }

    @Test
    void testInertVariables() {
        assertTrue(new StorageVariable("T", "MAX", "uint256", true, false, null).isInert());
        assertTrue(new StorageVariable("T", "token", "address", false, true, null).isInert());
        assertTrue(new StorageVariable("T", "MINTER_ROLE", "bytes32", false, false, null).isInert());
        assertFalse(new StorageVariable("T", "root", "bytes32", false, false, null).isInert());
    }

    @Test
    void testSlotCollapsesOntoCollection() {
        StorageVariable balances = StorageVariable.of("Vault", "balances");
        SlotInstance slot = new SlotInstance(balances, "msg.sender");

        assertEquals("balances[msg.sender]", slot.name());
        assertEquals(VariableKind.MAPPING_SLOT, slot.kind());
        assertEquals(balances.identity(), slot.identity());
        assertSame(balances, slot.base());
        assertNotEquals(slot, new SlotInstance(balances, "to"));
    }

    @Test
    void testGroupIdentityIsItsId() {
        StorageVariable a = StorageVariable.of("Pool", "a");
        StorageVariable b = StorageVariable.of("Pool", "b");
        VariableGroup g1 = new VariableGroup(1, List.of(b, a));

        assertEquals("{a, b}", g1.name());
        assertEquals("MVG:1", g1.identity());
        assertEquals(g1, new VariableGroup(1, List.of(a, StorageVariable.of("Pool", "c"))));
        assertNull(g1.declaringContract());
        assertThrows(IllegalArgumentException.class, () -> new VariableGroup(2, List.of(a)));
    }

    @Test
    void testExternalProxyIsLowerCased() {
        ExternalStateProxy proxy = new ExternalStateProxy("Token", "balanceOf");

        assertEquals("token.balanceof", proxy.name());
        assertEquals(VariableKind.EXTERNAL, proxy.kind());
        assertEquals("unknown", new ExternalStateProxy(" ", "sync").address());
    }

    @Test
    void testBlockOrder() {
        BlockId a1 = new BlockId("A.f()", 1);
        BlockId a2 = new BlockId("A.f()", 2);
        BlockId b0 = new BlockId("B.g()", 0);

        assertTrue(a1.precedes(a2));
        assertTrue(a2.precedes(b0));
        assertFalse(b0.precedes(a1));
        assertFalse(a1.precedes(a1));
        assertEquals("A.f()#1", a1.toString());
    }

    @Test
    void testTransactionSetIsSortedAndDeduplicated() {
        TransactionSet tx = TransactionSet.of("Vault.withdraw(uint256)", "Vault.deposit()");

        assertEquals(List.of("Vault.deposit()", "Vault.withdraw(uint256)"), tx.entries());
        assertFalse(tx.isSingleEntry());
        assertTrue(TransactionSet.of("A.f()", "A.f()").isSingleEntry());
    }

    @Test
    void testReentrantEscalation() {
        assertEquals(PairPattern.REENTRANT_STALE_READ, PairPattern.CROSS_TX_STALE_READ.reentrant());
        assertEquals(PairPattern.REENTRANT_DESTRUCTIVE_WRITE, PairPattern.DESTRUCTIVE_WRITE.reentrant());
        assertTrue(PairPattern.STALE_READ.reentrant().isReentrant());
        assertFalse(PairPattern.STALE_READ.isReentrant());
    }

    @Test
    void testShapeMerge() {
        ShapeTags merged = new ShapeTags(true, false).merge(new ShapeTags(false, true));
        assertEquals(new ShapeTags(true, true), merged);
        assertEquals(ShapeTags.NONE, ShapeTags.NONE.merge(ShapeTags.NONE));
    }
}
