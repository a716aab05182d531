package com.raditha.mvscan.frontend;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FrontEndLoaderTest {

    private final FrontEndLoader loader = new FrontEndLoader();

    private CompilationUnitModel vaultFixture() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/vault.json")) {
            assertNotNull(in);
            return loader.read(in);
        }
    }

    @Test
    void testReadFixture() throws IOException {
        CompilationUnitModel unit = vaultFixture();

        assertEquals(1, unit.contracts().size());
        ContractModel vault = unit.contract("Vault").orElseThrow();
        assertEquals(2, vault.stateVariables().size());
        assertTrue(vault.exposesFunction("withdraw"));

        FunctionModel withdraw = vault.functions().stream()
                .filter(f -> f.name().equals("withdraw"))
                .findFirst()
                .orElseThrow();
        assertEquals("Vault.withdraw(uint256)", withdraw.id());
        assertEquals(4, withdraw.nodes().size());

        NodeModel guard = withdraw.node(1).orElseThrow();
        assertEquals(NodeKind.REQUIRE, guard.kind());
        assertTrue(guard.isBranch());
        assertEquals("msg.sender", guard.reads().get(0).key());
        assertEquals(13, guard.source().startLine());

        NodeModel send = withdraw.node(3).orElseThrow();
        assertEquals(CallKind.LOW_LEVEL, send.calls().get(0).kind());
        assertFalse(send.calls().get(0).isResolved());
    }

    @Test
    void testMissingDefaultsAreFilled() throws IOException {
        CompilationUnitModel unit = vaultFixture();
        FunctionModel deposit = unit.functions()
                .filter(f -> f.name().equals("deposit"))
                .findFirst()
                .orElseThrow();

        NodeModel entry = deposit.entryNode().orElseThrow();
        assertEquals(0, entry.id());
        assertTrue(entry.calls().isEmpty());
        assertTrue(entry.localWrites().isEmpty());
    }

    @Test
    void testLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("unit.json");
        try (InputStream in = getClass().getResourceAsStream("/fixtures/vault.json")) {
            assertNotNull(in);
            Files.copy(in, file);
        }

        CompilationUnitModel unit = loader.load(file);
        assertEquals(2, unit.functions().count());
    }

    @Test
    void testLoadMissingFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> loader.load(dir.resolve("absent.json")));
    }

    @Test
    void testLoadMalformedFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ \"contracts\": [ {");

        assertThrows(IOException.class, () -> loader.load(file));
    }
}
