package com.raditha.mvscan;

import com.raditha.mvscan.analyzer.AnalysisContext;
import com.raditha.mvscan.frontend.AssignmentModel;
import com.raditha.mvscan.frontend.CallKind;
import com.raditha.mvscan.frontend.CallModel;
import com.raditha.mvscan.frontend.CompilationUnitModel;
import com.raditha.mvscan.frontend.ContractModel;
import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.frontend.NodeKind;
import com.raditha.mvscan.frontend.NodeModel;
import com.raditha.mvscan.frontend.ParameterModel;
import com.raditha.mvscan.frontend.SourceLocation;
import com.raditha.mvscan.frontend.StateVariableModel;
import com.raditha.mvscan.frontend.VariableRef;

import com.raditha.mvscan.sdg.SdgBuilder;
import com.raditha.mvscan.sdg.StateDependencyGraph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Small builders for front-end models and the contracts used across tests.
 */
public final class ModelFixtures {

    private ModelFixtures() {
    }

    public static VariableRef ref(String contract, String name) {
        return new VariableRef(contract, name, null);
    }

    public static VariableRef slot(String contract, String name, String key) {
        return new VariableRef(contract, name, key);
    }

    public static AssignmentModel assign(String lvalue, String rvalue) {
        return new AssignmentModel(lvalue, rvalue);
    }

    public static CallModel internalCall(String callee, String calleeName, String contract) {
        return new CallModel(CallKind.INTERNAL, callee, calleeName, contract, null, List.of(), null);
    }

    public static StateVariableModel stateVar(String name, String type) {
        return new StateVariableModel(name, type, false, false, null);
    }

    public static ParameterModel param(String name, String type) {
        return new ParameterModel(name, type);
    }

    /**
     * Fluent node builder.
     */
    public static NodeBuilder node(int id, NodeKind kind, String expression) {
        return new NodeBuilder(id, kind, expression);
    }

    public static final class NodeBuilder {
        private final int id;
        private final NodeKind kind;
        private final String expression;
        private final List<Integer> successors = new ArrayList<>();
        private final List<VariableRef> reads = new ArrayList<>();
        private final List<VariableRef> writes = new ArrayList<>();
        private final List<String> localWrites = new ArrayList<>();
        private final List<AssignmentModel> assignments = new ArrayList<>();
        private final List<CallModel> calls = new ArrayList<>();
        private int line;

        private NodeBuilder(int id, NodeKind kind, String expression) {
            this.id = id;
            this.kind = kind;
            this.expression = expression;
            this.line = id + 1;
        }

        public NodeBuilder succ(Integer... ids) {
            successors.addAll(List.of(ids));
            return this;
        }

        public NodeBuilder reads(VariableRef... refs) {
            reads.addAll(List.of(refs));
            return this;
        }

        public NodeBuilder writes(VariableRef... refs) {
            writes.addAll(List.of(refs));
            return this;
        }

        public NodeBuilder local(String... names) {
            localWrites.addAll(List.of(names));
            return this;
        }

        public NodeBuilder assigns(String lvalue, String rvalue) {
            assignments.add(assign(lvalue, rvalue));
            return this;
        }

        public NodeBuilder calls(CallModel call) {
            calls.add(call);
            return this;
        }

        public NodeBuilder line(int line) {
            this.line = line;
            return this;
        }

        public NodeModel build() {
            return new NodeModel(id, kind, expression, successors, reads, writes, localWrites, assignments, calls,
                    new SourceLocation("Test.sol", line, line));
        }
    }

    public static FunctionModel function(String contract, String name, List<ParameterModel> params,
                                         String visibility, NodeBuilder... nodes) {
        return function(contract, name, params, visibility, "nonpayable", List.of(), nodes);
    }

    public static FunctionModel function(String contract, String name, List<ParameterModel> params,
                                         String visibility, String mutability, List<String> modifiers,
                                         NodeBuilder... nodes) {
        List<NodeModel> built = new ArrayList<>();
        for (NodeBuilder nb : nodes) {
            built.add(nb.build());
        }
        return new FunctionModel(contract, name, params, visibility, mutability, "constructor".equals(name),
                modifiers, null, null, built);
    }

    public static ContractModel contract(String name, List<StateVariableModel> vars, FunctionModel... fns) {
        return new ContractModel(name, List.of(name), vars, List.of(fns));
    }

    public static CompilationUnitModel unit(ContractModel... contracts) {
        return new CompilationUnitModel(List.of(contracts));
    }

    /**
     * deposit() adds to balances[msg.sender]; withdraw(uint256) checks and
     * subtracts it, then sends ether.
     */
    public static CompilationUnitModel vault() {
        VariableRef bal = slot("Vault", "balances", "msg.sender");
        FunctionModel deposit = function("Vault", "deposit", List.of(), "external",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.EXPRESSION, "balances[msg.sender] += msg.value")
                        .reads(bal).writes(bal)
                        .assigns("balances[msg.sender]", "balances[msg.sender] + msg.value"));
        FunctionModel withdraw = function("Vault", "withdraw", List.of(param("amount", "uint256")), "external",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.REQUIRE, "require(balances[msg.sender] >= amount)").succ(2).reads(bal),
                node(2, NodeKind.EXPRESSION, "balances[msg.sender] -= amount").succ(3)
                        .reads(bal).writes(bal)
                        .assigns("balances[msg.sender]", "balances[msg.sender] - amount"),
                node(3, NodeKind.EXPRESSION, "msg.sender.call{value: amount}(\"\")")
                        .calls(new CallModel(CallKind.LOW_LEVEL, null, "call", null, "msg.sender", List.of(),
                                "amount")));
        return unit(contract("Vault", List.of(stateVar("balances", "mapping(address => uint256)")),
                deposit, withdraw));
    }

    /**
     * set(uint256) writes a and b; check() branches on both.
     */
    public static CompilationUnitModel pool() {
        FunctionModel set = function("Pool", "set", List.of(param("x", "uint256")), "public",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.EXPRESSION, "a = x").succ(2).writes(ref("Pool", "a")).assigns("a", "x"),
                node(2, NodeKind.EXPRESSION, "b = x").writes(ref("Pool", "b")).assigns("b", "x"));
        FunctionModel check = function("Pool", "check", List.of(), "public",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.IF, "a > 0 && b > 0").succ(2).reads(ref("Pool", "a"), ref("Pool", "b")),
                node(2, NodeKind.EXPRESSION, "hits += 1").writes(ref("Pool", "hits"))
                        .reads(ref("Pool", "hits")).assigns("hits", "hits + 1"));
        return unit(contract("Pool",
                List.of(stateVar("a", "uint256"), stateVar("b", "uint256"), stateVar("hits", "uint256")),
                set, check));
    }

    /**
     * configure(uint256) is a latched one-time setter of fee; charge(uint256)
     * reads fee.
     */
    public static CompilationUnitModel fees() {
        FunctionModel configure = function("Fees", "configure", List.of(param("f", "uint256")), "external",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.REQUIRE, "require(!configured)").succ(2).reads(ref("Fees", "configured")),
                node(2, NodeKind.EXPRESSION, "fee = f").succ(3).writes(ref("Fees", "fee")).assigns("fee", "f"),
                node(3, NodeKind.EXPRESSION, "configured = true")
                        .writes(ref("Fees", "configured")).assigns("configured", "true"));
        FunctionModel charge = function("Fees", "charge", List.of(param("amt", "uint256")), "external",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.EXPRESSION, "total = amt * fee")
                        .reads(ref("Fees", "fee")).writes(ref("Fees", "total")).assigns("total", "amt * fee"));
        return unit(contract("Fees",
                List.of(stateVar("fee", "uint256"), stateVar("configured", "bool"), stateVar("total", "uint256")),
                configure, charge));
    }

    /**
     * a() writes x and calls b(); b() branches on x and records it.
     */
    public static CompilationUnitModel bank() {
        FunctionModel a = function("Bank", "a", List.of(), "public",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.EXPRESSION, "x = 1").succ(2).writes(ref("Bank", "x")).assigns("x", "1"),
                node(2, NodeKind.EXPRESSION, "b()").calls(internalCall("Bank.b()", "b", "Bank")));
        FunctionModel b = function("Bank", "b", List.of(), "public",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.IF, "x > 0").succ(2).reads(ref("Bank", "x")),
                node(2, NodeKind.EXPRESSION, "seen = x").reads(ref("Bank", "x"))
                        .writes(ref("Bank", "seen")).assigns("seen", "x"));
        return unit(contract("Bank", List.of(stateVar("x", "uint256"), stateVar("seen", "uint256")), a, b));
    }

    /**
     * snapshot(address) is a view returning balances[who] and total;
     * check() calls it with msg.sender and branches on the result.
     */
    public static CompilationUnitModel ledger() {
        FunctionModel snapshot = function("Ledger", "snapshot", List.of(param("who", "address")), "public",
                "view", List.of(),
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.RETURN, "(balances[who], total)")
                        .reads(slot("Ledger", "balances", "who"), ref("Ledger", "total")));
        FunctionModel check = function("Ledger", "check", List.of(), "public",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.EXPRESSION, "(bal, tot) = snapshot(msg.sender)").succ(2).local("bal", "tot")
                        .calls(new CallModel(CallKind.INTERNAL, "Ledger.snapshot(address)", "snapshot", "Ledger",
                                null, List.of("msg.sender"), null)),
                node(2, NodeKind.IF, "bal > tot"));
        FunctionModel mint = function("Ledger", "mint", List.of(param("amt", "uint256")), "public",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.EXPRESSION, "total += amt").reads(ref("Ledger", "total"))
                        .writes(ref("Ledger", "total")).assigns("total", "total + amt"));
        return unit(contract("Ledger",
                List.of(stateVar("balances", "mapping(address => uint256)"), stateVar("total", "uint256")),
                snapshot, check, mint));
    }

    /**
     * spin() loops over a node reading counter with no sink anywhere.
     */
    public static CompilationUnitModel loop() {
        FunctionModel spin = function("Loop", "spin", List.of(), "public",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.OTHER, "counter").succ(2).reads(ref("Loop", "counter")),
                node(2, NodeKind.OTHER, "").succ(1));
        FunctionModel bump = function("Loop", "bump", List.of(), "public",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.EXPRESSION, "counter = 1").writes(ref("Loop", "counter")).assigns("counter", "1"));
        return unit(contract("Loop", List.of(stateVar("counter", "uint256")), spin, bump));
    }

    /**
     * pay() reads limit, copies it into a local and sends the local.
     */
    public static CompilationUnitModel payout() {
        FunctionModel pay = function("Payout", "pay", List.of(), "public",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.OTHER, "limit").succ(2).reads(ref("Payout", "limit")),
                node(2, NodeKind.EXPRESSION, "cached = limit").succ(3).local("cached").assigns("cached", "limit"),
                node(3, NodeKind.EXPRESSION, "token.transfer(recipient, cached)")
                        .calls(new CallModel(CallKind.HIGH_LEVEL, null, "transfer", null, "token",
                                List.of("recipient", "cached"), null)));
        FunctionModel guard = function("Payout", "guard", List.of(), "public",
                node(0, NodeKind.ENTRY_POINT, "").succ(1),
                node(1, NodeKind.OTHER, "limit").succ(2).reads(ref("Payout", "limit")),
                node(2, NodeKind.EXPRESSION, "limit = 0").succ(3).writes(ref("Payout", "limit")).assigns("limit", "0"),
                node(3, NodeKind.IF, "limit > 0").reads(ref("Payout", "limit")));
        return unit(contract("Payout", List.of(stateVar("limit", "uint256")), pay, guard));
    }

    public static AnalysisContext context(CompilationUnitModel unit) {
        return new AnalysisContext(unit, Path.of("."));
    }

    public static StateDependencyGraph sdgOf(AnalysisContext context) {
        return new SdgBuilder(context, false).build();
    }
}
