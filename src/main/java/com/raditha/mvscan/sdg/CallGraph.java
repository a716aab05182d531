package com.raditha.mvscan.sdg;

import com.raditha.mvscan.frontend.CallKind;
import com.raditha.mvscan.frontend.CallModel;
import com.raditha.mvscan.frontend.FunctionModel;
import com.raditha.mvscan.frontend.NodeModel;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Static call graph over resolved high-level and internal calls.
 * Dynamic and low-level calls have no edges.
 */
public class CallGraph {

    private final Map<String, Set<String>> callees = new TreeMap<>();
    private final Map<String, FunctionModel> functions = new TreeMap<>();

    public static CallGraph build(Collection<FunctionModel> functions) {
        CallGraph graph = new CallGraph();
        for (FunctionModel fn : functions) {
            graph.functions.put(fn.id(), fn);
            for (NodeModel node : fn.nodes()) {
                for (CallModel call : node.calls()) {
                    if (call.kind() != CallKind.LOW_LEVEL && call.callee() != null) {
                        graph.callees.computeIfAbsent(fn.id(), k -> new TreeSet<>()).add(call.callee());
                    }
                }
            }
        }
        return graph;
    }

    public Set<String> callees(String functionId) {
        return callees.getOrDefault(functionId, Set.of());
    }

    /**
     * True if {@code to} is reachable from {@code from} through one or more calls.
     */
    public boolean reaches(String from, String to) {
        Set<String> seen = new HashSet<>();
        Deque<String> work = new ArrayDeque<>(callees(from));
        while (!work.isEmpty()) {
            String cur = work.pop();
            if (cur.equals(to)) {
                return true;
            }
            if (seen.add(cur)) {
                work.addAll(callees(cur));
            }
        }
        return false;
    }

    /**
     * True if either function can call into the other.
     */
    public boolean reentrant(String a, String b) {
        return reaches(a, b) || reaches(b, a);
    }

    /**
     * True if both functions directly call at least one common function.
     */
    public boolean sharesCallee(String a, String b) {
        Set<String> left = callees(a);
        Set<String> right = callees(b);
        if (left.isEmpty() || right.isEmpty()) {
            return false;
        }
        return left.stream().anyMatch(right::contains);
    }

    /**
     * True if some non-view, non-pure function calls the given function.
     */
    public boolean isCalledFromStateful(String functionId) {
        for (Map.Entry<String, Set<String>> e : callees.entrySet()) {
            FunctionModel caller = functions.get(e.getKey());
            if (caller != null && !caller.isViewOnly() && e.getValue().contains(functionId)) {
                return true;
            }
        }
        return false;
    }
}
