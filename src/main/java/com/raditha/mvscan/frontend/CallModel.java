package com.raditha.mvscan.frontend;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A call operation inside a control-flow node.
 *
 * @param kind           Call kind
 * @param callee         Identifier of the resolved callee function, null when unresolved
 * @param calleeName     Called function name as written (e.g. {@code balanceOf})
 * @param calleeContract Contract declaring the resolved callee, null when unknown
 * @param destination    Destination address expression for message calls, null for internal calls
 * @param arguments      Argument expressions in order
 * @param value          Attached ether value expression, null when absent
 */
public record CallModel(
        CallKind kind,
        @Nullable String callee,
        String calleeName,
        @Nullable String calleeContract,
        @Nullable String destination,
        List<String> arguments,
        @Nullable String value) {

    public CallModel {
        if (kind == null) {
            kind = CallKind.INTERNAL;
        }
        if (calleeName == null) {
            calleeName = "";
        }
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public boolean isResolved() {
        return callee != null;
    }

    /**
     * Selector of the call: the callee name up to the parameter list, lower-cased.
     */
    public String selector() {
        int paren = calleeName.indexOf('(');
        String bare = paren >= 0 ? calleeName.substring(0, paren) : calleeName;
        return bare.trim().toLowerCase();
    }
}
