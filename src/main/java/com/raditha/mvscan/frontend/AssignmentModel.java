package com.raditha.mvscan.frontend;

/**
 * A three-address assignment {@code lvalue := rvalue} in textual form.
 *
 * @param lvalue Assigned location as source text (e.g. {@code balances[msg.sender]})
 * @param rvalue Right-hand side as source text
 */
public record AssignmentModel(String lvalue, String rvalue) {

    public AssignmentModel {
        if (lvalue == null) {
            lvalue = "";
        }
        if (rvalue == null) {
            rvalue = "";
        }
    }
}
