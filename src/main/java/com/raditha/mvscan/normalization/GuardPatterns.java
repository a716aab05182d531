package com.raditha.mvscan.normalization;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Text patterns over normalized predicates: admin guards, initialization
 * latches and post-initialization guards. All inputs are expected to be
 * normalized by {@link ExpressionNormalizer} (no whitespace, lower case).
 */
public final class GuardPatterns {

    /**
     * Modifier names that restrict a function to privileged callers.
     */
    public static final Set<String> ADMIN_MODIFIERS = Set.of(
            "onlyowner", "onlyadmin", "onlyrole", "onlygovernance", "onlygov", "onlydao",
            "onlytimelock", "onlyguardian", "onlymultisig", "auth", "requiresauth", "checkowner");

    private static final List<String> PRIVILEGED_TOKENS = List.of(
            "owner", "govern", "timelock", "guardian", "multisig", "admin");

    private static final Set<String> CREATION_PHASE_NAMES = Set.of(
            "bootstrap", "init", "initialize", "setup", "set_up");

    private GuardPatterns() {
    }

    public static boolean isAdminModifier(String modifier) {
        return modifier != null && ADMIN_MODIFIERS.contains(modifier.toLowerCase());
    }

    /**
     * Inline privileged-caller check, e.g. {@code msg.sender==owner} or
     * {@code hasrole(minter_role,msg.sender)}.
     */
    public static boolean isAdminGuard(String predicate) {
        if (predicate == null || predicate.isEmpty()) {
            return false;
        }
        boolean sender = predicate.contains("msg.sender");
        if (sender && PRIVILEGED_TOKENS.stream().anyMatch(predicate::contains)) {
            return true;
        }
        if (predicate.contains("hasrole") || predicate.contains("onlyrole")) {
            return true;
        }
        return sender && (predicate.contains("role") || predicate.contains("isadmin") || predicate.contains("isowner"));
    }

    public static boolean isCreationPhaseName(String functionName) {
        return functionName != null && CREATION_PHASE_NAMES.contains(functionName.toLowerCase());
    }

    public static boolean isInitializerModifier(String modifier) {
        return modifier != null && modifier.toLowerCase().contains("initializer");
    }

    /**
     * Latch candidates of a predicate, in the forms {@code !L}, {@code L==c},
     * {@code (L&C)==0} and {@code _initialized<k}.
     */
    public static Set<Latch> latchCandidates(String predicate) {
        Set<Latch> latches = new LinkedHashSet<>();
        if (predicate == null || predicate.isEmpty()) {
            return latches;
        }
        if (predicate.startsWith("!")) {
            String token = predicate.substring(1);
            if (ExpressionNormalizer.isIdentifier(token)) {
                latches.add(Latch.of(token, LatchForm.BOOL));
            }
        }
        int eq = predicate.indexOf("==");
        if (eq > 0) {
            String left = predicate.substring(0, eq);
            String right = predicate.substring(eq + 2);
            if (ExpressionNormalizer.isIdentifier(left)) {
                latches.add(new Latch(left, LatchForm.EQ, right));
            }
        }
        int amp = predicate.indexOf('&');
        if (amp > 0 && predicate.contains("==0") && !predicate.contains("&&")) {
            String left = stripParens(predicate.substring(0, amp));
            if (ExpressionNormalizer.isIdentifier(left)) {
                latches.add(Latch.of(left, LatchForm.MASK_ZERO));
            }
        }
        if (predicate.contains("<") && predicate.contains("_initialized")) {
            latches.add(Latch.of("_initialized", LatchForm.VERSION_LT));
        }
        return latches;
    }

    /**
     * Latch names guarded by a pre-initialization predicate where the latch is
     * compared against its initial value ({@code !L}, {@code L==false},
     * {@code L==0}, mask or version checks).
     */
    public static Set<String> preGuardLatchNames(String predicate) {
        Set<String> names = new LinkedHashSet<>();
        for (Latch latch : latchCandidates(predicate)) {
            if (latch.form() != LatchForm.EQ
                    || "false".equals(latch.comparedTo()) || "0".equals(latch.comparedTo())) {
                names.add(latch.name());
            }
        }
        return names;
    }

    /**
     * A monotone flip moves the latch out of its pre-initialization state.
     *
     * @param latch the latch
     * @param rhs   normalized right-hand side assigned to the latch
     */
    public static boolean isMonotoneFlip(Latch latch, String rhs) {
        return switch (latch.form()) {
            case BOOL, EQ -> rhs.contains("true") || rhs.contains("ready")
                    || rhs.contains("initialized") || "1".equals(rhs);
            case MASK_ZERO -> rhs.contains("|") || rhs.contains("set");
            case VERSION_LT -> !"0".equals(rhs) && !"false".equals(rhs);
        };
    }

    /**
     * An assignment that puts the latch back into its pre-initialization state.
     */
    public static boolean isReset(String rhs) {
        return "false".equals(rhs) || "0".equals(rhs)
                || "phase.uninitialized".equals(rhs) || rhs.contains("&=~") || rhs.contains("&~");
    }

    /**
     * True if a predicate only holds after the latch was flipped, e.g.
     * {@code initialized==true}, {@code _initialized>0} or a phase check.
     */
    public static boolean isPostGuard(String predicate, String latch) {
        if (predicate == null || predicate.isEmpty()) {
            return false;
        }
        if (("initialized".equals(latch) || "_initialized".equals(latch))
                && (predicate.contains("phase==live") || predicate.contains("phase.live"))) {
            return true;
        }
        if (!predicate.contains(latch)) {
            return false;
        }
        if (predicate.contains("!" + latch)
                || predicate.contains(latch + "==false")
                || predicate.contains(latch + "==0")) {
            return false;
        }
        return !("_initialized".equals(latch) && predicate.contains(latch + "<"));
    }

    private static String stripParens(String text) {
        String t = text;
        while (t.startsWith("(")) {
            t = t.substring(1);
        }
        while (t.endsWith(")")) {
            t = t.substring(0, t.length() - 1);
        }
        return t;
    }
}
