package com.raditha.mvscan.normalization;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.visitor.ModifierVisitor;
import com.github.javaparser.ast.visitor.Visitable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic, normalized-text view of IR expressions.
 * <p>
 * Contract expressions such as {@code balances[address(this)]} or
 * {@code require(!initialized, "done")} are close enough to Java expression
 * syntax that JavaParser can parse most of them. Parsed expressions are
 * rewritten to drop {@code this.} qualifiers, trivial {@code address(...)} /
 * {@code payable(...)} casts and redundant parentheses. Anything JavaParser
 * rejects goes through an equivalent textual rewrite.
 * <p>
 * The result is whitespace-free and lower-cased:
 * <pre>
 * Original:   balances[ address(this.vault) ]
 * Normalized: balances[vault]
 * </pre>
 * This is a text heuristic, not a semantic equivalence check.
 */
public class ExpressionNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionNormalizer.class);

    private static final Set<String> CAST_WRAPPERS = Set.of("address", "payable");
    private static final Set<String> PREDICATE_CALLS = Set.of("require", "assert");

    private static final Pattern CAST_PATTERN = Pattern.compile("\\b(?:address|payable)\\(([^()]*)\\)");
    private static final Pattern PREDICATE_PATTERN = Pattern.compile("^\\s*(?:require|assert)\\s*\\((.*)\\)\\s*;?\\s*$",
            Pattern.DOTALL);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private final JavaParser parser = new JavaParser();
    private final Map<String, String> cache = new HashMap<>();

    /**
     * Normalize an expression.
     *
     * @param text raw expression text, may be null
     * @return canonical text, empty for null or blank input
     */
    public String normalize(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return cache.computeIfAbsent(text, this::computeNormalized);
    }

    private String computeNormalized(String text) {
        Optional<Expression> parsed = parse(text);
        if (parsed.isPresent()) {
            Visitable rewritten = parsed.get().accept(new CanonicalizingVisitor(), null);
            if (rewritten instanceof Expression expression) {
                return squash(expression.toString());
            }
        }
        return textual(text);
    }

    /**
     * The predicate of a branch expression: the first argument of
     * {@code require(...)} / {@code assert(...)}, otherwise the expression
     * itself. Normalized.
     */
    public String predicateText(String expression) {
        if (expression == null || expression.isBlank()) {
            return "";
        }
        Optional<Expression> parsed = parse(expression);
        if (parsed.isPresent() && parsed.get() instanceof MethodCallExpr call
                && call.getScope().isEmpty()
                && PREDICATE_CALLS.contains(call.getNameAsString())
                && call.getArguments().isNonEmpty()) {
            return normalize(call.getArgument(0).toString());
        }
        Matcher m = PREDICATE_PATTERN.matcher(expression);
        if (m.matches()) {
            String args = m.group(1);
            int comma = topLevelComma(args);
            return normalize(comma < 0 ? args : args.substring(0, comma));
        }
        return normalize(expression);
    }

    /**
     * True if {@code token} appears in {@code text} as a whole identifier
     * (or member chain). Both sides are normalized first.
     */
    public boolean mentions(String text, String token) {
        String haystack = normalize(text);
        String needle = normalize(token);
        if (needle.isEmpty() || haystack.isEmpty()) {
            return false;
        }
        int from = 0;
        while (true) {
            int idx = haystack.indexOf(needle, from);
            if (idx < 0) {
                return false;
            }
            int end = idx + needle.length();
            boolean leftOk = idx == 0 || !isIdentifierChar(haystack.charAt(idx - 1));
            boolean rightOk = end == haystack.length() || !isIdentifierChar(haystack.charAt(end));
            if (leftOk && rightOk) {
                return true;
            }
            from = idx + 1;
        }
    }

    /**
     * True for {@code x + 0}, {@code x - 0}, {@code x * 1}, {@code x / 1} (and the
     * commutative forms of addition and multiplication) where x is the lvalue.
     */
    public boolean isIdentityUpdate(String lvalue, String rvalue) {
        String lv = normalize(lvalue);
        String rv = normalize(rvalue);
        if (lv.isEmpty()) {
            return false;
        }
        return rv.equals(lv + "+0") || rv.equals(lv + "-0")
                || rv.equals(lv + "*1") || rv.equals(lv + "/1")
                || rv.equals("0+" + lv) || rv.equals("1*" + lv);
    }

    public static boolean isIdentifier(String text) {
        return text != null && IDENTIFIER.matcher(text).matches();
    }

    private Optional<Expression> parse(String text) {
        ParseResult<Expression> result = parser.parseExpression(text.strip());
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult();
        }
        logger.trace("Falling back to textual normalization for '{}'", text);
        return Optional.empty();
    }

    private static String textual(String text) {
        String t = text.replace("this.", "");
        String previous;
        do {
            previous = t;
            t = CAST_PATTERN.matcher(t).replaceAll("$1");
        } while (!t.equals(previous));
        return squash(t);
    }

    private static String squash(String text) {
        return text.replaceAll("\\s+", "").toLowerCase();
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static int topLevelComma(String args) {
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < args.length(); i++) {
            char c = args.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (!inString) {
                if (c == '(' || c == '[') {
                    depth++;
                } else if (c == ')' || c == ']') {
                    depth--;
                } else if (c == ',' && depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Single-pass rewrite of the parsed expression.
     */
    private static class CanonicalizingVisitor extends ModifierVisitor<Void> {

        @Override
        public Visitable visit(MethodCallExpr n, Void arg) {
            super.visit(n, arg);
            if (n.getScope().isEmpty()
                    && CAST_WRAPPERS.contains(n.getNameAsString())
                    && n.getArguments().size() == 1) {
                return n.getArgument(0);
            }
            return n;
        }

        @Override
        public Visitable visit(FieldAccessExpr n, Void arg) {
            super.visit(n, arg);
            if (n.getScope() instanceof ThisExpr) {
                return new NameExpr(n.getNameAsString());
            }
            return n;
        }

        @Override
        public Visitable visit(EnclosedExpr n, Void arg) {
            super.visit(n, arg);
            Expression inner = n.getInner();
            if (inner.isNameExpr() || inner.isFieldAccessExpr() || inner.isLiteralExpr()
                    || inner.isArrayAccessExpr() || inner.isMethodCallExpr() || inner.isEnclosedExpr()) {
                return inner;
            }
            return n;
        }
    }
}
