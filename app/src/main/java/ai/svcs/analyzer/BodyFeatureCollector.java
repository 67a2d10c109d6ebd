package ai.svcs.analyzer;

import static ai.svcs.analyzer.ASTTraversalUtils.namedChildren;

import ai.svcs.analyzer.TreeSitterAdapter.ScopeKind;
import java.util.Set;
import org.treesitter.TSNode;

/**
 * Walks one declaration body and records its control flow, calls and usage histograms. The walk stops at nested
 * declarations: those become nodes of their own and carry their own facts.
 */
final class BodyFeatureCollector {
    static final Set<String> COMPARISON_OPERATORS = Set.of(
            "==", "!=", "===", "!==", "<", ">", "<=", ">=", "<>", "<=>", "is", "is not", "in", "not in", "instanceof");
    static final Set<String> LOGICAL_OPERATORS = Set.of("and", "or", "&&", "||", "??", "xor");
    static final Set<String> UNARY_OPERATORS = Set.of("not", "!", "~", "-", "+", "++", "--", "typeof", "void", "delete", "@");
    static final Set<String> BINARY_OPERATORS = Set.of(
            "+", "-", "*", "/", "//", "%", "**", "@", "<<", ">>", ">>>", "&", "|", "^", ".");

    private final TreeSitterAdapter adapter;
    private final SourceContent content;
    private final ScopeKind scope;
    private final NodeFeatures.Builder features;

    BodyFeatureCollector(TreeSitterAdapter adapter, SourceContent content, ScopeKind scope, NodeFeatures.Builder features) {
        this.adapter = adapter;
        this.content = content;
        this.scope = scope;
        this.features = features;
    }

    void collect(TSNode body) {
        walk(body, 0);
    }

    private void walk(TSNode node, int loopDepth) {
        // keyword tokens share their text with node types ("await", "lambda"), so only named nodes are visited
        for (var child : namedChildren(node)) {
            visit(child, loopDepth);
        }
    }

    private void visit(TSNode node, int loopDepth) {
        var type = node.getType();
        if (ASTTraversalUtils.ERROR_NODE.equals(type)) {
            return;
        }
        var declaration = adapter.declarationKind(node, scope);
        if (declaration != null) {
            if (declaration == TreeSitterAdapter.DeclarationKind.CLASS) {
                features.nestedClass();
            }
            return;
        }
        var construct = adapter.profile().construct(type);
        if (construct == null) {
            walk(node, loopDepth);
            return;
        }
        switch (construct) {
            case COMMENT -> {
                return;
            }
            case LOOP -> {
                features.controlFlow(ControlFlowKind.LOOP).decisionPoint().loopDepth(loopDepth + 1);
                walk(node, loopDepth + 1);
                return;
            }
            case CONDITIONAL -> features.controlFlow(ControlFlowKind.CONDITIONAL).decisionPoint();
            case BRANCH, CASE, TERNARY -> features.decisionPoint();
            case SWITCH -> features.controlFlow(ControlFlowKind.SWITCH);
            case TRY -> features.controlFlow(ControlFlowKind.TRY).tryStatement();
            case CATCH -> {
                features.decisionPoint();
                adapter.caughtTypes(node, content).forEach(features::caughtType);
            }
            case CONTEXT_MANAGER -> features.controlFlow(ControlFlowKind.CONTEXT_MANAGER);
            case CALL -> recordCall(node);
            case LAMBDA -> features.lambda();
            case COMPREHENSION -> features.comprehension(
                    adapter.profile().comprehensionKinds().getOrDefault(type, "list"));
            case RETURN -> features.returnStatement(node.getNamedChildCount() > 0);
            case YIELD -> features.yieldExpression();
            case AWAIT -> features.awaitExpression();
            case RAISE -> features.raiseStatement();
            case GLOBAL -> adapter.declaredNames(node, content).forEach(features::global);
            case NONLOCAL -> adapter.declaredNames(node, content).forEach(features::nonlocal);
            case ASSERT -> features.assertion();
            case STARRED -> features.starred();
            case SLICE -> features.slice();
            case BINARY -> {
                for (var op : adapter.operators(node, content)) {
                    var kind = classifyBinary(op);
                    features.usage(kind, op);
                    if (kind == UsageKind.LOGICAL_OPERATOR) {
                        features.decisionPoint();
                    }
                }
            }
            case BOOLEAN_OPERATOR -> {
                for (var op : adapter.operators(node, content)) {
                    features.usage(UsageKind.LOGICAL_OPERATOR, op).decisionPoint();
                }
            }
            case COMPARISON -> adapter.operators(node, content)
                    .forEach(op -> features.usage(UsageKind.COMPARISON_OPERATOR, op));
            case UNARY -> adapter.operators(node, content).forEach(op -> features.usage(UsageKind.UNARY_OPERATOR, op));
            case STRING -> features.usage(UsageKind.STRING_LITERAL, literalKey(node));
            case NUMBER -> features.usage(UsageKind.NUMERIC_LITERAL, literalKey(node));
            case BOOLEAN -> features.usage(UsageKind.BOOLEAN_LITERAL, literalKey(node));
            case NONE -> features.usage(UsageKind.NONE_LITERAL, literalKey(node));
            case ATTRIBUTE -> {
                var name = adapter.attributeName(node, content);
                if (!name.isEmpty()) {
                    features.usage(UsageKind.ATTRIBUTE_ACCESS, name);
                }
            }
            case SUBSCRIPT -> {
                var target = adapter.subscriptTarget(node, content);
                if (!target.isEmpty()) {
                    features.usage(UsageKind.SUBSCRIPT_ACCESS, target);
                }
            }
            case ASSIGNMENT -> {
                var target = adapter.assignmentTarget(node, content);
                if (!target.isEmpty()) {
                    features.usage(UsageKind.ASSIGNMENT, target);
                }
            }
            case AUGMENTED_ASSIGNMENT -> adapter.operators(node, content)
                    .forEach(op -> features.usage(UsageKind.AUGMENTED_ASSIGNMENT, op));
        }
        walk(node, loopDepth);
    }

    private void recordCall(TSNode node) {
        var target = adapter.callTarget(node, content);
        if (target.isEmpty()) {
            return;
        }
        features.call(target);
        if (adapter.profile().functionalCallNames().contains(lastSegment(target))) {
            features.functionalCall();
        }
    }

    private String literalKey(TSNode node) {
        var text = TokenText.collapseWhitespace(ASTTraversalUtils.extractNodeText(node, content));
        return text.length() > 60 ? text.substring(0, 60) : text;
    }

    static UsageKind classifyBinary(String op) {
        if (COMPARISON_OPERATORS.contains(op)) {
            return UsageKind.COMPARISON_OPERATOR;
        }
        if (LOGICAL_OPERATORS.contains(op)) {
            return UsageKind.LOGICAL_OPERATOR;
        }
        return UsageKind.BINARY_OPERATOR;
    }

    static String lastSegment(String target) {
        int start = 0;
        int dot = target.lastIndexOf('.');
        if (dot >= 0) start = Math.max(start, dot + 1);
        int arrow = target.lastIndexOf("->");
        if (arrow >= 0) start = Math.max(start, arrow + 2);
        int scope = target.lastIndexOf("::");
        if (scope >= 0) start = Math.max(start, scope + 2);
        return target.substring(start);
    }
}
