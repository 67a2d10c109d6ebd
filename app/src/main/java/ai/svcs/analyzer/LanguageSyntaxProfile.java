package ai.svcs.analyzer;

import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Node-type vocabulary of one tree-sitter grammar.
 *
 * @param constructs node type to the construct it represents in a body
 * @param comprehensionKinds comprehension node type to its kind ("list", "dict", "set", "generator")
 * @param functionalCallNames callee names (last segment) counted as functional-style calls
 * @param identifierFieldName field holding a declaration's name
 * @param bodyFieldName field holding a declaration's body
 * @param parametersFieldName field holding a function's parameter list
 * @param returnTypeFieldName field holding a function's return type, empty when the grammar has none
 */
public record LanguageSyntaxProfile(
        Map<String, BodyConstruct> constructs,
        Map<String, String> comprehensionKinds,
        Set<String> functionalCallNames,
        String identifierFieldName,
        String bodyFieldName,
        String parametersFieldName,
        String returnTypeFieldName) {

    public @Nullable BodyConstruct construct(String nodeType) {
        return constructs.get(nodeType);
    }

    public boolean isComment(String nodeType) {
        return constructs.get(nodeType) == BodyConstruct.COMMENT;
    }
}
