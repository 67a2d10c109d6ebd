package ai.svcs.semantic.patterns;

import ai.svcs.semantic.EventType;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Security-relevant edits: hardcoded secrets, dangerous APIs, input validation and query parameterization.
 */
final class SecurityRule implements PatternRule {
    private static final Pattern SECRET = Pattern.compile(
            "\\$?\\b(password|passwd|api_?key|secret|token|access_?key)\\b\\s*[:=]\\s*['\"][^'\"]{3,}['\"]",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ENV_LOOKUP =
            Pattern.compile("os\\.environ|getenv\\s*\\(|process\\.env|\\$_ENV|\\$_SERVER|keyring|secrets?manager");
    private static final Set<String> SENSITIVE_CALLS = Set.of(
            "eval",
            "exec",
            "system",
            "popen",
            "loads",
            "unserialize",
            "shell_exec",
            "passthru",
            "md5",
            "sha1",
            "Function",
            "execSync");
    private static final Pattern RAW_HTML = Pattern.compile("innerHTML\\s*=|dangerouslySetInnerHTML|shell\\s*=\\s*True");
    private static final Pattern VALIDATION_CALL =
            Pattern.compile("(?i)(validat\\w*|sanitiz\\w*|escape\\w*|htmlspecialchars|filter_var|is_valid\\w*|check_\\w+)");
    private static final Pattern SQL_FORMATTING = Pattern.compile(
            "(?i)['\"]\\s*(select|insert|update|delete)\\b[^'\"]*['\"]\\s*(%|\\+|\\.\\s*\\$|\\.format)|f['\"]\\s*(select|insert|update|delete)\\b[^'\"]*\\{");
    private static final Pattern SQL_PLACEHOLDER =
            Pattern.compile("(?i)['\"]\\s*(select|insert|update|delete)\\b[^'\"]*(\\?|%s|:\\w+|\\$\\d)[^'\"]*['\"]");

    @Override
    public String name() {
        return "security";
    }

    @Override
    public List<PatternMatch> detect(PatternInput input) {
        var matches = new ArrayList<PatternMatch>();
        var before = input.before().canonicalText();
        var after = input.after().canonicalText();

        int secretsBefore = PatternInput.count(SECRET, before);
        int secretsAfter = PatternInput.count(SECRET, after);
        boolean envAdded = PatternInput.count(ENV_LOOKUP, after) > PatternInput.count(ENV_LOOKUP, before);
        if (secretsAfter < secretsBefore) {
            matches.add(new PatternMatch(
                    EventType.SECURITY_IMPROVEMENT,
                    input.moduleId(),
                    input.path(),
                    "Hardcoded secret removed",
                    "Credential no longer stored in source",
                    List.of(
                            Signal.of("hardcoded credential removed", 2, true),
                            Signal.of("configuration or environment lookup introduced", 1, envAdded))));
        } else if (secretsAfter > secretsBefore) {
            matches.add(new PatternMatch(
                    EventType.SECURITY_VULNERABILITY,
                    input.moduleId(),
                    input.path(),
                    "Hardcoded secret introduced",
                    "Credential exposed in source",
                    List.of(
                            Signal.of("hardcoded credential added", 2, true),
                            Signal.of("no environment lookup added", 1, !envAdded))));
        }

        for (var pair : input.candidates()) {
            var added = new TreeSet<String>();
            for (var call : pair.featuresAfter().calls()) {
                var name = PatternInput.simpleName(call);
                if (SENSITIVE_CALLS.contains(name) && !PatternInput.calls(pair.before(), name)) {
                    added.add(call);
                }
            }
            boolean rawHtml = PatternInput.count(RAW_HTML, pair.textAfter())
                    > PatternInput.count(RAW_HTML, pair.textBefore());
            if (!added.isEmpty() || rawHtml) {
                matches.add(new PatternMatch(
                        EventType.SECURITY_VULNERABILITY,
                        pair.id(),
                        input.location(pair.after()),
                        added.isEmpty()
                                ? "Unescaped output or shell execution introduced"
                                : "Sensitive API introduced: " + String.join(", ", added),
                        "Potential injection or weak cryptography",
                        List.of(
                                Signal.of("sensitive API call added", 2, !added.isEmpty() || rawHtml),
                                Signal.of("reachable from a public declaration", 1, pair.after().isPublic()))));
            }

            boolean validationAdded = pair.featuresAfter().calls().stream()
                    .filter(c -> VALIDATION_CALL.matcher(PatternInput.simpleName(c)).matches())
                    .anyMatch(c -> !pair.featuresBefore().calls().contains(c));
            if (validationAdded) {
                matches.add(new PatternMatch(
                        EventType.SECURITY_IMPROVEMENT,
                        pair.id(),
                        input.location(pair.after()),
                        "Input validation added",
                        "Untrusted input is checked before use",
                        List.of(
                                Signal.of("validation call introduced", 2, true),
                                Signal.of(
                                        "new rejection path",
                                        1,
                                        pair.featuresAfter().raiseCount() > pair.featuresBefore().raiseCount()
                                                || pair.featuresAfter().returnCount()
                                                        > pair.featuresBefore().returnCount()))));
            }

            if (PatternInput.count(SQL_FORMATTING, pair.textBefore()) > 0
                    && PatternInput.count(SQL_FORMATTING, pair.textAfter()) == 0) {
                matches.add(new PatternMatch(
                        EventType.SECURITY_IMPROVEMENT,
                        pair.id(),
                        input.location(pair.after()),
                        "SQL injection prevention - parameterized queries",
                        "Query values are no longer spliced into SQL text",
                        List.of(
                                Signal.of("string-built SQL removed", 2, true),
                                Signal.of(
                                        "placeholder query introduced",
                                        2,
                                        PatternInput.count(SQL_PLACEHOLDER, pair.textAfter()) > 0))));
            }
        }
        return matches;
    }
}
