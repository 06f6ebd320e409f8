package com.keystone.core.quality;

import com.keystone.core.model.CheckerResult;
import com.keystone.core.model.IssueSeverity;
import com.keystone.core.model.QualityIssue;
import com.keystone.core.model.Submission;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Pattern scan for hard-coded secrets, injection-prone constructs and insecure calls.
 */
@Component
public class SecurityChecker implements QualityChecker {

    public static final String NAME = "security";

    private record Rule(Pattern pattern, IssueSeverity severity, String category, String description,
                        String suggestion, double penalty) {}

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("(?i)(password|passwd|pwd|secret|api_key|apikey|private_key|token)\\s*[=:]\\s*[\"'][^\"']{8,}[\"']"),
                    IssueSeverity.CRITICAL, "secrets", "Hard-coded credential",
                    "Load credentials from the environment or a secret store", 40),
            new Rule(Pattern.compile("-----BEGIN (RSA |EC )?PRIVATE KEY-----"),
                    IssueSeverity.CRITICAL, "secrets", "Embedded private key",
                    "Remove the key and rotate it", 40),
            new Rule(Pattern.compile("(?i)(execute|query)\\s*\\(\\s*[\"'][^\"']*(select|insert|update|delete)[^\"']*[\"']\\s*(\\+|%)"),
                    IssueSeverity.HIGH, "injection", "SQL built by string concatenation",
                    "Use parameterised queries", 15),
            new Rule(Pattern.compile("\\.innerHTML\\s*=|document\\.write\\s*\\("),
                    IssueSeverity.HIGH, "xss", "Unescaped HTML sink",
                    "Escape output or use a safe templating API", 15),
            new Rule(Pattern.compile("\\b(eval|exec)\\s*\\(|os\\.system\\s*\\(|pickle\\.loads\\s*\\("),
                    IssueSeverity.MEDIUM, "insecure-function", "Use of an insecure function",
                    "Replace with a safe alternative", 5)
    );

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckerResult check(Submission submission) {
        List<QualityIssue> issues = new ArrayList<>();
        double score = 100.0;
        for (var entry : submission.artifact().files().entrySet()) {
            for (Rule rule : RULES) {
                if (rule.pattern().matcher(entry.getValue()).find()) {
                    issues.add(new QualityIssue(rule.severity(), rule.category(), entry.getKey(),
                            rule.description(), rule.suggestion()));
                    score -= rule.penalty();
                }
            }
        }
        return new CheckerResult(NAME, Math.max(0.0, score), issues, false, Map.of("findings", issues.size()));
    }
}
