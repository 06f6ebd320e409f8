package com.keystone.core.quality;

import com.keystone.core.model.CheckerResult;
import com.keystone.core.model.IssueSeverity;
import com.keystone.core.model.QualityIssue;
import com.keystone.core.model.Submission;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Checks that source files carry doc comments and that larger bundles ship a README.
 */
@Component
public class DocumentationChecker implements QualityChecker {

    public static final String NAME = "documentation";

    private static final Set<String> SOURCE_EXTENSIONS = Set.of(
            ".java", ".kt", ".py", ".js", ".ts", ".go", ".rb", ".cs");

    private static final List<String> DOC_MARKERS = List.of("/**", "\"\"\"", "'''", "///");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckerResult check(Submission submission) {
        Map<String, String> files = submission.artifact().files();
        List<QualityIssue> issues = new ArrayList<>();
        double score = 100.0;
        int sources = 0;
        int documented = 0;

        for (var entry : files.entrySet()) {
            if (!isSource(entry.getKey())) {
                continue;
            }
            sources++;
            if (DOC_MARKERS.stream().anyMatch(entry.getValue()::contains)) {
                documented++;
            } else {
                issues.add(new QualityIssue(IssueSeverity.MEDIUM, "documentation", entry.getKey(),
                        "Source file has no doc comments", "Document the public API"));
                score -= 5;
            }
        }

        boolean hasReadme = files.keySet().stream()
                .map(p -> p.substring(p.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT))
                .anyMatch(n -> n.startsWith("readme"));
        if (!hasReadme && files.size() > 3) {
            issues.add(new QualityIssue(IssueSeverity.LOW, "documentation", null,
                    "No README in a multi-file artifact", "Add a README describing the change"));
            score -= 10;
        }

        return new CheckerResult(NAME, Math.max(0.0, score), issues, false,
                Map.of("sourceFiles", sources, "documented", documented, "readme", hasReadme));
    }

    private static boolean isSource(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return SOURCE_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }
}
