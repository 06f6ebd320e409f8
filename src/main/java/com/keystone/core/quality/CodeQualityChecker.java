package com.keystone.core.quality;

import com.keystone.core.model.CheckerResult;
import com.keystone.core.model.IssueSeverity;
import com.keystone.core.model.QualityIssue;
import com.keystone.core.model.Submission;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Static heuristics over the artifact's source files: bundle size, leftover
 * TODO/FIXME markers, oversized files.
 */
@Component
public class CodeQualityChecker implements QualityChecker {

    public static final String NAME = "code-quality";

    static final int MAX_FILES = 50;
    static final int MAX_LINES_PER_FILE = 1000;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckerResult check(Submission submission) {
        Map<String, String> files = submission.artifact().files();
        List<QualityIssue> issues = new ArrayList<>();
        double score = 100.0;

        if (files.size() > MAX_FILES) {
            issues.add(new QualityIssue(IssueSeverity.MEDIUM, "maintainability", null,
                    "Artifact contains " + files.size() + " files",
                    "Split the change into smaller submissions"));
            score -= 5;
        }

        int todoFiles = 0;
        long totalLines = 0;
        for (var entry : files.entrySet()) {
            String content = entry.getValue();
            long lines = content.lines().count();
            totalLines += lines;
            if (content.contains("TODO") || content.contains("FIXME")) {
                todoFiles++;
                issues.add(new QualityIssue(IssueSeverity.LOW, "maintainability", entry.getKey(),
                        "Unresolved TODO/FIXME marker", "Resolve or track the pending work"));
                score -= 2;
            }
            if (lines > MAX_LINES_PER_FILE) {
                issues.add(new QualityIssue(IssueSeverity.MEDIUM, "complexity", entry.getKey(),
                        "File has " + lines + " lines", "Break the file into smaller units"));
                score -= 3;
            }
        }

        return new CheckerResult(NAME, Math.max(0.0, score), issues, false,
                Map.of("files", files.size(), "lines", totalLines, "todoFiles", todoFiles));
    }
}
