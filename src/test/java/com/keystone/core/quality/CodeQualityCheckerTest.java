package com.keystone.core.quality;

import com.keystone.core.model.CheckerResult;
import com.keystone.core.model.IssueSeverity;
import com.keystone.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CodeQualityCheckerTest {

    private final CodeQualityChecker checker = new CodeQualityChecker();

    @Test
    void cleanArtifactScoresFull() {
        CheckerResult result = checker.check(Fixtures.submission(Map.of("App.java", "class App {}")));
        assertEquals(100.0, result.score());
        assertTrue(result.issues().isEmpty());
    }

    @Test
    void todoMarkersCostPerFile() {
        CheckerResult result = checker.check(Fixtures.submission(Map.of(
                "A.java", "// TODO tidy\n// TODO again",
                "B.java", "// FIXME")));
        assertEquals(96.0, result.score());
        assertEquals(2, result.issues().size());
        assertTrue(result.issues().stream().allMatch(i -> i.severity() == IssueSeverity.LOW));
    }

    @Test
    void oversizedFilesAndBundlesArePenalised() {
        Map<String, String> files = new HashMap<>();
        for (int i = 0; i < 51; i++) {
            files.put("f" + i + ".txt", "x");
        }
        files.put("Big.java", "line\n".repeat(1001));

        CheckerResult result = checker.check(Fixtures.submission(files));

        assertEquals(92.0, result.score());
        assertEquals(2, result.issues().stream().filter(i -> i.severity() == IssueSeverity.MEDIUM).count());
    }
}
