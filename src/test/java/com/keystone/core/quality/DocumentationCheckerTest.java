package com.keystone.core.quality;

import com.keystone.core.model.CheckerResult;
import com.keystone.support.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentationCheckerTest {

    private final DocumentationChecker checker = new DocumentationChecker();

    @Test
    void documentedSourcesWithReadmePass() {
        CheckerResult result = checker.check(Fixtures.submission(Map.of(
                "README.md", "# Change",
                "src/A.java", "/** A. */ class A {}",
                "src/b.py", "\"\"\"Module b.\"\"\"",
                "docs/notes.txt", "plain")));
        assertEquals(100.0, result.score());
    }

    @Test
    void undocumentedSourcesAndMissingReadme() {
        CheckerResult result = checker.check(Fixtures.submission(Map.of(
                "A.java", "class A {}",
                "B.java", "class B {}",
                "C.java", "/** C */ class C {}",
                "data.csv", "1,2")));
        assertEquals(80.0, result.score());
        assertEquals(3, result.issues().size());
    }

    @Test
    void smallBundlesNeedNoReadme() {
        CheckerResult result = checker.check(Fixtures.submission(Map.of("A.java", "/** ok */")));
        assertEquals(100.0, result.score());
    }
}
