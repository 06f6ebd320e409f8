package com.keystone.core.quality;

import com.keystone.core.model.CheckerResult;
import com.keystone.core.model.Submission;

/**
 * One independent quality criterion. Implementations must be safe to call
 * concurrently for different submissions.
 */
public interface QualityChecker {

    /** Stable name, matched against the configured weights. */
    String name();

    CheckerResult check(Submission submission);
}
