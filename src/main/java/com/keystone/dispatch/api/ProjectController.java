package com.keystone.dispatch.api;

import com.keystone.core.engine.PipelineEngine;
import com.keystone.core.model.ProjectQualitySummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Per-project quality and integration progress.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private final PipelineEngine engine;

    public ProjectController(PipelineEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/{id}/quality")
    public ResponseEntity<ProjectQualitySummary> quality(@PathVariable String id) {
        return ResponseEntity.ok(engine.projectQuality(id));
    }
}
