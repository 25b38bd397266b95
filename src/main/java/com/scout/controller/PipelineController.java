package com.scout.controller;

import com.scout.model.pipeline.PipelineRun;
import com.scout.service.pipeline.PipelineRunRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Inspection of finished pipeline runs.
 */
@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private final PipelineRunRegistry registry;

    public PipelineController(PipelineRunRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/runs")
    public ResponseEntity<List<PipelineRun>> getRecentRuns(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(registry.recent(Math.max(1, limit)));
    }

    @GetMapping("/runs/{id}")
    public ResponseEntity<PipelineRun> getRun(@PathVariable String id) {
        return registry.find(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
