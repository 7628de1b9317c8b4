package com.intentflow.api.rest;

import com.intentflow.core.model.RankedContext;
import com.intentflow.engine.memory.MemoryStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

/**
 * Read access to the ranked context of the memory graph.
 */
@RestController
@RequestMapping("/memory")
public class MemoryController {

    private static final int MAX_LIMIT = 100;

    private final MemoryStore memoryStore;

    public MemoryController(MemoryStore memoryStore) {
        this.memoryStore = memoryStore;
    }

    @GetMapping("/context")
    public ResponseEntity<List<RankedContext>> context(
            @RequestParam String roleScope,
            @RequestParam(name = "q", defaultValue = "") String query,
            @RequestParam(defaultValue = "10") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        List<String> terms = Arrays.stream(query.toLowerCase().split("\\s+"))
            .filter(term -> !term.isBlank())
            .toList();
        return ResponseEntity.ok(memoryStore.retrieveContext(roleScope, terms, limit));
    }
}
