package com.williamcallahan.poster_resolution_engine.controller;

import com.williamcallahan.poster_resolution_engine.service.ResolutionManager;
import com.williamcallahan.poster_resolution_engine.types.FallbackResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * REST endpoint for resolving a poster URL
 *
 * @author William Callahan
 */
@RestController
@RequestMapping("/api/posters")
public class PosterController {

    private static final Logger logger = LoggerFactory.getLogger(PosterController.class);

    private final ResolutionManager resolutionManager;

    public PosterController(ResolutionManager resolutionManager) {
        this.resolutionManager = resolutionManager;
    }

    /**
     * Resolves the poster for an item; unresolved lookups answer 404 with the sentinel source
     *
     * @param id catalog identifier of the item
     * @param name display name of the item
     * @return the resolution result
     */
    @GetMapping
    public CompletableFuture<ResponseEntity<FallbackResult>> resolve(@RequestParam("id") String id,
                                                                     @RequestParam(value = "name", defaultValue = "") String name) {
        logger.debug("Poster lookup requested for {} ({})", name, id);
        return resolutionManager.resolve(id, name)
            .thenApply(result -> result.hasUrl()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(404).body(result));
    }
}
