package com.hausbesuch.planner.controller;

import com.hausbesuch.planner.dto.ProviderRequest;
import com.hausbesuch.planner.exception.ProviderNotFoundException;
import com.hausbesuch.planner.model.Provider;
import com.hausbesuch.planner.service.ProviderService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/providers")
public class ProviderController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderController.class);

    private final ProviderService providerService;

    public ProviderController(ProviderService providerService) {
        this.providerService = providerService;
    }

    @GetMapping
    public ResponseEntity<List<Provider>> listProviders() {
        return ResponseEntity.ok(providerService.listProviders());
    }

    @GetMapping("/{providerId}")
    public ResponseEntity<?> getProvider(@PathVariable Long providerId) {
        try {
            return ResponseEntity.ok(providerService.getProvider(providerId));
        } catch (ProviderNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping
    public ResponseEntity<?> createProvider(@Valid @RequestBody ProviderRequest request) {
        try {
            return ResponseEntity.status(201).body(providerService.createProvider(request));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            LOGGER.error("Creating provider failed", e);
            return ResponseEntity.status(500).body(Map.of("error", e.getMessage()));
        }
    }

    @PutMapping("/{providerId}")
    public ResponseEntity<?> updateProvider(@PathVariable Long providerId,
                                            @Valid @RequestBody ProviderRequest request) {
        try {
            return ResponseEntity.ok(providerService.updateProvider(providerId, request));
        } catch (ProviderNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            LOGGER.error("Updating provider {} failed", providerId, e);
            return ResponseEntity.status(500).body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/{providerId}")
    public ResponseEntity<?> deleteProvider(@PathVariable Long providerId) {
        try {
            providerService.deleteProvider(providerId);
            return ResponseEntity.ok(Map.of("message", "Provider deleted"));
        } catch (ProviderNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            LOGGER.error("Deleting provider {} failed", providerId, e);
            return ResponseEntity.status(500).body(Map.of("error", e.getMessage()));
        }
    }
}
