package com.hausbesuch.planner.controller;

import com.hausbesuch.planner.dto.LocationUpdateRequest;
import com.hausbesuch.planner.dto.SettingRequest;
import com.hausbesuch.planner.model.Setting;
import com.hausbesuch.planner.service.SettingsService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/settings")
public class SettingsController {

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping("/{key}")
    public ResponseEntity<?> getSetting(@PathVariable String key) {
        return settingsService.find(key)
                .<ResponseEntity<?>>map(value -> ResponseEntity.ok(new Setting(key, value)))
                .orElseGet(() -> ResponseEntity.status(404).body(Map.of("error", "Setting not found: " + key)));
    }

    @PutMapping("/{key}")
    public ResponseEntity<?> putSetting(@PathVariable String key,
                                        @Valid @RequestBody SettingRequest request) {
        try {
            return ResponseEntity.ok(settingsService.put(key, request.getValue()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/location")
    public ResponseEntity<?> updateLocation(@Valid @RequestBody LocationUpdateRequest request) {
        try {
            return ResponseEntity.ok(settingsService.updateHomeLocation(request.getAddress(), request.getCity()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
