package com.hospital.opd.controller;

import com.hospital.opd.dto.ConfigUpdateRequest;
import com.hospital.opd.entity.ConfigurationEntry;
import com.hospital.opd.service.ConfigurationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/configurations")
public class ConfigurationController {

    private final ConfigurationService configurationService;

    public ConfigurationController(ConfigurationService configurationService) {
        this.configurationService = configurationService;
    }

    @GetMapping
    public Map<String, String> all() {
        return configurationService.effectiveValues();
    }

    @GetMapping("/category/{category}")
    public Map<String, String> byCategory(@PathVariable String category) {
        return configurationService.getByCategory(category);
    }

    @PutMapping("/{key}")
    public ConfigurationEntry set(@PathVariable String key, @RequestBody ConfigUpdateRequest request) {
        return configurationService.setValue(key, request.getValue(), request.getUpdatedBy());
    }

    @DeleteMapping("/{key}")
    public ResponseEntity<Void> reset(@PathVariable String key) {
        return configurationService.deleteValue(key)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
