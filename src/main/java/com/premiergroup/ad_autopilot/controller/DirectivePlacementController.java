package com.premiergroup.ad_autopilot.controller;

import com.premiergroup.ad_autopilot.dto.LinkPlacementRequest;
import com.premiergroup.ad_autopilot.dto.PlacementSyncResult;
import com.premiergroup.ad_autopilot.dto.PlacementView;
import com.premiergroup.ad_autopilot.service.pool.PlacementRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/directives/{directiveId}/placements")
@RequiredArgsConstructor
public class DirectivePlacementController {

    private final PlacementRegistryService registryService;

    @PostMapping
    public ResponseEntity<PlacementView> link(@PathVariable Long directiveId,
                                              @Valid @RequestBody LinkPlacementRequest request) {
        PlacementView view = registryService.link(directiveId, request.externalPlacementId().trim());
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @GetMapping
    public ResponseEntity<List<PlacementView>> list(@PathVariable Long directiveId) {
        List<PlacementView> placements = registryService.list(directiveId);
        if (placements.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(placements);
    }

    @DeleteMapping("/{placementId}")
    public ResponseEntity<Void> unlink(@PathVariable Long directiveId, @PathVariable Long placementId) {
        registryService.unlink(directiveId, placementId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/sync")
    public ResponseEntity<PlacementSyncResult> sync(@PathVariable Long directiveId) {
        return ResponseEntity.ok(registryService.sync(directiveId));
    }
}
