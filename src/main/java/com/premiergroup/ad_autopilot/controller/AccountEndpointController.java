package com.premiergroup.ad_autopilot.controller;

import com.premiergroup.ad_autopilot.dto.ContactEndpointRequest;
import com.premiergroup.ad_autopilot.dto.ContactEndpointView;
import com.premiergroup.ad_autopilot.service.endpoint.ContactEndpointService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/accounts/{accountId}/endpoints")
@RequiredArgsConstructor
public class AccountEndpointController {

    private final ContactEndpointService endpointService;

    @PostMapping
    public ResponseEntity<ContactEndpointView> add(@PathVariable Long accountId,
                                                   @Valid @RequestBody ContactEndpointRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(endpointService.add(accountId, request));
    }

    @GetMapping
    public ResponseEntity<List<ContactEndpointView>> list(@PathVariable Long accountId) {
        List<ContactEndpointView> endpoints = endpointService.list(accountId);
        if (endpoints.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(endpoints);
    }

    @PutMapping("/{endpointId}/default")
    public ResponseEntity<ContactEndpointView> markDefault(@PathVariable Long accountId,
                                                           @PathVariable Long endpointId) {
        return ResponseEntity.ok(endpointService.markDefault(accountId, endpointId));
    }

    @DeleteMapping("/{endpointId}")
    public ResponseEntity<Void> deactivate(@PathVariable Long accountId, @PathVariable Long endpointId) {
        endpointService.deactivate(accountId, endpointId);
        return ResponseEntity.noContent().build();
    }
}
