package com.premiergroup.ad_autopilot.dto;

import com.premiergroup.ad_autopilot.entity.ContactEndpoint;

public record ContactEndpointView(Long id, String value, String label, boolean isDefault, boolean isActive) {

    public static ContactEndpointView of(ContactEndpoint e) {
        return new ContactEndpointView(e.getId(), e.getValue(), e.getLabel(),
                Boolean.TRUE.equals(e.getIsDefault()), Boolean.TRUE.equals(e.getIsActive()));
    }
}
