package com.premiergroup.ad_autopilot;

import com.premiergroup.ad_autopilot.config.AutopilotProperties;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

/**
 * Binds {@link AutopilotProperties} the way Spring does, defaults included.
 */
public final class TestProperties {

    private TestProperties() {
    }

    public static AutopilotProperties defaults() {
        return with(Map.of());
    }

    public static AutopilotProperties with(Map<String, String> overrides) {
        return new Binder(new MapConfigurationPropertySource(overrides))
                .bindOrCreate("autopilot", AutopilotProperties.class);
    }
}
