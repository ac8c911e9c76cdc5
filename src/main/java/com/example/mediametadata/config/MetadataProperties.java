package com.example.mediametadata.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.ZoneId;

/**
 * Settings bound from {@code media.metadata.*}.
 *
 * @param captureZone zone used to read the zone-less {@code DateTimeOriginal} tag, {@code UTC} by default
 */
@ConfigurationProperties(prefix = "media.metadata")
public record MetadataProperties(@DefaultValue("UTC") String captureZone) {

    public MetadataProperties {
        if (captureZone == null || captureZone.isBlank()) {
            captureZone = "UTC";
        }
        ZoneId.of(captureZone);
    }

    public static MetadataProperties defaults() {
        return new MetadataProperties("UTC");
    }

    public ZoneId captureZoneId() {
        return ZoneId.of(captureZone);
    }
}
