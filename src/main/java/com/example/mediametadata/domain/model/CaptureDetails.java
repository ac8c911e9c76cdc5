package com.example.mediametadata.domain.model;

import java.time.Instant;

/**
 * Decimal view of {@link MediaMetadata} in the shape the media catalog persists.
 * Decimal fields are {@code null} when the underlying rational could not be converted.
 * {@code focalLength} is the display text of {@link FocalLength#describe()}.
 */
public record CaptureDetails(
        String make,
        String model,
        String lens,
        String focalLength,
        Instant capturedAt,
        Double fNumber,
        Double shutterSpeed,
        long exposureTimeNumerator,
        long exposureTimeDenominator,
        int isoSpeed,
        Double latitude,
        Double longitude,
        Double altitude
) {
}
