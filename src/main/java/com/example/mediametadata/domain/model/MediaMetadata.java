package com.example.mediametadata.domain.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Normalized capture metadata read from one media file.
 * Fields whose tag was absent keep their zero value: empty strings, {@link Fraction#ZERO}, {@code 0},
 * {@link FocalLength#EMPTY}, {@link Coordinate#EMPTY}, {@link Altitude#EMPTY}. {@code capturedAt} is
 * {@code null} when absent.
 */
public record MediaMetadata(
        String make,
        String model,
        String lens,
        FocalLength focalLength,
        Instant capturedAt,
        Fraction fNumber,
        Fraction exposureTime,
        Fraction shutterSpeed,
        int isoSpeed,
        Coordinate latitude,
        Coordinate longitude,
        Altitude altitude
) {

    public static final MediaMetadata EMPTY = builder().build();

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator used while a tag tree is walked. Not thread-safe; one per extraction.
     */
    public static final class Builder {

        private String make = "";
        private String model = "";
        private String lens = "";
        private FocalLength focalLength = FocalLength.EMPTY;
        private LocalDateTime captureTime;
        private ZoneId captureZone = ZoneOffset.UTC;
        private ZoneOffset captureOffset;
        private Fraction fNumber = Fraction.ZERO;
        private Fraction exposureTime = Fraction.ZERO;
        private Fraction shutterSpeed = Fraction.ZERO;
        private int isoSpeed;
        private Coordinate latitude = Coordinate.EMPTY;
        private Coordinate longitude = Coordinate.EMPTY;
        private Altitude altitude = Altitude.EMPTY;

        private Builder() {
        }

        public Builder make(String make) {
            this.make = make;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder lens(String lens) {
            this.lens = lens;
            return this;
        }

        public Builder focalLength(Fraction actual) {
            this.focalLength = focalLength.withActual(actual);
            return this;
        }

        public Builder focalLengthIn35mmFilm(int equivalent) {
            this.focalLength = focalLength.withEquivalent35mm(equivalent);
            return this;
        }

        /**
         * @param captureTime  wall-clock capture time as written by the camera
         * @param fallbackZone zone the time is read in unless the file records its own offset
         */
        public Builder captureTime(LocalDateTime captureTime, ZoneId fallbackZone) {
            this.captureTime = captureTime;
            this.captureZone = fallbackZone;
            return this;
        }

        public Builder captureOffset(ZoneOffset captureOffset) {
            this.captureOffset = captureOffset;
            return this;
        }

        public Builder fNumber(Fraction fNumber) {
            this.fNumber = fNumber;
            return this;
        }

        public Builder exposureTime(Fraction exposureTime) {
            this.exposureTime = exposureTime;
            return this;
        }

        public Builder shutterSpeed(Fraction shutterSpeed) {
            this.shutterSpeed = shutterSpeed;
            return this;
        }

        public Builder isoSpeed(int isoSpeed) {
            this.isoSpeed = isoSpeed;
            return this;
        }

        public Builder latitudeRef(String ref) {
            this.latitude = latitude.withRef(ref);
            return this;
        }

        public Builder latitude(Fraction degrees, Fraction minutes, Fraction seconds) {
            this.latitude = latitude.withDms(degrees, minutes, seconds);
            return this;
        }

        public Builder longitudeRef(String ref) {
            this.longitude = longitude.withRef(ref);
            return this;
        }

        public Builder longitude(Fraction degrees, Fraction minutes, Fraction seconds) {
            this.longitude = longitude.withDms(degrees, minutes, seconds);
            return this;
        }

        public Builder altitudeRef(int ref) {
            this.altitude = altitude.withRef(ref);
            return this;
        }

        public Builder altitude(Fraction value) {
            this.altitude = altitude.withValue(value);
            return this;
        }

        public MediaMetadata build() {
            String resolvedLens = lens;
            FocalLength resolvedFocalLength = focalLength;
            // the X100F has a fixed 23mm lens and records neither the lens model nor a 35mm equivalent
            if ("FUJIFILM".equals(make) && "X100F".equals(model)) {
                String described = focalLength.describe();
                if (described.isEmpty() || described.equals("23mm")) {
                    resolvedFocalLength = new FocalLength(new Fraction(23, 1), 35);
                }
                if (resolvedLens.isEmpty()) {
                    resolvedLens = "FUJINON single focal length lens";
                }
            }
            return new MediaMetadata(make, model, resolvedLens, resolvedFocalLength, resolveCapturedAt(),
                    fNumber, exposureTime, shutterSpeed, isoSpeed, latitude, longitude, altitude);
        }

        private Instant resolveCapturedAt() {
            if (captureTime == null) {
                return null;
            }
            ZoneId zone = captureOffset != null ? captureOffset : captureZone;
            return captureTime.atZone(zone).toInstant();
        }
    }
}
