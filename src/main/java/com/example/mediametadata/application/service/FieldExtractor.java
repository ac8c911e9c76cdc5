package com.example.mediametadata.application.service;

import com.example.mediametadata.config.MetadataProperties;
import com.example.mediametadata.domain.exception.DateParseException;
import com.example.mediametadata.domain.exception.FieldFormatException;
import com.example.mediametadata.domain.model.Fraction;
import com.example.mediametadata.domain.model.MediaMetadata;
import com.example.mediametadata.domain.model.RecognizedTag;
import com.example.mediametadata.infrastructure.exif.TagEntry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Applies one tag entry to the metadata being assembled.
 * Unrecognized tags are ignored; recognized tags are decoded against their declared shape first.
 * The capture time is read in the file's own {@code OffsetTimeOriginal} when it records a valid one,
 * otherwise in the configured capture zone.
 */
@Component
public class FieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

    private static final DateTimeFormatter CAPTURE_TIME_FORMATTER =
            DateTimeFormatter.ofPattern("uuuu:MM:dd HH:mm:ss").withResolverStyle(ResolverStyle.STRICT);

    private final TagValueDecoder decoder;
    private final ZoneId captureZone;

    /**
     * @param decoder    shape checker for raw payloads
     * @param properties supplies the zone capture times are read in when the file records no offset
     */
    public FieldExtractor(TagValueDecoder decoder, MetadataProperties properties) {
        this.decoder = decoder;
        this.captureZone = properties.captureZoneId();
    }

    /**
     * Decodes the entry and writes it into the builder when its tag is recognized.
     *
     * @param entry   tag entry from the walk
     * @param builder accumulator for the current extraction
     * @return the recognized tag that was applied, or empty when the entry was ignored
     * @throws FieldFormatException when a recognized tag has an unexpected payload
     * @throws DateParseException   when the capture time does not follow {@code YYYY:MM:DD HH:MM:SS}
     */
    public Optional<RecognizedTag> extract(TagEntry entry, MediaMetadata.Builder builder) {
        Optional<RecognizedTag> recognized = RecognizedTag.fromName(entry.name());
        if (recognized.isEmpty()) {
            return Optional.empty();
        }

        RecognizedTag tag = recognized.get();
        DecodedValue value = decoder.decode(tag, entry.rawValue());
        switch (tag) {
            case MAKE -> builder.make(value.text());
            case MODEL -> builder.model(value.text());
            case LENS_MODEL -> builder.lens(value.text());
            case FOCAL_LENGTH -> builder.focalLength(value.fraction());
            case FOCAL_LENGTH_IN_35MM_FILM -> builder.focalLengthIn35mmFilm(value.integer());
            case DATE_TIME_ORIGINAL -> builder.captureTime(parseCaptureTime(tag, value.text()), captureZone);
            case OFFSET_TIME_ORIGINAL -> parseOffset(value.text()).ifPresent(builder::captureOffset);
            case F_NUMBER -> builder.fNumber(value.fraction());
            case EXPOSURE_TIME -> builder.exposureTime(value.fraction());
            case SHUTTER_SPEED_VALUE -> builder.shutterSpeed(value.fraction());
            case ISO_SPEED_RATINGS -> builder.isoSpeed(value.integer());
            case GPS_LATITUDE_REF -> builder.latitudeRef(value.text());
            case GPS_LATITUDE -> {
                List<Fraction> dms = value.fractions();
                builder.latitude(dms.get(0), dms.get(1), dms.get(2));
            }
            case GPS_LONGITUDE_REF -> builder.longitudeRef(value.text());
            case GPS_LONGITUDE -> {
                List<Fraction> dms = value.fractions();
                builder.longitude(dms.get(0), dms.get(1), dms.get(2));
            }
            case GPS_ALTITUDE_REF -> builder.altitudeRef(value.integer());
            case GPS_ALTITUDE -> builder.altitude(value.fraction());
        }
        return recognized;
    }

    private LocalDateTime parseCaptureTime(RecognizedTag tag, String text) {
        try {
            return LocalDateTime.parse(text, CAPTURE_TIME_FORMATTER);
        } catch (DateTimeParseException ex) {
            throw new DateParseException(tag.tagName(), text, ex);
        }
    }

    // cameras without a clock zone setting write blanks here
    private Optional<ZoneOffset> parseOffset(String text) {
        try {
            return Optional.of(ZoneOffset.of(text.trim()));
        } catch (DateTimeException ex) {
            log.debug("Ignoring capture offset '{}': {}", text, ex.getMessage());
            return Optional.empty();
        }
    }
}
