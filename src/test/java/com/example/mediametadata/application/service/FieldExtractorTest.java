package com.example.mediametadata.application.service;

import com.example.mediametadata.config.MetadataProperties;
import com.example.mediametadata.domain.exception.DateParseException;
import com.example.mediametadata.domain.exception.FieldFormatException;
import com.example.mediametadata.domain.model.Altitude;
import com.example.mediametadata.domain.model.Coordinate;
import com.example.mediametadata.domain.model.FocalLength;
import com.example.mediametadata.domain.model.Fraction;
import com.example.mediametadata.domain.model.MediaMetadata;
import com.example.mediametadata.domain.model.RecognizedTag;
import com.example.mediametadata.infrastructure.exif.TagEntry;

import com.drew.lang.Rational;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for applying individual tag entries to a metadata builder.
 */
class FieldExtractorTest {

    private final FieldExtractor extractor = new FieldExtractor(new TagValueDecoder(), MetadataProperties.defaults());

    @Test
    void ignoresUnrecognizedTags() {
        MediaMetadata.Builder builder = MediaMetadata.builder();

        assertThat(extractor.extract(entry("IFD", 0x0131, "Software", "15.1"), builder)).isEmpty();
        assertThat(extractor.extract(entry("IFD", 0x9999, "UnknownTag_0x9999", new Object()), builder)).isEmpty();
        assertThat(builder.build()).isEqualTo(MediaMetadata.EMPTY);
    }

    @Test
    void appliesCameraFields() {
        MediaMetadata.Builder builder = MediaMetadata.builder();

        extractor.extract(entry("IFD", 0x010F, "Make", "Apple"), builder);
        extractor.extract(entry("IFD", 0x0110, "Model", "iPhone 11 Pro Max"), builder);
        extractor.extract(entry("IFD/Exif", 0x829D, "FNumber", new Rational(2, 1)), builder);
        extractor.extract(entry("IFD/Exif", 0x829A, "ExposureTime", new Rational(1, 121)), builder);
        extractor.extract(entry("IFD/Exif", 0x9201, "ShutterSpeedValue", new Rational(-1, 3)), builder);
        Object iso = 100;
        assertThat(extractor.extract(entry("IFD/Exif", 0x8827, "ISOSpeedRatings", iso), builder))
                .contains(RecognizedTag.ISO_SPEED_RATINGS);

        MediaMetadata metadata = builder.build();
        assertThat(metadata.make()).isEqualTo("Apple");
        assertThat(metadata.model()).isEqualTo("iPhone 11 Pro Max");
        assertThat(metadata.fNumber()).isEqualTo(new Fraction(2, 1));
        assertThat(metadata.exposureTime()).isEqualTo(new Fraction(1, 121));
        assertThat(metadata.shutterSpeed()).isEqualTo(new Fraction(-1, 3));
        assertThat(metadata.isoSpeed()).isEqualTo(100);
    }

    /**
     * Ensures references and DMS values populate the same coordinate regardless of arrival order.
     */
    @Test
    void combinesGpsReferenceAndValue() {
        MediaMetadata.Builder builder = MediaMetadata.builder();
        Rational[] latitude = {new Rational(51, 1), new Rational(33, 1), new Rational(3410, 100)};
        Rational[] longitude = {new Rational(0, 1), new Rational(7, 1), new Rational(4020, 100)};

        extractor.extract(entry("IFD/GPSInfo", 0x0002, "GPSLatitude", latitude), builder);
        extractor.extract(entry("IFD/GPSInfo", 0x0001, "GPSLatitudeRef", "N"), builder);
        extractor.extract(entry("IFD/GPSInfo", 0x0003, "GPSLongitudeRef", "W"), builder);
        extractor.extract(entry("IFD/GPSInfo", 0x0004, "GPSLongitude", longitude), builder);
        extractor.extract(entry("IFD/GPSInfo", 0x0006, "GPSAltitude", new Rational(12, 1)), builder);
        extractor.extract(entry("IFD/GPSInfo", 0x0005, "GPSAltitudeRef", 1), builder);

        MediaMetadata metadata = builder.build();
        assertThat(metadata.latitude())
                .isEqualTo(new Coordinate(new Fraction(51, 1), new Fraction(33, 1), new Fraction(3410, 100), "N"));
        assertThat(metadata.longitude().ref()).isEqualTo("W");
        assertThat(metadata.longitude().toDecimal()).isNegative();
        assertThat(metadata.altitude()).isEqualTo(new Altitude(new Fraction(12, 1), Altitude.BELOW_SEA_LEVEL));
        assertThat(metadata.altitude().toDecimal()).isEqualTo(-12.0);
    }

    @Test
    void parsesCaptureTimeAsUtcByDefault() {
        MediaMetadata.Builder builder = MediaMetadata.builder();

        extractor.extract(entry("IFD/Exif", 0x9003, "DateTimeOriginal", "2021:11:09 08:33:11"), builder);

        assertThat(builder.build().capturedAt()).isEqualTo(Instant.parse("2021-11-09T08:33:11Z"));
    }

    @Test
    void parsesCaptureTimeInConfiguredZone() {
        FieldExtractor tokyo = new FieldExtractor(new TagValueDecoder(), new MetadataProperties("Asia/Tokyo"));
        MediaMetadata.Builder builder = MediaMetadata.builder();

        tokyo.extract(entry("IFD/Exif", 0x9003, "DateTimeOriginal", "2021:11:09 08:33:11"), builder);

        assertThat(builder.build().capturedAt()).isEqualTo(Instant.parse("2021-11-08T23:33:11Z"));
    }

    /**
     * Ensures the recorded offset wins over the configured zone whichever of the two tags arrives first.
     */
    @Test
    void recordedOffsetOverridesConfiguredZone() {
        FieldExtractor tokyo = new FieldExtractor(new TagValueDecoder(), new MetadataProperties("Asia/Tokyo"));
        MediaMetadata.Builder offsetFirst = MediaMetadata.builder();
        MediaMetadata.Builder offsetLast = MediaMetadata.builder();

        tokyo.extract(entry("IFD/Exif", 0x9011, "OffsetTimeOriginal", "+02:00"), offsetFirst);
        tokyo.extract(entry("IFD/Exif", 0x9003, "DateTimeOriginal", "2019:06:22 17:45:03"), offsetFirst);
        tokyo.extract(entry("IFD/Exif", 0x9003, "DateTimeOriginal", "2019:06:22 17:45:03"), offsetLast);
        tokyo.extract(entry("IFD/Exif", 0x9011, "OffsetTimeOriginal", "+02:00"), offsetLast);

        assertThat(offsetFirst.build().capturedAt()).isEqualTo(Instant.parse("2019-06-22T15:45:03Z"));
        assertThat(offsetLast.build().capturedAt()).isEqualTo(Instant.parse("2019-06-22T15:45:03Z"));
    }

    @Test
    void westernOffsetMovesCaptureTimeForward() {
        MediaMetadata.Builder builder = MediaMetadata.builder();

        extractor.extract(entry("IFD/Exif", 0x9003, "DateTimeOriginal", "2021:11:09 20:00:00"), builder);
        extractor.extract(entry("IFD/Exif", 0x9011, "OffsetTimeOriginal", "-05:00"), builder);

        assertThat(builder.build().capturedAt()).isEqualTo(Instant.parse("2021-11-10T01:00:00Z"));
    }

    @Test
    void blankOrInvalidOffsetFallsBackToConfiguredZone() {
        MediaMetadata.Builder blank = MediaMetadata.builder();
        MediaMetadata.Builder invalid = MediaMetadata.builder();

        extractor.extract(entry("IFD/Exif", 0x9003, "DateTimeOriginal", "2021:11:09 08:33:11"), blank);
        extractor.extract(entry("IFD/Exif", 0x9011, "OffsetTimeOriginal", "      "), blank);
        extractor.extract(entry("IFD/Exif", 0x9003, "DateTimeOriginal", "2021:11:09 08:33:11"), invalid);
        extractor.extract(entry("IFD/Exif", 0x9011, "OffsetTimeOriginal", "+25:00"), invalid);

        assertThat(blank.build().capturedAt()).isEqualTo(Instant.parse("2021-11-09T08:33:11Z"));
        assertThat(invalid.build().capturedAt()).isEqualTo(Instant.parse("2021-11-09T08:33:11Z"));
    }

    @Test
    void offsetWithoutCaptureTimeLeavesCaptureTimeAbsent() {
        MediaMetadata.Builder builder = MediaMetadata.builder();

        extractor.extract(entry("IFD/Exif", 0x9011, "OffsetTimeOriginal", "+09:00"), builder);

        assertThat(builder.build().capturedAt()).isNull();
    }

    @Test
    void offsetStoredAsNumberIsRejected() {
        FieldFormatException ex = assertThrows(FieldFormatException.class, () -> extractor.extract(
                entry("IFD/Exif", 0x9011, "OffsetTimeOriginal", 9), MediaMetadata.builder()));

        assertThat(ex.tag()).isEqualTo("OffsetTimeOriginal");
    }

    @Test
    void appliesLensAndFocalLength() {
        MediaMetadata.Builder builder = MediaMetadata.builder();

        extractor.extract(entry("IFD/Exif", 0xA434, "LensModel", "iPhone 11 Pro Max back triple camera 4.25mm f/1.8"), builder);
        extractor.extract(entry("IFD/Exif", 0x920A, "FocalLength", new Rational(425, 100)), builder);
        extractor.extract(entry("IFD/Exif", 0xA405, "FocalLengthIn35mmFilm", 26), builder);

        MediaMetadata metadata = builder.build();
        assertThat(metadata.lens()).isEqualTo("iPhone 11 Pro Max back triple camera 4.25mm f/1.8");
        assertThat(metadata.focalLength()).isEqualTo(new FocalLength(new Fraction(425, 100), 26));
        assertThat(metadata.focalLength().describe()).isEqualTo("4.25mm (26mm in 35mm format)");
    }

    @Test
    void rejectsMalformedCaptureTime() {
        MediaMetadata.Builder builder = MediaMetadata.builder();

        DateParseException ex = assertThrows(DateParseException.class,
                () -> extractor.extract(entry("IFD/Exif", 0x9003, "DateTimeOriginal", "2021-11-09 08:33:11"), builder));

        assertThat(ex.value()).isEqualTo("2021-11-09 08:33:11");
        assertThat(ex).hasMessageContaining("DateTimeOriginal");
    }

    @Test
    void rejectsImpossibleCalendarDate() {
        assertThrows(DateParseException.class, () -> extractor.extract(
                entry("IFD/Exif", 0x9003, "DateTimeOriginal", "2021:02:30 10:00:00"), MediaMetadata.builder()));
    }

    @Test
    void rejectsMalformedRecognizedTag() {
        FieldFormatException ex = assertThrows(FieldFormatException.class, () -> extractor.extract(
                entry("IFD", 0x0110, "Model", new int[]{1, 2}), MediaMetadata.builder()));

        assertThat(ex.tag()).isEqualTo("Model");
        assertThat(ex.rawValueDescription()).isEqualTo("int[2][1, 2]");
    }

    /**
     * Documents that a repeated tag silently replaces the earlier value.
     */
    @Test
    void laterOccurrenceOfTagWins() {
        MediaMetadata.Builder builder = MediaMetadata.builder();

        extractor.extract(entry("IFD", 0x010F, "Make", "Canon"), builder);
        extractor.extract(entry("IFD", 0x010F, "Make", "FUJIFILM"), builder);

        assertThat(builder.build().make()).isEqualTo("FUJIFILM");
    }

    private static TagEntry entry(String ifd, int tagId, String name, Object rawValue) {
        return new TagEntry(ifd, tagId, name, rawValue);
    }
}
