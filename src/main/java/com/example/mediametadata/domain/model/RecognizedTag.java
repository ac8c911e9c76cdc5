package com.example.mediametadata.domain.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tags the extractor understands, keyed by their canonical container name, each with the payload
 * shape it must carry. Any other tag name is ignored.
 */
public enum RecognizedTag {
    MAKE("Make", TagShape.text()),
    MODEL("Model", TagShape.text()),
    LENS_MODEL("LensModel", TagShape.text()),
    FOCAL_LENGTH("FocalLength", TagShape.unsignedRationals(1)),
    FOCAL_LENGTH_IN_35MM_FILM("FocalLengthIn35mmFilm", TagShape.unsignedShort()),
    DATE_TIME_ORIGINAL("DateTimeOriginal", TagShape.text()),
    OFFSET_TIME_ORIGINAL("OffsetTimeOriginal", TagShape.text()),
    F_NUMBER("FNumber", TagShape.unsignedRationals(1)),
    EXPOSURE_TIME("ExposureTime", TagShape.unsignedRationals(1)),
    SHUTTER_SPEED_VALUE("ShutterSpeedValue", TagShape.signedRational()),
    ISO_SPEED_RATINGS("ISOSpeedRatings", TagShape.unsignedShort()),
    GPS_LATITUDE_REF("GPSLatitudeRef", TagShape.text()),
    GPS_LATITUDE("GPSLatitude", TagShape.unsignedRationals(3)),
    GPS_LONGITUDE_REF("GPSLongitudeRef", TagShape.text()),
    GPS_LONGITUDE("GPSLongitude", TagShape.unsignedRationals(3)),
    GPS_ALTITUDE_REF("GPSAltitudeRef", TagShape.unsignedByte()),
    GPS_ALTITUDE("GPSAltitude", TagShape.unsignedRationals(1));

    private static final Map<String, RecognizedTag> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(RecognizedTag::tagName, Function.identity()));

    private final String tagName;
    private final TagShape shape;

    RecognizedTag(String tagName, TagShape shape) {
        this.tagName = tagName;
        this.shape = shape;
    }

    public String tagName() {
        return tagName;
    }

    public TagShape shape() {
        return shape;
    }

	/**
	 * Looks up a recognized tag by its exact canonical name.
	 *
	 * @param name tag name produced by the tag index
	 * @return matching tag or empty for tags the extractor does not handle
	 */
    public static Optional<RecognizedTag> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
