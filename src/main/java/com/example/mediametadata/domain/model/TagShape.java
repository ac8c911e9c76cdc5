package com.example.mediametadata.domain.model;

/**
 * Payload shape a recognized tag must carry: the kind of each element and how many elements.
 */
public record TagShape(ValueKind kind, int count) {

    public static TagShape text() {
        return new TagShape(ValueKind.TEXT, 1);
    }

    public static TagShape unsignedRationals(int count) {
        return new TagShape(ValueKind.UNSIGNED_RATIONAL, count);
    }

    public static TagShape signedRational() {
        return new TagShape(ValueKind.SIGNED_RATIONAL, 1);
    }

    public static TagShape unsignedShort() {
        return new TagShape(ValueKind.UNSIGNED_SHORT, 1);
    }

    public static TagShape unsignedByte() {
        return new TagShape(ValueKind.UNSIGNED_BYTE, 1);
    }

    /**
     * Element kinds understood by the tag value decoder.
     */
    public enum ValueKind {
        TEXT,
        UNSIGNED_RATIONAL,
        SIGNED_RATIONAL,
        UNSIGNED_SHORT,
        UNSIGNED_BYTE
    }
}
