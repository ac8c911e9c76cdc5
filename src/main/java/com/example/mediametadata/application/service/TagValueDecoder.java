package com.example.mediametadata.application.service;

import com.example.mediametadata.domain.exception.FieldFormatException;
import com.example.mediametadata.domain.model.Fraction;
import com.example.mediametadata.domain.model.RecognizedTag;
import com.example.mediametadata.domain.model.TagShape;

import com.drew.lang.Rational;
import com.drew.metadata.StringValue;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Checks an untyped tag payload against the shape its {@link RecognizedTag} declares.
 * Understands the representations metadata-extractor uses: {@link String}/{@link StringValue} for text,
 * a single {@link Rational} or a {@code Rational[]} for rationals, boxed numbers or one-element primitive
 * arrays for integers.
 */
@Component
public class TagValueDecoder {

    private static final long MAX_UNSIGNED_SHORT = 0xFFFF;
    private static final long MAX_UNSIGNED_BYTE = 0xFF;

    /**
     * Decodes the payload of a recognized tag.
     *
     * @param tag tag whose declared shape the payload must match
     * @param raw payload as collected from the container
     * @return typed value
     * @throws FieldFormatException when the payload has the wrong type, element count or range
     */
    public DecodedValue decode(RecognizedTag tag, Object raw) {
        TagShape shape = tag.shape();
        return switch (shape.kind()) {
            case TEXT -> DecodedValue.ofText(decodeText(tag, raw));
            case UNSIGNED_RATIONAL, SIGNED_RATIONAL -> DecodedValue.ofFractions(decodeRationals(tag, raw));
            case UNSIGNED_SHORT, UNSIGNED_BYTE -> DecodedValue.ofInteger(decodeInteger(tag, raw));
        };
    }

    private String decodeText(RecognizedTag tag, Object raw) {
        if (raw instanceof String text) {
            return text;
        }
        if (raw instanceof StringValue stringValue) {
            return stringValue.toString();
        }
        throw formatError(tag, raw);
    }

    private List<Fraction> decodeRationals(RecognizedTag tag, Object raw) {
        TagShape shape = tag.shape();
        Rational[] rationals;
        if (raw instanceof Rational rational) {
            rationals = new Rational[]{rational};
        } else if (raw instanceof Rational[] array) {
            rationals = array;
        } else {
            throw formatError(tag, raw);
        }
        if (rationals.length != shape.count()) {
            throw formatError(tag, raw);
        }

        boolean unsigned = shape.kind() == TagShape.ValueKind.UNSIGNED_RATIONAL;
        List<Fraction> fractions = new ArrayList<>(rationals.length);
        for (Rational rational : rationals) {
            if (rational == null) {
                throw formatError(tag, raw);
            }
            if (unsigned && (rational.getNumerator() < 0 || rational.getDenominator() < 0)) {
                throw formatError(tag, raw);
            }
            fractions.add(new Fraction(rational.getNumerator(), rational.getDenominator()));
        }
        return fractions;
    }

    private int decodeInteger(RecognizedTag tag, Object raw) {
        int count = tag.shape().count();
        long value;
        if (count == 1 && (raw instanceof Integer || raw instanceof Short)) {
            value = ((Number) raw).longValue();
        } else if (count == 1 && raw instanceof Byte single) {
            value = Byte.toUnsignedInt(single);
        } else if (raw instanceof int[] ints && ints.length == count) {
            value = ints[0];
        } else if (raw instanceof short[] shorts && shorts.length == count) {
            value = shorts[0];
        } else if (raw instanceof byte[] bytes && bytes.length == count) {
            value = Byte.toUnsignedInt(bytes[0]);
        } else {
            throw formatError(tag, raw);
        }

        long max = tag.shape().kind() == TagShape.ValueKind.UNSIGNED_SHORT ? MAX_UNSIGNED_SHORT : MAX_UNSIGNED_BYTE;
        if (value < 0 || value > max) {
            throw formatError(tag, raw);
        }
        return (int) value;
    }

    private static FieldFormatException formatError(RecognizedTag tag, Object raw) {
        return new FieldFormatException(tag.tagName(), describe(raw));
    }

    /**
     * Renders a payload with its runtime type so format errors can be diagnosed without a debugger.
     * Covers the array types metadata-extractor produces.
     *
     * @param raw payload of any type, possibly {@code null}
     * @return e.g. {@code Rational[2][56/10, 1/1]} or {@code Long(100)}
     */
    static String describe(Object raw) {
        if (raw == null) {
            return "null";
        }
        if (raw instanceof Object[] objects) {
            return arrayLabel(raw, objects.length) + Arrays.toString(objects);
        }
        if (raw instanceof int[] ints) {
            return arrayLabel(raw, ints.length) + Arrays.toString(ints);
        }
        if (raw instanceof short[] shorts) {
            return arrayLabel(raw, shorts.length) + Arrays.toString(shorts);
        }
        if (raw instanceof byte[] bytes) {
            return arrayLabel(raw, bytes.length) + Arrays.toString(bytes);
        }
        if (raw instanceof long[] longs) {
            return arrayLabel(raw, longs.length) + Arrays.toString(longs);
        }
        return raw.getClass().getSimpleName() + "(" + raw + ")";
    }

    private static String arrayLabel(Object array, int length) {
        return array.getClass().getComponentType().getSimpleName() + "[" + length + "]";
    }
}
