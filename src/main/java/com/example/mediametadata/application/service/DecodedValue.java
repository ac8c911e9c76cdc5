package com.example.mediametadata.application.service;

import com.example.mediametadata.domain.model.Fraction;

import java.util.List;

/**
 * Typed payload of a recognized tag after its shape was checked.
 * Exactly one of the components is meaningful, depending on the tag's value kind.
 */
public record DecodedValue(String text, List<Fraction> fractions, int integer) {

    static DecodedValue ofText(String text) {
        return new DecodedValue(text, List.of(), 0);
    }

    static DecodedValue ofFractions(List<Fraction> fractions) {
        return new DecodedValue(null, List.copyOf(fractions), 0);
    }

    static DecodedValue ofInteger(int integer) {
        return new DecodedValue(null, List.of(), integer);
    }

    public Fraction fraction() {
        return fractions.get(0);
    }
}
