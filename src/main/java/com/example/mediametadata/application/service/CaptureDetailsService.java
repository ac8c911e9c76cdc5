package com.example.mediametadata.application.service;

import com.example.mediametadata.domain.exception.DecimalConversionException;
import com.example.mediametadata.domain.model.CaptureDetails;
import com.example.mediametadata.domain.model.MediaMetadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.function.DoubleSupplier;

/**
 * Application-layer service that projects {@link MediaMetadata} onto the decimal fields the media catalog stores.
 * Conversion failures never fail the projection; the affected field is left {@code null}.
 */
@Service
public class CaptureDetailsService {

    private static final Logger log = LoggerFactory.getLogger(CaptureDetailsService.class);

    private final MetadataAssembler metadataAssembler;

    public CaptureDetailsService(MetadataAssembler metadataAssembler) {
        this.metadataAssembler = metadataAssembler;
    }

    /**
     * Extracts metadata from a media file and converts it in one step.
     *
     * @param bytes full file content or its header portion
     * @return catalog-ready capture details
     */
    public CaptureDetails extractCaptureDetails(byte[] bytes) {
        return toCaptureDetails(metadataAssembler.extract(bytes));
    }

    /**
     * Converts the rational fields of a metadata record to decimals.
     *
     * @param metadata extracted metadata
     * @return capture details with {@code null} for every decimal that could not be computed
     */
    public CaptureDetails toCaptureDetails(MediaMetadata metadata) {
        return new CaptureDetails(
                metadata.make(),
                metadata.model(),
                metadata.lens(),
                metadata.focalLength().describe(),
                metadata.capturedAt(),
                decimalOrNull("fNumber", metadata.fNumber()::toDecimal),
                decimalOrNull("shutterSpeed", metadata.shutterSpeed()::toDecimal),
                metadata.exposureTime().numerator(),
                metadata.exposureTime().denominator(),
                metadata.isoSpeed(),
                decimalOrNull("latitude", metadata.latitude()::toDecimal),
                decimalOrNull("longitude", metadata.longitude()::toDecimal),
                decimalOrNull("altitude", metadata.altitude()::toDecimal)
        );
    }

    private Double decimalOrNull(String field, DoubleSupplier conversion) {
        try {
            return conversion.getAsDouble();
        } catch (DecimalConversionException ex) {
            log.debug("No decimal value for {}: {}", field, ex.getMessage());
            return null;
        }
    }
}
