package com.example.mediametadata.infrastructure.exif;

import com.example.mediametadata.infrastructure.exception.TagCollectionException;

import com.drew.imaging.FileType;
import com.drew.imaging.FileTypeDetector;
import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.imaging.jpeg.JpegSegmentType;
import com.drew.lang.SequentialByteArrayReader;
import com.drew.lang.SequentialReader;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Infrastructure adapter that finds the embedded EXIF block in a media file using metadata-extractor.
 * Hides the library's container detection from the rest of the application.
 */
@Component
public class ExifBlockLocator {

    private static final Logger log = LoggerFactory.getLogger(ExifBlockLocator.class);

    private static final int MARKER_PREFIX = 0xFF;
    private static final int START_OF_SCAN = 0xDA;
    private static final int END_OF_IMAGE = 0xD9;

    /**
     * Locates the tag container inside the given file content.
     * Unknown file types and containers without a root IFD are a normal outcome, not an error.
     *
     * @param bytes full file content or at least its header portion
     * @return located block, or empty when the file carries no EXIF metadata
     * @throws TagCollectionException when the container is recognized but the library cannot read it
     */
    public Optional<RawExifBlock> locate(byte[] bytes) {
        if (bytes.length == 0) {
            return Optional.empty();
        }

        FileType fileType = detectFileType(bytes);
        if (fileType == FileType.Unknown) {
            log.debug("No recognizable container in {} bytes; no metadata to read", bytes.length);
            return Optional.empty();
        }

        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(bytes), bytes.length);
        } catch (IOException ex) {
            if (fileType != FileType.Jpeg) {
                throw new TagCollectionException("failed to get raw exif data from " + fileType.getName() + " container", ex);
            }
            log.debug("JPEG ends before its image data ({}); reading the header segments only", ex.getMessage());
            metadata = readJpegHeader(bytes);
        } catch (ImageProcessingException ex) {
            throw new TagCollectionException("failed to get raw exif data from " + fileType.getName() + " container", ex);
        }

        if (!metadata.containsDirectoryOfType(ExifIFD0Directory.class)) {
            log.debug("{} container has no EXIF block", fileType.getName());
            return Optional.empty();
        }
        return Optional.of(new RawExifBlock(fileType, metadata));
    }

    /**
     * Reads the complete APP1 segments of a JPEG that was cut off, typically a header-only upload.
     * Segments are read until the start of the image data or the end of the bytes, whichever comes first;
     * a segment cut in the middle is dropped.
     */
    private Metadata readJpegHeader(byte[] bytes) {
        List<byte[]> app1Segments = new ArrayList<>();
        SequentialReader reader = new SequentialByteArrayReader(bytes);
        try {
            reader.skip(2);
            while (true) {
                if (reader.getUInt8() != MARKER_PREFIX) {
                    break;
                }
                int marker = reader.getUInt8();
                while (marker == MARKER_PREFIX) {
                    marker = reader.getUInt8();
                }
                if (marker == START_OF_SCAN || marker == END_OF_IMAGE) {
                    break;
                }
                int payloadLength = reader.getUInt16() - 2;
                if (payloadLength < 0) {
                    break;
                }
                byte[] payload = reader.getBytes(payloadLength);
                if ((byte) marker == JpegSegmentType.APP1.byteValue) {
                    app1Segments.add(payload);
                }
            }
        } catch (IOException ex) {
            log.debug("JPEG header ends after {} complete APP1 segments", app1Segments.size());
        }

        Metadata metadata = new Metadata();
        new ExifReader().readJpegSegments(app1Segments, metadata, JpegSegmentType.APP1);
        return metadata;
    }

    private FileType detectFileType(byte[] bytes) {
        try (BufferedInputStream stream = new BufferedInputStream(new ByteArrayInputStream(bytes))) {
            return FileTypeDetector.detectFileType(stream);
        } catch (IOException ex) {
            throw new TagCollectionException("failed to detect the container type", ex);
        }
    }
}
