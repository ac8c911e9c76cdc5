package com.example.mediametadata.infrastructure.exif;

import com.drew.imaging.FileType;
import com.drew.metadata.Metadata;

/**
 * Tag container located inside a media file, still in the library's directory form.
 *
 * @param fileType container type detected from the magic bytes
 * @param metadata directories read by metadata-extractor; holds at least one root IFD
 */
public record RawExifBlock(FileType fileType, Metadata metadata) {
}
