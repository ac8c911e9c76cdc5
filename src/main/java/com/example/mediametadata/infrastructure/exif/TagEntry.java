package com.example.mediametadata.infrastructure.exif;

/**
 * One tag found while collecting a container, with its payload left untyped.
 *
 * @param ifdPath  path of the IFD holding the tag, e.g. {@code IFD/GPSInfo}
 * @param tagId    numeric tag identifier
 * @param name     canonical tag name from the {@link TagIndex}
 * @param rawValue payload exactly as the library decoded it
 */
public record TagEntry(String ifdPath, int tagId, String name, Object rawValue) {
}
