package com.example.mediametadata.infrastructure.exif;

import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Canonical EXIF tag names keyed by IFD path and tag id.
 * Covers the tags the extraction reads plus the neighbouring camera, timing and GPS tags that show up in
 * debug output; any other id resolves to {@code UnknownTag_0x....}.
 * Built once, lazily, and shared read-only by every extraction.
 */
public final class TagIndex {

    private final Map<String, Map<Integer, String>> namesByIfd;

    private TagIndex(Map<String, Map<Integer, String>> namesByIfd) {
        Map<String, Map<Integer, String>> copy = new HashMap<>();
        namesByIfd.forEach((ifd, names) -> copy.put(ifd, Map.copyOf(names)));
        this.namesByIfd = Map.copyOf(copy);
    }

    /**
     * @return process-wide index of the standard EXIF tags, created on first use
     */
    public static TagIndex standard() {
        return Holder.STANDARD;
    }

    /**
     * Resolves the canonical name of a tag.
     *
     * @param ifdPath IFD the tag was found in
     * @param tagId   numeric tag identifier
     * @return canonical name, or {@code UnknownTag_0x....} for tags the index does not define in that IFD
     */
    public String nameOf(String ifdPath, int tagId) {
        Map<Integer, String> names = namesByIfd.get(ifdPath);
        String name = names != null ? names.get(tagId) : null;
        return name != null ? name : String.format(Locale.ROOT, "UnknownTag_0x%04x", tagId);
    }

    private static final class Holder {
        private static final TagIndex STANDARD = new TagIndex(Map.of(
                IfdMapping.ROOT_PATH, rootTags(),
                IfdMapping.EXIF_PATH, exifTags(),
                IfdMapping.GPS_PATH, gpsTags(),
                IfdMapping.INTEROP_PATH, Map.of(
                        ExifDirectoryBase.TAG_INTEROP_INDEX, "InteroperabilityIndex",
                        ExifDirectoryBase.TAG_INTEROP_VERSION, "InteroperabilityVersion")
        ));

        // camera identity plus the pointers to the sub-IFDs
        private static Map<Integer, String> rootTags() {
            Map<Integer, String> tags = new HashMap<>();
            tags.put(ExifDirectoryBase.TAG_MAKE, "Make");
            tags.put(ExifDirectoryBase.TAG_MODEL, "Model");
            tags.put(ExifDirectoryBase.TAG_ORIENTATION, "Orientation");
            tags.put(ExifDirectoryBase.TAG_SOFTWARE, "Software");
            tags.put(ExifDirectoryBase.TAG_DATETIME, "DateTime");
            tags.put(ExifIFD0Directory.TAG_EXIF_SUB_IFD_OFFSET, "ExifTag");
            tags.put(ExifIFD0Directory.TAG_GPS_INFO_OFFSET, "GPSTag");
            return tags;
        }

        // exposure, timing and optics
        private static Map<Integer, String> exifTags() {
            Map<Integer, String> tags = new HashMap<>();
            tags.put(ExifDirectoryBase.TAG_EXPOSURE_TIME, "ExposureTime");
            tags.put(ExifDirectoryBase.TAG_FNUMBER, "FNumber");
            tags.put(ExifDirectoryBase.TAG_ISO_EQUIVALENT, "ISOSpeedRatings");
            tags.put(ExifDirectoryBase.TAG_DATETIME_ORIGINAL, "DateTimeOriginal");
            tags.put(ExifDirectoryBase.TAG_DATETIME_DIGITIZED, "DateTimeDigitized");
            tags.put(ExifDirectoryBase.TAG_TIME_ZONE, "OffsetTime");
            tags.put(ExifDirectoryBase.TAG_TIME_ZONE_ORIGINAL, "OffsetTimeOriginal");
            tags.put(ExifDirectoryBase.TAG_SHUTTER_SPEED, "ShutterSpeedValue");
            tags.put(ExifDirectoryBase.TAG_APERTURE, "ApertureValue");
            tags.put(ExifDirectoryBase.TAG_FOCAL_LENGTH, "FocalLength");
            tags.put(ExifDirectoryBase.TAG_35MM_FILM_EQUIV_FOCAL_LENGTH, "FocalLengthIn35mmFilm");
            tags.put(ExifDirectoryBase.TAG_LENS_MAKE, "LensMake");
            tags.put(ExifDirectoryBase.TAG_LENS_MODEL, "LensModel");
            tags.put(ExifDirectoryBase.TAG_EXIF_IMAGE_WIDTH, "PixelXDimension");
            tags.put(ExifDirectoryBase.TAG_EXIF_IMAGE_HEIGHT, "PixelYDimension");
            tags.put(ExifSubIFDDirectory.TAG_INTEROP_OFFSET, "InteroperabilityTag");
            return tags;
        }

        private static Map<Integer, String> gpsTags() {
            Map<Integer, String> tags = new HashMap<>();
            tags.put(GpsDirectory.TAG_VERSION_ID, "GPSVersionID");
            tags.put(GpsDirectory.TAG_LATITUDE_REF, "GPSLatitudeRef");
            tags.put(GpsDirectory.TAG_LATITUDE, "GPSLatitude");
            tags.put(GpsDirectory.TAG_LONGITUDE_REF, "GPSLongitudeRef");
            tags.put(GpsDirectory.TAG_LONGITUDE, "GPSLongitude");
            tags.put(GpsDirectory.TAG_ALTITUDE_REF, "GPSAltitudeRef");
            tags.put(GpsDirectory.TAG_ALTITUDE, "GPSAltitude");
            tags.put(GpsDirectory.TAG_TIME_STAMP, "GPSTimeStamp");
            tags.put(GpsDirectory.TAG_DATE_STAMP, "GPSDateStamp");
            return tags;
        }
    }
}
