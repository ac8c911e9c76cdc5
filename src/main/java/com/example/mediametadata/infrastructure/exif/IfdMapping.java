package com.example.mediametadata.infrastructure.exif;

import com.drew.metadata.Directory;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifInteropDirectory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;

import java.util.Map;
import java.util.Optional;

/**
 * Maps metadata-extractor directory types to the standard IFD paths of the EXIF tree.
 * Directories outside the standard tree (maker notes, thumbnails) have no path and are not walked.
 * <p>
 * The standard mapping is built once, lazily, and never mutated afterwards.
 */
public final class IfdMapping {

    public static final String ROOT_PATH = "IFD";
    public static final String EXIF_PATH = "IFD/Exif";
    public static final String GPS_PATH = "IFD/GPSInfo";
    public static final String INTEROP_PATH = "IFD/Exif/Iop";

    private final Map<Class<? extends Directory>, String> paths;

    private IfdMapping(Map<Class<? extends Directory>, String> paths) {
        this.paths = Map.copyOf(paths);
    }

    /**
     * @return process-wide standard mapping, created on first use
     */
    public static IfdMapping standard() {
        return Holder.STANDARD;
    }

    /**
     * Resolves the IFD path of a directory by its exact type.
     *
     * @param directory directory read by the library
     * @return IFD path or empty when the directory is not part of the standard tree
     */
    public Optional<String> pathOf(Directory directory) {
        return Optional.ofNullable(paths.get(directory.getClass()));
    }

    public boolean isRoot(Directory directory) {
        return pathOf(directory).filter(ROOT_PATH::equals).isPresent();
    }

    private static final class Holder {
        private static final IfdMapping STANDARD = new IfdMapping(Map.of(
                ExifIFD0Directory.class, ROOT_PATH,
                ExifSubIFDDirectory.class, EXIF_PATH,
                GpsDirectory.class, GPS_PATH,
                ExifInteropDirectory.class, INTEROP_PATH
        ));
    }
}
