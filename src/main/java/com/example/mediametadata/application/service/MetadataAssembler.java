package com.example.mediametadata.application.service;

import com.example.mediametadata.application.exception.MetadataExtractionException;
import com.example.mediametadata.domain.exception.DomainException;
import com.example.mediametadata.domain.exception.MediaBytesRequiredException;
import com.example.mediametadata.domain.model.MediaMetadata;
import com.example.mediametadata.domain.model.RecognizedTag;
import com.example.mediametadata.infrastructure.exception.TagCollectionException;
import com.example.mediametadata.infrastructure.exif.ExifBlockLocator;
import com.example.mediametadata.infrastructure.exif.ExifTagCollector;
import com.example.mediametadata.infrastructure.exif.IfdMapping;
import com.example.mediametadata.infrastructure.exif.IfdNode;
import com.example.mediametadata.infrastructure.exif.RawExifBlock;
import com.example.mediametadata.infrastructure.exif.TagIndex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Application-layer service that turns the bytes of a media file into a {@link MediaMetadata} record.
 * It locates the tag block, walks the collected tag tree and hands every entry to the {@link FieldExtractor}.
 * Stateless and safe to call from any number of threads.
 */
@Service
public class MetadataAssembler {

    private static final Logger log = LoggerFactory.getLogger(MetadataAssembler.class);

    private final ExifBlockLocator blockLocator;
    private final ExifTagCollector tagCollector;
    private final FieldExtractor fieldExtractor;

    /**
     * @param blockLocator   finds the embedded tag block
     * @param tagCollector   turns the block into a walkable tree
     * @param fieldExtractor decodes individual tag entries
     */
    public MetadataAssembler(ExifBlockLocator blockLocator, ExifTagCollector tagCollector, FieldExtractor fieldExtractor) {
        this.blockLocator = blockLocator;
        this.tagCollector = tagCollector;
        this.fieldExtractor = fieldExtractor;
    }

    /**
     * Extracts capture metadata from a media file.
     * Files without embedded metadata yield {@link MediaMetadata#EMPTY}.
     *
     * @param bytes full file content or its header portion
     * @return populated metadata record
     * @throws MediaBytesRequiredException  when {@code bytes} is null
     * @throws TagCollectionException       when the tag container cannot be parsed
     * @throws MetadataExtractionException  when a recognized tag carries malformed data
     */
    public MediaMetadata extract(byte[] bytes) {
        if (bytes == null) {
            throw new MediaBytesRequiredException();
        }

        Optional<RawExifBlock> block = blockLocator.locate(bytes);
        if (block.isEmpty()) {
            return MediaMetadata.EMPTY;
        }

        IfdNode root = tagCollector.collect(IfdMapping.standard(), TagIndex.standard(), block.get());
        MediaMetadata.Builder builder = MediaMetadata.builder();
        Set<RecognizedTag> seen = EnumSet.noneOf(RecognizedTag.class);
        try {
            root.walk((ifd, entry) -> fieldExtractor.extract(entry, builder).ifPresent(tag -> {
                if (!seen.add(tag)) {
                    log.debug("{} repeated in {}; keeping the later value", tag.tagName(), ifd.getPath());
                }
            }));
        } catch (DomainException ex) {
            throw new MetadataExtractionException("failed to walk exif data tree: " + ex.getMessage(), ex);
        }

        log.debug("Read {} of {} tags from {} container", seen.size(), root.size(), block.get().fileType().getName());
        return builder.build();
    }
}
