package com.example.mediametadata.infrastructure.exif;

import com.example.mediametadata.infrastructure.exception.TagCollectionException;

import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the flat directory list read by metadata-extractor into a walkable IFD tree.
 * Child IFDs are attached through the library's parent links; payloads are copied without interpretation.
 */
@Component
public class ExifTagCollector {

    private static final Logger log = LoggerFactory.getLogger(ExifTagCollector.class);

    /**
     * Builds the tag tree rooted at the first root IFD of the block.
     *
     * @param mapping directory type to IFD path mapping
     * @param index   canonical tag names
     * @param block   block returned by {@link ExifBlockLocator}
     * @return root node of the tree
     * @throws TagCollectionException when the block has no readable root IFD
     */
    public IfdNode collect(IfdMapping mapping, TagIndex index, RawExifBlock block) {
        Metadata metadata = block.metadata();
        Directory root = null;
        for (Directory directory : metadata.getDirectories()) {
            if (mapping.isRoot(directory)) {
                root = directory;
                break;
            }
        }
        if (root == null) {
            throw new TagCollectionException("failed to collect exif data: no root IFD in "
                    + block.fileType().getName() + " container");
        }
        if (root.getTagCount() == 0 && root.hasErrors()) {
            throw new TagCollectionException("failed to collect exif data: " + firstError(root));
        }
        return buildNode(mapping, index, metadata, root);
    }

    private IfdNode buildNode(IfdMapping mapping, TagIndex index, Metadata metadata, Directory directory) {
        String path = mapping.pathOf(directory)
                .orElseThrow(() -> new IllegalArgumentException("Unmapped directory " + directory.getName()));
        if (directory.hasErrors()) {
            log.warn("{} ({}) was read with errors, first: {}", path, directory.getName(), firstError(directory));
        }

        List<TagEntry> entries = new ArrayList<>();
        for (Tag tag : directory.getTags()) {
            int tagId = tag.getTagType();
            entries.add(new TagEntry(path, tagId, index.nameOf(path, tagId), directory.getObject(tagId)));
        }

        List<IfdNode> children = new ArrayList<>();
        for (Directory candidate : metadata.getDirectories()) {
            if (candidate.getParent() == directory && mapping.pathOf(candidate).isPresent()) {
                children.add(buildNode(mapping, index, metadata, candidate));
            }
        }
        return new IfdNode(path, entries, children);
    }

    private static String firstError(Directory directory) {
        for (String error : directory.getErrors()) {
            return error;
        }
        return "unknown error";
    }
}
