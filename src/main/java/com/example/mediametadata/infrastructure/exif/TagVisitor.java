package com.example.mediametadata.infrastructure.exif;

/**
 * Callback invoked once per tag entry while an {@link IfdNode} tree is walked.
 * Throwing from {@link #visit} stops the walk and the exception reaches the caller of {@code walk}.
 */
@FunctionalInterface
public interface TagVisitor {

    void visit(IfdNode ifd, TagEntry entry);
}
