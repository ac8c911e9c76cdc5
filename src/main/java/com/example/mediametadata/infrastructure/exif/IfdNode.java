package com.example.mediametadata.infrastructure.exif;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Node of a collected tag tree: the entries of one IFD followed by its child IFDs.
 * A tree is single-pass; walking the same node twice is rejected.
 */
public final class IfdNode {

    private final String path;
    private final List<TagEntry> entries;
    private final List<IfdNode> children;
    private final AtomicBoolean walked = new AtomicBoolean();

    public IfdNode(String path, List<TagEntry> entries, List<IfdNode> children) {
        this.path = path;
        this.entries = List.copyOf(entries);
        this.children = List.copyOf(children);
    }

    public String getPath() {
        return path;
    }

    public List<TagEntry> getEntries() {
        return entries;
    }

    public List<IfdNode> getChildren() {
        return children;
    }

    /**
     * Visits every entry of this IFD in container order, then recurses into each child IFD.
     *
     * @param visitor callback receiving each entry; an exception it throws aborts the walk
     * @throws IllegalStateException when this node was already walked
     */
    public void walk(TagVisitor visitor) {
        if (!walked.compareAndSet(false, true)) {
            throw new IllegalStateException("tag tree rooted at " + path + " has already been walked");
        }
        for (TagEntry entry : entries) {
            visitor.visit(this, entry);
        }
        for (IfdNode child : children) {
            child.walk(visitor);
        }
    }

    /**
     * @return number of entries in this node and all of its descendants
     */
    public int size() {
        int size = entries.size();
        for (IfdNode child : children) {
            size += child.size();
        }
        return size;
    }
}
