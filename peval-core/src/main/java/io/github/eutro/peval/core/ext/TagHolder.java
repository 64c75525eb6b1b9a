package io.github.eutro.peval.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.EnumSet;
import java.util.Set;

/**
 * An implementation of {@link Taggable} backed by an {@link EnumSet}.
 */
public class TagHolder implements Taggable {
    @Nullable
    private Set<Tag> tags = null; // most callables are never tagged

    @Override
    public synchronized void addTag(Tag tag) {
        if (tags == null) tags = EnumSet.noneOf(Tag.class);
        tags.add(tag);
    }

    @Override
    public synchronized boolean hasTag(Tag tag) {
        return tags != null && tags.contains(tag);
    }
}
