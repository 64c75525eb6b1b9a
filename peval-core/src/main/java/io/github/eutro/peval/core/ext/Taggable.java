package io.github.eutro.peval.core.ext;

/**
 * Something that {@link Tag}s can be put on.
 * <p>
 * Runtime callables are taggable, which is how the {@code pure} and {@code inline}
 * decorators mark them.
 */
public interface Taggable {
    /**
     * Put a tag on this.
     *
     * @param tag The tag.
     */
    void addTag(Tag tag);

    /**
     * Get whether a tag has been put on this.
     *
     * @param tag The tag.
     * @return Whether it has.
     */
    boolean hasTag(Tag tag);

    /**
     * Put a tag on a value, and return it.
     *
     * @param value The value.
     * @param tag   The tag.
     * @param <T>   The type of the value.
     * @return The value.
     */
    static <T extends Taggable> T tagged(T value, Tag tag) {
        value.addTag(tag);
        return value;
    }
}
