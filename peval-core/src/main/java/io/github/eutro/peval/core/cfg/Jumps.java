package io.github.eutro.peval.core.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The nodes of a subgraph that leave it other than by falling through: by {@code return},
 * {@code break}, {@code continue} or by raising.
 */
public final class Jumps {
    public static final Jumps NONE = new Jumps(
            Collections.emptyList(),
            Collections.emptyList(),
            Collections.emptyList(),
            Collections.emptyList());

    public final List<Integer> returns;
    public final List<Integer> breaks;
    public final List<Integer> continues;
    public final List<Integer> raises;

    public Jumps(List<Integer> returns, List<Integer> breaks, List<Integer> continues, List<Integer> raises) {
        this.returns = Collections.unmodifiableList(new ArrayList<>(returns));
        this.breaks = Collections.unmodifiableList(new ArrayList<>(breaks));
        this.continues = Collections.unmodifiableList(new ArrayList<>(continues));
        this.raises = Collections.unmodifiableList(new ArrayList<>(raises));
    }

    public static Jumps returns(int handle) {
        return new Jumps(Collections.singletonList(handle), Collections.emptyList(),
                Collections.emptyList(), Collections.emptyList());
    }

    public static Jumps breaks(int handle) {
        return new Jumps(Collections.emptyList(), Collections.singletonList(handle),
                Collections.emptyList(), Collections.emptyList());
    }

    public static Jumps continues(int handle) {
        return new Jumps(Collections.emptyList(), Collections.emptyList(),
                Collections.singletonList(handle), Collections.emptyList());
    }

    public static Jumps raises(List<Integer> handles) {
        return new Jumps(Collections.emptyList(), Collections.emptyList(),
                Collections.emptyList(), handles);
    }

    /**
     * Get these jumps with the raises replaced.
     *
     * @param raises The new raises.
     * @return The new jumps.
     */
    public Jumps withRaises(List<Integer> raises) {
        return new Jumps(returns, breaks, continues, raises);
    }

    public Jumps join(Jumps other) {
        return new Jumps(
                concat(returns, other.returns),
                concat(breaks, other.breaks),
                concat(continues, other.continues),
                concat(raises, other.raises));
    }

    private static List<Integer> concat(List<Integer> a, List<Integer> b) {
        List<Integer> out = new ArrayList<>(a);
        out.addAll(b);
        return out;
    }
}
