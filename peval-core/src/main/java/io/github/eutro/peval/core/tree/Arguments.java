package io.github.eutro.peval.core.tree;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The formal parameters of a function or lambda: positional-or-keyword parameters,
 * then an optional {@code *vararg} and an optional {@code **kwarg}.
 */
public final class Arguments extends Node {
    public final List<Param> params;
    @Nullable
    public final Param vararg;
    @Nullable
    public final Param kwarg;

    public Arguments(List<Param> params, @Nullable Param vararg, @Nullable Param kwarg) {
        boolean seenDefault = false;
        for (Param param : params) {
            if (param.defaultValue != null) {
                seenDefault = true;
            } else if (seenDefault) {
                throw new IllegalArgumentException("non-default parameter " + param.name + " follows default parameter");
            }
        }
        this.params = copy(params);
        this.vararg = vararg;
        this.kwarg = kwarg;
    }

    public Arguments(List<Param> params) {
        this(params, null, null);
    }

    public static Arguments empty() {
        return new Arguments(Collections.emptyList());
    }

    /**
     * Get the names of all parameters, including variadic ones, in declaration order.
     *
     * @return The names.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (Param param : params) {
            names.add(param.name);
        }
        if (vararg != null) names.add(vararg.name);
        if (kwarg != null) names.add(kwarg.name);
        return names;
    }

    /**
     * Find the index of the named positional parameter.
     *
     * @param name The parameter name.
     * @return The index, or -1 if there is no such parameter.
     */
    public int indexOf(String name) {
        for (int i = 0; i < params.size(); i++) {
            if (params.get(i).name.equals(name)) return i;
        }
        return -1;
    }

    @Override
    public List<Object> fields() {
        return Arrays.asList(params, vararg, kwarg);
    }

    @Override
    public Arguments withFields(List<Object> fields) {
        return new Arguments(listField(fields.get(0)), (Param) fields.get(1), (Param) fields.get(2));
    }
}
