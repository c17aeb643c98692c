/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.model;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;


/**
 * Ordered per-level beam descriptors of a note, first entry being the outermost (eighth) beam
 */
public final class Beams {
    public static final Beams NONE = new Beams(Collections.emptyList());

    private final List<BeamType> levels;

    private Beams(List<BeamType> levels) {
        this.levels = levels;
    }

    public static Beams of(BeamType... levels) {
        if (levels.length == 0)
            return NONE;
        return new Beams(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(levels))));
    }

    public static Beams of(List<BeamType> levels) {
        return of(levels.toArray(new BeamType[0]));
    }

    /**
     * @param key level codes joined by {@code _}, as produced by {@link #key()}
     */
    public static Beams parse(String key) {
        if (StringUtils.isEmpty(key))
            return NONE;
        List<BeamType> levels = new ArrayList<>();
        for (String code : key.split("_"))
            levels.add(BeamType.fromCode(code));
        return of(levels);
    }

    public List<BeamType> getLevels() {
        return levels;
    }

    public boolean isEmpty() {
        return levels.isEmpty();
    }

    /**
     * @return single comparable key, e.g. {@code start_partial-right}. Empty for unbeamed notes
     */
    public String key() {
        StringBuilder strb = new StringBuilder();
        for (BeamType level : levels) {
            if (strb.length() > 0)
                strb.append('_');
            strb.append(level.code());
        }
        return strb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Beams && levels.equals(((Beams) o).levels);
    }

    @Override
    public int hashCode() {
        return levels.hashCode();
    }

    @Override
    public String toString() {
        return key();
    }
}
