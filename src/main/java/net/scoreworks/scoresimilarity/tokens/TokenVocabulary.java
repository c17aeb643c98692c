/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoresimilarity.tokens;

import net.scoreworks.scoresimilarity.model.Durations;
import net.scoreworks.scoresimilarity.model.KeySignature;
import net.scoreworks.scoresimilarity.model.TimeSignature;
import org.apache.commons.lang3.math.Fraction;


/**
 * The flat token vocabulary scores are exchanged in. A score reads {@code R <top staff tokens> L <bottom staff
 * tokens>}. Staff tokens are structural ({@code bar}, {@code <voice>}, {@code </voice>}), attributes
 * ({@code clef_treble}, {@code key_sharp_2}, {@code time_3/4}) and note or rest groups like
 * {@code note_C4 note_E4 len_1/2 stem_up beam_start tie_start} or {@code rest len_1}
 */
public final class TokenVocabulary {
    public static final String RIGHT_HAND = "R";
    public static final String LEFT_HAND = "L";
    public static final String BAR = "bar";
    public static final String VOICE_OPEN = "<voice>";
    public static final String VOICE_CLOSE = "</voice>";
    public static final String REST = "rest";

    public static final String NOTE_PREFIX = "note_";
    public static final String LENGTH_PREFIX = "len_";
    public static final String STEM_PREFIX = "stem_";
    public static final String BEAM_PREFIX = "beam_";
    public static final String TIE_PREFIX = "tie_";
    public static final String CLEF_PREFIX = "clef_";
    public static final String KEY_PREFIX = "key_";
    public static final String TIME_PREFIX = "time_";
    /** prefix of an older concatenated form of len_/stem_/beam_ */
    public static final String ATTRIBUTE_PREFIX = "attr_";

    private TokenVocabulary() {}

    public static String length(Fraction duration) {
        return LENGTH_PREFIX + Durations.format(duration);
    }

    public static String key(KeySignature keySignature) {
        int sharps = keySignature.getSharps();
        if (sharps > 0)
            return KEY_PREFIX + "sharp_" + sharps;
        if (sharps < 0)
            return KEY_PREFIX + "flat_" + (-sharps);
        return KEY_PREFIX + "natural_0";
    }

    public static String time(TimeSignature timeSignature) {
        return TIME_PREFIX + timeSignature.getNumerator() + "/" + timeSignature.getBeatUnit();
    }

    public static String value(String token, String prefix) {
        return token.substring(prefix.length());
    }
}
