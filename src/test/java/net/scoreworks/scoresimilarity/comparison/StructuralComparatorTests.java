package net.scoreworks.scoresimilarity.comparison;

import net.scoreworks.scoresimilarity.model.*;
import org.apache.commons.lang3.math.Fraction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static net.scoreworks.scoresimilarity.model.Durations.HALF;
import static net.scoreworks.scoresimilarity.model.Durations.QUARTER;

public class StructuralComparatorTests {
    StructuralComparator comparator = new StructuralComparator();

    private static ScoreItem item(int staff, Event event) {
        return item(staff, event, EventContext.DEFAULT);
    }

    private static ScoreItem item(int staff, Event event, EventContext context) {
        return new ScoreItem(staff, Fraction.ZERO, event, context);
    }

    private static Note note(String pitch, Fraction duration, StemDirection stem) {
        return new Note(Pitch.parse(pitch), duration, stem, Beams.NONE, TieState.NONE);
    }

    private static Chord chord(Fraction duration, String... pitches) {
        Pitch[] parsed = new Pitch[pitches.length];
        for (int i = 0; i < pitches.length; i++)
            parsed[i] = Pitch.parse(pitches[i]);
        return new Chord(Arrays.asList(parsed), duration);
    }

    private static void assertOnly(ErrorVector errors, ErrorKind... expected) {
        int[] counts = new int[ErrorKind.values().length];
        for (ErrorKind kind : expected)
            counts[kind.ordinal()]++;
        for (ErrorKind kind : ErrorKind.values())
            Assertions.assertEquals(counts[kind.ordinal()], errors.get(kind), kind.getLabel());
    }

    @Test
    public void testIdenticalWindowsHaveNoErrors() {
        List<ScoreItem> a = Arrays.asList(
                item(Staff.TOP, Barline.regular()),
                item(Staff.TOP, new Clef(ClefKind.TREBLE)),
                item(Staff.TOP, chord(QUARTER, "C4", "E4", "G4")),
                item(Staff.BOTTOM, new Rest(HALF)));
        List<ScoreItem> b = Arrays.asList(
                item(Staff.TOP, Barline.measureBoundary()),
                item(Staff.TOP, new Clef(ClefKind.TREBLE)),
                item(Staff.TOP, chord(QUARTER, "G4", "C4", "E4")),
                item(Staff.BOTTOM, new Rest(HALF)));
        ComparisonState state = comparator.run(a, b);
        Assertions.assertTrue(state.getErrors().isZero());
        Assertions.assertTrue(state.getRemainingA().isEmpty());
        Assertions.assertTrue(state.getRemainingB().isEmpty());
    }

    @Test
    public void testStaffAssignment() {
        ErrorVector errors = comparator.compare(
                Collections.singletonList(item(Staff.TOP, note("C4", QUARTER, StemDirection.UP))),
                Collections.singletonList(item(Staff.BOTTOM, note("C4", QUARTER, StemDirection.UP))));
        assertOnly(errors, ErrorKind.STAFF_ASSIGNMENT);
    }

    @Test
    public void testStaffAssignmentHidesAttributeErrors() {
        ErrorVector errors = comparator.compare(
                Collections.singletonList(item(Staff.TOP, note("C4", QUARTER, StemDirection.UP))),
                Collections.singletonList(item(Staff.BOTTOM, note("C4", HALF, StemDirection.DOWN))));
        assertOnly(errors, ErrorKind.STAFF_ASSIGNMENT);
    }

    @Test
    public void testEnharmonicPairOnOtherStaffKeepsAttributeErrors() {
        ErrorVector errors = comparator.compare(
                Collections.singletonList(item(Staff.TOP, note("C4", QUARTER, StemDirection.UP))),
                Collections.singletonList(item(Staff.BOTTOM, note("B#3", HALF, StemDirection.DOWN))));
        assertOnly(errors, ErrorKind.STAFF_ASSIGNMENT, ErrorKind.NOTE_SPELLING, ErrorKind.NOTE_DURATION, ErrorKind.STEM_DIRECTION);
    }

    @Test
    public void testChordDecomposition() {
        ComparisonState state = comparator.run(
                Collections.singletonList(item(Staff.TOP, chord(QUARTER, "C4", "E4", "G4"))),
                Collections.singletonList(item(Staff.TOP, chord(QUARTER, "C4", "E4"))));
        assertOnly(state.getErrors(), ErrorKind.NOTE_DELETION);
        Assertions.assertEquals(2, state.getDecomposedChords());
        Assertions.assertEquals(1, state.getRemainingA().size());
        Assertions.assertEquals(Pitch.parse("G4"), ((Note) state.getRemainingA().get(0).getEvent()).getPitch());
    }

    @Test
    public void testChordAgainstSingleNotes() {
        ErrorVector errors = comparator.compare(
                Collections.singletonList(item(Staff.TOP, chord(HALF, "C4", "E4"))),
                Arrays.asList(item(Staff.TOP, new Note(Pitch.parse("C4"), HALF)), item(Staff.TOP, new Note(Pitch.parse("E4"), QUARTER))));
        assertOnly(errors, ErrorKind.NOTE_DURATION);
    }

    @Test
    public void testAttributeMismatchesCountSeparately() {
        Note a = new Note(Pitch.parse("D4"), QUARTER, StemDirection.UP, Beams.of(BeamType.START), TieState.NONE);
        Note b = new Note(Pitch.parse("D4"), HALF, StemDirection.DOWN, Beams.NONE, TieState.START);
        ErrorVector errors = comparator.compare(
                Collections.singletonList(item(Staff.TOP, a)),
                Collections.singletonList(item(Staff.TOP, b)));
        assertOnly(errors, ErrorKind.NOTE_DURATION, ErrorKind.STEM_DIRECTION, ErrorKind.BEAMS, ErrorKind.TIE);
    }

    @Test
    public void testContextMismatchesCountOnPairedNotes() {
        EventContext treble = EventContext.DEFAULT.withClef(ClefKind.TREBLE).withKeySharps(1)
                .withTimeSignature(new TimeSignature(3, 4));
        EventContext bass = EventContext.DEFAULT.withClef(ClefKind.BASS).withKeySharps(-1)
                .withTimeSignature(new TimeSignature(2, 4)).withVoice("2");
        ErrorVector errors = comparator.compare(
                Collections.singletonList(item(Staff.TOP, note("G4", QUARTER, StemDirection.UP), treble)),
                Collections.singletonList(item(Staff.TOP, note("G4", QUARTER, StemDirection.DOWN), bass)));
        assertOnly(errors, ErrorKind.STEM_DIRECTION, ErrorKind.CLEF, ErrorKind.KEY_SIGNATURE, ErrorKind.TIME_SIGNATURE, ErrorKind.VOICE);
    }

    @Test
    public void testEquivalentTimeSignaturesDoNotCount() {
        EventContext twoFour = EventContext.DEFAULT.withTimeSignature(new TimeSignature(2, 4));
        EventContext fourEight = EventContext.DEFAULT.withTimeSignature(new TimeSignature(4, 8));
        ErrorVector errors = comparator.compare(
                Arrays.asList(item(Staff.TOP, new TimeSignature(2, 4), twoFour), item(Staff.TOP, note("G4", QUARTER, StemDirection.UP), twoFour)),
                Arrays.asList(item(Staff.TOP, new TimeSignature(4, 8), fourEight), item(Staff.TOP, note("G4", HALF, StemDirection.UP), fourEight)));
        assertOnly(errors, ErrorKind.NOTE_DURATION);
    }

    @Test
    public void testContextAloneIsNotAnError() {
        ErrorVector errors = comparator.compare(
                Collections.singletonList(item(Staff.TOP, note("G4", QUARTER, StemDirection.UP), EventContext.DEFAULT.withClef(ClefKind.TREBLE))),
                Collections.singletonList(item(Staff.TOP, note("G4", QUARTER, StemDirection.UP), EventContext.DEFAULT.withClef(ClefKind.BASS))));
        Assertions.assertTrue(errors.isZero());
    }

    @Test
    public void testEnharmonicPrecedence() {
        ErrorVector errors = comparator.compare(
                Collections.singletonList(item(Staff.TOP, note("F#4", QUARTER, StemDirection.UP))),
                Collections.singletonList(item(Staff.TOP, note("Gb4", QUARTER, StemDirection.UP))));
        assertOnly(errors, ErrorKind.NOTE_SPELLING);
    }

    @Test
    public void testExactPitchIsPreferredOverEnharmonic() {
        ErrorVector errors = comparator.compare(
                Collections.singletonList(item(Staff.TOP, note("F#4", QUARTER, StemDirection.UP))),
                Arrays.asList(item(Staff.TOP, note("Gb4", QUARTER, StemDirection.UP)), item(Staff.TOP, note("F#4", HALF, StemDirection.UP))));
        assertOnly(errors, ErrorKind.NOTE_DURATION, ErrorKind.NOTE_INSERTION);
    }

    @Test
    public void testRestDurationIsAlsoCountedAsDeletion() {
        ComparisonState state = comparator.run(
                Collections.singletonList(item(Staff.TOP, new Rest(QUARTER))),
                Collections.singletonList(item(Staff.TOP, new Rest(HALF))));
        assertOnly(state.getErrors(), ErrorKind.REST_DURATION, ErrorKind.REST_DELETION);
        Assertions.assertTrue(state.getRemainingB().isEmpty());
    }

    @Test
    public void testResidualCounting() {
        List<ScoreItem> a = Arrays.asList(
                item(Staff.TOP, new KeySignature(2)),
                item(Staff.TOP, chord(QUARTER, "C4", "E4", "G4")),
                item(Staff.BOTTOM, new Rest(QUARTER)));
        List<ScoreItem> b = Arrays.asList(
                item(Staff.TOP, new Clef(ClefKind.BASS)),
                item(Staff.TOP, note("A2", QUARTER, StemDirection.UP)),
                item(Staff.TOP, new VoiceMarker("2")));
        ErrorVector errors = comparator.compare(a, b);
        Assertions.assertEquals(3, errors.get(ErrorKind.NOTE_DELETION));
        Assertions.assertEquals(1, errors.get(ErrorKind.NOTE_INSERTION));
        Assertions.assertEquals(1, errors.get(ErrorKind.REST_DELETION));
        Assertions.assertEquals(5, errors.total());
    }

    @Test
    public void testPassOrder() {
        List<ComparisonPass> passes = comparator.getPasses();
        Assertions.assertEquals(7, passes.size());
        Assertions.assertEquals("ExactMatchPass", passes.get(0).getClass().getSimpleName());
        Assertions.assertEquals("ResidualPass", passes.get(6).getClass().getSimpleName());
    }

    @Test
    public void testStructuralEquality() {
        Assertions.assertTrue(StructuralEquality.equal(Barline.regular(), Barline.measureBoundary()));
        Assertions.assertTrue(StructuralEquality.equal(new KeySignature(-3), new KeySignature(-3)));
        Assertions.assertFalse(StructuralEquality.equal(new KeySignature(-3), new KeySignature(3)));
        Assertions.assertTrue(StructuralEquality.equal(new TimeSignature(3, 4), new TimeSignature(6, 8)));
        Assertions.assertFalse(StructuralEquality.equal(new Clef(ClefKind.TREBLE), new Clef(ClefKind.BASS)));
        Assertions.assertFalse(StructuralEquality.equal(new Rest(QUARTER), note("C4", QUARTER, StemDirection.UP)));
        Assertions.assertFalse(StructuralEquality.equal(note("C4", QUARTER, StemDirection.UP), note("C4", QUARTER, StemDirection.DOWN)));
        Assertions.assertTrue(StructuralEquality.equal(new VoiceMarker("2"), new VoiceMarker("2")));
    }
}
