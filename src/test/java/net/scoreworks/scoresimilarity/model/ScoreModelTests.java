package net.scoreworks.scoresimilarity.model;

import net.scoreworks.scoresimilarity.exceptions.MalformedScoreException;
import net.scoreworks.scoresimilarity.test_model.StaffWriter;
import org.apache.commons.lang3.math.Fraction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static net.scoreworks.scoresimilarity.model.Durations.QUARTER;

public class ScoreModelTests {

    @Test
    public void testContextIsResolvedPerEvent() {
        Staff staff = StaffWriter.top()
                .bar().clef(ClefKind.TREBLE).key(2).time(3, 4)
                .note("D4", QUARTER)
                .clef(ClefKind.BASS)
                .note("F#3", QUARTER)
                .build();
        List<StaffEntry> entries = staff.getEntries();
        EventContext first = entries.get(4).getContext();
        Assertions.assertEquals(ClefKind.TREBLE, first.getClef());
        Assertions.assertEquals(2, first.getKeySharps());
        Assertions.assertEquals(Durations.of(3, 4), first.getTimeSignatureRatio());
        Assertions.assertEquals(ClefKind.BASS, entries.get(6).getContext().getClef());
        Assertions.assertEquals(2, entries.get(6).getContext().getKeySharps());
    }

    @Test
    public void testMissingContextDefaults() {
        Staff staff = StaffWriter.top().note("C4", QUARTER).build();
        EventContext context = staff.getEntries().get(0).getContext();
        Assertions.assertNull(context.getClef());
        Assertions.assertNull(context.getTimeSignatureRatio());
        Assertions.assertEquals(0, context.getKeySharps());
        Assertions.assertEquals(VoiceMarker.DEFAULT_VOICE, context.getVoice());
    }

    @Test
    public void testVoicesAreScopedToMeasures() {
        StaffWriter writer = StaffWriter.top().bar().voice("2").note("C4", Durations.WHOLE);
        Staff staff = writer.bar().note("D4", QUARTER).build();
        List<StaffEntry> entries = staff.getEntries();
        Assertions.assertEquals("2", entries.get(2).getContext().getVoice());
        Assertions.assertEquals("1", entries.get(4).getContext().getVoice());
    }

    @Test
    public void testEntriesAreOrderedStablyByOffset() {
        StaffBuilder builder = new StaffBuilder(Staff.TOP);
        builder.add(Fraction.ZERO, new VoiceMarker("1"));
        builder.add(Fraction.ZERO, new Note(Pitch.parse("C5"), Durations.HALF));
        builder.add(Fraction.ZERO, new VoiceMarker("2"));
        builder.add(Fraction.ZERO, new Note(Pitch.parse("C4"), QUARTER));
        builder.add(QUARTER, new Note(Pitch.parse("D4"), QUARTER));
        builder.add(Durations.HALF, new VoiceMarker("1"));
        builder.add(Durations.HALF, new Note(Pitch.parse("E5"), QUARTER));
        builder.add(Fraction.ZERO, new Clef(ClefKind.TREBLE));
        Staff staff = builder.build();

        List<StaffEntry> entries = staff.getEntries();
        Assertions.assertEquals(EventKind.CLEF, entries.get(4).getEvent().getKind());
        Assertions.assertEquals(QUARTER, entries.get(5).getOffset());
        Assertions.assertEquals("2", entries.get(5).getContext().getVoice());
        Assertions.assertEquals("1", entries.get(7).getContext().getVoice());
        for (int i = 1; i < entries.size(); i++)
            Assertions.assertTrue(entries.get(i - 1).getOffset().compareTo(entries.get(i).getOffset()) <= 0);
    }

    @Test
    public void testMalformedInput() {
        Assertions.assertThrows(MalformedScoreException.class, () -> new Rest(Fraction.getFraction(-1, 2)));
        Assertions.assertThrows(MalformedScoreException.class, () -> new Chord(Collections.emptyList(), QUARTER));
        Assertions.assertThrows(MalformedScoreException.class,
                () -> new StaffBuilder(Staff.TOP).add(Fraction.getFraction(-1, 1), new Rest(QUARTER)));
        Assertions.assertThrows(MalformedScoreException.class, () -> new Staff(2, Collections.emptyList()));
        Assertions.assertThrows(MalformedScoreException.class, () -> new Staff(Staff.TOP, Arrays.asList(
                new StaffEntry(QUARTER, new Rest(QUARTER), EventContext.DEFAULT),
                new StaffEntry(Fraction.ZERO, new Rest(QUARTER), EventContext.DEFAULT))));
        Assertions.assertThrows(MalformedScoreException.class, () -> new Score(Collections.emptyList()));
        Staff top = StaffWriter.top().build();
        Assertions.assertThrows(MalformedScoreException.class, () -> Score.of(top, top, top));
        Assertions.assertThrows(MalformedScoreException.class, () -> Score.of(StaffWriter.bottom().build()));
    }

    @Test
    public void testDurationsAreReduced() {
        Note note = new Note(Pitch.parse("C4"), Fraction.getFraction(2, 4));
        Assertions.assertEquals(Durations.EIGHTH, note.getDuration());
        Assertions.assertEquals("3/2", Durations.format(Durations.parse("6/4")));
        Assertions.assertEquals("2", Durations.format(Durations.parse("2")));
        Assertions.assertEquals(Durations.of(3, 2), Durations.parse("1.5"));
    }

    @Test
    public void testChordDecomposition() {
        Chord chord = new Chord(Arrays.asList(
                new Chord.Tone(Pitch.parse("C4")),
                new Chord.Tone(Pitch.parse("E4"), StemDirection.DOWN, TieState.START)),
                QUARTER, StemDirection.UP, Beams.of(BeamType.START), TieState.NONE);
        List<Note> notes = chord.decompose();
        Assertions.assertEquals(2, notes.size());
        Assertions.assertEquals(StemDirection.UP, notes.get(0).getStem());
        Assertions.assertEquals(TieState.NONE, notes.get(0).getTie());
        Assertions.assertEquals(StemDirection.DOWN, notes.get(1).getStem());
        Assertions.assertEquals(TieState.START, notes.get(1).getTie());
        Assertions.assertEquals("start", notes.get(1).getBeams().key());
        Assertions.assertEquals(QUARTER, notes.get(1).getDuration());
    }

    @Test
    public void testSymbolCounts() {
        Score score = Score.of(
                StaffWriter.top().bar().note("C4", QUARTER).chord(QUARTER, "C4", "E4", "G4").rest(Durations.HALF).build(),
                StaffWriter.bottom().bar().chord(Durations.HALF, "C3", "G3").rest(Durations.HALF).build());
        SymbolCounts counts = score.countSymbols();
        Assertions.assertEquals(new SymbolCounts(1, 2, 5, 2), counts);
        Assertions.assertEquals(6, counts.get(SymbolClass.NOTE));
        Assertions.assertEquals(2, counts.get(SymbolClass.REST));
    }

    @Test
    public void testBeamsKey() {
        Beams beams = Beams.of(BeamType.START, BeamType.PARTIAL_RIGHT);
        Assertions.assertEquals("start_partial-right", beams.key());
        Assertions.assertEquals(beams, Beams.parse("start_partial-right"));
        Assertions.assertEquals("", Beams.NONE.key());
        Assertions.assertTrue(Beams.parse("").isEmpty());
    }

    @Test
    public void testTimeSignatureRatio() {
        Assertions.assertEquals(new TimeSignature(2, 4).ratio(), new TimeSignature(4, 8).ratio());
        Assertions.assertEquals(Durations.of(3), new TimeSignature(6, 8).measureLength());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new KeySignature(8));
    }
}
