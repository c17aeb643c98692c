package net.scoreworks.scoresimilarity.comparison;

import net.scoreworks.scoresimilarity.alignment.AlignmentPath;
import net.scoreworks.scoresimilarity.alignment.Anchor;
import net.scoreworks.scoresimilarity.model.Durations;
import net.scoreworks.scoresimilarity.test_model.ScoreFixtures;
import org.apache.commons.lang3.math.Fraction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

public class WindowPartitionerTests {
    WindowPartitioner partitioner = new WindowPartitioner();
    List<ScoreItem> itemsA = ScoreItem.flatten(ScoreFixtures.melody("C4", "D4", "E4"));
    List<ScoreItem> itemsB = ScoreItem.flatten(ScoreFixtures.melody("C4", "G4", "D4", "E4"));

    private static Anchor anchor(int a, int b) {
        return Anchor.of(Durations.of(a), Durations.of(b));
    }

    @Test
    public void testWindowsFollowThePath() {
        AlignmentPath path = new AlignmentPath(Arrays.asList(anchor(0, 0), anchor(1, 1), anchor(1, 2), anchor(2, 3)));
        List<WindowPair> windows = partitioner.partition(path, itemsA, itemsB);
        Assertions.assertEquals(3, windows.size());

        WindowPair first = windows.get(0);
        Assertions.assertEquals(Fraction.ZERO, first.getWindowA().getStart());
        Assertions.assertEquals(Durations.of(1), first.getWindowA().getEnd());
        //barline and C4
        Assertions.assertEquals(2, first.getWindowA().getItems().size());
        Assertions.assertEquals(2, first.getWindowB().getItems().size());

        //B skipped a group, so its window spans two offsets
        WindowPair second = windows.get(1);
        Assertions.assertEquals(Durations.of(1), second.getWindowA().getStart());
        Assertions.assertEquals(Durations.of(2), second.getWindowA().getEnd());
        Assertions.assertEquals(Durations.of(1), second.getWindowB().getStart());
        Assertions.assertEquals(Durations.of(3), second.getWindowB().getEnd());
        Assertions.assertEquals(1, second.getWindowA().getItems().size());
        Assertions.assertEquals(2, second.getWindowB().getItems().size());

        WindowPair last = windows.get(2);
        Assertions.assertTrue(last.getWindowA().isUnbounded());
        Assertions.assertTrue(last.getWindowB().isUnbounded());
        Assertions.assertEquals(Durations.of(2), last.getWindowA().getStart());
        Assertions.assertEquals(Durations.of(3), last.getWindowB().getStart());
        Assertions.assertEquals(1, last.getWindowA().getItems().size());
        Assertions.assertEquals(1, last.getWindowB().getItems().size());
    }

    @Test
    public void testEveryItemLandsInExactlyOneWindow() {
        AlignmentPath path = new AlignmentPath(Arrays.asList(anchor(0, 0), anchor(1, 1), anchor(2, 1), anchor(2, 2), anchor(2, 3)));
        int countA = 0, countB = 0;
        for (WindowPair windows : partitioner.partition(path, itemsA, itemsB)) {
            countA += windows.getWindowA().getItems().size();
            countB += windows.getWindowB().getItems().size();
        }
        Assertions.assertEquals(itemsA.size(), countA);
        Assertions.assertEquals(itemsB.size(), countB);
    }

    @Test
    public void testEmptyPathGivesOneWindow() {
        List<WindowPair> windows = partitioner.partition(AlignmentPath.EMPTY, itemsA, itemsB);
        Assertions.assertEquals(1, windows.size());
        Assertions.assertEquals(Fraction.ZERO, windows.get(0).getWindowA().getStart());
        Assertions.assertTrue(windows.get(0).getWindowA().isUnbounded());
        Assertions.assertEquals(itemsA, windows.get(0).getWindowA().getItems());
        Assertions.assertEquals(itemsB, windows.get(0).getWindowB().getItems());
    }
}
