package org.alarmlog.anomaly;

import org.alarmlog.error.DataInsufficiencyException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequenceSplitTest {

    private static List<double[]> sequences(int n) {
        List<double[]> list = new ArrayList<>();
        for (int i = 0; i < n; i++) list.add(new double[]{i});
        return list;
    }

    @Test
    void splitsChronologically() {
        List<double[]> all = sequences(10);

        SequenceSplit split = SequenceSplit.chronological(all, 0.7);

        assertEquals(7, split.getTrain().size());
        assertEquals(3, split.getFuture().size());
        assertSame(all.get(7), split.getFuture().get(0));
        assertFalse(split.isDegenerate());
    }

    @Test
    void keepsAtLeastOneFutureSequence() {
        SequenceSplit split = SequenceSplit.chronological(sequences(2), 0.9);

        assertEquals(1, split.getTrain().size());
        assertEquals(1, split.getFuture().size());
    }

    @Test
    void singleSequenceServesBothSides() {
        List<double[]> one = sequences(1);

        SequenceSplit split = SequenceSplit.chronological(one, 0.7);

        assertTrue(split.isDegenerate());
        assertSame(one.get(0), split.getTrain().get(0));
        assertSame(one.get(0), split.getFuture().get(0));
    }

    @Test
    void noSequencesIsAnError() {
        assertThrows(DataInsufficiencyException.class,
                () -> SequenceSplit.chronological(Collections.emptyList(), 0.7));
    }
}
