package org.alarmlog.sequence;

import org.alarmlog.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SequenceBuilderTest {

    private static double[] codes(int length) {
        double[] codes = new double[length];
        for (int i = 0; i < length; i++) codes[i] = i;
        return codes;
    }

    @Test
    void windowCountIsLengthMinusWindowPlusOne() {
        for (int length = 0; length <= 15; length++) {
            MachineSequences seq = SequenceBuilder.build("1", codes(length), 5, 2);
            assertEquals(Math.max(0, length - 5 + 1), seq.size());
            assertEquals(seq.size(), seq.getForecastPairs().size());
        }
    }

    @Test
    void windowsFollowInputOrder() {
        MachineSequences seq = SequenceBuilder.build("1", codes(6), 4, 1);

        assertArrayEquals(new double[]{0, 1, 2, 3}, seq.getWindows().get(0));
        assertArrayEquals(new double[]{2, 3, 4, 5}, seq.getWindows().get(2));
    }

    @Test
    void pairsSplitAtTheHorizon() {
        MachineSequences seq = SequenceBuilder.build("1", codes(10), 10, 3);

        ForecastPair pair = seq.getForecastPairs().get(0);
        assertEquals(7, pair.inputLength());
        assertEquals(3, pair.targetLength());
        assertArrayEquals(new double[]{7, 8, 9}, pair.getTarget());
    }

    @Test
    void shortHistoryYieldsNothing() {
        assertTrue(SequenceBuilder.build("1", codes(9), 10, 1).isEmpty());
    }

    @Test
    void rejectsInvalidHorizon() {
        assertThrows(ConfigurationException.class, () -> SequenceBuilder.validate(10, 10));
        assertThrows(ConfigurationException.class, () -> SequenceBuilder.validate(10, 0));
        assertThrows(ConfigurationException.class, () -> SequenceBuilder.validate(1, 1));
    }
}
