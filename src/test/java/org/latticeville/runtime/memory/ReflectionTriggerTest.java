package org.latticeville.runtime.memory;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ReflectionTriggerTest {

    @Test
    void firesOnTheRecordThatReachesTheThreshold() {
        ReflectionTrigger trigger = new ReflectionTrigger(9);

        trigger.record(3);
        trigger.record(3);
        assertThat(trigger.isDue()).isFalse();

        trigger.record(3);
        assertThat(trigger.isDue()).isTrue();
        assertThat(trigger.getAccumulated()).isEqualTo(9L);
    }

    @Test
    void resetStartsANewWindow() {
        ReflectionTrigger trigger = new ReflectionTrigger(5);
        trigger.record(7);

        trigger.reset(4);

        assertThat(trigger.isDue()).isFalse();
        assertThat(trigger.getAccumulated()).isZero();
        assertThat(trigger.getFirstUnreflectedId()).isEqualTo(4L);
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThatThrownBy(() -> new ReflectionTrigger(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
