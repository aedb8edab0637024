package net.cadence.integration.spring.cron;

import net.cadence.core.model.Schedule;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CronUtilsScheduleDescriberTest {

    final CronUtilsScheduleDescriber describer = new CronUtilsScheduleDescriber();

    @Test
    void manual_and_interval_are_described_directly() {
        assertEquals("manual only", describer.describe(Schedule.manual()));
        assertEquals("every minute", describer.describe(Schedule.interval(1)));
        assertEquals("every 90 minutes", describer.describe(Schedule.interval(90)));
    }

    @Test
    void cron_is_described_in_words() {
        String text = describer.describe(Schedule.cron("*/15 * * * *"));

        assertThat(text).isNotBlank().contains("15").doesNotContain("*/15");
    }

    @Test
    void same_expression_is_described_once() {
        String first = describer.describe(Schedule.cron("0 9 * * 1-5"));
        assertThat(describer.describe(Schedule.cron("0 9 * * 1-5"))).isSameAs(first);
    }
}
