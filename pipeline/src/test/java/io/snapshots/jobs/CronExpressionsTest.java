package io.snapshots.jobs;

import io.snapshots.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CronExpressionsTest {
    @Test
    void accepts_common_schedules() {
        for (String expr : new String[]{"0 * * * *", "5 0 * * *", "10 0 * * 1", "*/15 * * * *", "0 9-17/2 * * MON-FRI",
                "30 0 1,15 * *", "0 0 * JAN,JUL 0", "0 0 * * 7"}) {
            assertTrue(CronExpressions.isValid(expr), expr);
        }
    }

    @Test
    void rejects_malformed_schedules() {
        for (String expr : new String[]{"", "* * * *", "* * * * * *", "60 * * * *", "* 24 * * *", "* * 0 * *",
                "* * * 13 *", "* * * * 8", "*/0 * * * *", "5-1 * * * *", "a * * * *", "1,,2 * * * *"}) {
            assertFalse(CronExpressions.isValid(expr), expr);
        }
    }

    @Test
    void error_names_the_field() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> CronExpressions.validate("0 25 * * *"));
        assertTrue(e.getMessage().contains("hour"));
    }
}
