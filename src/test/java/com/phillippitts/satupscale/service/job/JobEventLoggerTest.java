package com.phillippitts.satupscale.service.job;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobEventLoggerTest {

    @Test
    void fieldsKeepInsertionOrderAndSkipNulls() {
        Map<String, Object> fields = JobEventLogger.fields("job_id", "a", "description", null, "total_units", 3);

        assertThat(fields).containsExactly(Map.entry("job_id", "a"), Map.entry("total_units", 3));
    }

    @Test
    void fieldsRejectOddArgumentCount() {
        assertThatThrownBy(() -> JobEventLogger.fields("job_id"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
