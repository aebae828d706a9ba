package com.umitunal.jobmgr.serialization;

import com.umitunal.jobmgr.core.Job;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class StatusCodecTest {

    private final StatusCodec codec = new StatusCodec();

    @Test
    @DisplayName("Should encode statuses as bare keywords")
    void testEncode() {
        assertThat(codec.encode(Job.Status.PENDING)).isEqualTo("PENDING");
        assertThat(codec.encode(Job.Status.COMPLETED)).isEqualTo("COMPLETED");
    }

    @Test
    @DisplayName("Should tolerate surrounding whitespace")
    void testDecodeTrims() {
        assertThat(codec.decode("  PAUSED \r")).isEqualTo(Job.Status.PAUSED);
    }

    @Test
    @DisplayName("Should reject unknown keywords")
    void testUnknownKeyword() {
        assertThatThrownBy(() -> codec.decode("DONE"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DONE");
        assertThatThrownBy(() -> codec.decode("pending"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
