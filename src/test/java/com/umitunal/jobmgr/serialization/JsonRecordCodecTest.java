package com.umitunal.jobmgr.serialization;

import com.umitunal.jobmgr.model.JobRecord;
import com.umitunal.jobmgr.model.PidBinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class JsonRecordCodecTest {

    private final JsonRecordCodec<JobRecord> jobCodec = new JsonRecordCodec<>(JobRecord.class);
    private final JsonRecordCodec<PidBinding> pidCodec = new JsonRecordCodec<>(PidBinding.class);

    @Test
    @DisplayName("Should keep commands with delimiters, quotes and newlines on one line")
    void testSpecialCharactersStayOnOneLine() {
        // Given
        JobRecord record = new JobRecord("k1", "printf 'a|b\\tc\"d\"\\n'; echo \"x\ny\"", "/tmp/with space");

        // When
        String line = jobCodec.encode(record);
        JobRecord decoded = jobCodec.decode(line);

        // Then
        assertThat(line).doesNotContain("\n");
        assertThat(decoded).isEqualTo(record);
    }

    @Test
    @DisplayName("Should write fields in key, command, workdir order")
    void testFieldOrder() {
        String line = jobCodec.encode(new JobRecord("k1", "echo hi", "/home/u"));

        assertThat(line).isEqualTo("{\"key\":\"k1\",\"command\":\"echo hi\",\"workdir\":\"/home/u\"}");
    }

    @Test
    @DisplayName("Should reject a record with a missing field")
    void testMissingField() {
        assertThatThrownBy(() -> jobCodec.decode("{\"key\":\"k1\",\"command\":\"echo hi\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("JobRecord");
    }

    @Test
    @DisplayName("Should reject a null field")
    void testNullField() {
        assertThatThrownBy(() -> jobCodec.decode("{\"key\":\"k1\",\"command\":null,\"workdir\":\"/\"}"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject lines that are not JSON objects")
    void testGarbage() {
        assertThatThrownBy(() -> jobCodec.decode("echo hi|/tmp"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> jobCodec.decode(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> jobCodec.decode("{\"key\":\"k1\",\"command\":\"a\",\"workdir\":\"/\"} trailing"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject non-positive pids")
    void testInvalidPid() {
        assertThat(pidCodec.decode("{\"key\":\"k1\",\"pid\":4242}").getPid()).isEqualTo(4242L);

        assertThatThrownBy(() -> pidCodec.decode("{\"key\":\"k1\",\"pid\":0}"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> pidCodec.decode("{\"key\":\"k1\"}"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
