package com.typedumper.core.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link StageTimer}.
 */
class StageTimerTest {

    private final List<String> reported = new ArrayList<>();
    private final StageTimer timer = new StageTimer((stage, elapsed) -> reported.add(stage));

    @Test
    void measure_returnsResultAndReportsStage() {
        String result = timer.measure("Create type model", () -> "model");

        assertThat(result).isEqualTo("model");
        assertThat(reported).containsExactly("Create type model");
    }

    @Test
    void measure_whenActionThrows_stillReportsStage() {
        assertThatThrownBy(() -> timer.measure("Analyze binary data", () -> {
            throw new IOException("truncated");
        })).isInstanceOf(IOException.class).hasMessage("truncated");

        assertThat(reported).containsExactly("Analyze binary data");
    }

    @Test
    void run_reportsEveryStageInOrder() throws Exception {
        timer.run("Generate C# code", () -> { });
        timer.run("Generate IDA Python script", () -> { });

        assertThat(reported).containsExactly("Generate C# code", "Generate IDA Python script");
    }

    @Test
    void format_printsSecondsWithTwoDecimals() {
        assertThat(StageTimer.format(Duration.ofMillis(1500))).isEqualTo("1.50");
        assertThat(StageTimer.format(Duration.ZERO)).isEqualTo("0.00");
    }
}
