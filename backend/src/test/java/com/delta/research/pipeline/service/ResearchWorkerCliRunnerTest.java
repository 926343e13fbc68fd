package com.delta.research.pipeline.service;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;

class ResearchWorkerCliRunnerTest {

    @Test
    void sleepAcceptsBothOptionForms() {
        assertThat(ResearchWorkerCliRunner.sleepSeconds(new DefaultApplicationArguments("--loop", "--sleep=7"), 2))
            .isEqualTo(7);
        assertThat(ResearchWorkerCliRunner.sleepSeconds(new DefaultApplicationArguments("--loop", "--sleep", "9"), 2))
            .isEqualTo(9);
    }

    @Test
    void sleepFallsBackWhenMissingOrInvalid() {
        assertThat(ResearchWorkerCliRunner.sleepSeconds(new DefaultApplicationArguments("--loop"), 2)).isEqualTo(2);
        assertThat(ResearchWorkerCliRunner.sleepSeconds(new DefaultApplicationArguments("--sleep=soon"), 3)).isEqualTo(3);
        assertThat(ResearchWorkerCliRunner.sleepSeconds(new DefaultApplicationArguments("--sleep=0"), 3)).isEqualTo(1);
    }
}
