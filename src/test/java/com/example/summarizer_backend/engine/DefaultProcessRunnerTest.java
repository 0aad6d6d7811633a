package com.example.summarizer_backend.engine;

import com.example.summarizer_backend.engine.Interfaces.ProcessRunner;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class DefaultProcessRunnerTest {

    @Test
    void stderrBufferKeepsOnlyTheNewestCharacters() {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < 100; i++) {
            DefaultProcessRunner.appendTail(buf, "line " + i, 32);
            assertThat(buf.length()).isLessThanOrEqualTo(32);
        }
        assertThat(buf.toString()).endsWith("line 99\n").doesNotContain("line 1\n");
    }

    @Test
    void chattyProcessKeepsBoundedStderrTail() throws Exception {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "no POSIX shell");
        String script = "i=0; while [ $i -lt 2000 ]; do echo \"progress line $i\" >&2; i=$((i+1)); done; echo done";

        ProcessRunner.Result res = new DefaultProcessRunner().run(List.of("/bin/sh", "-c", script), Duration.ofSeconds(30));

        assertThat(res.succeeded()).isTrue();
        assertThat(new String(res.stdout(), StandardCharsets.UTF_8)).isEqualTo("done\n");
        assertThat(res.stderr()).hasSizeLessThanOrEqualTo(4000).endsWith("progress line 1999\n");
    }

    @Test
    void slowProcessIsKilledOnTimeout() {
        assumeTrue(Files.isExecutable(Path.of("/bin/sh")), "no POSIX shell");

        assertThatThrownBy(() -> new DefaultProcessRunner().run(List.of("/bin/sh", "-c", "sleep 5"), Duration.ofMillis(200)))
                .isInstanceOf(ProcessRunner.ProcessTimeoutException.class)
                .hasMessageContaining("timed out");
    }
}
