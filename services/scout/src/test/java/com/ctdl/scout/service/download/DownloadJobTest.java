package com.ctdl.scout.service.download;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DownloadJobTest {

    @Test
    void defaultDirectoryReplacesSpaces() {
        assertThat(DownloadJob.defaultDirectory("machine learning basics")).isEqualTo("machine-learning-basics");
    }

    @Test
    void sizeBoundsAreInKilobytes() {
        DownloadJob job = new DownloadJob(Set.of(), Path.of("out"), 1, 2, false);

        assertThat(job.acceptsSize(1023)).isFalse();
        assertThat(job.acceptsSize(1024)).isTrue();
        assertThat(job.acceptsSize(2048)).isTrue();
        assertThat(job.acceptsSize(2049)).isFalse();
    }

    @Test
    void negativeMaximumMeansUnbounded() {
        DownloadJob job = new DownloadJob(Set.of(), Path.of("out"), 0, DownloadJob.UNBOUNDED, false);

        assertThat(job.acceptsSize(Long.MAX_VALUE)).isTrue();
        assertThat(job.acceptsSize(0)).isTrue();
    }

    @Test
    void keepsLinkOrder() {
        DownloadJob job = new DownloadJob(new LinkedHashSet<>(List.of("c", "a", "b")), Path.of("out"), 0, -1, false);

        assertThat(job.links()).containsExactly("c", "a", "b");
    }

    @Test
    void rejectsInvertedBounds() {
        assertThatThrownBy(() -> new DownloadJob(Set.of(), Path.of("out"), 10, 5, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DownloadJob(Set.of(), Path.of("out"), -1, 5, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
