package com.ctdl.scout.service.download;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One batch of validated links and the constraints every file in it must satisfy.
 *
 * @param minSizeKb smallest accepted file, in KB
 * @param maxSizeKb largest accepted file, in KB, or {@value #UNBOUNDED}
 */
public record DownloadJob(Set<String> links, Path directory, long minSizeKb, long maxSizeKb, boolean noRedirects) {

    public static final long UNBOUNDED = -1;
    private static final long KB = 1024;

    public DownloadJob {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        if (minSizeKb < 0) {
            throw new IllegalArgumentException("minSizeKb must not be negative but was " + minSizeKb);
        }
        if (maxSizeKb != UNBOUNDED && maxSizeKb < minSizeKb) {
            throw new IllegalArgumentException("maxSizeKb " + maxSizeKb + " is below minSizeKb " + minSizeKb);
        }
        links = Collections.unmodifiableSet(new LinkedHashSet<>(links));
    }

    /**
     * Directory used when none is given: the topic with spaces turned into hyphens.
     */
    public static String defaultDirectory(String topic) {
        return topic.replace(' ', '-');
    }

    public long minBytes() {
        return minSizeKb * KB;
    }

    public long maxBytes() {
        return maxSizeKb == UNBOUNDED ? Long.MAX_VALUE : maxSizeKb * KB;
    }

    public boolean acceptsSize(long bytes) {
        return bytes >= minBytes() && bytes <= maxBytes();
    }
}
