package co.deferworks.lode.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobOptionsTest {

    @Test
    void noneLeavesEverythingToTheDefaults() {
        var options = JobOptions.none();
        assertNull(options.maxAttempts());
        assertNull(options.backoffStrategy());
        assertNull(options.retryDelaySeconds());
        assertEquals(List.of(), options.tags());
    }

    @Test
    void withersReplaceOneComponent() {
        var options = JobOptions.none()
                .withMaxAttempts(4)
                .withBackoffStrategy(BackoffStrategy.FIXED)
                .withRetryDelaySeconds(30);
        assertEquals(new JobOptions(4, BackoffStrategy.FIXED, 30), options);
    }

    @Test
    void rejectsNonPositiveMaxAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new JobOptions(0, null, null));
    }

    @Test
    void rejectsMaxAttemptsBeyondColumnRange() {
        assertEquals(32767, new JobOptions(32767, null, null).maxAttempts());
        assertThrows(IllegalArgumentException.class, () -> new JobOptions(32768, null, null));
    }

    @Test
    void tagsAreCopiedAndKeptThroughWithers() {
        var tags = new ArrayList<>(List.of("billing", "nightly"));
        var options = JobOptions.none().withTags(tags).withMaxAttempts(2);
        tags.add("late");

        assertEquals(List.of("billing", "nightly"), options.tags());
        assertEquals(List.of(), options.withTags(null).tags());
    }

    @Test
    void rejectsBlankOrCommaTags() {
        assertThrows(IllegalArgumentException.class, () -> JobOptions.none().withTags(List.of(" ")));
        assertThrows(IllegalArgumentException.class, () -> JobOptions.none().withTags(List.of("a,b")));
    }

    @Test
    void rejectsNegativeRetryDelay() {
        assertThrows(IllegalArgumentException.class, () -> new JobOptions(null, null, -1));
    }

    @Test
    void parsesBackoffNamesCaseInsensitively() {
        assertEquals(BackoffStrategy.EXPONENTIAL, BackoffStrategy.parse("exponential"));
        assertEquals(BackoffStrategy.LINEAR, BackoffStrategy.parse(" Linear "));
        assertThrows(IllegalArgumentException.class, () -> BackoffStrategy.parse("random"));
        assertThrows(IllegalArgumentException.class, () -> BackoffStrategy.parse(""));
    }
}
