package com.lodestar.core;

import com.lodestar.core.model.FileRecord;
import com.lodestar.core.model.ProjectSnapshot;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Shared test data: the three-file auth project and a clock tests can advance.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private Fixtures() {}

    public static FileRecord file(String path, int tokens) {
        return FileRecord.of(path, tokens, NOW);
    }

    public static FileRecord fileWithImports(String path, int tokens, String... imports) {
        return file(path, tokens).withMetadata(Map.of(FileRecord.METADATA_IMPORTS, List.of(imports)));
    }

    /** auth.go (400 tokens), auth_test.go (300), README.md (200), all modified at {@link #NOW}. */
    public static ProjectSnapshot authProject() {
        return ProjectSnapshot.of("auth-service", List.of(
                file("auth.go", 400),
                file("auth_test.go", 300),
                file("README.md", 200)));
    }

    public static MutableClock clock() {
        return new MutableClock(NOW);
    }

    /** A clock that only moves when told to. */
    public static final class MutableClock extends Clock {

        private Instant now;

        public MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
