package com.questrail.fixture.core;

import com.questrail.fixture.api.FixtureService;
import com.questrail.fixture.api.NetworkHandle;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FixtureGroupTest {

    private final List<String> calls = new ArrayList<>();

    /**
     * Fixture that journals its lifecycle calls and can be told to fail.
     */
    private final class JournalingFixture implements FixtureService {
        private final String name;
        private final List<String> aliases;
        private boolean failOnStart;
        private boolean failOnStop;
        private boolean alive;

        JournalingFixture(String name, String... aliases) {
            this.name = name;
            this.aliases = List.of(aliases);
        }

        @Override
        public void start() {
            calls.add("start " + name);
            if (failOnStart) {
                throw new IllegalStateException(name + " failed to start");
            }
            alive = true;
        }

        @Override
        public void stop() {
            calls.add("stop " + name);
            alive = false;
            if (failOnStop) {
                throw new IllegalStateException(name + " failed to stop");
            }
        }

        @Override
        public boolean isAlive() {
            return alive;
        }

        @Override
        public List<String> connect(NetworkHandle network) {
            calls.add("connect " + name + " " + network.name());
            return aliases;
        }

        @Override
        public void disconnect(NetworkHandle network) {
            calls.add("disconnect " + name + " " + network.name());
        }
    }

    @Test
    void membersStartInOrderAndStopInReverse() {
        FixtureGroup group = FixtureGroup.of(new JournalingFixture("db"), new JournalingFixture("app"));

        group.start();
        assertTrue(group.isAlive());
        group.stop();

        assertFalse(group.isAlive());
        assertEquals(List.of("start db", "start app", "stop app", "stop db"), calls);
    }

    @Test
    void failedStartRollsBackStartedMembers() {
        JournalingFixture db = new JournalingFixture("db");
        JournalingFixture cache = new JournalingFixture("cache");
        JournalingFixture app = new JournalingFixture("app");
        app.failOnStart = true;
        cache.failOnStop = true;
        FixtureGroup group = FixtureGroup.of(db, cache, app);

        IllegalStateException e = assertThrows(IllegalStateException.class, group::start);

        assertEquals("app failed to start", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("cache failed to stop", e.getSuppressed()[0].getMessage());
        assertEquals(List.of("start db", "start cache", "start app", "stop cache", "stop db"), calls);
        assertFalse(db.isAlive());
    }

    @Test
    void stopVisitsEveryMemberAndRethrowsFirstFailure() {
        JournalingFixture db = new JournalingFixture("db");
        JournalingFixture app = new JournalingFixture("app");
        db.failOnStop = true;
        app.failOnStop = true;
        FixtureGroup group = FixtureGroup.of(db, app);

        IllegalStateException e = assertThrows(IllegalStateException.class, group::stop);

        assertEquals("app failed to stop", e.getMessage());
        assertEquals("db failed to stop", e.getSuppressed()[0].getMessage());
        assertEquals(List.of("stop app", "stop db"), calls);
    }

    @Test
    void connectReturnsDistinctAliasesInMemberOrder() {
        FixtureGroup group = FixtureGroup.of(
            new JournalingFixture("db", "db", "postgres"),
            new JournalingFixture("logstash", "host.docker.internal"),
            new JournalingFixture("mock", "host.docker.internal"));
        NetworkHandle network = NetworkHandle.named("it");

        assertEquals(List.of("db", "postgres", "host.docker.internal"), group.connect(network));
        group.disconnect(network);

        assertEquals(List.of(
            "connect db it", "connect logstash it", "connect mock it",
            "disconnect mock it", "disconnect logstash it", "disconnect db it"), calls);
    }

    @Test
    void startedAndCloseComposeWithTryWithResources() {
        JournalingFixture db = new JournalingFixture("db");

        try (FixtureGroup group = FixtureService.started(FixtureGroup.of(db))) {
            assertTrue(group.isAlive());
        }

        assertFalse(db.isAlive());
        assertEquals(List.of("start db", "stop db"), calls);
    }

    @Test
    void membersAreCopied() {
        List<FixtureService> members = new ArrayList<>(List.of(new JournalingFixture("db")));
        FixtureGroup group = new FixtureGroup(members);

        members.clear();

        assertEquals(1, group.members().size());
        assertThrows(UnsupportedOperationException.class, () -> group.members().clear());
    }

    @Test
    void networkHandleRequiresName() {
        assertThrows(IllegalArgumentException.class, () -> NetworkHandle.named(" "));
        assertThrows(NullPointerException.class, () -> FixtureGroup.of().connect(null));
    }
}
