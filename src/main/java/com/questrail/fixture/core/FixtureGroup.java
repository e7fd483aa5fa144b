package com.questrail.fixture.core;

import com.questrail.fixture.api.FixtureService;
import com.questrail.fixture.api.NetworkHandle;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * FixtureGroup
 * =============================================================================
 * A {@link FixtureService} composed of an ordered list of member fixtures.
 *
 * <h2>Ordering</h2>
 * Members must be listed so that it is safe to start them in order (a fixture
 * appears after the fixtures it depends on). The group therefore:
 * <ul>
 *   <li>starts members first to last</li>
 *   <li>stops members last to first</li>
 *   <li>connects members first to last and disconnects them last to first</li>
 * </ul>
 *
 * <h2>Partial start</h2>
 * If a member fails to start, the members already started by this call are
 * stopped in reverse order and the original failure is rethrown. Failures
 * raised while rolling back are attached as suppressed exceptions.
 *
 * <h2>Threading</h2>
 * Not thread-safe. A group is driven from the test thread that owns it.
 */
public final class FixtureGroup implements FixtureService
{
    private final List<FixtureService> members;

    public FixtureGroup(List<? extends FixtureService> members)
    {
        Objects.requireNonNull(members, "members");
        for (FixtureService member : members) {
            Objects.requireNonNull(member, "member");
        }
        this.members = List.copyOf(members);
    }

    public static FixtureGroup of(FixtureService... members)
    {
        return new FixtureGroup(List.of(members));
    }

    public List<FixtureService> members()
    {
        return members;
    }

    @Override
    public void start()
    {
        List<FixtureService> started = new ArrayList<>();
        for (FixtureService member : members) {
            try {
                member.start();
            } catch (RuntimeException e) {
                rollback(started, e);
                throw e;
            }
            started.add(member);
        }
    }

    private static void rollback(List<FixtureService> started, RuntimeException failure)
    {
        for (int i = started.size() - 1; i >= 0; i--) {
            try {
                started.get(i).stop();
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
    }

    /**
     * Stops every member in reverse order. A failing member does not prevent the
     * remaining members from being stopped; the first failure is rethrown once
     * all members were visited.
     */
    @Override
    public void stop()
    {
        RuntimeException failure = null;
        for (int i = members.size() - 1; i >= 0; i--) {
            try {
                members.get(i).stop();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public boolean isAlive()
    {
        for (FixtureService member : members) {
            if (!member.isAlive()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Connects every member and returns the distinct aliases in member order.
     */
    @Override
    public List<String> connect(NetworkHandle network)
    {
        Objects.requireNonNull(network, "network");
        Set<String> aliases = new LinkedHashSet<>();
        for (FixtureService member : members) {
            aliases.addAll(member.connect(network));
        }
        return List.copyOf(aliases);
    }

    @Override
    public void disconnect(NetworkHandle network)
    {
        Objects.requireNonNull(network, "network");
        for (int i = members.size() - 1; i >= 0; i--) {
            members.get(i).disconnect(network);
        }
    }
}
