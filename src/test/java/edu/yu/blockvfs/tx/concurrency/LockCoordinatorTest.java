package edu.yu.blockvfs.tx.concurrency;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class LockCoordinatorTest {

    private static final String FILE = "coord.db";

    private LocalMutualExclusion mx;
    private LockCoordinator coordinator;
    private List<String> events;

    @BeforeEach
    public void setUp() {
        this.mx = new LocalMutualExclusion(200);
        this.coordinator = new LockCoordinator(FILE, this.mx);
        this.events = new ArrayList<>();
    }

    private LockTransitionHook recorder(String tag) {
        return new LockTransitionHook() {
            @Override
            public void beforeAcquire(LockLevel current, LockLevel target) {
                events.add(tag + ":beforeAcquire " + current + "->" + target
                        + " held=" + mx.heldBy(FILE, coordinator.owner()));
            }

            @Override
            public void afterAcquire(LockLevel previous, LockLevel current) {
                events.add(tag + ":afterAcquire " + previous + "->" + current
                        + " held=" + mx.heldBy(FILE, coordinator.owner()));
            }

            @Override
            public void beforeRelease(LockLevel current, LockLevel target) {
                events.add(tag + ":beforeRelease " + current + "->" + target
                        + " held=" + mx.heldBy(FILE, coordinator.owner()));
            }

            @Override
            public void afterRelease(LockLevel previous, LockLevel current) {
                events.add(tag + ":afterRelease " + previous + "->" + current
                        + " held=" + mx.heldBy(FILE, coordinator.owner()));
            }
        };
    }

    @Test
    @DisplayName("hooks run in registration order around the lock change")
    public void hookOrder() {
        this.coordinator.register(recorder("a"));
        this.coordinator.register(recorder("b"));

        this.coordinator.lock(LockLevel.SHARED);
        assertEquals(List.of(
                "a:beforeAcquire UNLOCKED->SHARED held=UNLOCKED",
                "b:beforeAcquire UNLOCKED->SHARED held=UNLOCKED",
                "a:afterAcquire UNLOCKED->SHARED held=SHARED",
                "b:afterAcquire UNLOCKED->SHARED held=SHARED"), this.events);

        this.events.clear();
        this.coordinator.lock(LockLevel.EXCLUSIVE);
        this.coordinator.unlock(LockLevel.SHARED);
        assertEquals(List.of(
                "a:beforeAcquire SHARED->EXCLUSIVE held=SHARED",
                "b:beforeAcquire SHARED->EXCLUSIVE held=SHARED",
                "a:afterAcquire SHARED->EXCLUSIVE held=EXCLUSIVE",
                "b:afterAcquire SHARED->EXCLUSIVE held=EXCLUSIVE",
                "a:beforeRelease EXCLUSIVE->SHARED held=EXCLUSIVE",
                "b:beforeRelease EXCLUSIVE->SHARED held=EXCLUSIVE",
                "a:afterRelease EXCLUSIVE->SHARED held=SHARED",
                "b:afterRelease EXCLUSIVE->SHARED held=SHARED"), this.events);
    }

    @Test
    @DisplayName("transitions that don't change the level are no-ops")
    public void noOps() {
        this.coordinator.register(recorder("a"));

        this.coordinator.unlock(LockLevel.UNLOCKED);
        this.coordinator.lock(LockLevel.RESERVED);
        this.events.clear();

        this.coordinator.lock(LockLevel.SHARED);
        this.coordinator.lock(LockLevel.RESERVED);
        assertTrue(this.events.isEmpty());
        assertEquals(LockLevel.RESERVED, this.coordinator.level());

        this.coordinator.unlock(LockLevel.SHARED);
        this.events.clear();
        this.coordinator.unlock(LockLevel.SHARED);
        assertTrue(this.events.isEmpty());
        assertEquals(LockLevel.SHARED, this.coordinator.level());

        assertThrows(IllegalArgumentException.class, () -> this.coordinator.unlock(LockLevel.PENDING));
        assertThrows(IllegalArgumentException.class, () -> this.coordinator.lock(null));
        assertThrows(IllegalArgumentException.class, () -> this.coordinator.register(null));
    }

    @Test
    @DisplayName("a failing release hook keeps the lock held")
    public void failingReleaseHook() {
        this.coordinator.register(new LockTransitionHook() {
            @Override
            public void beforeRelease(LockLevel current, LockLevel target) {
                throw new IllegalStateException("flush failed");
            }
        });

        this.coordinator.lock(LockLevel.EXCLUSIVE);
        assertThrows(IllegalStateException.class, () -> this.coordinator.unlock(LockLevel.SHARED));
        assertEquals(LockLevel.EXCLUSIVE, this.coordinator.level());
        assertEquals(LockLevel.EXCLUSIVE, this.mx.heldBy(FILE, this.coordinator.owner()));
    }

    @Test
    @DisplayName("a failing acquisition hook backs the lock out so a retry runs it again")
    public void failingAcquireHook() {
        final int[] attempts = { 0 };
        this.coordinator.register(new LockTransitionHook() {
            @Override
            public void afterAcquire(LockLevel previous, LockLevel current) {
                if (attempts[0]++ == 0) {
                    throw new IllegalStateException("reload failed");
                }
            }
        });

        assertThrows(IllegalStateException.class, () -> this.coordinator.lock(LockLevel.SHARED));
        assertEquals(LockLevel.UNLOCKED, this.coordinator.level());
        assertEquals(LockLevel.UNLOCKED, this.mx.heldBy(FILE, this.coordinator.owner()));

        this.coordinator.lock(LockLevel.SHARED);
        assertEquals(2, attempts[0]);
        assertEquals(LockLevel.SHARED, this.coordinator.level());
        assertEquals(LockLevel.SHARED, this.mx.heldBy(FILE, this.coordinator.owner()));
    }

    @Test
    @DisplayName("a failing hook on the way up from SHARED returns to SHARED")
    public void failingHookFromShared() {
        this.coordinator.lock(LockLevel.SHARED);
        this.coordinator.register(new LockTransitionHook() {
            @Override
            public void afterAcquire(LockLevel previous, LockLevel current) {
                throw new IllegalStateException("boom");
            }
        });

        assertThrows(IllegalStateException.class, () -> this.coordinator.lock(LockLevel.RESERVED));
        assertEquals(LockLevel.SHARED, this.coordinator.level());
        assertEquals(LockLevel.SHARED, this.mx.heldBy(FILE, this.coordinator.owner()));

        // another handle may now take RESERVED
        LockCoordinator other = new LockCoordinator(FILE, this.mx);
        other.lock(LockLevel.SHARED);
        assertDoesNotThrow(() -> other.lock(LockLevel.RESERVED));
    }

    @Test
    @DisplayName("abandon drops the lock without running hooks")
    public void abandon() {
        this.coordinator.lock(LockLevel.EXCLUSIVE);
        this.coordinator.register(recorder("a"));

        this.coordinator.abandon();

        assertTrue(this.events.isEmpty());
        assertEquals(LockLevel.UNLOCKED, this.coordinator.level());
        assertEquals(LockLevel.UNLOCKED, this.mx.heldBy(FILE, this.coordinator.owner()));
        assertDoesNotThrow(() -> this.coordinator.abandon());
    }

    @Test
    @DisplayName("an unregistered hook no longer runs")
    public void unregister() {
        LockTransitionHook hook = recorder("a");
        this.coordinator.register(hook);
        this.coordinator.unregister(hook);

        this.coordinator.lock(LockLevel.SHARED);
        assertTrue(this.events.isEmpty());
    }

    @Test
    @DisplayName("a lock that can't be acquired leaves the level unchanged")
    public void acquireTimeout() {
        LockCoordinator other = new LockCoordinator(FILE, this.mx);
        other.lock(LockLevel.EXCLUSIVE);

        assertThrows(LockAbortException.class, () -> this.coordinator.lock(LockLevel.SHARED));
        assertEquals(LockLevel.UNLOCKED, this.coordinator.level());
        assertNotEquals(other.owner(), this.coordinator.owner());
    }

}
