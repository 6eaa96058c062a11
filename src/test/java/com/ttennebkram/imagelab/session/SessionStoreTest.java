package com.ttennebkram.imagelab.session;

import com.ttennebkram.imagelab.EmptyHistoryException;
import com.ttennebkram.imagelab.SessionNotFoundException;
import com.ttennebkram.imagelab.TestImages;
import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.processing.ImageProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SessionStoreTest {

    private SessionStore store;
    private Image original;

    /** Adds a constant to every sample; never changes shape. */
    private static ImageProcessor brighten(int amount) {
        return input -> {
            byte[] samples = input.toByteArray();
            for (int i = 0; i < samples.length; i++) {
                samples[i] = (byte) Math.min(255, (samples[i] & 0xFF) + amount);
            }
            return Image.of(input.rows(), input.cols(), input.channels(), samples);
        };
    }

    @BeforeEach
    void setUp() {
        AtomicInteger ids = new AtomicInteger();
        store = new SessionStore(new ConcurrentHashMap<>(), () -> "s" + ids.incrementAndGet(), 0);
        original = TestImages.randomRgb(4, 4, 1L);
    }

    @Test
    void createStartsWithOriginalAndEmptyHistory() {
        String id = store.create(original);
        Session session = store.get(id);

        assertEquals("s1", id);
        assertSame(original, session.getOriginal());
        assertSame(original, session.getWorking());
        assertEquals(0, session.getHistoryDepth());
        assertEquals(1, store.size());
    }

    @Test
    void undoNTimesRestoresStart() {
        String id = store.create(original);
        List<Image> seen = new ArrayList<>();
        seen.add(store.working(id));
        for (int i = 1; i <= 5; i++) {
            seen.add(store.mutate(id, brighten(i)));
        }
        assertEquals(5, store.get(id).getHistoryDepth());

        for (int i = 4; i >= 0; i--) {
            assertEquals(seen.get(i), store.undo(id));
        }
        assertEquals(original, store.working(id));
        assertThrows(EmptyHistoryException.class, () -> store.undo(id));
    }

    @Test
    void resetRestoresOriginalAndClearsHistory() {
        String id = store.create(original);
        store.mutate(id, brighten(10));
        store.mutate(id, brighten(10));

        assertEquals(original, store.reset(id));
        assertEquals(0, store.get(id).getHistoryDepth());
        assertThrows(EmptyHistoryException.class, () -> store.undo(id));
    }

    @Test
    void failedOperationLeavesSessionUntouched() {
        String id = store.create(original);
        store.mutate(id, brighten(1));
        Image before = store.working(id);

        assertThrows(ValidationException.class, () -> store.mutate(id, input -> {
            throw new ValidationException("bad parameter");
        }));
        assertEquals(before, store.working(id));
        assertEquals(1, store.get(id).getHistoryDepth());
    }

    @Test
    void shapeChangingOperationRejected() {
        String id = store.create(original);
        assertThrows(IllegalStateException.class,
                () -> store.mutate(id, input -> Image.filled(2, 2, 3, 0)));
        assertSame(original, store.working(id));
        assertEquals(0, store.get(id).getHistoryDepth());
    }

    @Test
    void unknownSessionReported() {
        SessionNotFoundException e = assertThrows(SessionNotFoundException.class, () -> store.undo("missing"));
        assertEquals("missing", e.getSessionId());
        assertThrows(SessionNotFoundException.class, () -> store.mutate("missing", brighten(1)));
        assertThrows(ValidationException.class, () -> store.get(null));
    }

    @Test
    void historyLimitDropsOldestEntries() {
        SessionStore limited = new SessionStore(2);
        String id = limited.create(original);
        Image first = limited.mutate(id, brighten(1));
        limited.mutate(id, brighten(1));
        limited.mutate(id, brighten(1));

        assertEquals(2, limited.get(id).getHistoryDepth());
        limited.undo(id);
        assertEquals(first, limited.undo(id));
        assertThrows(EmptyHistoryException.class, () -> limited.undo(id));
    }

    @Test
    void removeDropsSession() {
        String id = store.create(original);
        assertTrue(store.remove(id));
        assertFalse(store.remove(id));
        assertThrows(SessionNotFoundException.class, () -> store.get(id));
        assertEquals(0, store.size());
    }

    @Test
    void sessionsAreIndependent() {
        String a = store.create(original);
        String b = store.create(original);
        store.mutate(a, brighten(50));
        assertSame(original, store.working(b));
    }

    @Test
    void concurrentMutationsOnOneSessionAreSerialized() throws Exception {
        String id = store.create(Image.filled(2, 2, 1, 0));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Image>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                futures.add(pool.submit(() -> store.mutate(id, brighten(1))));
            }
            for (Future<Image> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(100, store.working(id).get(0, 0));
        assertEquals(100, store.get(id).getHistoryDepth());
    }
}
