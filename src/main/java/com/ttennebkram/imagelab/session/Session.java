package com.ttennebkram.imagelab.session;

import com.ttennebkram.imagelab.EmptyHistoryException;
import com.ttennebkram.imagelab.model.Image;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * One uploaded image with its working copy and undo history.
 *
 * Working and every history entry share the original's shape. All state changes go
 * through {@link SessionStore}, which holds {@link #lock()} while it reads and writes.
 */
public final class Session {

    private static final Logger LOG = Logger.getLogger(Session.class.getName());

    private final String id;
    private final Image original;
    private final int historyLimit;
    private final Deque<Image> history = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Image working;

    Session(String id, Image original, int historyLimit) {
        this.id = id;
        this.original = original;
        this.working = original;
        this.historyLimit = historyLimit;
    }

    public String getId() {
        return id;
    }

    public Image getOriginal() {
        return original;
    }

    public Image getWorking() {
        return working;
    }

    public int getHistoryDepth() {
        lock.lock();
        try {
            return history.size();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lock() {
        return lock;
    }

    // ===== Mutators, called with the lock held =====

    void commit(Image result) {
        if (!result.sameShape(original)) {
            throw new IllegalStateException("Operation changed the image shape from "
                    + original.shape() + " to " + result.shape());
        }
        history.push(working);
        if (historyLimit > 0 && history.size() > historyLimit) {
            history.removeLast();
            LOG.warning("Session " + id + " reached history limit " + historyLimit + ", oldest entry discarded");
        }
        working = result;
    }

    void undo() {
        if (history.isEmpty()) {
            throw new EmptyHistoryException(id);
        }
        working = history.pop();
    }

    void reset() {
        history.clear();
        working = original;
    }
}
