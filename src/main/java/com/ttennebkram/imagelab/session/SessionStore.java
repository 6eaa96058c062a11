package com.ttennebkram.imagelab.session;

import com.ttennebkram.imagelab.SessionNotFoundException;
import com.ttennebkram.imagelab.ValidationException;
import com.ttennebkram.imagelab.model.Image;
import com.ttennebkram.imagelab.processing.ImageProcessor;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Owns every live session. Sessions never share state, so each one is locked on its own.
 *
 * Mutations are all-or-nothing: the processor is validated when it is built, the result is
 * computed while holding the session lock, and only a successful result is committed.
 */
public class SessionStore {

    private static final Logger LOG = Logger.getLogger(SessionStore.class.getName());

    private final ConcurrentMap<String, Session> sessions;
    private final Supplier<String> idGenerator;
    private final int historyLimit;

    public SessionStore(ConcurrentMap<String, Session> sessions, Supplier<String> idGenerator, int historyLimit) {
        if (historyLimit < 0) {
            throw new ValidationException("historyLimit must be >= 0, got " + historyLimit);
        }
        this.sessions = sessions;
        this.idGenerator = idGenerator;
        this.historyLimit = historyLimit;
    }

    public SessionStore(int historyLimit) {
        this(new ConcurrentHashMap<>(), () -> UUID.randomUUID().toString(), historyLimit);
    }

    public SessionStore() {
        this(0);
    }

    /**
     * Register a new session whose original and working image are both {@code image}.
     *
     * @return the new session id
     */
    public String create(Image image) {
        if (image == null) {
            throw new ValidationException("image is required");
        }
        String id = idGenerator.get();
        Session session = new Session(id, image, historyLimit);
        if (sessions.putIfAbsent(id, session) != null) {
            throw new IllegalStateException("Duplicate session id " + id);
        }
        LOG.info("Created session " + id + " (" + image.shape() + ")");
        return id;
    }

    public Session get(String id) {
        if (id == null) {
            throw new ValidationException("session_id is required");
        }
        Session session = sessions.get(id);
        if (session == null) {
            throw new SessionNotFoundException(id);
        }
        return session;
    }

    public Image working(String id) {
        return get(id).getWorking();
    }

    /**
     * Apply a processor to the working image and push the previous one onto history.
     *
     * @return the new working image
     */
    public Image mutate(String id, ImageProcessor processor) {
        Session session = get(id);
        session.lock().lock();
        try {
            Image result = processor.process(session.getWorking());
            session.commit(result);
            LOG.fine("Session " + id + " mutated, history depth " + session.getHistoryDepth());
            return result;
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * Restore the most recent history entry.
     *
     * @throws com.ttennebkram.imagelab.EmptyHistoryException if there is nothing to undo
     */
    public Image undo(String id) {
        Session session = get(id);
        session.lock().lock();
        try {
            session.undo();
            LOG.fine("Session " + id + " undo, history depth " + session.getHistoryDepth());
            return session.getWorking();
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * Discard all history and go back to the original. Cannot be undone.
     */
    public Image reset(String id) {
        Session session = get(id);
        session.lock().lock();
        try {
            session.reset();
            LOG.fine("Session " + id + " reset to original");
            return session.getWorking();
        } finally {
            session.lock().unlock();
        }
    }

    public boolean remove(String id) {
        boolean removed = sessions.remove(id) != null;
        if (removed) {
            LOG.info("Removed session " + id);
        }
        return removed;
    }

    public int size() {
        return sessions.size();
    }
}
