package com.ttennebkram.imagelab;

/**
 * Undo was requested on a session with no history left.
 */
public class EmptyHistoryException extends ImageLabException {

    public EmptyHistoryException(String sessionId) {
        super("Nothing to undo in session " + sessionId);
    }
}
