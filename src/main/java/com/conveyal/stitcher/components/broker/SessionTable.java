package com.conveyal.stitcher.components.broker;

import com.conveyal.stitcher.models.StitchJob;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkState;

/**
 * All sessions in flight, keyed on session ID. Every session is removed exactly once: either by the completion
 * callback through remove(), or when its worker is declared dead through removeForHosts(). Both happen under this
 * object's monitor, so a completion racing a fleet sweep resolves the session only once.
 */
public class SessionTable {

    private final Map<String, Session> sessions = new HashMap<>();

    /** Record a session before its job is sent to the worker, so an early completion callback can find it. */
    public synchronized Session open (String sessionId, String workerAddress, StitchJob job) {
        checkState(!sessions.containsKey(sessionId), "Duplicate session ID %s", sessionId);
        Session session = new Session(sessionId, workerAddress, job);
        sessions.put(sessionId, session);
        return session;
    }

    /**
     * Record the status URL returned by the worker.
     * @return false if the session was already resolved while the dispatch was in progress.
     */
    public synchronized boolean acknowledge (String sessionId, String statusUrl) {
        Session session = sessions.get(sessionId);
        if (session == null) return false;
        session.acknowledge(statusUrl);
        return true;
    }

    /** @return the removed session, or null if there was no session with this ID. */
    public synchronized Session remove (String sessionId) {
        return sessions.remove(sessionId);
    }

    /**
     * Remove every session on any of the given hosts.
     * @return the removed sessions, whose jobs will never be completed by those hosts.
     */
    public synchronized List<Session> removeForHosts (Set<String> hosts) {
        List<Session> removed = new ArrayList<>();
        if (hosts.isEmpty()) return removed;
        Iterator<Session> iterator = sessions.values().iterator();
        while (iterator.hasNext()) {
            Session session = iterator.next();
            if (hosts.contains(session.workerAddress)) {
                removed.add(session);
                iterator.remove();
            }
        }
        return removed;
    }

    public synchronized Session get (String sessionId) {
        return sessions.get(sessionId);
    }

    public synchronized int size () {
        return sessions.size();
    }

}
