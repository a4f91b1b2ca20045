package io.github.shangor.landrop.core.service;

import io.github.shangor.landrop.core.model.TransferTask;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions whose task has not reached a terminal status yet, keyed by task id.
 */
public class TaskRegistry {
    private final Map<String, TransferSession> sessions = new ConcurrentHashMap<>();

    /**
     * @return {@code false} if another live session already uses the same task id
     */
    public boolean register(TransferSession session) {
        return sessions.putIfAbsent(session.task().getTaskId(), session) == null;
    }

    public TransferTask get(String id) {
        TransferSession session = sessions.get(id);
        return session == null ? null : session.task();
    }

    public TransferSession session(String id) {
        return sessions.get(id);
    }

    public Collection<TransferTask> all() {
        List<TransferTask> tasks = new ArrayList<>(sessions.size());
        for (TransferSession session : sessions.values()) {
            tasks.add(session.task());
        }
        return Collections.unmodifiableList(tasks);
    }

    public boolean remove(TransferSession session) {
        TransferTask task = session.task();
        return task != null && sessions.remove(task.getTaskId(), session);
    }
}
