package com.phillippitts.voicegate.testutil;

import com.phillippitts.voicegate.domain.SessionStatus;
import com.phillippitts.voicegate.domain.VoiceSession;
import com.phillippitts.voicegate.service.session.SessionRegistry;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed session registry with the same conditional-update semantics as the JDBC one.
 */
public class InMemorySessionRegistry implements SessionRegistry {

    private final Map<String, VoiceSession> rows = new ConcurrentHashMap<>();

    @Override
    public void register(VoiceSession session) {
        if (rows.putIfAbsent(session.sessionId(), session) != null) {
            throw new DuplicateKeyException(session.sessionId());
        }
    }

    @Override
    public Optional<VoiceSession> find(String sessionId) {
        return Optional.ofNullable(rows.get(sessionId));
    }

    @Override
    public synchronized boolean touch(String sessionId, Instant at) {
        VoiceSession s = rows.get(sessionId);
        if (s == null || !s.isActive()) {
            return false;
        }
        rows.put(sessionId, new VoiceSession(s.sessionId(), s.identityKey(), s.modelTier(), s.voiceProfile(),
                s.status(), s.startedAt(), at, null, null, 0));
        return true;
    }

    @Override
    public synchronized boolean closeIfActive(String sessionId, Instant endedAt, String endReason,
                                              long durationSeconds) {
        VoiceSession s = rows.get(sessionId);
        if (s == null || !s.isActive()) {
            return false;
        }
        rows.put(sessionId, new VoiceSession(s.sessionId(), s.identityKey(), s.modelTier(), s.voiceProfile(),
                SessionStatus.ENDED, s.startedAt(), s.lastActivityAt(), endedAt, endReason, durationSeconds));
        return true;
    }

    @Override
    public List<VoiceSession> findIdleActive(Instant cutoff, int limit) {
        return rows.values().stream()
                .filter(VoiceSession::isActive)
                .filter(s -> s.lastActivityAt().isBefore(cutoff))
                .sorted(Comparator.comparing(VoiceSession::lastActivityAt))
                .limit(limit)
                .toList();
    }

    @Override
    public List<VoiceSession> findActive(int limit) {
        return rows.values().stream()
                .filter(VoiceSession::isActive)
                .sorted(Comparator.comparing(VoiceSession::startedAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public boolean hasNewerActiveSession(String identityKey, String excludingSessionId, Instant startedAfter) {
        return rows.values().stream()
                .anyMatch(s -> s.isActive()
                        && s.identityKey().equals(identityKey)
                        && !s.sessionId().equals(excludingSessionId)
                        && !s.startedAt().isBefore(startedAfter));
    }

    @Override
    public void recordBlocked(VoiceSession attempt) {
        rows.put(attempt.sessionId(), attempt);
    }

    public List<VoiceSession> all() {
        return List.copyOf(rows.values());
    }
}
