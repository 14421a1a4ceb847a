package com.flamingo.ai.pdfchat.service.session;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** In-memory store of live sessions keyed by their opaque id. */
@Component
public class SessionRegistry {

  private static final int SESSION_ID_BYTES = 32;

  private final SecureRandom random = new SecureRandom();
  private final Map<String, IndexingSession> sessions = new ConcurrentHashMap<>();

  /** 256 random bits, URL-safe Base64 without padding. */
  public String newSessionId() {
    byte[] bytes = new byte[SESSION_ID_BYTES];
    random.nextBytes(bytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  public void register(IndexingSession session) {
    sessions.put(session.getId(), session);
  }

  public Optional<IndexingSession> find(String sessionId) {
    return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
  }

  public Optional<IndexingSession> remove(String sessionId) {
    return Optional.ofNullable(sessions.remove(sessionId));
  }

  public List<IndexingSession> all() {
    return List.copyOf(sessions.values());
  }

  public int size() {
    return sessions.size();
  }
}
