package com.flamingo.ai.pdfchat.service.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically tears down sessions that have been idle past their TTL. */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionExpirySweeper {

  private final SessionIndexManager sessionIndexManager;

  @Scheduled(
      fixedDelayString = "${rag.session.sweep-interval:PT1M}",
      initialDelayString = "${rag.session.sweep-interval:PT1M}")
  public void sweep() {
    int expired = sessionIndexManager.expireIdleSessions();
    if (expired > 0) {
      log.info("Session sweep removed {} idle sessions", expired);
    } else {
      log.debug("Session sweep found no idle sessions");
    }
  }
}
