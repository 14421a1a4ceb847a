package com.flamingo.ai.pdfchat.service.session;

import com.flamingo.ai.pdfchat.domain.model.SessionDocument;

/**
 * A document accepted into a session together with the bytes still to be indexed.
 *
 * @param document the accepted document
 * @param content PDF bytes
 */
public record PendingDocument(SessionDocument document, byte[] content) {}
