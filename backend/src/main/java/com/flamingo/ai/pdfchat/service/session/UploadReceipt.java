package com.flamingo.ai.pdfchat.service.session;

import com.flamingo.ai.pdfchat.domain.model.IndexingProgress;

/**
 * What an accepted upload reports back to the caller.
 *
 * @param sessionId session the files were added to
 * @param progress indexing state right after the build was scheduled
 * @param sessionFiles files in the session, this upload included
 * @param sessionBytes bytes in the session, this upload included
 */
public record UploadReceipt(
    String sessionId, IndexingProgress progress, int sessionFiles, long sessionBytes) {}
