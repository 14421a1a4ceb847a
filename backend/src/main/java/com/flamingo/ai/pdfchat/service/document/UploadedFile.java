package com.flamingo.ai.pdfchat.service.document;

/**
 * Raw bytes of one uploaded file, detached from the HTTP request.
 *
 * @param fileName original file name as sent by the client
 * @param content file content
 */
public record UploadedFile(String fileName, byte[] content) {

  public long sizeBytes() {
    return content.length;
  }
}
