package com.flamingo.ai.pdfchat.service.document;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.exception.UploadLimitExceededException;
import com.flamingo.ai.pdfchat.exception.UploadLimitExceededException.Limit;
import com.flamingo.ai.pdfchat.service.session.SessionIndexManager;
import com.flamingo.ai.pdfchat.service.session.UploadReceipt;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the DocumentService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  static final String DEFAULT_FILE_NAME = "file.pdf";

  private final SessionIndexManager sessionIndexManager;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "document.upload", description = "Time to accept an upload")
  public UploadReceipt upload(String sessionId, List<MultipartFile> files) {
    List<MultipartFile> parts = files == null ? List.of() : files;
    log.info(
        "Upload of {} files for {}",
        parts.size(),
        sessionId == null ? "a new session" : "session " + sessionId);

    validateFiles(parts);

    List<UploadedFile> uploaded = new ArrayList<>(parts.size());
    for (MultipartFile part : parts) {
      uploaded.add(new UploadedFile(fileNameOf(part), readBytes(part)));
    }

    UploadReceipt receipt = sessionIndexManager.upload(sessionId, uploaded);
    meterRegistry.counter("document.uploaded").increment(uploaded.size());
    return receipt;
  }

  private void validateFiles(List<MultipartFile> files) {
    RagConfig.Upload limits = ragConfig.getUpload();
    if (files.isEmpty()) {
      throw new UploadLimitExceededException(Limit.NO_FILES, "No files uploaded");
    }
    if (files.size() > limits.getMaxFilesPerSession()) {
      throw new UploadLimitExceededException(
          Limit.FILE_COUNT, "Too many files (more than " + limits.getMaxFilesPerSession() + ")");
    }
    long total = 0;
    for (MultipartFile file : files) {
      if (file.getSize() > limits.getMaxFileBytes()) {
        throw new UploadLimitExceededException(
            Limit.FILE_SIZE,
            "File " + fileNameOf(file) + " exceeds the " + toMegabytes(limits.getMaxFileBytes())
                + " MB limit");
      }
      total += file.getSize();
    }
    if (total > limits.getMaxSessionBytes()) {
      throw new UploadLimitExceededException(
          Limit.SESSION_SIZE,
          "Total upload size exceeds " + toMegabytes(limits.getMaxSessionBytes()) + " MB");
    }
  }

  private byte[] readBytes(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      log.error("Failed to read upload {}: {}", fileNameOf(file), e.getMessage());
      throw new UncheckedIOException("Failed to read uploaded file " + fileNameOf(file), e);
    }
  }

  private static String fileNameOf(MultipartFile file) {
    String name = file.getOriginalFilename();
    return name == null || name.isBlank() ? DEFAULT_FILE_NAME : name;
  }

  private static long toMegabytes(long bytes) {
    return bytes / (1024 * 1024);
  }
}
