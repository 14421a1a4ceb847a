package com.flamingo.ai.pdfchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the session-scoped PDF retrieval service. */
@SpringBootApplication
public class PdfChatApplication {

  public static void main(String[] args) {
    SpringApplication.run(PdfChatApplication.class, args);
  }
}
