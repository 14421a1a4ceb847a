package com.flamingo.ai.pdfchat;

import static com.flamingo.ai.pdfchat.support.PdfFixtures.pdf;
import static com.flamingo.ai.pdfchat.support.PdfFixtures.words;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.pdfchat.support.FakeEmbeddingModel;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/** Drives a session through upload, status polling, query and teardown over HTTP. */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Session API Integration Test")
class SessionApiIntegrationTest {

  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @BeforeEach
  void setUp() {
    when(embeddingModel.embedAll(anyList()))
        .thenAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              return Response.from(
                  segments.stream()
                      .map(s -> Embedding.from(FakeEmbeddingModel.vectorFor(s.text())))
                      .toList());
            });
  }

  private JsonNode awaitSettled(String sessionId) throws Exception {
    for (int attempt = 0; attempt < 200; attempt++) {
      String body =
          mockMvc
              .perform(get("/api/sessions/{sessionId}/status", sessionId))
              .andExpect(status().isOk())
              .andReturn()
              .getResponse()
              .getContentAsString();
      JsonNode status = objectMapper.readTree(body);
      if (!"indexing".equals(status.get("status").asText())) {
        return status;
      }
      Thread.sleep(50);
    }
    throw new AssertionError("Session " + sessionId + " did not finish indexing");
  }

  @Test
  @DisplayName("Should index uploads and answer queries until the session is deleted")
  void shouldServeFullSessionLifecycle() throws Exception {
    MockMultipartFile atlas =
        new MockMultipartFile(
            "files",
            "atlas.pdf",
            "application/pdf",
            pdf("The capital of France is Paris.", words("filler", 300)));

    String uploadBody =
        mockMvc
            .perform(multipart("/api/sessions/uploads").file(atlas))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.totalFiles").value(1))
            .andReturn()
            .getResponse()
            .getContentAsString();
    String sessionId = objectMapper.readTree(uploadBody).get("sessionId").asText();
    assertThat(sessionId).hasSize(43);

    JsonNode settled = awaitSettled(sessionId);
    assertThat(settled.get("status").asText()).isEqualTo("done");
    assertThat(settled.get("filesIndexed").asInt()).isEqualTo(1);

    mockMvc
        .perform(get("/api/sessions/{sessionId}/documents", sessionId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].fileName").value("atlas.pdf"))
        .andExpect(jsonPath("$[0].outcome").value("OK"))
        .andExpect(jsonPath("$[0].pageCount").value(2));

    mockMvc
        .perform(
            post("/api/sessions/{sessionId}/query", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"What is the capital of France?\",\"maxResults\":3}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("done"))
        .andExpect(jsonPath("$.keywordOnly").value(false))
        .andExpect(jsonPath("$.results[0].fileName").value("atlas.pdf"))
        .andExpect(jsonPath("$.results[0].pageStart").value(1));

    mockMvc
        .perform(delete("/api/sessions/{sessionId}", sessionId))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(get("/api/sessions/{sessionId}/status", sessionId))
        .andExpect(status().isNotFound());
  }

  @Test
  @DisplayName("Should report a scanned-only upload as an error")
  void shouldReportScannedUpload() throws Exception {
    MockMultipartFile scan =
        new MockMultipartFile("files", "scan.pdf", "application/pdf", pdf("", ""));

    String uploadBody =
        mockMvc
            .perform(multipart("/api/sessions/uploads").file(scan))
            .andExpect(status().isAccepted())
            .andReturn()
            .getResponse()
            .getContentAsString();
    String sessionId = objectMapper.readTree(uploadBody).get("sessionId").asText();

    JsonNode settled = awaitSettled(sessionId);
    assertThat(settled.get("status").asText()).isEqualTo("error");
    assertThat(settled.get("error").asText()).contains("scan.pdf");

    mockMvc
        .perform(
            post("/api/sessions/{sessionId}/query", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"anything\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.details").value("error"));
  }

  @Test
  @DisplayName("Should report liveness")
  void shouldReportHealth() throws Exception {
    mockMvc
        .perform(get("/healthz"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.version").value("test"));
  }
}
