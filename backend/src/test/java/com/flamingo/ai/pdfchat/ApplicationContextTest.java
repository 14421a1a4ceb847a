package com.flamingo.ai.pdfchat;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.service.document.DocumentService;
import com.flamingo.ai.pdfchat.service.rag.HybridSearchService;
import com.flamingo.ai.pdfchat.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.pdfchat.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.pdfchat.service.rag.extraction.TextExtractor;
import com.flamingo.ai.pdfchat.service.session.SessionIndexManager;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The embedding model is mocked so the test runs
 * without an API key or network access.
 */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(SessionIndexManager.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentService.class)).isNotNull();
    assertThat(applicationContext.getBean(HybridSearchService.class)).isNotNull();
    assertThat(applicationContext.getBean(TextExtractor.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentChunker.class)).isNotNull();
  }

  @Test
  @DisplayName("Embedding calls should be wrapped by retry and circuit breaker")
  void embeddingServiceShouldBeProxied() {
    assertThat(AopUtils.isAopProxy(applicationContext.getBean(EmbeddingService.class))).isTrue();
  }

  @Test
  @DisplayName("Pipeline defaults should bind from application.yml")
  void ragConfigShouldBind() {
    RagConfig ragConfig = applicationContext.getBean(RagConfig.class);

    assertThat(ragConfig.getChunking().getWindowTokens()).isEqualTo(500);
    assertThat(ragConfig.getChunking().overlapTokens()).isEqualTo(75);
    assertThat(ragConfig.getUpload().getMaxFilesPerSession()).isEqualTo(10);
    assertThat(ragConfig.getRetrieval().getDefaultMaxResults()).isEqualTo(8);
  }
}
