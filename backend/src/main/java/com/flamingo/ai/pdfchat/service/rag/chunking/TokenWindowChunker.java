package com.flamingo.ai.pdfchat.service.rag.chunking;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.domain.model.DocumentChunk;
import com.flamingo.ai.pdfchat.service.rag.chunking.Tokenizer.Token;
import com.flamingo.ai.pdfchat.service.rag.extraction.ExtractedDocument;
import com.flamingo.ai.pdfchat.service.rag.extraction.ExtractedPage;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentChunker} that slides a fixed token window over a document's text.
 *
 * <p>Text pages are joined with a blank line; the start offset of each page is kept so every chunk
 * can report the pages it covers. The window holds {@code windowTokens} tokens and advances by
 * {@code windowTokens - round(windowTokens * overlap)}, so consecutive chunks share exactly the
 * overlap tokens. Only the final chunk of a document may be shorter than the window. Chunk text is
 * the exact source substring from the first token's start to the last token's end.
 */
@Service
@Slf4j
public class TokenWindowChunker implements DocumentChunker {

  static final String PAGE_SEPARATOR = "\n\n";

  @Override
  public List<DocumentChunk> chunk(
      DocumentContext context, ExtractedDocument document, RagConfig config) {
    PagedText paged = concatenate(document.textPages());
    List<Token> tokens = Tokenizer.tokenize(paged.text());
    if (tokens.isEmpty()) {
      return List.of();
    }

    int window = config.getChunking().getWindowTokens();
    int stride = config.getChunking().strideTokens();

    List<DocumentChunk> chunks = new ArrayList<>();
    int start = 0;
    while (true) {
      int end = Math.min(start + window, tokens.size());
      chunks.add(buildChunk(context, paged, tokens, start, end, chunks.size()));
      if (end == tokens.size()) {
        break;
      }
      start += stride;
    }

    log.debug(
        "{}: {} tokens over {} text pages -> {} chunks (window={}, stride={})",
        context.fileName(),
        tokens.size(),
        paged.pageStarts().size(),
        chunks.size(),
        window,
        stride);
    return chunks;
  }

  private DocumentChunk buildChunk(
      DocumentContext context,
      PagedText paged,
      List<Token> tokens,
      int fromToken,
      int toToken,
      int chunkIndex) {
    int startOffset = tokens.get(fromToken).start();
    int endOffset = tokens.get(toToken - 1).end();
    return DocumentChunk.builder()
        .id(DocumentChunk.idFor(context.documentId(), chunkIndex))
        .documentId(context.documentId())
        .documentOrdinal(context.ordinal())
        .fileName(context.fileName())
        .chunkIndex(chunkIndex)
        .pageStart(paged.pageAt(startOffset))
        .pageEnd(paged.pageAt(endOffset - 1))
        .startOffset(startOffset)
        .endOffset(endOffset)
        .tokenCount(toToken - fromToken)
        .text(paged.text().substring(startOffset, endOffset))
        .build();
  }

  private PagedText concatenate(List<ExtractedPage> pages) {
    StringBuilder text = new StringBuilder();
    List<int[]> pageStarts = new ArrayList<>(pages.size());
    for (ExtractedPage page : pages) {
      if (page.text().isEmpty()) {
        continue;
      }
      if (text.length() > 0) {
        text.append(PAGE_SEPARATOR);
      }
      pageStarts.add(new int[] {page.pageNumber(), text.length()});
      text.append(page.text());
    }
    return new PagedText(text.toString(), pageStarts);
  }

  /**
   * Concatenated document text with the offset at which each page begins.
   *
   * @param text page texts joined by {@link #PAGE_SEPARATOR}
   * @param pageStarts {@code int[]{pageNumber, startOffset}} in ascending offset order
   */
  private record PagedText(String text, List<int[]> pageStarts) {

    int pageAt(int offset) {
      int page = pageStarts.get(0)[0];
      for (int[] entry : pageStarts) {
        if (entry[1] > offset) {
          break;
        }
        page = entry[0];
      }
      return page;
    }
  }
}
