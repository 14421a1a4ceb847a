package com.flamingo.ai.pdfchat.service.rag.extraction;

import com.flamingo.ai.pdfchat.config.RagConfig;
import com.flamingo.ai.pdfchat.exception.PageLimitExceededException;
import com.flamingo.ai.pdfchat.exception.ScannedDocumentException;
import com.flamingo.ai.pdfchat.exception.UnreadablePdfException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/**
 * {@link TextExtractor} for PDF documents backed by Apache PDFBox 3.x.
 *
 * <p>Pages are stripped one at a time so each page's text stays attributable for citations. A page
 * counts as scanned when its non-whitespace character density, relative to the media box area in
 * square inches, is below {@code rag.extraction.min-chars-per-square-inch}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PdfBoxTextExtractor implements TextExtractor {

  private static final float POINTS_PER_INCH = 72f;

  private final RagConfig ragConfig;

  @Override
  public ExtractedDocument extract(String fileName, byte[] content) {
    try (PDDocument pdf = Loader.loadPDF(content)) {
      int pageCount = pdf.getNumberOfPages();
      int maxPages = ragConfig.getExtraction().getMaxPages();
      if (pageCount > maxPages) {
        throw new PageLimitExceededException(fileName, pageCount, maxPages);
      }
      log.debug("Extracting {} pages from {}", pageCount, fileName);

      PDFTextStripper stripper = new PDFTextStripper();
      List<ExtractedPage> pages = new ArrayList<>(pageCount);
      for (int p = 1; p <= pageCount; p++) {
        String text = stripPage(stripper, pdf, p, fileName);
        boolean scanned = isScanned(text, pdf.getPage(p - 1));
        pages.add(new ExtractedPage(p, text, scanned));
      }

      ExtractedDocument extracted = new ExtractedDocument(fileName, pageCount, pages);
      if (extracted.textPages().isEmpty()) {
        throw new ScannedDocumentException(fileName, pageCount);
      }
      if (!extracted.scannedPageNumbers().isEmpty()) {
        log.info(
            "{}: {} of {} pages have no text layer and are skipped",
            fileName,
            extracted.scannedPageNumbers().size(),
            pageCount);
      }
      return extracted;
    } catch (IOException e) {
      log.warn("PDFBox could not load {}: {}", fileName, e.getMessage());
      throw new UnreadablePdfException(fileName, e);
    }
  }

  private String stripPage(PDFTextStripper stripper, PDDocument pdf, int pageNumber, String name) {
    stripper.setStartPage(pageNumber);
    stripper.setEndPage(pageNumber);
    try {
      return normalize(stripper.getText(pdf));
    } catch (IOException e) {
      // A damaged content stream on one page is reported as a page without text.
      log.warn("{}: text extraction failed on page {}: {}", name, pageNumber, e.getMessage());
      return "";
    }
  }

  private boolean isScanned(String text, PDPage page) {
    long visibleChars = text.codePoints().filter(c -> !Character.isWhitespace(c)).count();
    if (visibleChars == 0) {
      return true;
    }
    PDRectangle box = page.getMediaBox();
    double squareInches =
        (box.getWidth() / POINTS_PER_INCH) * (box.getHeight() / POINTS_PER_INCH);
    if (squareInches <= 0) {
      return false;
    }
    return visibleChars / squareInches < ragConfig.getExtraction().getMinCharsPerSquareInch();
  }

  private static String normalize(String raw) {
    return raw.replace("\r\n", "\n").replace('\r', '\n').strip();
  }
}
