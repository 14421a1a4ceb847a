package com.flamingo.ai.pdfchat.service.rag.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic tokenizer shared by chunking and keyword indexing.
 *
 * <p>A token is either a maximal run of letters and digits, or any other single non-whitespace
 * character. Whitespace separates tokens and is never part of one. The same input always produces
 * the same tokens with the same offsets, independent of locale or JVM.
 */
public final class Tokenizer {

  private Tokenizer() {}

  /**
   * A token and its character span in the source text.
   *
   * @param text the token as it appears in the source
   * @param start inclusive start offset
   * @param end exclusive end offset
   */
  public record Token(String text, int start, int end) {

    /** {@code true} for letter/digit runs, {@code false} for punctuation and symbols. */
    public boolean isWord() {
      return Character.isLetterOrDigit(text.codePointAt(0));
    }

    public String normalized() {
      return text.toLowerCase(Locale.ROOT);
    }
  }

  public static List<Token> tokenize(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    List<Token> tokens = new ArrayList<>();
    int i = 0;
    int length = text.length();
    while (i < length) {
      int cp = text.codePointAt(i);
      if (Character.isWhitespace(cp)) {
        i += Character.charCount(cp);
        continue;
      }
      int start = i;
      if (Character.isLetterOrDigit(cp)) {
        while (i < length && Character.isLetterOrDigit(text.codePointAt(i))) {
          i += Character.charCount(text.codePointAt(i));
        }
      } else {
        i += Character.charCount(cp);
      }
      tokens.add(new Token(text.substring(start, i), start, i));
    }
    return tokens;
  }

  public static int countTokens(String text) {
    return tokenize(text).size();
  }

  /** Lower-cased word tokens in order; punctuation is dropped. Used for keyword matching. */
  public static List<String> terms(String text) {
    return tokenize(text).stream().filter(Token::isWord).map(Token::normalized).toList();
  }
}
