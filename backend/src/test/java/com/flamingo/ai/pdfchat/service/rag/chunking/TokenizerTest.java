package com.flamingo.ai.pdfchat.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.pdfchat.service.rag.chunking.Tokenizer.Token;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Tokenizer Tests")
class TokenizerTest {

  @Test
  @DisplayName("Should split word runs and single punctuation characters with offsets")
  void shouldSplitWordsAndPunctuation() {
    List<Token> tokens = Tokenizer.tokenize("Paris, 2024!  ok");

    assertThat(tokens)
        .containsExactly(
            new Token("Paris", 0, 5),
            new Token(",", 5, 6),
            new Token("2024", 7, 11),
            new Token("!", 11, 12),
            new Token("ok", 14, 16));
  }

  @Test
  @DisplayName("Should return no tokens for blank input")
  void shouldReturnNoTokensForBlankInput() {
    assertThat(Tokenizer.tokenize("")).isEmpty();
    assertThat(Tokenizer.tokenize(" \n\t ")).isEmpty();
    assertThat(Tokenizer.tokenize(null)).isEmpty();
  }

  @Test
  @DisplayName("Terms should be lower-cased words without punctuation")
  void termsShouldBeLowerCasedWords() {
    assertThat(Tokenizer.terms("The Capital of FRANCE is Paris."))
        .containsExactly("the", "capital", "of", "france", "is", "paris");
  }

  @Test
  @DisplayName("Should keep accented letters inside one token")
  void shouldKeepAccentedLettersTogether() {
    assertThat(Tokenizer.terms("Café déjà-vu")).containsExactly("café", "déjà", "vu");
  }

  @Test
  @DisplayName("Token offsets should address the source text")
  void tokenOffsetsShouldAddressSource() {
    String text = "alpha (beta) gamma";

    for (Token token : Tokenizer.tokenize(text)) {
      assertThat(text.substring(token.start(), token.end())).isEqualTo(token.text());
    }
    assertThat(Tokenizer.countTokens(text)).isEqualTo(5);
  }
}
