package dev.clinrank.funnel;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextTokensTest {

  @Test
  void lower_cases_and_splits_on_punctuation() {
    assertThat(TextTokens.tokenize("ECG shows ST elevation; 5-FU started."))
        .containsExactly("ecg", "shows", "st", "elevation", "5", "fu", "started");
  }

  @Test
  void folds_accents_to_ascii() {
    assertThat(TextTokens.tokenize("Sjögren, Ménière")).containsExactly("sjogren", "meniere");
  }

  @Test
  void keeps_stop_words() {
    assertThat(TextTokens.tokenize("no history of")).containsExactly("no", "history", "of");
  }

  @Test
  void blank_or_null_text_has_no_tokens() {
    assertThat(TextTokens.tokenize(null)).isEmpty();
    assertThat(TextTokens.tokenize(" ...; ")).isEmpty();
  }
}
