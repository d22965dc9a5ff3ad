package dev.clinrank.funnel;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.miscellaneous.ASCIIFoldingFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/**
 * Tokeniser shared by the lexical index, interaction and pairwise scorers.
 *
 * <p>Lucene {@link StandardTokenizer} word boundaries (Unicode UAX#29), lower-cased and folded to
 * ASCII, with no stop words: {@code "5-FU"} yields {@code [5, fu]} and {@code "Sjögren"} yields
 * {@code [sjogren]}.
 */
public final class TextTokens {

  private static final Analyzer ANALYZER =
      new Analyzer() {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
          StandardTokenizer source = new StandardTokenizer();
          TokenStream filtered = new ASCIIFoldingFilter(new LowerCaseFilter(source));
          return new TokenStreamComponents(source, filtered);
        }
      };

  private TextTokens() {}

  /** The analyzer behind {@link #tokenize}, for indexing with identical terms. */
  public static Analyzer analyzer() {
    return ANALYZER;
  }

  public static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return tokens;
    }
    try (TokenStream stream = ANALYZER.tokenStream("", text)) {
      CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
      stream.reset();
      while (stream.incrementToken()) {
        tokens.add(term.toString());
      }
      stream.end();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to tokenize text", e);
    }
    return tokens;
  }
}
