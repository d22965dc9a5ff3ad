package dev.clinrank.funnel.scout;

import dev.clinrank.corpus.Chunk;
import dev.clinrank.corpus.ChunkCorpus;
import dev.clinrank.funnel.RankOrdering;
import dev.clinrank.funnel.TextTokens;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Okapi BM25 over an in-memory Lucene index of the corpus.
 *
 * <p>Chunks are analysed with {@link TextTokens#analyzer()} and scored with {@link
 * BM25Similarity} using the configured k1 and b. The query is the disjunction of its distinct
 * terms, so only chunks sharing at least one term with the query are returned.
 *
 * <p>Instances are immutable once opened and safe for concurrent queries.
 */
public final class Bm25LexicalIndex implements LexicalIndex {

  private static final Logger log = LoggerFactory.getLogger(Bm25LexicalIndex.class);

  static final String ID_FIELD = "chunk_id";
  static final String TEXT_FIELD = "text";

  private final IndexSearcher searcher;
  private final int documentCount;

  private Bm25LexicalIndex(IndexSearcher searcher, int documentCount) {
    this.searcher = searcher;
    this.documentCount = documentCount;
  }

  /**
   * Opens an index over every chunk of the corpus.
   *
   * @param corpus the corpus snapshot
   * @param k1 term-frequency saturation
   * @param b length normalisation
   * @return the index
   * @throws UncheckedIOException if the in-memory index cannot be built
   */
  public static Bm25LexicalIndex open(ChunkCorpus corpus, double k1, double b) {
    BM25Similarity similarity = new BM25Similarity((float) k1, (float) b);
    Directory directory = new ByteBuffersDirectory();
    IndexWriterConfig config = new IndexWriterConfig(TextTokens.analyzer());
    config.setSimilarity(similarity);
    config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);

    try {
      try (IndexWriter writer = new IndexWriter(directory, config)) {
        for (Chunk chunk : corpus.chunks()) {
          Document document = new Document();
          document.add(new StringField(ID_FIELD, chunk.chunkId(), Field.Store.YES));
          document.add(new TextField(TEXT_FIELD, chunk.text(), Field.Store.NO));
          writer.addDocument(document);
        }
        writer.commit();
      }
      DirectoryReader reader = DirectoryReader.open(directory);
      IndexSearcher searcher = new IndexSearcher(reader);
      searcher.setSimilarity(similarity);
      log.debug("Opened BM25 index: {} chunks (k1={}, b={})", reader.numDocs(), k1, b);
      return new Bm25LexicalIndex(searcher, reader.numDocs());
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to build BM25 index", e);
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>Every matching chunk is scored before truncation so that ties at the cut-off are broken by
   * chunk id rather than by index order.
   *
   * @throws UncheckedIOException if the index cannot be read
   */
  @Override
  public List<IndexHit> search(String query, int maxResults) {
    Set<String> terms = new LinkedHashSet<>(TextTokens.tokenize(query));
    if (terms.isEmpty() || documentCount == 0) {
      return List.of();
    }

    BooleanQuery.Builder builder = new BooleanQuery.Builder();
    for (String term : terms) {
      builder.add(new TermQuery(new Term(TEXT_FIELD, term)), BooleanClause.Occur.SHOULD);
    }

    try {
      TopDocs topDocs = searcher.search(builder.build(), documentCount);
      StoredFields storedFields = searcher.storedFields();
      List<IndexHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
      for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
        String chunkId = storedFields.document(scoreDoc.doc).get(ID_FIELD);
        hits.add(new IndexHit(chunkId, scoreDoc.score));
      }
      return RankOrdering.topK(
          hits, RankOrdering.byScoreThenId(IndexHit::score, IndexHit::chunkId), maxResults);
    } catch (IOException e) {
      throw new UncheckedIOException("BM25 search failed for query: " + query, e);
    }
  }
}
