package dev.clinrank.eval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Ranking quality of one final result list, written as {@code metrics.json}. */
@JsonPropertyOrder({
  "k",
  "ranked",
  "relevant",
  "recall_at_k",
  "precision_at_k",
  "reciprocal_rank",
  "ndcg_at_k"
})
public record MetricsReport(
    @JsonProperty("k") int k,
    @JsonProperty("ranked") int ranked,
    @JsonProperty("relevant") int relevant,
    @JsonProperty("recall_at_k") double recallAtK,
    @JsonProperty("precision_at_k") double precisionAtK,
    @JsonProperty("reciprocal_rank") double reciprocalRank,
    @JsonProperty("ndcg_at_k") double ndcgAtK) {}
