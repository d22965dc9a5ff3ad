package dev.clinrank.funnel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RankOrderingTest {

  private record Scored(String id, double score, double secondary) {}

  @Test
  void orders_by_score_descending_then_id_ascending() {
    List<Scored> records =
        List.of(
            new Scored("c3", 0.5, 0.0),
            new Scored("c1", 0.9, 0.0),
            new Scored("c2", 0.5, 0.0),
            new Scored("c0", 0.1, 0.0));

    List<Scored> ranked =
        RankOrdering.topK(
            records, RankOrdering.byScoreThenId(Scored::score, Scored::id), records.size());

    assertThat(ranked).extracting(Scored::id).containsExactly("c1", "c2", "c3", "c0");
  }

  @Test
  void tie_break_is_lexicographic_not_numeric() {
    List<Scored> records = List.of(new Scored("c10", 1.0, 0.0), new Scored("c9", 1.0, 0.0));

    List<Scored> ranked =
        RankOrdering.topK(records, RankOrdering.byScoreThenId(Scored::score, Scored::id), 2);

    assertThat(ranked).extracting(Scored::id).containsExactly("c10", "c9");
  }

  @Test
  void secondary_score_breaks_primary_ties_before_id() {
    List<Scored> records =
        List.of(
            new Scored("a", 0.8, 0.2),
            new Scored("b", 0.8, 0.9),
            new Scored("c", 0.8, 0.9),
            new Scored("d", 0.9, 0.0));

    List<Scored> ranked =
        RankOrdering.topK(
            records,
            RankOrdering.byScoresThenId(Scored::score, Scored::secondary, Scored::id),
            4);

    assertThat(ranked).extracting(Scored::id).containsExactly("d", "b", "c", "a");
  }

  @Test
  void truncates_to_limit() {
    List<Scored> records =
        List.of(new Scored("a", 0.1, 0), new Scored("b", 0.2, 0), new Scored("c", 0.3, 0));

    List<Scored> ranked =
        RankOrdering.topK(records, RankOrdering.byScoreThenId(Scored::score, Scored::id), 2);

    assertThat(ranked).extracting(Scored::id).containsExactly("c", "b");
  }

  @Test
  void result_is_independent_of_input_order() {
    List<Scored> records = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      records.add(new Scored("c" + i, (i % 7) / 7.0, 0.0));
    }
    List<Scored> expected =
        RankOrdering.topK(records, RankOrdering.byScoreThenId(Scored::score, Scored::id), 20);

    Collections.shuffle(records, new Random(42));
    List<Scored> shuffled =
        RankOrdering.topK(records, RankOrdering.byScoreThenId(Scored::score, Scored::id), 20);

    assertThat(shuffled).isEqualTo(expected);
  }

  @Test
  void negative_limit_is_rejected() {
    assertThatThrownBy(
            () ->
                RankOrdering.topK(
                    List.<Scored>of(), RankOrdering.byScoreThenId(Scored::score, Scored::id), -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void distinct_by_id_keeps_first_occurrence() {
    List<Scored> records =
        List.of(new Scored("a", 0.1, 0), new Scored("b", 0.2, 0), new Scored("a", 0.9, 0));

    assertThat(RankOrdering.distinctById(records, Scored::id))
        .containsExactly(new Scored("a", 0.1, 0), new Scored("b", 0.2, 0));
  }
}
