package dev.pmsignal.clustering;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pmsignal.feedback.FeedbackRecord;
import dev.pmsignal.fixture.FeedbackRecordBuilder;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RepresentativeSelectorTest {

  private static final float[] CENTROID = {1.0f, 0.0f};

  private final RepresentativeSelector selector =
      new RepresentativeSelector(new ClusteringProperties());

  @Test
  void dominantFileMakesGroupHomogeneous() {
    List<FeedbackRecord> records = rankedRecords("a.json", "a.json", "b.csv", "a.json", "a.json");

    Representatives result = select(List.of(0, 1, 2, 3, 4), records);

    assertThat(result.homogeneity()).isEqualTo(Homogeneity.HOMOGENEOUS);
    assertThat(result.excerpts()).containsExactly("text 0", "text 1", "text 3");
  }

  @Test
  void noDominantFileKeepsEveryPick() {
    List<FeedbackRecord> records = rankedRecords("a.json", "b.csv", "a.json", "b.csv", "a.json");

    Representatives result = select(List.of(0, 1, 2, 3, 4), records);

    assertThat(result.homogeneity()).isEqualTo(Homogeneity.MIXED);
    assertThat(result.excerpts())
        .containsExactly("text 0", "text 1", "text 2", "text 3", "text 4");
  }

  @Test
  void ranksByCosineSimilarityRegardlessOfMemberOrder() {
    List<FeedbackRecord> records = rankedRecords("a", "b", "c", "d", "e");

    Representatives result = select(List.of(4, 2, 0, 3, 1), records);

    assertThat(result.excerpts())
        .containsExactly("text 0", "text 1", "text 2", "text 3", "text 4");
  }

  @Test
  void keepsOnlyConfiguredNumberOfPicks() {
    List<FeedbackRecord> records = rankedRecords("a", "b", "c", "d", "e", "f", "g");

    Representatives result = select(List.of(6, 5, 4, 3, 2, 1, 0), records);

    assertThat(result.excerpts())
        .containsExactly("text 0", "text 1", "text 2", "text 3", "text 4");
  }

  @Test
  void ignoresRowsOutsideTheGroup() {
    List<FeedbackRecord> records = rankedRecords("a", "b", "c", "d");

    Representatives result = select(List.of(2, 3), records);

    assertThat(result.excerpts()).containsExactly("text 2", "text 3");
    assertThat(result.homogeneity()).isEqualTo(Homogeneity.MIXED);
  }

  @Test
  void equalSimilarityKeepsMemberOrder() {
    List<FeedbackRecord> records = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      records.add(
          new FeedbackRecordBuilder().text("same " + i).sourceFile("f" + i).vector(2, 0).build());
    }

    Representatives result = select(List.of(2, 0, 1), records);

    assertThat(result.excerpts()).containsExactly("same 2", "same 0", "same 1");
  }

  @Test
  void truncatesLongExcerpts() {
    String longText = "x".repeat(300);
    List<FeedbackRecord> records =
        List.of(new FeedbackRecordBuilder().text(longText).vector(1, 0).build());

    Representatives result = select(List.of(0), records);

    assertThat(result.excerpts().get(0)).hasSize(RepresentativeSelector.MAX_EXCERPT_LENGTH);
  }

  private Representatives select(List<Integer> members, List<FeedbackRecord> records) {
    float[][] matrix = records.stream().map(FeedbackRecord::embedding).toArray(float[][]::new);
    return selector.select(members, matrix, records, CENTROID);
  }

  /** Record i gets text "text i" and a vector that drifts further from the centroid as i grows. */
  private static List<FeedbackRecord> rankedRecords(String... files) {
    List<FeedbackRecord> records = new ArrayList<>();
    for (int i = 0; i < files.length; i++) {
      records.add(
          new FeedbackRecordBuilder()
              .text("text " + i)
              .sourceFile(files[i])
              .vector(1.0f, 0.1f * i)
              .build());
    }
    return records;
  }
}
