package dev.pmsignal.clustering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pmsignal.feedback.FeedbackRecord;
import dev.pmsignal.feedback.SourceType;
import dev.pmsignal.fixture.FeedbackRecordBuilder;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MinoritySourceBalancerTest {

  private final MinoritySourceBalancer balancer =
      new MinoritySourceBalancer(new ClusteringProperties());

  @Test
  void appendsCopiesOfTypesBelowThreshold() {
    List<FeedbackRecord> records = records(SourceType.SLACK, 19);
    FeedbackRecord jira = record(SourceType.JIRA, 99);
    records.add(jira);

    BalancedSample sample = balancer.balance(records, matrixOf(records));

    assertThat(sample.originalCount()).isEqualTo(20);
    assertThat(sample.syntheticCount()).isEqualTo(1);
    assertThat(sample.records()).hasSize(21).endsWith(jira);
    assertThat(sample.matrix()[20]).containsExactly(jira.embedding());
    assertThat(sample.records().subList(0, 20)).containsExactlyElementsOf(records);
  }

  @Test
  void shareAtThresholdIsNotOversampled() {
    List<FeedbackRecord> records = records(SourceType.SLACK, 9);
    records.add(record(SourceType.JIRA, 99));

    BalancedSample sample = balancer.balance(records, matrixOf(records));

    assertThat(sample.syntheticCount()).isZero();
    assertThat(sample.records()).containsExactlyElementsOf(records);
  }

  @Test
  void syntheticCopiesFollowSourceTypeOrder() {
    List<FeedbackRecord> records = records(SourceType.SLACK, 40);
    FeedbackRecord firstCall = record(SourceType.TRANSCRIPT, 100);
    FeedbackRecord ticket = record(SourceType.JIRA, 101);
    FeedbackRecord secondCall = record(SourceType.TRANSCRIPT, 102);
    records.add(firstCall);
    records.add(ticket);
    records.add(secondCall);

    BalancedSample sample = balancer.balance(records, matrixOf(records));

    assertThat(sample.records().subList(sample.originalCount(), sample.records().size()))
        .containsExactly(ticket, firstCall, secondCall);
  }

  @Test
  void singleSourceTypeIsNeverOversampled() {
    List<FeedbackRecord> records = records(SourceType.TRANSCRIPT, 5);

    assertThat(balancer.balance(records, matrixOf(records)).syntheticCount()).isZero();
  }

  @Test
  void emptyInputGivesEmptySample() {
    BalancedSample sample = balancer.balance(List.of(), new float[0][]);

    assertThat(sample.records()).isEmpty();
    assertThat(sample.originalCount()).isZero();
  }

  @Test
  void rejectsMatrixOfDifferentSize() {
    List<FeedbackRecord> records = records(SourceType.SLACK, 2);

    assertThatThrownBy(() -> balancer.balance(records, new float[1][]))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static List<FeedbackRecord> records(SourceType type, int count) {
    List<FeedbackRecord> records = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      records.add(record(type, i));
    }
    return records;
  }

  private static FeedbackRecord record(SourceType type, int seed) {
    return new FeedbackRecordBuilder().sourceType(type).vector(seed, 1.0f).build();
  }

  private static float[][] matrixOf(List<FeedbackRecord> records) {
    return records.stream().map(FeedbackRecord::embedding).toArray(float[][]::new);
  }
}
