package dev.pmsignal.clustering;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ClusterCountSelectorTest {

  private final ClusterCountSelector selector = new ClusterCountSelector();

  @ParameterizedTest(name = "{0} records from {1} files -> {2}")
  @CsvSource({
    "15, 1, 3",
    "500, 1, 3",
    "15, 2, 3",
    "19, 4, 3",
    "20, 2, 5",
    "50, 2, 5",
    "51, 2, 7",
    "100, 3, 7",
    "101, 3, 10",
    "1000, 6, 10"
  })
  void followsRuleTable(int records, int files, int expected) {
    assertThat(selector.select(records, files)).isEqualTo(expected);
  }

  @Test
  void hintCapsSelectedCount() {
    assertThat(selector.resolve(101, 3, 4)).isEqualTo(4);
  }

  @Test
  void hintLargerThanSelectionIsIgnored() {
    assertThat(selector.resolve(150, 1, 8)).isEqualTo(3);
  }

  @Test
  void nonPositiveOrMissingHintMeansNoCap() {
    assertThat(selector.resolve(101, 3, null)).isEqualTo(10);
    assertThat(selector.resolve(101, 3, 0)).isEqualTo(10);
    assertThat(selector.resolve(101, 3, -2)).isEqualTo(10);
  }

  @Test
  void resultIsRaisedToAtLeastTwo() {
    assertThat(selector.resolve(101, 3, 1)).isEqualTo(2);
  }

  @Test
  void resultNeverExceedsRecordCount() {
    assertThat(selector.resolve(2, 1, null)).isEqualTo(2);
    assertThat(selector.resolve(1, 1, null)).isEqualTo(1);
  }
}
