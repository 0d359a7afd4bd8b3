package com.example.matrimony.pipeline.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JobParametersTest {

  @Test
  void integersAcceptWholeNumbersAndNumericStrings() {
    final JobParameters parameters =
        JobParameters.of(Map.of("a", 5, "b", 7.0d, "c", " 12 ", "d", 2.5d));

    assertThat(parameters.getInt("a", 0, 1, 10)).isEqualTo(5);
    assertThat(parameters.getInt("b", 0, 1, 10)).isEqualTo(7);
    assertThat(parameters.getInt("c", 0, 1, 20)).isEqualTo(12);
    assertThat(parameters.getInt("missing", 3, 1, 10)).isEqualTo(3);
    assertThatThrownBy(() -> parameters.getInt("d", 0, 1, 10))
        .isInstanceOf(InvalidJobParametersException.class);
  }

  @Test
  void integersOutsideTheRangeAreRejected() {
    final JobParameters parameters = JobParameters.of(Map.of("batchSize", 501));

    assertThatThrownBy(() -> parameters.getInt("batchSize", 100, 1, 500))
        .isInstanceOf(InvalidJobParametersException.class)
        .hasMessageContaining("between 1 and 500");
  }

  @Test
  void valuesBeyondIntRangeAreRejectedBeforeNarrowing() {
    final JobParameters parameters =
        JobParameters.of(
            Map.of(
                "wrapsToHundred", 4294967396L,
                "hugeString", "99999999999",
                "hugeDouble", 1.0e12d,
                "notANumber", Double.NaN));

    assertThatThrownBy(() -> parameters.getInt("wrapsToHundred", 100, 1, 500))
        .isInstanceOf(InvalidJobParametersException.class)
        .hasMessageContaining("but was 4294967396");
    assertThatThrownBy(() -> parameters.getInt("hugeString", 100, 1, 500))
        .isInstanceOf(InvalidJobParametersException.class)
        .hasMessageContaining("between 1 and 500");
    assertThatThrownBy(() -> parameters.getInt("hugeDouble", 100, 1, 500))
        .isInstanceOf(InvalidJobParametersException.class);
    assertThatThrownBy(() -> parameters.getInt("notANumber", 100, 1, 500))
        .isInstanceOf(InvalidJobParametersException.class)
        .hasMessageContaining("must be an integer");
  }

  @Test
  void booleansAndStrings() {
    final JobParameters parameters =
        JobParameters.of(Map.of("flag", "TRUE", "bad", 1, "name", "  ", "list", List.of(Map.of("k", "v"))));

    assertThat(parameters.getBoolean("flag", false)).isTrue();
    assertThat(parameters.getBoolean("missing", true)).isTrue();
    assertThatThrownBy(() -> parameters.getBoolean("bad", false))
        .isInstanceOf(InvalidJobParametersException.class);
    assertThat(parameters.getString("name")).isNull();
    assertThat(parameters.getObjectList("list")).containsExactly(Map.of("k", "v"));
    assertThatThrownBy(() -> parameters.getObjectList("name"))
        .isInstanceOf(InvalidJobParametersException.class);
  }
}
