package com.crosslend.bridge.adapter;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChainSelectorTableTest {

  @Test
  void translatesBothWaysIgnoringCase() {
    ChainSelectorTable<Long> table = ChainSelectorTable.of(Map.of("Polygon", 30109L, "arbitrum", 30110L));

    assertThat(table.selectorFor("POLYGON")).contains(30109L);
    assertThat(table.chainFor(30110L)).contains("arbitrum");
    assertThat(table.chainFor(1L)).isEmpty();
    assertThat(table.chainNames()).containsExactly("arbitrum", "polygon");
  }

  @Test
  void chainOrderDoesNotDependOnInputCasing() {
    ChainSelectorTable<Long> upper = ChainSelectorTable.of(Map.of("Polygon", 1L, "Base", 2L, "arbitrum", 3L));
    ChainSelectorTable<Long> lower = ChainSelectorTable.of(Map.of("polygon", 1L, "base", 2L, "ARBITRUM", 3L));

    assertThat(upper.chainNames()).containsExactly("arbitrum", "base", "polygon");
    assertThat(lower.chainNames()).isEqualTo(upper.chainNames());
  }

  @Test
  void rejectsSelectorsSharedByTwoChains() {
    assertThatThrownBy(() -> ChainSelectorTable.of(Map.of("polygon", 7L, "amoy", 7L)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("selector 7");
  }
}
