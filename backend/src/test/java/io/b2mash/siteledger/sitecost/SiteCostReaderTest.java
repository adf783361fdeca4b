package io.b2mash.siteledger.sitecost;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SiteCostReaderTest {

  private static final UUID PROJECT_ID = UUID.randomUUID();

  @Mock private SiteCostProvider provider;

  @Test
  void laborCost_returnsProviderValue() {
    when(provider.laborCost(PROJECT_ID)).thenReturn(new BigDecimal("1234.50"));

    assertThat(new SiteCostReader(provider).laborCost(PROJECT_ID)).isEqualByComparingTo("1234.50");
  }

  @Test
  void laborCost_providerFails_returnsZero() {
    when(provider.laborCost(PROJECT_ID)).thenThrow(new IllegalStateException("timeout"));

    assertThat(new SiteCostReader(provider).laborCost(PROJECT_ID)).isEqualByComparingTo("0");
  }

  @Test
  void internalEquipmentCost_nullCountsAsZero() {
    when(provider.internalEquipmentCost(PROJECT_ID)).thenReturn(null);

    assertThat(new SiteCostReader(provider).internalEquipmentCost(PROJECT_ID))
        .isEqualByComparingTo("0");
  }

  @Test
  void noOpProvider_reportsZero() {
    var reader = new SiteCostReader(new NoOpSiteCostProvider());

    assertThat(reader.laborCost(PROJECT_ID)).isEqualByComparingTo("0");
    assertThat(reader.internalEquipmentCost(PROJECT_ID)).isEqualByComparingTo("0");
  }
}
