package com.clarifi.backend.services.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class AmountUtilsTest {

    @Test
    void toAmount_nullBecomesZero() {
        assertThat(AmountUtils.toAmount(null)).isEqualByComparingTo("0");
    }

    @Test
    void percentageOf_usesTwoDecimalsAndGuardsZeroTotal() {
        assertThat(AmountUtils.percentageOf(new BigDecimal("1"), new BigDecimal("3"))).isEqualByComparingTo("33.33");
        assertThat(AmountUtils.percentageOf(new BigDecimal("2"), new BigDecimal("3"))).isEqualByComparingTo("66.67");
        assertThat(AmountUtils.percentageOf(new BigDecimal("5"), BigDecimal.ZERO)).isEqualByComparingTo("0");
    }

    @Test
    void roundedPercentage_roundsHalfUp() {
        assertThat(AmountUtils.roundedPercentage(new BigDecimal("550"), new BigDecimal("500"))).isEqualTo(110);
        assertThat(AmountUtils.roundedPercentage(new BigDecimal("1.005"), new BigDecimal("2"))).isEqualTo(50);
        assertThat(AmountUtils.roundedPercentage(new BigDecimal("1.01"), new BigDecimal("2"))).isEqualTo(51);
        assertThat(AmountUtils.roundedPercentage(new BigDecimal("10"), null)).isZero();
    }

    @Test
    void changePercentage_isSignedRelativeChange() {
        assertThat(AmountUtils.changePercentage(new BigDecimal("130"), new BigDecimal("100"))).isEqualByComparingTo("30");
        assertThat(AmountUtils.changePercentage(new BigDecimal("90"), new BigDecimal("120"))).isEqualByComparingTo("-25");
    }
}
