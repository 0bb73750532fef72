package com.liveprecision.rates;

import com.liveprecision.domain.Currency;
import com.liveprecision.domain.CurrencyKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CurrencyRegistryTest {

    private final CurrencyRegistry registry = new CurrencyRegistry();

    @Test
    void lookupIsCaseInsensitive() {
        assertThat(registry.find("usd")).map(Currency::code).contains("USD");
        assertThat(registry.isSupported(" eur ")).isTrue();
        assertThat(registry.isSupported("XYZ")).isFalse();
        assertThat(registry.isSupported(null)).isFalse();
    }

    @Test
    void inactiveCurrencyIsKnownButNotSupported() {
        assertThat(registry.find("HRK")).isPresent();
        assertThat(registry.isSupported("HRK")).isFalse();
        assertThat(registry.active()).extracting(Currency::code).doesNotContain("HRK");
    }

    @Test
    void kindsAndDecimalPlaces() {
        assertThat(registry.isFiat("JPY")).isTrue();
        assertThat(registry.isCrypto("BTC")).isTrue();
        assertThat(registry.isFiat("BTC")).isFalse();
        assertThat(registry.find("JPY")).map(Currency::decimalPlaces).contains(0);
        assertThat(registry.find("ETH")).map(Currency::decimalPlaces).contains(8);
        assertThat(registry.codes(CurrencyKind.CRYPTO)).contains("BTC", "ETH").doesNotContain("USD");
        assertThat(registry.codes(CurrencyKind.COMMODITY)).containsExactly("XAU", "XAG");
    }

    @Test
    void rejectsDuplicateCodes() {
        Currency usd = new Currency("USD", "US Dollar", "$", CurrencyKind.FIAT, 2, true, "United States");
        assertThatThrownBy(() -> new CurrencyRegistry(List.of(usd, usd)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("USD");
    }
}
