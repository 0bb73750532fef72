package com.liveprecision.rates;

import com.liveprecision.domain.Currency;
import com.liveprecision.domain.CurrencyKind;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static catalogue of known currencies, built once at startup. HRK is listed but inactive since Croatia
 * adopted the euro.
 */
@Component
public class CurrencyRegistry {

    private final Map<String, Currency> currencies;

    public CurrencyRegistry() {
        this(defaultCurrencies());
    }

    public CurrencyRegistry(List<Currency> seed) {
        Map<String, Currency> byCode = new LinkedHashMap<>();
        for (Currency c : seed) {
            if (byCode.putIfAbsent(c.code(), c) != null) {
                throw new IllegalArgumentException("Duplicate currency code " + c.code());
            }
        }
        this.currencies = Collections.unmodifiableMap(byCode);
    }

    public Optional<Currency> find(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(currencies.get(code.strip().toUpperCase(Locale.ROOT)));
    }

    /** Known and active. */
    public boolean isSupported(String code) {
        return find(code).map(Currency::active).orElse(false);
    }

    public boolean isFiat(String code) {
        return find(code).filter(Currency::active).map(Currency::isFiat).orElse(false);
    }

    public boolean isCrypto(String code) {
        return find(code).filter(Currency::active).map(Currency::isCrypto).orElse(false);
    }

    public List<Currency> all() {
        return List.copyOf(currencies.values());
    }

    public List<Currency> active() {
        return currencies.values().stream().filter(Currency::active).toList();
    }

    public List<String> codes(CurrencyKind kind) {
        return currencies.values().stream()
                .filter(Currency::active)
                .filter(c -> c.kind() == kind)
                .map(Currency::code)
                .toList();
    }

    static List<Currency> defaultCurrencies() {
        return List.of(
                fiat("USD", "US Dollar", "$", 2, "United States"),
                fiat("EUR", "Euro", "€", 2, "European Union"),
                fiat("GBP", "British Pound", "£", 2, "United Kingdom"),
                fiat("JPY", "Japanese Yen", "¥", 0, "Japan"),
                fiat("CHF", "Swiss Franc", "CHF", 2, "Switzerland"),
                fiat("CAD", "Canadian Dollar", "C$", 2, "Canada"),
                fiat("AUD", "Australian Dollar", "A$", 2, "Australia"),
                fiat("NZD", "New Zealand Dollar", "NZ$", 2, "New Zealand"),
                fiat("SEK", "Swedish Krona", "kr", 2, "Sweden"),
                fiat("NOK", "Norwegian Krone", "kr", 2, "Norway"),
                fiat("DKK", "Danish Krone", "kr", 2, "Denmark"),
                fiat("PLN", "Polish Zloty", "zł", 2, "Poland"),
                fiat("CZK", "Czech Koruna", "Kč", 2, "Czech Republic"),
                fiat("HUF", "Hungarian Forint", "Ft", 0, "Hungary"),
                fiat("BGN", "Bulgarian Lev", "лв", 2, "Bulgaria"),
                fiat("RON", "Romanian Leu", "lei", 2, "Romania"),
                new Currency("HRK", "Croatian Kuna", "kn", CurrencyKind.FIAT, 2, false, "Croatia"),
                fiat("RUB", "Russian Ruble", "₽", 2, "Russia"),
                fiat("CNY", "Chinese Yuan", "¥", 2, "China"),
                fiat("INR", "Indian Rupee", "₹", 2, "India"),
                fiat("BRL", "Brazilian Real", "R$", 2, "Brazil"),
                fiat("MXN", "Mexican Peso", "$", 2, "Mexico"),
                fiat("ZAR", "South African Rand", "R", 2, "South Africa"),
                fiat("SGD", "Singapore Dollar", "S$", 2, "Singapore"),
                fiat("HKD", "Hong Kong Dollar", "HK$", 2, "Hong Kong"),
                crypto("BTC", "Bitcoin", "₿"),
                crypto("ETH", "Ethereum", "Ξ"),
                crypto("ADA", "Cardano", "₳"),
                crypto("DOT", "Polkadot", "DOT"),
                crypto("SOL", "Solana", "SOL"),
                crypto("MATIC", "Polygon", "MATIC"),
                crypto("AVAX", "Avalanche", "AVAX"),
                crypto("LINK", "Chainlink", "LINK"),
                crypto("UNI", "Uniswap", "UNI"),
                crypto("LTC", "Litecoin", "Ł"),
                new Currency("XAU", "Gold (troy ounce)", "XAU", CurrencyKind.COMMODITY, 6, true, null),
                new Currency("XAG", "Silver (troy ounce)", "XAG", CurrencyKind.COMMODITY, 6, true, null)
        );
    }

    private static Currency fiat(String code, String name, String symbol, int decimals, String country) {
        return new Currency(code, name, symbol, CurrencyKind.FIAT, decimals, true, country);
    }

    private static Currency crypto(String code, String name, String symbol) {
        return new Currency(code, name, symbol, CurrencyKind.CRYPTO, 8, true, null);
    }
}
