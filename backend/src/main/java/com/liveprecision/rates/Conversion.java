package com.liveprecision.rates;

import com.liveprecision.domain.ExchangeRate;
import com.liveprecision.domain.HighPrecisionValue;

/**
 * Amount converted with {@code rate}. {@code converted} is rounded to the target currency's decimal places
 * unless the pair is an identity.
 */
public record Conversion(HighPrecisionValue amount, HighPrecisionValue converted, ExchangeRate rate) {
}
