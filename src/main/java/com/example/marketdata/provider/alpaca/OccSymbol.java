package com.example.marketdata.provider.alpaca;

import com.example.marketdata.model.OptionType;
import lombok.Value;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OCC option symbol: root, yyMMdd expiration, C/P, strike x 1000 in 8 digits.
 * AAPL240119C00150000 is the AAPL 150 call expiring 2024-01-19.
 */
@Value
public class OccSymbol {

    private static final Pattern OCC = Pattern.compile("^([A-Z][A-Z0-9.]{0,5})(\\d{2})(\\d{2})(\\d{2})([CP])(\\d{8})$");
    private static final ZoneId EXCHANGE_ZONE = ZoneId.of("America/New_York");
    private static final LocalTime EXPIRATION_TIME = LocalTime.of(16, 0);

    String root;
    LocalDate expirationDate;
    OptionType optionType;
    BigDecimal strike;

    public static OccSymbol parse(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Option symbol is null");
        }
        Matcher m = OCC.matcher(symbol.trim().toUpperCase(Locale.ROOT));
        if (!m.matches()) {
            throw new IllegalArgumentException("Not an OCC option symbol: " + symbol);
        }
        LocalDate expiration;
        try {
            expiration = LocalDate.of(
                2000 + Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)),
                Integer.parseInt(m.group(4)));
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Not an OCC option symbol: " + symbol, e);
        }
        BigDecimal strike = new BigDecimal(m.group(6)).movePointLeft(3).stripTrailingZeros();
        if (strike.scale() < 0) {
            strike = strike.setScale(0);
        }
        return new OccSymbol(m.group(1), expiration, OptionType.fromOccCode(m.group(5).charAt(0)), strike);
    }

    /**
     * Expiration as the 16:00 New York close of the expiration date.
     */
    public Instant expirationInstant() {
        return expirationDate.atTime(EXPIRATION_TIME).atZone(EXCHANGE_ZONE).toInstant();
    }
}
