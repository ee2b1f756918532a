package com.tradescan.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OCC option symbology, e.g. {@code AAPL240119C00190000}.
 */
public final class OptionSymbols {

    private static final Pattern OCC = Pattern.compile("^([A-Z.]{1,6})(\\d{6})([CP])(\\d{8})$");
    private static final int CONTRACT_SIZE = 100;
    private static final DateTimeFormatter EXPIRY = DateTimeFormatter.ofPattern("yyMMdd");

    private OptionSymbols() {
    }

    public static boolean isOptionSymbol(String symbol) {
        return symbol != null && OCC.matcher(symbol.trim().toUpperCase()).matches();
    }

    /**
     * Shares per unit traded: 100 for an OCC contract symbol, 1 otherwise.
     */
    public static int multiplierFor(String symbol) {
        return isOptionSymbol(symbol) ? CONTRACT_SIZE : 1;
    }

    public static Optional<Parsed> parse(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        Matcher matcher = OCC.matcher(symbol.trim().toUpperCase());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        LocalDate expiration = LocalDate.parse(matcher.group(2), EXPIRY);
        boolean call = "C".equals(matcher.group(3));
        BigDecimal strike = new BigDecimal(matcher.group(4)).divide(BigDecimal.valueOf(1000), 3, RoundingMode.UNNECESSARY);
        return Optional.of(new Parsed(matcher.group(1), expiration, call, strike));
    }

    public record Parsed(String underlying, LocalDate expiration, boolean call, BigDecimal strike) {}
}
