package com.crabtrading.backend.service.execution;

import com.crabtrading.backend.dto.LedgerResult;
import com.crabtrading.backend.dto.PositionMark;
import com.crabtrading.backend.exception.LedgerErrorCode;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical symbol forms and asset-class rules shared by order execution and valuation.
 */
@Component
public class SymbolClassifier {

    public static final String PRE_IPO_PREFIX = "PRE:";
    public static final double OPTION_CONTRACT_MULTIPLIER = 100.0;

    private static final String OPTION_PREFIX = "O:";
    private static final Pattern OPTION_SYMBOL = Pattern.compile("^[A-Z]{1,6}\\d{6}[CP]\\d{8}$");
    private static final Pattern OPTION_ROOT = Pattern.compile("^[A-Z]{1,6}$");
    private static final DateTimeFormatter OCC_DATE = DateTimeFormatter.ofPattern("yyMMdd");

    private static final Map<String, String> LISTED_ALIASES = Map.of("FIGMA", "FIG");
    private static final Set<String> CRYPTO_BASES = Set.of(
            "BTC", "ETH", "SOL", "DOGE", "LTC", "BNB", "XRP", "ADA",
            "AVAX", "DOT", "MATIC", "LINK", "BCH", "ETC", "UNI", "ATOM",
            "TRX", "SHIB", "PEPE", "ARB", "OP", "NEAR");
    private static final List<String> CRYPTO_QUOTES = List.of("USDT", "USDC", "USD", "BTC", "ETH");
    private static final Set<String> FIAT_QUOTES = Set.of("USD", "USDT", "USDC");
    private static final List<String> SEPARATORS = List.of("/", "-", "_");

    public LedgerResult<String> normalize(String symbol) {
        String s = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT).replace(" ", "");
        if (s.isEmpty()) {
            return LedgerResult.reject(LedgerErrorCode.INVALID_SYMBOL, "symbol is blank");
        }
        if (LISTED_ALIASES.containsKey(s)) {
            return LedgerResult.ok(LISTED_ALIASES.get(s));
        }
        if (s.startsWith(PRE_IPO_PREFIX)) {
            String base = s.substring(PRE_IPO_PREFIX.length());
            if (base.isEmpty()) {
                return LedgerResult.reject(LedgerErrorCode.INVALID_SYMBOL, "pre-IPO symbol has no base");
            }
            if (LISTED_ALIASES.containsKey(base)) {
                return LedgerResult.reject(LedgerErrorCode.INVALID_SYMBOL,
                        "preipo_symbol_already_listed_use_" + LISTED_ALIASES.get(base).toLowerCase(Locale.ROOT));
            }
            return LedgerResult.ok(PRE_IPO_PREFIX + base);
        }
        if (s.startsWith(OPTION_PREFIX)) {
            s = s.substring(OPTION_PREFIX.length());
        }
        if (OPTION_SYMBOL.matcher(s).matches()) {
            return LedgerResult.ok(s);
        }
        for (String separator : SEPARATORS) {
            int index = s.indexOf(separator);
            if (index >= 0) {
                String left = s.substring(0, index);
                String right = s.substring(index + separator.length());
                if (CRYPTO_BASES.contains(left) && CRYPTO_QUOTES.contains(right)) {
                    return LedgerResult.ok(FIAT_QUOTES.contains(right) ? left + "USD" : left + right);
                }
                return LedgerResult.ok(s);
            }
        }
        if (CRYPTO_BASES.contains(s)) {
            return LedgerResult.ok(s + "USD");
        }
        for (String quote : CRYPTO_QUOTES) {
            if (s.endsWith(quote)) {
                String base = s.substring(0, s.length() - quote.length());
                if (CRYPTO_BASES.contains(base)) {
                    return LedgerResult.ok(FIAT_QUOTES.contains(quote) ? base + "USD" : s);
                }
            }
        }
        return LedgerResult.ok(s);
    }

    public boolean isCrypto(String symbol) {
        String s = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        if (s.isEmpty()) {
            return false;
        }
        if (CRYPTO_BASES.contains(s)) {
            return true;
        }
        for (String separator : SEPARATORS) {
            int index = s.indexOf(separator);
            if (index >= 0) {
                return CRYPTO_BASES.contains(s.substring(0, index))
                        && CRYPTO_QUOTES.contains(s.substring(index + separator.length()));
            }
        }
        for (String quote : CRYPTO_QUOTES) {
            if (s.endsWith(quote) && CRYPTO_BASES.contains(s.substring(0, s.length() - quote.length()))) {
                return true;
            }
        }
        return false;
    }

    public boolean isOption(String symbol) {
        String s = symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT);
        if (s.startsWith(OPTION_PREFIX)) {
            s = s.substring(OPTION_PREFIX.length());
        }
        return OPTION_SYMBOL.matcher(s).matches();
    }

    public boolean isPreIpo(String symbol) {
        return symbol != null && symbol.trim().toUpperCase(Locale.ROOT).startsWith(PRE_IPO_PREFIX);
    }

    public double contractMultiplier(String symbol) {
        return isOption(symbol) ? OPTION_CONTRACT_MULTIPLIER : 1.0;
    }

    public PositionMark.AssetClass assetClass(String symbol) {
        if (isOption(symbol)) {
            return PositionMark.AssetClass.OPTION;
        }
        if (isPreIpo(symbol)) {
            return PositionMark.AssetClass.PRE_IPO;
        }
        return isCrypto(symbol) ? PositionMark.AssetClass.CRYPTO : PositionMark.AssetClass.STOCK;
    }

    /**
     * Builds an OCC option symbol: root, expiry as yymmdd, C or P, strike times 1000 padded to
     * eight digits. Weekend expiries are rejected with the preceding Friday suggested.
     */
    public LedgerResult<String> buildOptionSymbol(String underlying, LocalDate expiry, String right, double strike) {
        String root = underlying == null ? "" : underlying.trim().toUpperCase(Locale.ROOT);
        if (!OPTION_ROOT.matcher(root).matches()) {
            return LedgerResult.reject(LedgerErrorCode.INVALID_SYMBOL, "invalid_option_underlying");
        }
        if (expiry == null) {
            return LedgerResult.reject(LedgerErrorCode.INVALID_SYMBOL, "invalid_option_expiry_use_yyyy_mm_dd");
        }
        DayOfWeek day = expiry.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            LocalDate friday = expiry.minusDays(day.getValue() - DayOfWeek.FRIDAY.getValue());
            return LedgerResult.reject(LedgerErrorCode.INVALID_SYMBOL,
                    "invalid_option_expiry_weekend_use_" + friday.toString().replace('-', '_'));
        }
        String side = right == null ? "" : right.trim().toUpperCase(Locale.ROOT);
        String cp;
        if ("CALL".equals(side) || "C".equals(side)) {
            cp = "C";
        } else if ("PUT".equals(side) || "P".equals(side)) {
            cp = "P";
        } else {
            return LedgerResult.reject(LedgerErrorCode.INVALID_SYMBOL, "invalid_option_right_use_call_or_put");
        }
        if (!(strike > 0) || Double.isInfinite(strike)) {
            return LedgerResult.reject(LedgerErrorCode.INVALID_SYMBOL, "invalid_option_strike");
        }
        long strikeThousandths = Math.round(strike * 1000.0);
        if (strikeThousandths > 99_999_999L) {
            return LedgerResult.reject(LedgerErrorCode.INVALID_SYMBOL, "invalid_option_strike");
        }
        return LedgerResult.ok(root + expiry.format(OCC_DATE) + cp + String.format(Locale.ROOT, "%08d", strikeThousandths));
    }
}
