package com.example.property.search.fingerprint;

import com.example.property.common.util.StringSanitizer;
import com.example.property.search.exception.InvalidSearchException;
import com.example.property.search.model.ListingSort;
import com.example.property.search.model.NumericRange;
import com.example.property.search.model.SearchFilters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw query parameters into {@link SearchFilters}.
 *
 * <p>Keys are matched case-insensitively, ignoring {@code _} and {@code -}, so
 * {@code min_price}, {@code minPrice} and {@code min-price} are the same parameter.
 * Ranges accept {@code 300000-500000}, {@code 300000-}, {@code -500000} and {@code 300000+};
 * explicit min/max parameters override the matching side of a range. Unknown keys are ignored.
 */
@Slf4j
@Component
public class SearchFilterParser {

    private static final Pattern RANGE = Pattern.compile("^(\\d*)\\s*-\\s*(\\d*)$");
    private static final Pattern AT_LEAST = Pattern.compile("^(\\d+)\\s*\\+$");
    private static final Pattern WHOLE_NUMBER = Pattern.compile("^\\d+$");

    public SearchFilters parse(Map<String, String> rawParams) {
        Map<String, String> params = normalizeKeys(rawParams);

        NumericRange price = range("price", params.get("price"));
        price = NumericRange.between(
                firstNonNull(number("minPrice", params.get("minprice")), price.min()),
                firstNonNull(number("maxPrice", params.get("maxprice")), price.max()));

        NumericRange size = range("size", firstNonNull(params.get("size"), params.get("area")));
        size = NumericRange.between(
                firstNonNull(number("minSize", firstNonNull(params.get("minsize"), params.get("minarea"))), size.min()),
                firstNonNull(number("maxSize", firstNonNull(params.get("maxsize"), params.get("maxarea"))), size.max()));

        Long bedrooms = number("bedrooms", firstNonNull(params.get("bedrooms"), params.get("quartos")));

        return SearchFilters.builder()
                .city(params.get("city"))
                .state(params.get("state"))
                .neighborhood(firstNonNull(params.get("neighborhood"), params.get("bairro")))
                .price(price)
                .size(size)
                .bedrooms(bedrooms == null ? null : toInt("bedrooms", bedrooms))
                .propertyType(firstNonNull(params.get("propertytype"), params.get("type")))
                .sort(sort(params.get("sort")))
                .page(positiveInt("page", params.get("page"), SearchFilters.DEFAULT_PAGE))
                .pageSize(positiveInt("pageSize", firstNonNull(params.get("pagesize"), params.get("perpage")),
                        SearchFilters.DEFAULT_PAGE_SIZE))
                .build();
    }

    private static Map<String, String> normalizeKeys(Map<String, String> rawParams) {
        Map<String, String> params = new HashMap<>();
        if (rawParams == null) {
            return params;
        }
        rawParams.forEach((key, value) -> {
            if (key == null || value == null || value.isBlank()) {
                return;
            }
            String normalized = key.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
            params.put(normalized, value.trim());
        });
        return params;
    }

    private static NumericRange range(String field, String value) {
        if (value == null) {
            return NumericRange.unbounded();
        }
        String compact = value.replace(" ", "");
        Matcher atLeast = AT_LEAST.matcher(compact);
        if (atLeast.matches()) {
            return NumericRange.atLeast(parseLong(field, atLeast.group(1)));
        }
        Matcher range = RANGE.matcher(compact);
        if (range.matches() && !(range.group(1).isEmpty() && range.group(2).isEmpty())) {
            Long min = range.group(1).isEmpty() ? null : parseLong(field, range.group(1));
            Long max = range.group(2).isEmpty() ? null : parseLong(field, range.group(2));
            return NumericRange.between(min, max);
        }
        throw new InvalidSearchException(field,
                field + " must be a range like 100000-500000, 100000- or -500000, got '"
                        + StringSanitizer.forLog(value) + "'");
    }

    private static Long number(String field, String value) {
        if (value == null) {
            return null;
        }
        if (!WHOLE_NUMBER.matcher(value).matches()) {
            throw new InvalidSearchException(field,
                    field + " must be a non-negative whole number, got '" + StringSanitizer.forLog(value) + "'");
        }
        return parseLong(field, value);
    }

    private static long parseLong(String field, String digits) {
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new InvalidSearchException(field, field + " is out of range");
        }
    }

    private static int positiveInt(String field, String value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        long parsed = number(field, value);
        if (parsed < 1) {
            throw new InvalidSearchException(field, field + " must be at least 1");
        }
        return toInt(field, parsed);
    }

    private static int toInt(String field, long value) {
        if (value > Integer.MAX_VALUE) {
            throw new InvalidSearchException(field, field + " is out of range");
        }
        return (int) value;
    }

    private static ListingSort sort(String value) {
        if (value == null) {
            return ListingSort.PRICE_ASC;
        }
        return ListingSort.fromKey(value).orElseThrow(() -> {
            log.debug("Rejected unknown sort key: {}", StringSanitizer.forLog(value));
            return new InvalidSearchException("sort", "unknown sort '" + StringSanitizer.forLog(value)
                    + "'; expected one of price_asc, price_desc, size_asc, size_desc, newest");
        });
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }
}
