package com.example.property.search.adapter;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the HTML source adapters: slugs, Brazilian price and feature parsing,
 * neighborhood and listing id extraction.
 */
public final class ListingTextParser {

    public static final Pattern BEDROOMS = Pattern.compile("(\\d+)\\s*quarto", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    public static final Pattern BATHROOMS = Pattern.compile("(\\d+)\\s*banheiro", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    public static final Pattern AREA = Pattern.compile("(\\d+)\\s*m(?:²|2)", Pattern.CASE_INSENSITIVE);

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern PRICE_ON_REQUEST = Pattern.compile("consult|sob\\s+consulta|a\\s+combinar");
    private static final Pattern CURRENCY_AMOUNT = Pattern.compile("r\\$\\s*(\\d[\\d.]*)(?:,(\\d+))?");
    private static final Pattern AMOUNT = Pattern.compile("(\\d[\\d.]*)(?:,(\\d+))?");
    private static final Pattern THOUSANDS = Pattern.compile("\\bmil\\b");
    private static final Pattern MILLIONS = Pattern.compile("\\b(?:mi|milh[õo]es|milh[ãa]o)\\b");
    private static final Pattern ID_MARKER = Pattern.compile("id-(\\d+)");
    private static final Pattern LISTING_ID = Pattern.compile("/imovel/[^?#]*?(\\d{5,})");
    private static final Pattern TRAILING_ID = Pattern.compile("(\\d{5,})/?(?:[?#].*)?$");

    private static final List<Pattern> NEIGHBORHOOD_PATTERNS = List.of(
            Pattern.compile("-\\s*([^,\\d-]+?)\\s*,"),
            Pattern.compile(",\\s*([^,\\d]+?)\\s*-"),
            Pattern.compile("^([^,\\d]+?)\\s*,")
    );

    private static final Map<String, String> PROPERTY_TYPES = Map.ofEntries(
            Map.entry("apartamento", "apartment"),
            Map.entry("apartment", "apartment"),
            Map.entry("casa", "house"),
            Map.entry("house", "house"),
            Map.entry("sobrado", "house"),
            Map.entry("condominio", "condo"),
            Map.entry("condo", "condo"),
            Map.entry("cobertura", "penthouse"),
            Map.entry("penthouse", "penthouse"),
            Map.entry("kitnet", "studio"),
            Map.entry("studio", "studio"),
            Map.entry("loft", "loft"),
            Map.entry("terreno", "land"),
            Map.entry("land", "land")
    );

    private static final Map<String, String> SITE_TYPE_SLUGS = Map.of(
            "apartment", "apartamento",
            "house", "casa",
            "condo", "condominio",
            "penthouse", "cobertura",
            "studio", "studio",
            "loft", "loft",
            "land", "terreno"
    );

    private ListingTextParser() {}

    /**
     * "São Paulo" becomes "sao-paulo".
     */
    public static String slug(String value) {
        if (value == null) {
            return "";
        }
        String ascii = DIACRITICS.matcher(Normalizer.normalize(value, Normalizer.Form.NFD)).replaceAll("");
        String slug = NON_SLUG.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }

    public static String cleanText(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = WHITESPACE.matcher(value).replaceAll(" ").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Parses "R$ 1.250.000", "R$ 450 mil" or "R$ 1,2 mi". Returns null for "Sob consulta" and
     * text without an amount. Decimal cents are dropped.
     */
    public static Long parsePrice(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (PRICE_ON_REQUEST.matcher(lower).find()) {
            return null;
        }
        Matcher m = CURRENCY_AMOUNT.matcher(lower);
        if (!m.find()) {
            m = AMOUNT.matcher(lower);
            if (!m.find()) {
                return null;
            }
        }
        String digits = m.group(1).replace(".", "");
        if (digits.isEmpty()) {
            return null;
        }
        long whole = Long.parseLong(digits);
        String fraction = m.group(2);
        if (MILLIONS.matcher(lower).find()) {
            return scaled(whole, fraction, 1_000_000);
        }
        if (THOUSANDS.matcher(lower).find()) {
            return scaled(whole, fraction, 1_000);
        }
        return whole;
    }

    public static Integer extractInt(String text, Pattern pattern) {
        if (text == null) {
            return null;
        }
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return null;
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Best-effort neighborhood from an address such as "Rua Harmonia, 123 - Vila Madalena, São Paulo - SP".
     * Candidates equal to the city are skipped.
     */
    public static String extractNeighborhood(String address, String city) {
        String cleaned = cleanText(address);
        if (cleaned == null) {
            return null;
        }
        String citySlug = slug(city);
        for (Pattern pattern : NEIGHBORHOOD_PATTERNS) {
            Matcher m = pattern.matcher(cleaned);
            while (m.find()) {
                String candidate = cleanText(m.group(1));
                if (candidate != null && candidate.length() > 2 && !slug(candidate).equals(citySlug)
                        && !candidate.matches("(?i)(rua|avenida|av\\.?|alameda|travessa)\\b.*")) {
                    return candidate;
                }
            }
        }
        return null;
    }

    /**
     * Numeric listing id from a listing URL, or null when the URL carries none.
     */
    public static String extractListingId(String url) {
        if (url == null) {
            return null;
        }
        Matcher marker = ID_MARKER.matcher(url);
        if (marker.find()) {
            return marker.group(1);
        }
        Matcher m = LISTING_ID.matcher(url);
        if (m.find()) {
            return m.group(1);
        }
        Matcher trailing = TRAILING_ID.matcher(url);
        return trailing.find() ? trailing.group(1) : null;
    }

    /**
     * Maps Portuguese or English type names to the canonical English type, or null if unrecognized.
     */
    public static String canonicalPropertyType(String value) {
        if (value == null) {
            return null;
        }
        String slug = slug(value);
        String direct = PROPERTY_TYPES.get(slug);
        if (direct != null) {
            return direct;
        }
        for (String word : slug.split("-")) {
            String mapped = PROPERTY_TYPES.get(word);
            if (mapped != null) {
                return mapped;
            }
        }
        return null;
    }

    /**
     * URL path segment the listing sites use for a property type, or null when there is none.
     */
    public static String siteTypeSlug(String propertyType) {
        String canonical = canonicalPropertyType(propertyType);
        return canonical == null ? null : SITE_TYPE_SLUGS.get(canonical);
    }

    private static long scaled(long whole, String fraction, long unit) {
        if (fraction == null || fraction.isEmpty()) {
            return whole * unit;
        }
        double value = Double.parseDouble(whole + "." + fraction);
        return Math.round(value * unit);
    }
}
