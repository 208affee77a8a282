package com.example.property.search.adapter;

import java.util.List;

/**
 * CSS selectors locating a listing card and its fields on a source results page.
 * Card selectors are tried in order and the first one that matches anything is used;
 * field selectors may be comma-separated groups, first match wins.
 */
public record CardSelectors(
        List<String> cards,
        String link,
        String title,
        String price,
        String address,
        String features
) {
}
