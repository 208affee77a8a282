package com.example.property.search.merge;

import com.example.property.search.adapter.ListingTextParser;
import com.example.property.search.model.ListingRecord;

/**
 * Decides whether two records describe the same listing.
 *
 * <p>Records that both carry a source id match only on that id. Otherwise they match when their
 * normalized address (or title, without addresses) is equal and their prices, and sizes when both
 * are known, agree within the relative tolerances.
 */
public class ListingSimilarity {

    private final double priceTolerance;
    private final double sizeTolerance;

    public ListingSimilarity(double priceTolerance, double sizeTolerance) {
        this.priceTolerance = priceTolerance;
        this.sizeTolerance = sizeTolerance;
    }

    public boolean isSameListing(ListingRecord a, ListingRecord b) {
        if (a.equals(b)) {
            return true;
        }
        if (a.sourceId() != null && b.sourceId() != null) {
            return a.sourceId().equals(b.sourceId());
        }
        String keyA = textKey(a);
        String keyB = textKey(b);
        if (keyA == null || !keyA.equals(keyB)) {
            return false;
        }
        if (a.price() == null || b.price() == null) {
            return false;
        }
        if (!withinTolerance(a.price(), b.price(), priceTolerance)) {
            return false;
        }
        return a.sizeSqm() == null || b.sizeSqm() == null
                || withinTolerance(a.sizeSqm(), b.sizeSqm(), sizeTolerance);
    }

    static boolean withinTolerance(long a, long b, double tolerance) {
        long larger = Math.max(Math.abs(a), Math.abs(b));
        if (larger == 0) {
            return true;
        }
        return Math.abs(a - b) <= tolerance * larger;
    }

    private static String textKey(ListingRecord record) {
        String basis = record.address() != null ? record.address() : record.title();
        String slug = ListingTextParser.slug(basis);
        return slug.isEmpty() ? null : slug;
    }
}
