package com.example.property.search.model;

public enum ListingOrigin {
    LIVE,
    SYNTHETIC
}
