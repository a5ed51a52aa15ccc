package com.bmsedge.forecast.model;

/**
 * How an alias came to point at its item.
 */
public enum AliasOrigin {
    /** The name the item was created from. */
    CANONICAL,
    /** Added by an administrator. */
    EXPLICIT,
    /** Matched a configured canonicalization rule. */
    RULE,
    /** Token-overlap match above the similarity threshold. */
    FUZZY
}
