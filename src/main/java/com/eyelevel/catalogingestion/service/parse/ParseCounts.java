package com.eyelevel.catalogingestion.service.parse;

/**
 * Running totals of staged rows written by a parse job.
 */
public record ParseCounts(int families, int products, int variations, int images) {

    public static final ParseCounts EMPTY = new ParseCounts(0, 0, 0, 0);

    public ParseCounts plus(ParseCounts other) {
        return new ParseCounts(families + other.families, products + other.products,
                variations + other.variations, images + other.images);
    }
}
