package com.game.metadata.provider;

/**
 * Store price in major currency units.
 */
public record PriceInfo(String currency, Double initialPrice, Double finalPrice, Integer discountPercent,
                        boolean free) {

    public static PriceInfo freeToPlay() {
        return new PriceInfo(null, 0.0, 0.0, 0, true);
    }
}
