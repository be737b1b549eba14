package com.flagship.wager_ledger.odds;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Conversions between American odds and decimal prices.
 *
 * Key rules:
 * - American odds must have a magnitude of at least 100 (0 has no price)
 * - Decimal prices are carried with {@link #WORKING_SCALE} fractional digits
 * - Parlay prices are always the product of leg decimals, never of American values
 * - A price stored on a wager is rounded to {@link #PRICE_SCALE} digits by {@link #roundPrice}
 * - A wager price may not exceed {@link #MAX_PRICE}
 *
 * All methods are pure and thread-safe.
 */
public final class OddsMath {

    public static final int WORKING_SCALE = 10;
    public static final int PRICE_SCALE = 4;
    public static final BigDecimal MAX_PRICE = new BigDecimal("1000000000");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private OddsMath() {
        // Utility class
    }

    /**
     * Converts American odds to a decimal multiplier.
     *
     * @param americanOdds signed odds, e.g. -150 or +200
     * @return decimal price, always greater than 1
     * @throws InvalidOddsException if |americanOdds| is below 100
     */
    public static BigDecimal toDecimal(int americanOdds) {
        requireValidAmerican(americanOdds);

        BigDecimal odds = BigDecimal.valueOf(americanOdds);
        if (americanOdds > 0) {
            return BigDecimal.ONE.add(odds.divide(HUNDRED, WORKING_SCALE, RoundingMode.HALF_UP));
        }
        return BigDecimal.ONE.add(HUNDRED.divide(odds.abs(), WORKING_SCALE, RoundingMode.HALF_UP));
    }

    /**
     * Multiplies leg prices into one aggregate price.
     *
     * @throws EmptyLegSetException if no prices are given
     */
    public static BigDecimal combineLegs(Collection<BigDecimal> prices) {
        if (prices == null || prices.isEmpty()) {
            throw new EmptyLegSetException();
        }
        BigDecimal product = BigDecimal.ONE;
        for (BigDecimal price : prices) {
            requireValidPrice(price);
            product = product.multiply(price);
        }
        return product.setScale(WORKING_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Converts a decimal price back to American odds for display.
     *
     * Prices of 2.0 and above map to positive odds, anything lower to negative odds.
     * Even money therefore always renders as +100. Long parlays overflow {@code int}, so the
     * result is a {@code long}.
     *
     * @throws InvalidPriceException if the price is not greater than 1
     */
    public static long toAmerican(BigDecimal decimalPrice) {
        requireValidPrice(decimalPrice);

        BigDecimal profit = decimalPrice.subtract(BigDecimal.ONE);
        if (decimalPrice.compareTo(TWO) >= 0) {
            return profit.multiply(HUNDRED).setScale(0, RoundingMode.HALF_UP).longValueExact();
        }
        return HUNDRED.negate()
                .divide(profit, 0, RoundingMode.HALF_UP)
                .longValueExact();
    }

    /**
     * Combines American leg odds into the price stored on a wager.
     *
     * @throws InvalidPriceException if the combined price is above {@link #MAX_PRICE}
     */
    public static BigDecimal priceForLegs(Collection<Integer> americanOdds) {
        if (americanOdds == null || americanOdds.isEmpty()) {
            throw new EmptyLegSetException();
        }
        BigDecimal price = roundPrice(combineLegs(americanOdds.stream().map(OddsMath::toDecimal).toList()));
        if (price.compareTo(MAX_PRICE) > 0) {
            throw new InvalidPriceException(String.format(
                    "Combined price %s is above the limit of %s", price.toPlainString(), MAX_PRICE.toPlainString()));
        }
        return price;
    }

    /**
     * Rounds a working price to the precision persisted on wagers.
     */
    public static BigDecimal roundPrice(BigDecimal price) {
        return price.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    public static boolean isValidAmerican(int americanOdds) {
        return Math.abs((long) americanOdds) >= 100;
    }

    private static void requireValidAmerican(int americanOdds) {
        if (!isValidAmerican(americanOdds)) {
            throw new InvalidOddsException(americanOdds);
        }
    }

    private static void requireValidPrice(BigDecimal price) {
        if (price == null || price.compareTo(BigDecimal.ONE) <= 0) {
            throw new InvalidPriceException(price);
        }
    }
}
