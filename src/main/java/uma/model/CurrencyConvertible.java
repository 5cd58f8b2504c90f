package uma.model;

/**
 * @param min smallest amount, in the currency's smallest unit, the receiver converts
 * @param max largest amount, in the currency's smallest unit, the receiver converts
 */
public record CurrencyConvertible(
    long min,
    long max
) {

}
