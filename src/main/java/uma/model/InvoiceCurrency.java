package uma.model;

import lombok.Builder;

/**
 * Currency descriptor embedded in an invoice.
 *
 * @param code     such as {@code USD}
 * @param name
 * @param symbol
 * @param decimals digits after the decimal point of the smallest unit
 */
@Builder
public record InvoiceCurrency(
    String code,
    String name,
    String symbol,
    int decimals
) {

}
