package uma.model;

/**
 * The settlement chosen by the sender.
 *
 * @param layer           such as {@code ln} or {@code spark}
 * @param assetIdentifier such as {@code BTC}
 */
public record SettlementInfo(
    String layer,
    String assetIdentifier
) {

}
