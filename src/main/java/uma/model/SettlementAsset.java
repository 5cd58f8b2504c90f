package uma.model;

import java.util.Map;

/**
 * @param identifier  asset identifier on its layer
 * @param multipliers currency code to the amount of the asset's smallest unit per smallest unit of that currency
 */
public record SettlementAsset(
    String identifier,
    Map<String, Double> multipliers
) {

}
