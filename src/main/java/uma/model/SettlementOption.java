package uma.model;

import java.util.List;

public record SettlementOption(
    String settlementLayer,
    List<SettlementAsset> assets
) {

}
