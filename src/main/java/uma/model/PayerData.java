package uma.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonCreator.Mode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Data about the sender that the receiving VASP asked for in its lnurlp response.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class PayerData extends CounterPartyData<CompliancePayerData> {

    @Builder
    public PayerData(String identifier, String name, String email, CompliancePayerData compliance,
        Map<String, JsonNode> extraFields
    ) {
        super(identifier, name, email, compliance, extraFields);
    }

    @JsonCreator(mode = Mode.DELEGATING)
    public static PayerData fromJson(ObjectNode node) {
        return new PayerData(
            textField(node, IDENTIFIER),
            textField(node, NAME),
            textField(node, EMAIL),
            objectField(node, COMPLIANCE, CompliancePayerData.class),
            unreservedFields(node)
        );
    }

    public PayerData withCompliance(CompliancePayerData compliance) {
        return new PayerData(identifier().orElse(null), name().orElse(null), email().orElse(null),
            compliance, extraFields());
    }
}
