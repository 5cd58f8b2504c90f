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
 * Data about the receiver that the sending VASP asked for in its pay request.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public final class PayeeData extends CounterPartyData<CompliancePayeeData> {

    @Builder
    public PayeeData(String identifier, String name, String email, CompliancePayeeData compliance,
        Map<String, JsonNode> extraFields
    ) {
        super(identifier, name, email, compliance, extraFields);
    }

    @JsonCreator(mode = Mode.DELEGATING)
    public static PayeeData fromJson(ObjectNode node) {
        return new PayeeData(
            textField(node, IDENTIFIER),
            textField(node, NAME),
            textField(node, EMAIL),
            objectField(node, COMPLIANCE, CompliancePayeeData.class),
            unreservedFields(node)
        );
    }

    public PayeeData withCompliance(CompliancePayeeData compliance) {
        return new PayeeData(identifier().orElse(null), name().orElse(null), email().orElse(null),
            compliance, extraFields());
    }
}
