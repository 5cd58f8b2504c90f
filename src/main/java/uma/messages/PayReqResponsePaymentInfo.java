package uma.messages;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * Final currency details of a payment. The invoice amount is {@code amount * multiplier + fee}.
 *
 * @param amount                   in the smallest unit of the receiving currency, absent from version 0 responses
 * @param currencyCode             the currency the receiver will receive
 * @param decimals                 matches the currency's {@code decimals} in the lnurlp response
 * @param multiplier               millisatoshis per smallest unit of the receiving currency
 * @param exchangeFeesMillisatoshi fees charged by the receiving VASP
 */
@Builder
@JsonInclude(Include.NON_NULL)
public record PayReqResponsePaymentInfo(
    @Nullable
    Long amount,
    String currencyCode,
    int decimals,
    double multiplier,
    @JsonProperty("fee")
    long exchangeFeesMillisatoshi
) {

}
