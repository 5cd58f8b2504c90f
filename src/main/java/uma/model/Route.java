package uma.model;

import java.util.List;

/**
 * Legacy LNURL routing hint. UMA receivers send an empty list and carry route hints in the invoice.
 */
public record Route(
    String pubkey,
    List<RouteHop> path
) {

    public record RouteHop(
        String pubkey,
        String channel,
        long fee,
        long msatoshi
    ) {

    }
}
