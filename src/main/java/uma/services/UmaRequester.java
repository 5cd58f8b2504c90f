package uma.services;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Performs the HTTP GETs of the protocol, such as fetching another VASP's public keys.
 */
public interface UmaRequester {

    /**
     * @return the response body
     */
    String makeGetRequest(String url);

    default Mono<String> makeGetRequestAsync(String url) {
        return Mono.fromCallable(() -> makeGetRequest(url))
            .subscribeOn(Schedulers.boundedElastic());
    }
}
