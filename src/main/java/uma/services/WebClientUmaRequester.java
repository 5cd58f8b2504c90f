package uma.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Non-2xx responses surface as {@link org.springframework.web.reactive.function.client.WebClientResponseException}.
 */
@Service
@Slf4j
public class WebClientUmaRequester implements UmaRequester {

    private final WebClient webClient;

    public WebClientUmaRequester(WebClient.Builder webClientBuilder) {
        webClient = webClientBuilder.build();
    }

    @Override
    public String makeGetRequest(String url) {
        return makeGetRequestAsync(url).block();
    }

    @Override
    public Mono<String> makeGetRequestAsync(String url) {
        log.debug("Starting GET {}", url);
        return webClient
            .get()
            .uri(url)
            .accept(MediaType.APPLICATION_JSON)
            .retrieve()
            .bodyToMono(String.class)
            .doOnNext(body -> log.debug("Response from url={} body={}", url, body));
    }
}
