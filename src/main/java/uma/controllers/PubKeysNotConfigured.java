package uma.controllers;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class PubKeysNotConfigured extends RuntimeException {

    public PubKeysNotConfigured() {
        super("Public keys are not configured");
    }
}
