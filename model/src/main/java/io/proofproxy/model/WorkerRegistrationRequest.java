package io.proofproxy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.io.Serializable;
import java.net.URI;

/**
 * Request to add a worker to a running proxy. The id defaults to the address authority.
 */
@Getter
@AllArgsConstructor
public class WorkerRegistrationRequest implements Serializable {
    @JsonProperty("workerId")
    private final String workerId;

    @JsonProperty("address")
    private final URI address;
}
