package io.proofproxy.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.io.Serializable;

@Getter
@AllArgsConstructor
public class WorkerDeregistrationRequest implements Serializable {
    @JsonProperty("workerId")
    private final String workerId;
}
