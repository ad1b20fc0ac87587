package io.proofproxy.proxy.transport;

import io.proofproxy.model.ProofRequest;
import io.proofproxy.model.ProofResult;
import io.proofproxy.proxy.exception.TransportException;

import java.net.URI;
import java.time.Duration;

/**
 * The proxy's side of the worker protocol. Calls block and are never made under the scheduling lock.
 */
public interface WorkerClient {

    /**
     * Forwards a job and waits for the worker's answer.
     *
     * @return the worker's result, successful or not
     * @throws TransportException if no well-formed answer arrived within the timeout
     */
    ProofResult prove(URI worker, ProofRequest request, Duration timeout) throws TransportException;

    /**
     * Liveness check.
     *
     * @throws TransportException if the worker did not answer healthy within the timeout
     */
    void probe(URI worker, Duration timeout) throws TransportException;
}
