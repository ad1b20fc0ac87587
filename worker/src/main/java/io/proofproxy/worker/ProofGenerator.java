package io.proofproxy.worker;

/**
 * Proof backend hosted by a worker. Implementations are discovered through
 * {@link java.util.ServiceLoader} by {@code WorkerMain}.
 *
 * <p>The worker never calls {@link #prove(byte[])} concurrently on one instance.</p>
 */
public interface ProofGenerator {

    /**
     * Produces a proof for the given opaque payload.
     *
     * @param payload job payload exactly as submitted by the client
     * @return serialized proof
     * @throws Exception if the proof cannot be produced; the message is reported to the proxy
     */
    byte[] prove(byte[] payload) throws Exception;
}
