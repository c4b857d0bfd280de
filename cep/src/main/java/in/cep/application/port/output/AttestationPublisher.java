package in.cep.application.port.output;

import in.cep.domain.credit.AttestationEvent;

/**
 * Publishes signed attestation events to the public event bridge. Best effort: callers log failures.
 */
public interface AttestationPublisher {

    void publish(AttestationEvent event);

    static AttestationPublisher none() {
        return event -> {};
    }
}
