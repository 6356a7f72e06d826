package turnstile.core.port.in;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.admission.AdmissionDecision;
import turnstile.core.model.admission.AdmissionRequest;

/**
 * Primary port for request admission: authentication, then rate limiting, then permissions.
 */
public interface AdmissionControl {

    /**
     * Decide whether a request may proceed to its handler.
     *
     * @param request the inbound request
     * @return Uni with the decision
     */
    Uni<AdmissionDecision> admit(AdmissionRequest request);
}
