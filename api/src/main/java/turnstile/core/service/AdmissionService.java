package turnstile.core.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.admission.AdmissionDecision;
import turnstile.core.model.admission.AdmissionRequest;
import turnstile.core.model.auth.AuthenticationOutcome;
import turnstile.core.port.in.AdmissionControl;
import turnstile.core.service.activity.ActivityRecorder;
import turnstile.core.service.auth.ApiKeyAuthenticator;
import turnstile.core.service.permission.PermissionEvaluator;
import turnstile.core.service.ratelimit.RateLimitManager;
import turnstile.core.service.ratelimit.RequestCostCalculator;

/**
 * Runs the admission pipeline: authentication, then rate limiting, then permission checks.
 *
 * <p>Each stage runs only when the previous one admitted the request. A failure of the key
 * record store surfaces as a failed {@link Uni} carrying
 * {@link turnstile.core.model.auth.KeyStoreUnavailableException}.
 */
@ApplicationScoped
public class AdmissionService implements AdmissionControl {

    private final ApiKeyAuthenticator authenticator;
    private final RateLimitManager rateLimitManager;
    private final RequestCostCalculator costCalculator;
    private final PermissionEvaluator permissionEvaluator;
    private final ActivityRecorder activity;

    @Inject
    public AdmissionService(
            ApiKeyAuthenticator authenticator,
            RateLimitManager rateLimitManager,
            RequestCostCalculator costCalculator,
            PermissionEvaluator permissionEvaluator,
            ActivityRecorder activity) {
        this.authenticator = authenticator;
        this.rateLimitManager = rateLimitManager;
        this.costCalculator = costCalculator;
        this.permissionEvaluator = permissionEvaluator;
        this.activity = activity;
    }

    @Override
    public Uni<AdmissionDecision> admit(AdmissionRequest request) {
        return authenticator.authenticate(request.authentication()).flatMap(outcome -> {
            if (outcome instanceof AuthenticationOutcome.Rejected rejected) {
                return Uni.createFrom().item(AdmissionDecision.unauthenticated(rejected));
            }
            final var apiKey = ((AuthenticationOutcome.Valid) outcome).apiKey();
            final var path = request.path();
            final var cost = costCalculator.cost(request.method(), path);

            return rateLimitManager
                    .check(apiKey, path, cost, request.authentication().sourceIp())
                    .map(rateLimit -> {
                        if (!rateLimit.allowed()) {
                            return AdmissionDecision.rateLimited(outcome, rateLimit);
                        }
                        final var required = request.permission();
                        if (required.isPresent()) {
                            final var granted = permissionEvaluator.hasPermission(apiKey.scopes(), required.get());
                            activity.permissionChecked(apiKey, path, required.get(), granted);
                            if (!granted) {
                                return AdmissionDecision.forbidden(outcome, rateLimit, required.get());
                            }
                        }
                        return AdmissionDecision.admitted(outcome, rateLimit);
                    });
        });
    }
}
