package turnstile.adapter.out.notification;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import turnstile.core.model.auth.ApiKeyRecord;
import turnstile.core.model.lifecycle.ExpirationNotice;
import turnstile.core.model.lifecycle.NoticeLevel;
import turnstile.core.model.lifecycle.RotationResult;
import turnstile.core.port.out.LifecycleNotifier;

/**
 * Lifecycle notifier that writes owner notifications to the audit log.
 *
 * <p>The presented form of a replacement key is never logged; only key ids appear.
 */
@ApplicationScoped
public class LoggingLifecycleNotifier implements LifecycleNotifier {

    private static final Logger AUDIT = Logger.getLogger("turnstile.audit.lifecycle");

    @Override
    public void expiring(ExpirationNotice notice) {
        final var message = String.format(
                "KEY_EXPIRING keyId=%s name=%s user=%s expiresAt=%s days=%d level=%s actions=%s",
                notice.keyId(),
                notice.keyName(),
                notice.userId(),
                notice.expiresAt(),
                notice.daysUntilExpiry(),
                notice.level().value(),
                notice.suggestedActions());
        if (notice.level() == NoticeLevel.CRITICAL) {
            AUDIT.warn(message);
        } else {
            AUDIT.info(message);
        }
    }

    @Override
    public void rotated(ApiKeyRecord rotatedKey, RotationResult result) {
        AUDIT.infof(
                "KEY_ROTATED keyId=%s newKeyId=%s user=%s trigger=%s transitionDays=%d",
                result.oldKeyId(),
                result.newKeyId(),
                rotatedKey.userId(),
                result.trigger().value(),
                result.transitionDays());
    }
}
