package biz.kryukov.dev.healthwatch.uptime;

import biz.kryukov.dev.healthwatch.ValidationException;

/**
 * TLS certificate expectations for a probe.
 *
 * @param checkCertificate     whether to inspect the server certificate
 * @param warnDaysBeforeExpiry remaining validity, in days, below which the probe fails
 */
public record SslPolicy(boolean checkCertificate, int warnDaysBeforeExpiry) {

    public SslPolicy {
        if (warnDaysBeforeExpiry < 0) {
            throw new ValidationException(
                    "warnDaysBeforeExpiry must not be negative, got " + warnDaysBeforeExpiry);
        }
    }
}
