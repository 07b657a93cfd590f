package io.healthcontroller.enums;

/**
 * Outcome of checking one target.
 *
 * <ul>
 *   <li><strong>HEALTHY</strong> - no unhealthy criteria apply</li>
 *   <li><strong>UNHEALTHY</strong> - criteria held past their timeout, remediation required</li>
 *   <li><strong>PENDING</strong> - criteria apply but their timeout has not elapsed yet</li>
 * </ul>
 */
public enum HealthVerdict {
    HEALTHY,
    UNHEALTHY,
    PENDING
}
