/**
 * Spring configuration: thread pools, recovery wiring and the {@code @ConfigurationProperties}
 * classes under {@code config.properties}.
 *
 * <p>Property prefixes:
 * <ul>
 *   <li>{@code backend.*} - executable location, bind address, health monitor and startup polling</li>
 *   <li>{@code recovery.*} - restart budget, backoff and system-restart phases</li>
 *   <li>{@code threadpool.*} - scheduler and executor sizing</li>
 * </ul>
 */
package com.phillippitts.newwork.config;
