/**
 * Utility package for the nntpchan front-end settings.
 *
 * <p>
 * Provides fail-fast error reporting, secret masking for logs, and log-path rendering. Utilities in
 * this package are stateless.
 * </p>
 */
package io.github.yok.nntpchan.util;
