/**
 * Startup validation of the bound configuration sections.
 *
 * <p>
 * {@link io.github.yok.nntpchan.validation.SettingsValidator} separates fatal errors, reported
 * together through {@link io.github.yok.nntpchan.validation.SettingsValidationException}, from
 * warnings that are only logged.
 * </p>
 */
package io.github.yok.nntpchan.validation;
