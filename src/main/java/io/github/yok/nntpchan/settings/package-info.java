/**
 * Immutable settings snapshot and its assembler.
 *
 * <p>
 * {@link io.github.yok.nntpchan.settings.FrontendSettings} is built once at process start and
 * never changes afterwards.
 * </p>
 */
package io.github.yok.nntpchan.settings;
