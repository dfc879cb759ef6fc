/**
 * Configuration model package for the nntpchan front-end.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} (or environment
 * variables and system properties), such as the database descriptor, the NNTP endpoint and login,
 * asset directories, external tool paths, and the site identity.
 * </p>
 *
 * <p>
 * These classes are mutable binding targets; the rest of the application reads the immutable
 * {@link io.github.yok.nntpchan.settings.FrontendSettings} assembled from them.
 * </p>
 */
package io.github.yok.nntpchan.config;
