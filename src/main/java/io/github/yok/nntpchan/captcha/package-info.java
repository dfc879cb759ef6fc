/**
 * Discovery of the TrueType fonts used to render captcha challenges.
 */
package io.github.yok.nntpchan.captcha;
