/**
 * Host-header policy derived from the {@code frontend.allowed-hosts} setting.
 */
package io.github.yok.nntpchan.hosts;
