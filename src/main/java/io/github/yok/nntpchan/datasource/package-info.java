/**
 * Database access handle built from the assembled settings.
 */
package io.github.yok.nntpchan.datasource;
