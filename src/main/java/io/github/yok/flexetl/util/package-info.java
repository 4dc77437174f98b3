/**
 * Shared helpers: date/time parsing, log path rendering and fatal error reporting.
 */
package io.github.yok.flexetl.util;
