/**
 * Spring Boot configuration properties bound from {@code application.yml}.
 */
package io.github.yok.flexetl.config;
