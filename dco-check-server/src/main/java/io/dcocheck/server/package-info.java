/**
 * HTTP server receiving GitHub webhook deliveries and running the DCO check.
 */
@NullMarked
package io.dcocheck.server;

import org.jspecify.annotations.NullMarked;
