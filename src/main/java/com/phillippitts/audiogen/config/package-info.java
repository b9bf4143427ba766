/**
 * Spring wiring: backend selection, the synthesis thread pool and the request source.
 *
 * <p>Typed settings live in {@link com.phillippitts.audiogen.config.properties}.
 */
package com.phillippitts.audiogen.config;
