/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.audiogen.exception.AudioGenException}.
 * They split into two groups by how far a failure propagates:
 * <ul>
 *   <li>Run-fatal: {@link com.phillippitts.audiogen.exception.InvalidConfigException} and
 *       {@link com.phillippitts.audiogen.exception.AuthExhaustedException} abort the batch
 *       with a non-zero exit code.</li>
 *   <li>Request-fatal: {@link com.phillippitts.audiogen.exception.SynthesisException}
 *       (transport, decode and backend-status variants) and
 *       {@link com.phillippitts.audiogen.exception.ArtifactIoException} abandon the current
 *       request; the batch moves on to the next one.</li>
 * </ul>
 *
 * <p>None of them are retried automatically. Retry is reserved for authentication refresh.
 *
 * @see com.phillippitts.audiogen.exception.SynthesisExceptionBuilder
 * @since 1.0
 */
package com.phillippitts.audiogen.exception;
