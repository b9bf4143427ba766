/**
 * Immutable domain types of the audio generation pipeline.
 *
 * <p>A {@link com.phillippitts.audiogen.domain.SynthesisRequest} is split into
 * {@link com.phillippitts.audiogen.domain.TextChunk}s, each rendered into a
 * {@link com.phillippitts.audiogen.domain.SynthesizedChunk}, and the chunks are combined
 * into one {@link com.phillippitts.audiogen.domain.AudioArtifact} which is then recorded
 * as a {@link com.phillippitts.audiogen.domain.ProvenanceRecord}.
 */
package com.phillippitts.audiogen.domain;
