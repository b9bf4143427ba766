package com.phillippitts.audiogen.domain;

/**
 * Closed set of output formats, each with the file extension artifacts get and the
 * format name the cloud backend expects.
 */
public enum AudioFormat {
    MP3("mp3", "mp3"),
    OGG_VORBIS("ogg", "ogg_vorbis"),
    PCM("pcm", "pcm");

    private final String extension;
    private final String backendName;

    AudioFormat(String extension, String backendName) {
        this.extension = extension;
        this.backendName = backendName;
    }

    public String extension() {
        return extension;
    }

    public String backendName() {
        return backendName;
    }
}
