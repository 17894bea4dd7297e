package com.example.s3explorer.gateway;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

/**
 * Detects the media type of an upload from its leading bytes and file name.
 */
public class ContentTypeDetector {
    private static final String FALLBACK = "application/octet-stream";

    private final Tika tika;

    public ContentTypeDetector(Tika tika) {
        this.tika = tika;
    }

    public String detect(String fileName, byte[] content) {
        String detected = tika.detect(content, fileName);
        MediaType mediaType = detected == null ? null : MediaType.parse(detected);
        return mediaType == null ? FALLBACK : mediaType.getBaseType().toString();
    }
}
