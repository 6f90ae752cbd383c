package com.intelcompliance.domain.model;

import lombok.Value;

import java.time.Instant;

@Value
public class DecryptedFile {
    byte[] content;
    String filename;
    String mimeType;
    long size;
    Instant uploadedAt;

    public byte[] getContent() {
        return content.clone();
    }
}
