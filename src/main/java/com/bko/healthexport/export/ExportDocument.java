package com.bko.healthexport.export;

import java.util.Objects;

public record ExportDocument(String filename, byte[] content) {
    public ExportDocument {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(content, "content");
    }
}
